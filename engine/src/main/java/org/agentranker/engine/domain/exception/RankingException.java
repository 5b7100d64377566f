package org.agentranker.engine.domain.exception;

/**
 * Base class for all failures raised by the ranking engine.
 */
public class RankingException extends RuntimeException {

    public RankingException(String message) {
        super(message);
    }

    public RankingException(String message, Throwable cause) {
        super(message, cause);
    }
}
