package org.agentranker.engine.domain.exception;

/**
 * Thrown when a ranking is requested before any metric snapshot has been loaded.
 */
public final class SnapshotUnavailableException extends RankingException {

    public SnapshotUnavailableException(String message) {
        super(message);
    }
}
