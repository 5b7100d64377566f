package org.agentranker.engine.domain.exception;

/**
 * Thrown when scoring weights or normalization domains are not usable.
 * Only raised while a configuration is being built, never while a request is scored.
 */
public final class ConfigurationException extends RankingException {

    public ConfigurationException(String message) {
        super(message);
    }
}
