package org.agentranker.engine.domain.exception;

/**
 * Thrown when a metric store record is inconsistent with the rest of the snapshot.
 * The aggregator logs it and excludes the record.
 */
public final class DataIntegrityException extends RankingException {

    public DataIntegrityException(String message) {
        super(message);
    }
}
