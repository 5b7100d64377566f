package org.agentranker.engine.domain.exception;

/**
 * Thrown when a customer profile is incomplete or carries a value outside its closed enumeration.
 * Raised before any aggregation work starts.
 */
public final class ValidationException extends RankingException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Name of the offending profile field.
     */
    public String getField() {
        return field;
    }
}
