package org.agentranker.engine.domain.model;

import org.agentranker.engine.domain.exception.ValidationException;

/**
 * An enumeration constant with a display label used on the wire and in the metric store.
 */
public interface Labeled {

    String getLabel();

    /**
     * Resolve a raw label against the constants of a closed enumeration.
     * Surrounding whitespace is ignored; matching is otherwise exact.
     *
     * @throws ValidationException if the label is missing or unknown
     */
    static <E extends Enum<E> & Labeled> E resolve(Class<E> type, String field, String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new ValidationException(field, field + " must not be empty");
        }
        String label = raw.trim();
        for (E constant : type.getEnumConstants()) {
            if (constant.getLabel().equals(label)) {
                return constant;
            }
        }
        throw new ValidationException(field, String.format("Unknown %s: '%s'", field, label));
    }
}
