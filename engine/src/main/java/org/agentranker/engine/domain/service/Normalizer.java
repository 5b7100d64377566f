package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.model.NormalizationDomain;

import java.util.Objects;

/**
 * Maps raw metrics onto the 1 to 5 scale by linear interpolation followed by a clamp.
 * Values outside the domain land on the nearest end of the target range.
 */
public final class Normalizer {

    public static final double TARGET_MIN = 1.0;
    public static final double TARGET_MAX = 5.0;

    /**
     * Normalize a value against its domain.
     *
     * @param value raw metric value
     * @param domain source interval, already validated to have {@code max > min}
     * @return value in [{@value #TARGET_MIN}, {@value #TARGET_MAX}]
     */
    public double normalize(double value, NormalizationDomain domain) {
        Objects.requireNonNull(domain, "domain must not be null");
        double raw = TARGET_MIN
                + (value - domain.getMin()) * (TARGET_MAX - TARGET_MIN) / (domain.getMax() - domain.getMin());
        return clamp(raw);
    }

    private static double clamp(double raw) {
        if (Double.isNaN(raw)) {
            return TARGET_MIN;
        }
        return Math.max(TARGET_MIN, Math.min(TARGET_MAX, raw));
    }
}
