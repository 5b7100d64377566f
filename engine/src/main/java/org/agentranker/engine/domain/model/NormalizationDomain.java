package org.agentranker.engine.domain.model;

import org.agentranker.engine.domain.exception.ConfigurationException;

/**
 * Practical [min, max] range of a raw metric, used as the source interval when
 * interpolating onto the 1 to 5 target scale.
 */
public final class NormalizationDomain {

    private final double min;
    private final double max;

    private NormalizationDomain(double min, double max) {
        this.min = min;
        this.max = max;
    }

    /**
     * @throws ConfigurationException if the bounds are not finite or {@code max <= min}
     */
    public static NormalizationDomain of(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new ConfigurationException(String.format("Normalization domain bounds must be finite: [%s, %s]",
                    min, max));
        }
        if (max <= min) {
            throw new ConfigurationException(String.format(
                    "Normalization domain max must be greater than min: [%s, %s]", min, max));
        }
        return new NormalizationDomain(min, max);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizationDomain)) {
            return false;
        }
        NormalizationDomain that = (NormalizationDomain) o;
        return Double.compare(min, that.min) == 0 && Double.compare(max, that.max) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(min) + Double.hashCode(max);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
