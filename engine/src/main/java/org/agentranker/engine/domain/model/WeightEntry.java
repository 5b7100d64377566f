package org.agentranker.engine.domain.model;

import java.util.Objects;

/**
 * One named dimension of the base score and the signal it reads.
 */
public final class WeightEntry {

    private final String dimension;
    private final ScoringSignal signal;
    private final double weight;

    public WeightEntry(String dimension, ScoringSignal signal, double weight) {
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
        this.weight = weight;
    }

    public String getDimension() {
        return dimension;
    }

    public ScoringSignal getSignal() {
        return signal;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return dimension + "(" + signal.getKey() + ")=" + weight;
    }
}
