package org.agentranker.engine.domain.model;

import org.agentranker.engine.domain.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable, validated configuration for agent scoring: the weight vector, the baseline
 * fallback rating and the normalization domains.
 * Loaded from the metric store at startup and cached; several instances may coexist.
 */
public final class ScoringConfig {

    public static final double WEIGHT_SUM_EPSILON = 1e-9;
    public static final double RATING_SCALE_MIN = 1.0;
    public static final double RATING_SCALE_MAX = 5.0;

    // Weight keys are WEIGHT_PREFIX + signal key, e.g. weight_lead_source
    public static final String WEIGHT_PREFIX = "weight_";

    // Other keys
    public static final String BASELINE_RATING = "baseline_rating";
    public static final String SERVICE_YEARS_MIN = "service_years_min";
    public static final String SERVICE_YEARS_MAX = "service_years_max";
    public static final String TRIP_VOLUME_MIN = "trip_volume_min";
    public static final String TRIP_VOLUME_MAX = "trip_volume_max";
    public static final String TRIP_VOLUME_FROM_POOL = "trip_volume_from_pool";
    public static final String TIE_TOLERANCE = "tie_tolerance";

    private static final Set<String> SETTING_KEYS = Set.of(BASELINE_RATING, SERVICE_YEARS_MIN, SERVICE_YEARS_MAX,
            TRIP_VOLUME_MIN, TRIP_VOLUME_MAX, TRIP_VOLUME_FROM_POOL, TIE_TOLERANCE);

    public static final double DEFAULT_BASELINE_RATING = 3.0;
    public static final double DEFAULT_SERVICE_YEARS_MIN = 2.0;
    public static final double DEFAULT_SERVICE_YEARS_MAX = 18.0;
    public static final double DEFAULT_TRIP_VOLUME_MIN = 0.0;
    public static final double DEFAULT_TRIP_VOLUME_MAX = 10.0;
    public static final double DEFAULT_TIE_TOLERANCE = 1e-9;

    private final List<WeightEntry> weights;
    private final double baselineRating;
    private final NormalizationDomain serviceYearsDomain;
    private final NormalizationDomain tripVolumeDomain;
    private final boolean tripVolumeFromPool;
    private final double tieTolerance;

    private ScoringConfig(Builder builder) {
        this.weights = Collections.unmodifiableList(new ArrayList<>(builder.weights));
        this.baselineRating = builder.baselineRating;
        this.serviceYearsDomain = NormalizationDomain.of(builder.serviceYearsMin, builder.serviceYearsMax);
        this.tripVolumeDomain = NormalizationDomain.of(builder.tripVolumeMin, builder.tripVolumeMax);
        this.tripVolumeFromPool = builder.tripVolumeFromPool;
        this.tieTolerance = builder.tieTolerance;
        validate();
    }

    /**
     * Creates a configuration from key/value pairs layered over the defaults.
     * When any weight key is present the whole weight vector comes from the map.
     *
     * @throws ConfigurationException if a key is unknown, a weight key names no known signal
     *         or the result is invalid
     */
    public static ScoringConfig fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        Builder builder = defaultsBuilder();

        Map<String, Double> weightValues = new TreeMap<>();
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getKey().startsWith(WEIGHT_PREFIX)) {
                weightValues.put(entry.getKey(), entry.getValue());
            } else if (!SETTING_KEYS.contains(entry.getKey())) {
                throw new ConfigurationException("Unknown config key: " + entry.getKey());
            }
        }
        if (!weightValues.isEmpty()) {
            builder.clearWeights();
            for (Map.Entry<String, Double> entry : weightValues.entrySet()) {
                String dimension = entry.getKey().substring(WEIGHT_PREFIX.length());
                ScoringSignal signal = ScoringSignal.fromKey(dimension);
                if (signal == null) {
                    throw new ConfigurationException(String.format(
                            "Weight '%s' has no independent input signal", entry.getKey()));
                }
                builder.weight(dimension, signal, valueOf(values, entry.getKey(), 0.0));
            }
        }

        builder.baselineRating(valueOf(values, BASELINE_RATING, builder.baselineRating));
        builder.serviceYearsDomain(valueOf(values, SERVICE_YEARS_MIN, builder.serviceYearsMin),
                valueOf(values, SERVICE_YEARS_MAX, builder.serviceYearsMax));
        builder.tripVolumeDomain(valueOf(values, TRIP_VOLUME_MIN, builder.tripVolumeMin),
                valueOf(values, TRIP_VOLUME_MAX, builder.tripVolumeMax));
        builder.tripVolumeFromPool(valueOf(values, TRIP_VOLUME_FROM_POOL, builder.tripVolumeFromPool ? 1.0 : 0.0) != 0.0);
        builder.tieTolerance(valueOf(values, TIE_TOLERANCE, builder.tieTolerance));
        return builder.build();
    }

    /**
     * Creates the default configuration: tenure carries no weight.
     */
    public static ScoringConfig defaults() {
        return defaultsBuilder().build();
    }

    /**
     * Builder preloaded with the default weights and domains.
     */
    public static Builder defaultsBuilder() {
        return new Builder()
                .weight("rating", ScoringSignal.RATING, 0.30)
                .weight("lead_source", ScoringSignal.LEAD_SOURCE_RATING, 0.20)
                .weight("destination", ScoringSignal.DESTINATION_RATING, 0.20)
                .weight("communication", ScoringSignal.COMMUNICATION_RATING, 0.10)
                .weight("trip_volume", ScoringSignal.TRIP_VOLUME, 0.20);
    }

    private static double valueOf(Map<String, Double> values, String key, double defaultValue) {
        if (!values.containsKey(key)) {
            return defaultValue;
        }
        Double value = values.get(key);
        if (value == null) {
            throw new ConfigurationException("Missing value for config key: " + key);
        }
        return value;
    }

    private void validate() {
        if (weights.isEmpty()) {
            throw new ConfigurationException("At least one weight must be configured");
        }
        Map<ScoringSignal, String> claimed = new EnumMap<>(ScoringSignal.class);
        double sum = 0.0;
        for (WeightEntry entry : weights) {
            double weight = entry.getWeight();
            if (!Double.isFinite(weight) || weight < 0.0) {
                throw new ConfigurationException(String.format(
                        "Weight for '%s' must be a finite non-negative number: %s", entry.getDimension(), weight));
            }
            String previous = claimed.putIfAbsent(entry.getSignal(), entry.getDimension());
            if (previous != null) {
                throw new ConfigurationException(String.format(
                        "Signal '%s' is weighted twice, by '%s' and '%s'",
                        entry.getSignal().getKey(), previous, entry.getDimension()));
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_EPSILON) {
            throw new ConfigurationException(String.format("Weights must sum to 1.0 but sum to %.12f", sum));
        }
        if (!Double.isFinite(baselineRating)
                || baselineRating < RATING_SCALE_MIN || baselineRating > RATING_SCALE_MAX) {
            throw new ConfigurationException(String.format(
                    "Baseline rating must lie on the %.1f-%.1f scale: %s",
                    RATING_SCALE_MIN, RATING_SCALE_MAX, baselineRating));
        }
        if (!Double.isFinite(tieTolerance) || tieTolerance < 0.0) {
            throw new ConfigurationException("Tie tolerance must be a finite non-negative number: " + tieTolerance);
        }
    }

    public List<WeightEntry> getWeights() {
        return weights;
    }

    /**
     * Weight configured for a signal, 0 when the signal is not part of the vector.
     */
    public double weightOf(ScoringSignal signal) {
        for (WeightEntry entry : weights) {
            if (entry.getSignal() == signal) {
                return entry.getWeight();
            }
        }
        return 0.0;
    }

    public double getBaselineRating() {
        return baselineRating;
    }

    public NormalizationDomain getServiceYearsDomain() {
        return serviceYearsDomain;
    }

    /**
     * Static trip volume domain; used directly unless {@link #isTripVolumeFromPool()} is set.
     */
    public NormalizationDomain getTripVolumeDomain() {
        return tripVolumeDomain;
    }

    public boolean isTripVolumeFromPool() {
        return tripVolumeFromPool;
    }

    public double getTieTolerance() {
        return tieTolerance;
    }

    @Override
    public String toString() {
        return "ScoringConfig{weights=" + weights
                + ", baseline=" + baselineRating
                + ", serviceYears=" + serviceYearsDomain
                + ", tripVolume=" + (tripVolumeFromPool ? "pool" : tripVolumeDomain.toString())
                + '}';
    }

    /**
     * Builder for ScoringConfig. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private final List<WeightEntry> weights = new ArrayList<>();
        private double baselineRating = DEFAULT_BASELINE_RATING;
        private double serviceYearsMin = DEFAULT_SERVICE_YEARS_MIN;
        private double serviceYearsMax = DEFAULT_SERVICE_YEARS_MAX;
        private double tripVolumeMin = DEFAULT_TRIP_VOLUME_MIN;
        private double tripVolumeMax = DEFAULT_TRIP_VOLUME_MAX;
        private boolean tripVolumeFromPool = true;
        private double tieTolerance = DEFAULT_TIE_TOLERANCE;

        public Builder weight(String dimension, ScoringSignal signal, double weight) {
            this.weights.add(new WeightEntry(dimension, signal, weight));
            return this;
        }

        public Builder clearWeights() {
            this.weights.clear();
            return this;
        }

        public Builder baselineRating(double baselineRating) {
            this.baselineRating = baselineRating;
            return this;
        }

        public Builder serviceYearsDomain(double min, double max) {
            this.serviceYearsMin = min;
            this.serviceYearsMax = max;
            return this;
        }

        public Builder tripVolumeDomain(double min, double max) {
            this.tripVolumeMin = min;
            this.tripVolumeMax = max;
            return this;
        }

        public Builder tripVolumeFromPool(boolean tripVolumeFromPool) {
            this.tripVolumeFromPool = tripVolumeFromPool;
            return this;
        }

        public Builder tieTolerance(double tieTolerance) {
            this.tieTolerance = tieTolerance;
            return this;
        }

        /**
         * @throws ConfigurationException if the configuration is not usable
         */
        public ScoringConfig build() {
            return new ScoringConfig(this);
        }
    }
}
