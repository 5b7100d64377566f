package org.agentranker.engine.domain.model;

/**
 * Independent input signals a weight entry can draw on.
 * There is no department signal since no customer attribute maps to a department.
 */
public enum ScoringSignal {
    RATING("rating"),
    LEAD_SOURCE_RATING("lead_source"),
    DESTINATION_RATING("destination"),
    COMMUNICATION_RATING("communication"),
    SERVICE_YEARS("service_years"),
    TRIP_VOLUME("trip_volume");

    private final String key;

    ScoringSignal(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Signal for a configuration key suffix, or null if none matches.
     */
    public static ScoringSignal fromKey(String key) {
        for (ScoringSignal signal : values()) {
            if (signal.key.equals(key)) {
                return signal;
            }
        }
        return null;
    }
}
