package org.agentranker.engine.domain.model;

/**
 * Spaceports a trip can launch from.
 */
public enum LaunchLocation implements Labeled {
    KENNEDY_SPACE_CENTER("Kennedy Space Center"),
    DALLAS_FORT_WORTH("Dallas-Fort Worth Launch Complex"),
    NEW_YORK_ORBITAL_GATEWAY("New York Orbital Gateway"),
    TOKYO_SPACEPORT_TERMINAL("Tokyo Spaceport Terminal"),
    DUBAI_INTERPLANETARY_HUB("Dubai Interplanetary Hub"),
    LONDON_ASCENSION_PLATFORM("London Ascension Platform"),
    SYDNEY_STELLAR_PORT("Sydney Stellar Port");

    private final String label;

    LaunchLocation(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static LaunchLocation fromLabel(String label) {
        return Labeled.resolve(LaunchLocation.class, "launch_location", label);
    }
}
