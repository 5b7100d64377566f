package org.agentranker.engine.domain.model;

/**
 * Bookable trip destinations.
 */
public enum Destination implements Labeled {
    MARS("Mars"),
    EUROPA("Europa"),
    VENUS("Venus"),
    TITAN("Titan"),
    GANYMEDE("Ganymede");

    private final String label;

    Destination(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static Destination fromLabel(String label) {
        return Labeled.resolve(Destination.class, "destination", label);
    }
}
