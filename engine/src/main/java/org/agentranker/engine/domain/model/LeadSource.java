package org.agentranker.engine.domain.model;

/**
 * Where the customer lead came from.
 */
public enum LeadSource implements Labeled {
    ORGANIC("Organic"),
    BOUGHT("Bought");

    private final String label;

    LeadSource(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static LeadSource fromLabel(String label) {
        return Labeled.resolve(LeadSource.class, "lead_source", label);
    }
}
