package org.agentranker.engine.domain.model;

/**
 * How the customer asked to be contacted.
 */
public enum CommunicationMethod implements Labeled {
    PHONE_CALL("Phone Call"),
    TEXT("Text");

    private final String label;

    CommunicationMethod(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static CommunicationMethod fromLabel(String label) {
        return Labeled.resolve(CommunicationMethod.class, "communication_method", label);
    }
}
