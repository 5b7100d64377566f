package org.agentranker.engine.domain.model;

import java.util.Objects;

/**
 * A historical customer-to-agent assignment with its booking, if one was made.
 */
public final class AssignmentRecord {

    private final int assignmentId;
    private final int agentId;
    private final LeadSource leadSource;
    private final CommunicationMethod communicationMethod;
    private final BookingRecord booking;

    public AssignmentRecord(int assignmentId, int agentId, LeadSource leadSource,
                            CommunicationMethod communicationMethod, BookingRecord booking) {
        this.assignmentId = assignmentId;
        this.agentId = agentId;
        this.leadSource = Objects.requireNonNull(leadSource, "leadSource must not be null");
        this.communicationMethod = Objects.requireNonNull(communicationMethod, "communicationMethod must not be null");
        this.booking = booking;
    }

    public int getAssignmentId() {
        return assignmentId;
    }

    public int getAgentId() {
        return agentId;
    }

    public LeadSource getLeadSource() {
        return leadSource;
    }

    public CommunicationMethod getCommunicationMethod() {
        return communicationMethod;
    }

    /**
     * Linked booking, or null when the assignment never turned into a booking.
     */
    public BookingRecord getBooking() {
        return booking;
    }

    public boolean hasBooking() {
        return booking != null;
    }
}
