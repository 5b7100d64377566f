package org.agentranker.engine.domain.model;

import java.util.Objects;

/**
 * Outcome of a historical assignment.
 */
public final class BookingRecord {

    private final int bookingId;
    private final int assignmentId;
    private final Destination destination;
    private final BookingStatus status;

    public BookingRecord(int bookingId, int assignmentId, Destination destination, BookingStatus status) {
        this.bookingId = bookingId;
        this.assignmentId = assignmentId;
        this.destination = Objects.requireNonNull(destination, "destination must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public int getBookingId() {
        return bookingId;
    }

    public int getAssignmentId() {
        return assignmentId;
    }

    public Destination getDestination() {
        return destination;
    }

    public BookingStatus getStatus() {
        return status;
    }

    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    public boolean isCancelled() {
        return status == BookingStatus.CANCELLED;
    }
}
