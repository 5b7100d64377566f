package org.agentranker.engine.domain.model;

/**
 * Outcome of a booking. Anything the store reports that is neither confirmed nor cancelled
 * is still in progress and only counts toward the booking total.
 */
public enum BookingStatus implements Labeled {
    CONFIRMED("Confirmed"),
    CANCELLED("Cancelled"),
    PENDING("Pending"),
    IN_PROGRESS("In Progress");

    private final String label;

    BookingStatus(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    /**
     * Map a status label from the metric store. Unknown labels are treated as in progress.
     */
    public static BookingStatus fromLabel(String label) {
        if (label == null) {
            return IN_PROGRESS;
        }
        String trimmed = label.trim();
        for (BookingStatus status : values()) {
            if (status.label.equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        return IN_PROGRESS;
    }
}
