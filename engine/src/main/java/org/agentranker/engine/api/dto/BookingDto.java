package org.agentranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for the booking linked to an assignment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BookingDto {

    @JsonProperty("booking_id")
    private Integer bookingId;

    @JsonProperty("assignment_id")
    private Integer assignmentId;

    @JsonProperty("destination")
    private String destination;

    @JsonProperty("booking_status")
    private String bookingStatus;

    public Integer getBookingId() {
        return bookingId;
    }

    public void setBookingId(Integer bookingId) {
        this.bookingId = bookingId;
    }

    public Integer getAssignmentId() {
        return assignmentId;
    }

    public void setAssignmentId(Integer assignmentId) {
        this.assignmentId = assignmentId;
    }

    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }

    public String getBookingStatus() {
        return bookingStatus;
    }

    public void setBookingStatus(String bookingStatus) {
        this.bookingStatus = bookingStatus;
    }
}
