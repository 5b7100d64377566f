package org.agentranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a historical assignment with its booking, if any.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignmentDto {

    @JsonProperty("assignment_id")
    private Integer assignmentId;

    @JsonProperty("agent_id")
    private Integer agentId;

    @JsonProperty("lead_source")
    private String leadSource;

    @JsonProperty("communication_method")
    private String communicationMethod;

    @JsonProperty("booking")
    private BookingDto booking;

    public Integer getAssignmentId() {
        return assignmentId;
    }

    public void setAssignmentId(Integer assignmentId) {
        this.assignmentId = assignmentId;
    }

    public Integer getAgentId() {
        return agentId;
    }

    public void setAgentId(Integer agentId) {
        this.agentId = agentId;
    }

    public String getLeadSource() {
        return leadSource;
    }

    public void setLeadSource(String leadSource) {
        this.leadSource = leadSource;
    }

    public String getCommunicationMethod() {
        return communicationMethod;
    }

    public void setCommunicationMethod(String communicationMethod) {
        this.communicationMethod = communicationMethod;
    }

    public BookingDto getBooking() {
        return booking;
    }

    public void setBooking(BookingDto booking) {
        this.booking = booking;
    }
}
