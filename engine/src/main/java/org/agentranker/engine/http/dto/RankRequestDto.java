package org.agentranker.engine.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /rank: the raw customer profile labels.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RankRequestDto {

    @JsonProperty("communication_method")
    private String communicationMethod;

    @JsonProperty("lead_source")
    private String leadSource;

    @JsonProperty("destination")
    private String destination;

    @JsonProperty("launch_location")
    private String launchLocation;

    @JsonProperty("customer_name")
    private String customerName;

    public String getCommunicationMethod() {
        return communicationMethod;
    }

    public void setCommunicationMethod(String communicationMethod) {
        this.communicationMethod = communicationMethod;
    }

    public String getLeadSource() {
        return leadSource;
    }

    public void setLeadSource(String leadSource) {
        this.leadSource = leadSource;
    }

    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }

    public String getLaunchLocation() {
        return launchLocation;
    }

    public void setLaunchLocation(String launchLocation) {
        this.launchLocation = launchLocation;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }
}
