package org.agentranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for an agent record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AgentDto {

    @JsonProperty("agent_id")
    private Integer agentId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("average_customer_service_rating")
    private Double averageCustomerServiceRating;

    @JsonProperty("department_name")
    private String departmentName;

    @JsonProperty("years_of_service")
    private Integer yearsOfService;

    public Integer getAgentId() {
        return agentId;
    }

    public void setAgentId(Integer agentId) {
        this.agentId = agentId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Double getAverageCustomerServiceRating() {
        return averageCustomerServiceRating;
    }

    public void setAverageCustomerServiceRating(Double averageCustomerServiceRating) {
        this.averageCustomerServiceRating = averageCustomerServiceRating;
    }

    public String getDepartmentName() {
        return departmentName;
    }

    public void setDepartmentName(String departmentName) {
        this.departmentName = departmentName;
    }

    public Integer getYearsOfService() {
        return yearsOfService;
    }

    public void setYearsOfService(Integer yearsOfService) {
        this.yearsOfService = yearsOfService;
    }
}
