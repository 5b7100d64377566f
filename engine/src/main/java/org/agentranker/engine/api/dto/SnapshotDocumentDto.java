package org.agentranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A whole metric store extract in one document, as read from a snapshot file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SnapshotDocumentDto {

    @JsonProperty("agents")
    private List<AgentDto> agents;

    @JsonProperty("assignments")
    private List<AssignmentDto> assignments;

    @JsonProperty("config")
    private List<ConfigItemDto> config;

    public List<AgentDto> getAgents() {
        return agents;
    }

    public void setAgents(List<AgentDto> agents) {
        this.agents = agents;
    }

    public List<AssignmentDto> getAssignments() {
        return assignments;
    }

    public void setAssignments(List<AssignmentDto> assignments) {
        this.assignments = assignments;
    }

    public List<ConfigItemDto> getConfig() {
        return config;
    }

    public void setConfig(List<ConfigItemDto> config) {
        this.config = config;
    }
}
