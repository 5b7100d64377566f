package org.agentranker.engine.api;

import org.agentranker.engine.api.dto.AgentDto;
import org.agentranker.engine.api.dto.AssignmentDto;
import org.agentranker.engine.api.dto.ConfigItemDto;
import org.agentranker.engine.api.dto.SnapshotDocumentDto;

import java.util.List;

/**
 * Read-only client for the metric store.
 * Each method returns null when the store could not be read.
 */
public interface MetricStoreClient {

    /**
     * Get all agent records.
     * GET /v1/agents
     */
    List<AgentDto> fetchAgents();

    /**
     * Get all historical assignments, each with its linked booking if one exists.
     * GET /v1/assignments
     */
    List<AssignmentDto> fetchAssignments();

    /**
     * Get scoring configuration overrides.
     * GET /v1/ranking/config
     */
    List<ConfigItemDto> fetchScoringConfig();

    /**
     * Get agents, assignments and configuration for one refresh.
     * Returns null when agents or assignments could not be read; a config of null
     * means the configuration alone was unavailable.
     */
    default SnapshotDocumentDto fetchDocument() {
        List<AgentDto> agents = fetchAgents();
        List<AssignmentDto> assignments = fetchAssignments();
        if (agents == null || assignments == null) {
            return null;
        }
        SnapshotDocumentDto document = new SnapshotDocumentDto();
        document.setAgents(agents);
        document.setAssignments(assignments);
        document.setConfig(fetchScoringConfig());
        return document;
    }
}
