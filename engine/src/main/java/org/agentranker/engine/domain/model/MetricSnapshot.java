package org.agentranker.engine.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of the metric store taken at one point in time.
 * A ranking request reads exactly one snapshot from start to finish.
 */
public final class MetricSnapshot {

    private final List<AgentRecord> agents;
    private final List<AssignmentRecord> assignments;
    private final Instant takenAt;

    public MetricSnapshot(List<AgentRecord> agents, List<AssignmentRecord> assignments, Instant takenAt) {
        this.agents = List.copyOf(Objects.requireNonNull(agents, "agents must not be null"));
        this.assignments = List.copyOf(Objects.requireNonNull(assignments, "assignments must not be null"));
        this.takenAt = Objects.requireNonNull(takenAt, "takenAt must not be null");
    }

    public static MetricSnapshot empty() {
        return new MetricSnapshot(Collections.emptyList(), Collections.emptyList(), Instant.EPOCH);
    }

    public List<AgentRecord> getAgents() {
        return agents;
    }

    public List<AssignmentRecord> getAssignments() {
        return assignments;
    }

    public Instant getTakenAt() {
        return takenAt;
    }

    @Override
    public String toString() {
        return String.format("MetricSnapshot{agents=%d, assignments=%d, takenAt=%s}",
                agents.size(), assignments.size(), takenAt);
    }
}
