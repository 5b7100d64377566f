package org.agentranker.engine.domain.model;

import java.util.Objects;

/**
 * A service agent as stored in the metric store.
 */
public final class AgentRecord {

    private final int agentId;
    private final String name;
    private final double rating;
    private final String departmentName;
    private final int yearsOfService;

    public AgentRecord(int agentId, String name, double rating, String departmentName, int yearsOfService) {
        this.agentId = agentId;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.rating = rating;
        this.departmentName = departmentName;
        this.yearsOfService = yearsOfService;
    }

    public int getAgentId() {
        return agentId;
    }

    public String getName() {
        return name;
    }

    /**
     * Average customer service rating on the 1.0 to 5.0 scale.
     */
    public double getRating() {
        return rating;
    }

    /**
     * Descriptive only; never used for scoring.
     */
    public String getDepartmentName() {
        return departmentName;
    }

    public int getYearsOfService() {
        return yearsOfService;
    }

    @Override
    public String toString() {
        return String.format("AgentRecord{id=%d, name='%s', rating=%.2f, years=%d}",
                agentId, name, rating, yearsOfService);
    }
}
