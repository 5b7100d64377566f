package org.agentranker.engine.domain.model;

import org.agentranker.engine.domain.exception.DataIntegrityException;

import java.util.Objects;

/**
 * Per-request performance summary of one agent, conditioned on a customer profile.
 * The three conditional ratings are null when the agent has no qualifying history.
 */
public final class AgentPerformanceProfile {

    private final int agentId;
    private final String name;
    private final String departmentName;
    private final double rating;
    private final int yearsOfService;
    private final Double leadSourceRating;
    private final Double destinationRating;
    private final Double communicationRating;
    private final int totalBookings;
    private final int confirmedBookings;
    private final int cancelledBookings;

    private AgentPerformanceProfile(Builder builder) {
        this.agentId = builder.agentId;
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.departmentName = builder.departmentName;
        this.rating = builder.rating;
        this.yearsOfService = builder.yearsOfService;
        this.leadSourceRating = builder.leadSourceRating;
        this.destinationRating = builder.destinationRating;
        this.communicationRating = builder.communicationRating;
        if (builder.totalBookings < 0 || builder.confirmedBookings < 0 || builder.cancelledBookings < 0) {
            throw new IllegalArgumentException("booking counts must not be negative");
        }
        if (builder.confirmedBookings + builder.cancelledBookings > builder.totalBookings) {
            throw new DataIntegrityException(String.format(
                    "confirmed (%d) + cancelled (%d) exceeds total (%d) for agent %d",
                    builder.confirmedBookings, builder.cancelledBookings, builder.totalBookings, builder.agentId));
        }
        this.totalBookings = builder.totalBookings;
        this.confirmedBookings = builder.confirmedBookings;
        this.cancelledBookings = builder.cancelledBookings;
    }

    public int getAgentId() {
        return agentId;
    }

    public String getName() {
        return name;
    }

    public String getDepartmentName() {
        return departmentName;
    }

    public double getRating() {
        return rating;
    }

    public int getYearsOfService() {
        return yearsOfService;
    }

    public Double getLeadSourceRating() {
        return leadSourceRating;
    }

    public Double getDestinationRating() {
        return destinationRating;
    }

    public Double getCommunicationRating() {
        return communicationRating;
    }

    public int getTotalBookings() {
        return totalBookings;
    }

    public int getConfirmedBookings() {
        return confirmedBookings;
    }

    public int getCancelledBookings() {
        return cancelledBookings;
    }

    /**
     * Share of bookings that were cancelled, 0 when the agent has no bookings.
     */
    public double getCancellationRate() {
        if (totalBookings == 0) {
            return 0.0;
        }
        return (double) cancelledBookings / totalBookings;
    }

    @Override
    public String toString() {
        return String.format("AgentPerformanceProfile{id=%d, rating=%.2f, leadSource=%s, destination=%s, "
                        + "communication=%s, bookings=%d/%d/%d}",
                agentId, rating, leadSourceRating, destinationRating, communicationRating,
                confirmedBookings, cancelledBookings, totalBookings);
    }

    /**
     * Builder for AgentPerformanceProfile.
     */
    public static final class Builder {
        private int agentId;
        private String name;
        private String departmentName;
        private double rating;
        private int yearsOfService;
        private Double leadSourceRating;
        private Double destinationRating;
        private Double communicationRating;
        private int totalBookings;
        private int confirmedBookings;
        private int cancelledBookings;

        public Builder agent(AgentRecord agent) {
            this.agentId = agent.getAgentId();
            this.name = agent.getName();
            this.departmentName = agent.getDepartmentName();
            this.rating = agent.getRating();
            this.yearsOfService = agent.getYearsOfService();
            return this;
        }

        public Builder agentId(int agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder departmentName(String departmentName) {
            this.departmentName = departmentName;
            return this;
        }

        public Builder rating(double rating) {
            this.rating = rating;
            return this;
        }

        public Builder yearsOfService(int yearsOfService) {
            this.yearsOfService = yearsOfService;
            return this;
        }

        public Builder leadSourceRating(Double leadSourceRating) {
            this.leadSourceRating = leadSourceRating;
            return this;
        }

        public Builder destinationRating(Double destinationRating) {
            this.destinationRating = destinationRating;
            return this;
        }

        public Builder communicationRating(Double communicationRating) {
            this.communicationRating = communicationRating;
            return this;
        }

        public Builder totalBookings(int totalBookings) {
            this.totalBookings = totalBookings;
            return this;
        }

        public Builder confirmedBookings(int confirmedBookings) {
            this.confirmedBookings = confirmedBookings;
            return this;
        }

        public Builder cancelledBookings(int cancelledBookings) {
            this.cancelledBookings = cancelledBookings;
            return this;
        }

        public AgentPerformanceProfile build() {
            return new AgentPerformanceProfile(this);
        }
    }
}
