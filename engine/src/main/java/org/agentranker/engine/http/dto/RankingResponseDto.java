package org.agentranker.engine.http.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.CustomerProfile;
import org.agentranker.engine.domain.model.RankingResult;
import org.agentranker.engine.domain.model.ScoredAgent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Response body for POST /rank.
 */
public final class RankingResponseDto {

    @JsonProperty("customer_profile")
    private final ProfileDto customerProfile;

    @JsonProperty("computed_at")
    private final Instant computedAt;

    @JsonProperty("snapshot_taken_at")
    private final Instant snapshotTakenAt;

    @JsonProperty("agents")
    private final List<ScoredAgentDto> agents;

    private RankingResponseDto(ProfileDto customerProfile, Instant computedAt, Instant snapshotTakenAt,
                               List<ScoredAgentDto> agents) {
        this.customerProfile = customerProfile;
        this.computedAt = computedAt;
        this.snapshotTakenAt = snapshotTakenAt;
        this.agents = agents;
    }

    /**
     * Build the response for a ranking, keeping at most {@code limit} agents.
     */
    public static RankingResponseDto from(RankingResult result, int limit) {
        List<ScoredAgentDto> agents = new ArrayList<>();
        for (ScoredAgent agent : result.top(limit)) {
            agents.add(new ScoredAgentDto(agent));
        }
        return new RankingResponseDto(new ProfileDto(result.getCustomerProfile()),
                result.getComputedAt(), result.getSnapshotTakenAt(), agents);
    }

    public ProfileDto getCustomerProfile() {
        return customerProfile;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    public Instant getSnapshotTakenAt() {
        return snapshotTakenAt;
    }

    public List<ScoredAgentDto> getAgents() {
        return agents;
    }

    /**
     * Echo of the customer profile, as labels.
     */
    public static final class ProfileDto {
        @JsonProperty("communication_method")
        private final String communicationMethod;

        @JsonProperty("lead_source")
        private final String leadSource;

        @JsonProperty("destination")
        private final String destination;

        @JsonProperty("launch_location")
        private final String launchLocation;

        @JsonProperty("customer_name")
        private final String customerName;

        ProfileDto(CustomerProfile profile) {
            this.communicationMethod = profile.getCommunicationMethod().getLabel();
            this.leadSource = profile.getLeadSource().getLabel();
            this.destination = profile.getDestination().getLabel();
            this.launchLocation = profile.getLaunchLocation().getLabel();
            this.customerName = profile.getCustomerName();
        }

        public String getCommunicationMethod() {
            return communicationMethod;
        }

        public String getLeadSource() {
            return leadSource;
        }

        public String getDestination() {
            return destination;
        }

        public String getLaunchLocation() {
            return launchLocation;
        }

        public String getCustomerName() {
            return customerName;
        }
    }

    /**
     * One ranked agent.
     */
    public static final class ScoredAgentDto {
        @JsonProperty("rank")
        private final int rank;

        @JsonProperty("agent_id")
        private final int agentId;

        @JsonProperty("name")
        private final String name;

        @JsonProperty("department_name")
        private final String departmentName;

        @JsonProperty("rating")
        private final double rating;

        @JsonProperty("lead_source_rating")
        private final Double leadSourceRating;

        @JsonProperty("destination_rating")
        private final Double destinationRating;

        @JsonProperty("communication_rating")
        private final Double communicationRating;

        @JsonProperty("years_of_service")
        private final int yearsOfService;

        @JsonProperty("total_bookings")
        private final int totalBookings;

        @JsonProperty("confirmed_bookings")
        private final int confirmedBookings;

        @JsonProperty("cancelled_bookings")
        private final int cancelledBookings;

        @JsonProperty("cancellation_rate")
        private final double cancellationRate;

        @JsonProperty("normalized_service_years")
        private final double normalizedServiceYears;

        @JsonProperty("normalized_trip_volume")
        private final double normalizedTripVolume;

        @JsonProperty("base_score")
        private final double baseScore;

        @JsonProperty("final_score")
        private final double finalScore;

        ScoredAgentDto(ScoredAgent agent) {
            AgentPerformanceProfile profile = agent.getProfile();
            this.rank = agent.getRank();
            this.agentId = profile.getAgentId();
            this.name = profile.getName();
            this.departmentName = profile.getDepartmentName();
            this.rating = profile.getRating();
            this.leadSourceRating = profile.getLeadSourceRating();
            this.destinationRating = profile.getDestinationRating();
            this.communicationRating = profile.getCommunicationRating();
            this.yearsOfService = profile.getYearsOfService();
            this.totalBookings = profile.getTotalBookings();
            this.confirmedBookings = profile.getConfirmedBookings();
            this.cancelledBookings = profile.getCancelledBookings();
            this.cancellationRate = profile.getCancellationRate();
            this.normalizedServiceYears = agent.getNormalizedServiceYears();
            this.normalizedTripVolume = agent.getNormalizedTripVolume();
            this.baseScore = agent.getBaseScore();
            this.finalScore = agent.getFinalScore();
        }

        public int getRank() {
            return rank;
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

        public Double getLeadSourceRating() {
            return leadSourceRating;
        }

        public Double getDestinationRating() {
            return destinationRating;
        }

        public Double getCommunicationRating() {
            return communicationRating;
        }

        public int getYearsOfService() {
            return yearsOfService;
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

        public double getCancellationRate() {
            return cancellationRate;
        }

        public double getNormalizedServiceYears() {
            return normalizedServiceYears;
        }

        public double getNormalizedTripVolume() {
            return normalizedTripVolume;
        }

        public double getBaseScore() {
            return baseScore;
        }

        public double getFinalScore() {
            return finalScore;
        }
    }
}
