package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.exception.DataIntegrityException;
import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.AgentRecord;
import org.agentranker.engine.domain.model.AssignmentRecord;
import org.agentranker.engine.domain.model.BookingRecord;
import org.agentranker.engine.domain.model.CustomerProfile;
import org.agentranker.engine.domain.model.MetricSnapshot;
import org.agentranker.engine.domain.model.ScoringConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Implementation of PerformanceAggregator with left-join semantics over the agent records.
 *
 * Conditional ratings average the agent's overall rating across the qualifying records,
 * so they flag experience with the requested lead source, destination or communication
 * method rather than carrying an independent outcome. Booking counts are agent-wide.
 *
 * Inconsistent records are logged and excluded; they never fail the request.
 */
public final class PerformanceAggregatorImpl implements PerformanceAggregator {

    private static final Logger LOG = Logger.getLogger(PerformanceAggregatorImpl.class.getName());

    @Override
    public List<AgentPerformanceProfile> aggregate(CustomerProfile customer, MetricSnapshot snapshot) {
        Objects.requireNonNull(customer, "customer must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Map<Integer, Tally> tallies = indexAgents(snapshot.getAgents());

        for (AssignmentRecord assignment : snapshot.getAssignments()) {
            try {
                Tally tally = tallies.get(assignment.getAgentId());
                if (tally == null) {
                    throw new DataIntegrityException(String.format(
                            "Assignment %d references unknown agent %d",
                            assignment.getAssignmentId(), assignment.getAgentId()));
                }
                tally.add(assignment, checkedBooking(assignment), customer);
            } catch (DataIntegrityException e) {
                LOG.warning(() -> "Excluding record: " + e.getMessage());
            }
        }

        List<AgentPerformanceProfile> profiles = new ArrayList<>(tallies.size());
        for (Tally tally : tallies.values()) {
            AgentPerformanceProfile profile = tally.toProfile();
            LOG.fine(() -> "Aggregated " + profile);
            profiles.add(profile);
        }
        return profiles;
    }

    /**
     * Index agents by id in ascending order, dropping records that cannot be scored.
     */
    private Map<Integer, Tally> indexAgents(List<AgentRecord> agents) {
        Map<Integer, Tally> tallies = new TreeMap<>();
        for (AgentRecord agent : agents) {
            try {
                checkAgent(agent);
                if (tallies.containsKey(agent.getAgentId())) {
                    throw new DataIntegrityException("Duplicate agent id " + agent.getAgentId()
                            + ", keeping the first record");
                }
                tallies.put(agent.getAgentId(), new Tally(agent));
            } catch (DataIntegrityException e) {
                LOG.warning(() -> "Excluding record: " + e.getMessage());
            }
        }
        return tallies;
    }

    private void checkAgent(AgentRecord agent) {
        double rating = agent.getRating();
        if (Double.isNaN(rating) || rating < ScoringConfig.RATING_SCALE_MIN || rating > ScoringConfig.RATING_SCALE_MAX) {
            throw new DataIntegrityException(String.format("Agent %d has rating %s outside %.1f-%.1f",
                    agent.getAgentId(), rating, ScoringConfig.RATING_SCALE_MIN, ScoringConfig.RATING_SCALE_MAX));
        }
        if (agent.getYearsOfService() < 0) {
            throw new DataIntegrityException(String.format("Agent %d has negative years of service: %d",
                    agent.getAgentId(), agent.getYearsOfService()));
        }
    }

    /**
     * The assignment's booking, or null if it has none or the booking belongs to another assignment.
     */
    private BookingRecord checkedBooking(AssignmentRecord assignment) {
        BookingRecord booking = assignment.getBooking();
        if (booking != null && booking.getAssignmentId() != assignment.getAssignmentId()) {
            LOG.warning(() -> String.format("Excluding record: booking %d is linked to assignment %d but claims %d",
                    booking.getBookingId(), assignment.getAssignmentId(), booking.getAssignmentId()));
            return null;
        }
        return booking;
    }

    /**
     * Running sums for one agent.
     */
    private static final class Tally {
        private final AgentRecord agent;
        private double leadSourceSum;
        private int leadSourceCount;
        private double destinationSum;
        private int destinationCount;
        private double communicationSum;
        private int communicationCount;
        private int totalBookings;
        private int confirmedBookings;
        private int cancelledBookings;

        Tally(AgentRecord agent) {
            this.agent = agent;
        }

        void add(AssignmentRecord assignment, BookingRecord booking, CustomerProfile customer) {
            double rating = agent.getRating();
            if (assignment.getLeadSource() == customer.getLeadSource()) {
                leadSourceSum += rating;
                leadSourceCount++;
            }
            if (assignment.getCommunicationMethod() == customer.getCommunicationMethod()) {
                communicationSum += rating;
                communicationCount++;
            }
            if (booking == null) {
                return;
            }
            if (booking.getDestination() == customer.getDestination()) {
                destinationSum += rating;
                destinationCount++;
            }
            totalBookings++;
            if (booking.isConfirmed()) {
                confirmedBookings++;
            } else if (booking.isCancelled()) {
                cancelledBookings++;
            }
        }

        AgentPerformanceProfile toProfile() {
            return new AgentPerformanceProfile.Builder()
                    .agent(agent)
                    .leadSourceRating(mean(leadSourceSum, leadSourceCount))
                    .destinationRating(mean(destinationSum, destinationCount))
                    .communicationRating(mean(communicationSum, communicationCount))
                    .totalBookings(totalBookings)
                    .confirmedBookings(confirmedBookings)
                    .cancelledBookings(cancelledBookings)
                    .build();
        }

        private static Double mean(double sum, int count) {
            return count == 0 ? null : sum / count;
        }
    }
}
