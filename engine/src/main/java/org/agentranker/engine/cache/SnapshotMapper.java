package org.agentranker.engine.cache;

import org.agentranker.engine.api.dto.AgentDto;
import org.agentranker.engine.api.dto.AssignmentDto;
import org.agentranker.engine.api.dto.BookingDto;
import org.agentranker.engine.api.dto.ConfigItemDto;
import org.agentranker.engine.domain.exception.DataIntegrityException;
import org.agentranker.engine.domain.exception.ValidationException;
import org.agentranker.engine.domain.model.AgentRecord;
import org.agentranker.engine.domain.model.AssignmentRecord;
import org.agentranker.engine.domain.model.BookingRecord;
import org.agentranker.engine.domain.model.BookingStatus;
import org.agentranker.engine.domain.model.CommunicationMethod;
import org.agentranker.engine.domain.model.Destination;
import org.agentranker.engine.domain.model.LeadSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Converts metric store DTOs into domain records.
 * Records that cannot be converted are logged and left out.
 */
final class SnapshotMapper {

    private static final Logger LOG = Logger.getLogger(SnapshotMapper.class.getName());

    List<AgentRecord> toAgents(List<AgentDto> dtos) {
        List<AgentRecord> agents = new ArrayList<>(dtos.size());
        for (AgentDto dto : dtos) {
            try {
                agents.add(toAgent(dto));
            } catch (DataIntegrityException e) {
                LOG.warning(() -> "Excluding record: " + e.getMessage());
            }
        }
        return agents;
    }

    List<AssignmentRecord> toAssignments(List<AssignmentDto> dtos) {
        List<AssignmentRecord> assignments = new ArrayList<>(dtos.size());
        for (AssignmentDto dto : dtos) {
            try {
                assignments.add(toAssignment(dto));
            } catch (DataIntegrityException e) {
                LOG.warning(() -> "Excluding record: " + e.getMessage());
            }
        }
        return assignments;
    }

    Map<String, Double> toConfigMap(List<ConfigItemDto> items) {
        Map<String, Double> values = new HashMap<>();
        for (ConfigItemDto item : items) {
            if (item.getKey() == null || item.getKey().trim().isEmpty()) {
                LOG.warning("Ignoring scoring config item without key");
                continue;
            }
            values.put(item.getKey().trim(), item.getValue());
        }
        return values;
    }

    private AgentRecord toAgent(AgentDto dto) {
        if (dto.getAgentId() == null) {
            throw new DataIntegrityException("Agent record without agent_id");
        }
        if (dto.getName() == null || dto.getAverageCustomerServiceRating() == null || dto.getYearsOfService() == null) {
            throw new DataIntegrityException("Agent " + dto.getAgentId()
                    + " is missing name, rating or years of service");
        }
        return new AgentRecord(dto.getAgentId(), dto.getName(), dto.getAverageCustomerServiceRating(),
                dto.getDepartmentName(), dto.getYearsOfService());
    }

    private AssignmentRecord toAssignment(AssignmentDto dto) {
        if (dto.getAssignmentId() == null || dto.getAgentId() == null) {
            throw new DataIntegrityException("Assignment record without assignment_id or agent_id");
        }
        int assignmentId = dto.getAssignmentId();
        try {
            LeadSource leadSource = LeadSource.fromLabel(dto.getLeadSource());
            CommunicationMethod method = CommunicationMethod.fromLabel(dto.getCommunicationMethod());
            return new AssignmentRecord(assignmentId, dto.getAgentId(), leadSource, method,
                    toBooking(dto.getBooking(), assignmentId));
        } catch (ValidationException e) {
            throw new DataIntegrityException("Assignment " + assignmentId + ": " + e.getMessage());
        }
    }

    /**
     * Booking of an assignment, or null. A booking with an unknown destination is dropped
     * while the assignment itself is kept.
     */
    private BookingRecord toBooking(BookingDto dto, int parentAssignmentId) {
        if (dto == null) {
            return null;
        }
        if (dto.getBookingId() == null) {
            LOG.warning(() -> "Excluding record: booking without booking_id on assignment " + parentAssignmentId);
            return null;
        }
        // Nested bookings may leave the back reference implicit
        int assignmentId = dto.getAssignmentId() != null ? dto.getAssignmentId() : parentAssignmentId;
        try {
            return new BookingRecord(dto.getBookingId(), assignmentId,
                    Destination.fromLabel(dto.getDestination()), BookingStatus.fromLabel(dto.getBookingStatus()));
        } catch (ValidationException e) {
            LOG.warning(() -> "Excluding record: booking " + dto.getBookingId() + ": " + e.getMessage());
            return null;
        }
    }
}
