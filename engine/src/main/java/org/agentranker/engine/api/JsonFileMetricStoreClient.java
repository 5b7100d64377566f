package org.agentranker.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.agentranker.engine.api.dto.AgentDto;
import org.agentranker.engine.api.dto.AssignmentDto;
import org.agentranker.engine.api.dto.ConfigItemDto;
import org.agentranker.engine.api.dto.SnapshotDocumentDto;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MetricStoreClient reading a snapshot document from a JSON file.
 * The file is read again on every call so edits show up on the next refresh;
 * a refresh takes all sections from a single read.
 */
public final class JsonFileMetricStoreClient implements MetricStoreClient {

    private static final Logger LOG = Logger.getLogger(JsonFileMetricStoreClient.class.getName());

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileMetricStoreClient(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonFileMetricStoreClient(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public List<AgentDto> fetchAgents() {
        SnapshotDocumentDto document = fetchDocument();
        return document != null ? document.getAgents() : null;
    }

    @Override
    public List<AssignmentDto> fetchAssignments() {
        SnapshotDocumentDto document = fetchDocument();
        return document != null ? document.getAssignments() : null;
    }

    @Override
    public List<ConfigItemDto> fetchScoringConfig() {
        SnapshotDocumentDto document = fetchDocument();
        return document != null ? document.getConfig() : null;
    }

    /**
     * Parses the file once. Missing sections come back as empty lists.
     */
    @Override
    public SnapshotDocumentDto fetchDocument() {
        SnapshotDocumentDto document;
        try {
            document = mapper.readValue(file.toFile(), SnapshotDocumentDto.class);
        } catch (IOException e) {
            LOG.log(Level.WARNING, e, () -> "[FILE] Failed to read snapshot document from " + file);
            return null;
        }
        if (document == null) {
            LOG.warning(() -> "[FILE] Snapshot document " + file + " is empty");
            return null;
        }
        document.setAgents(orEmpty(document.getAgents()));
        document.setAssignments(orEmpty(document.getAssignments()));
        document.setConfig(orEmpty(document.getConfig()));
        return document;
    }

    private static <T> List<T> orEmpty(List<T> items) {
        return items != null ? items : Collections.emptyList();
    }
}
