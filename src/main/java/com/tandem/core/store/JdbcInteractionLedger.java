package com.tandem.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tandem.core.error.StoreException;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.InteractionStatus;
import com.tandem.core.model.InteractionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link InteractionLedger}. Metadata is stored as a JSON text column.
 */
public class JdbcInteractionLedger implements InteractionLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcInteractionLedger.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
            "id, task_id, session_id, interaction_type, status, content, metadata, created_at, created_by";

    private static final String SELECT_BY_TASK_SQL = """
            SELECT %s FROM %s
            WHERE task_id = ?
            ORDER BY created_at ASC, id ASC
            """.formatted(COLUMNS, JdbcSchema.INTERACTION_LOGS);

    private static final String SELECT_LATEST_HUMAN_SQL = """
            SELECT %s FROM %s
            WHERE session_id = ? AND interaction_type = ? AND created_at > ?
            ORDER BY created_at DESC, id DESC
            LIMIT 1
            """.formatted(COLUMNS, JdbcSchema.INTERACTION_LOGS);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcInteractionLedger(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    @Override
    public List<InteractionLogEntry> findByTask(long taskId) {
        return queryList(SELECT_BY_TASK_SQL, stmt -> stmt.setLong(1, taskId), "task " + taskId);
    }

    @Override
    public Optional<InteractionLogEntry> findLatestHumanResponse(String sessionId, Instant after) {
        List<InteractionLogEntry> rows = queryList(SELECT_LATEST_HUMAN_SQL, stmt -> {
            stmt.setString(1, sessionId);
            stmt.setString(2, InteractionType.HUMAN_RESPONSE.name());
            stmt.setTimestamp(3, JdbcSchema.toTimestamp(after));
        }, "latest human response in session " + sessionId);
        return rows.stream().findFirst();
    }

    private List<InteractionLogEntry> queryList(String sql, JdbcProjectStore.StatementBinder binder,
                                                String description) {
        List<InteractionLogEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read interaction log for {}", description, e);
            throw new StoreException("Failed to read interaction log for " + description, e);
        }
        return entries;
    }

    private InteractionLogEntry fromResultSet(ResultSet rs) throws SQLException {
        return new InteractionLogEntry(
                rs.getLong("id"),
                rs.getLong("task_id"),
                rs.getString("session_id"),
                InteractionType.valueOf(rs.getString("interaction_type")),
                InteractionStatus.valueOf(rs.getString("status")),
                rs.getString("content"),
                deserializeMetadata(rs.getString("metadata")),
                JdbcSchema.toInstant(rs.getTimestamp("created_at")),
                rs.getString("created_by"));
    }

    private Map<String, Object> deserializeMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize interaction metadata", e);
        }
    }
}
