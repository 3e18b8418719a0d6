package com.tandem.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tandem.core.error.InteractionException;
import com.tandem.core.error.StoreException;
import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.NewTask;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC-based {@link TaskStore} backed by PostgreSQL.
 * <p>
 * {@link #commit(TaskTransition)} runs in a single database transaction: a versioned
 * {@code UPDATE} of the task row, the optional ledger insert and the project activity
 * touch either all land or are rolled back together.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private static final String COLUMNS = """
            id, project_id, creator_id, title, content, status, is_interactive, ai_waiting_feedback,
            interaction_session_id, feedback_content, feedback_at, created_at, updated_at, completed_at, version""";

    private static final String SELECT_BY_ID_SQL =
            "SELECT " + COLUMNS + " FROM " + JdbcSchema.TASKS + " WHERE id = ?";

    private static final String SELECT_RECENT_SQL =
            "SELECT " + COLUMNS + " FROM " + JdbcSchema.TASKS + " ORDER BY updated_at DESC LIMIT ?";

    private static final String INSERT_SQL = """
            INSERT INTO %s (project_id, creator_id, title, content, status, is_interactive,
                            created_at, updated_at, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0)
            """.formatted(JdbcSchema.TASKS);

    private static final String UPDATE_VERSIONED_SQL = """
            UPDATE %s
            SET status = ?, ai_waiting_feedback = ?, interaction_session_id = ?,
                feedback_content = ?, feedback_at = ?, completed_at = ?,
                updated_at = ?, version = version + 1
            WHERE id = ? AND version = ?
            """.formatted(JdbcSchema.TASKS);

    private static final String INSERT_LOG_SQL = """
            INSERT INTO %s (task_id, session_id, interaction_type, status, content, metadata, created_at, created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(JdbcSchema.INTERACTION_LOGS);

    private static final String TOUCH_PROJECT_SQL =
            "UPDATE " + JdbcSchema.PROJECTS + " SET last_activity_at = ? WHERE id = ?";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcTaskStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<Task> findById(long taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setLong(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Failed to load task {}", taskId, e);
            throw new StoreException("Failed to load task " + taskId, e);
        }
    }

    @Override
    public List<Task> findCreatedAfter(long projectId, Instant after, Set<TaskStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
        String sql = "SELECT " + COLUMNS + " FROM " + JdbcSchema.TASKS
                + " WHERE project_id = ? AND created_at > ? AND status IN (" + placeholders + ")"
                + " ORDER BY created_at ASC, id ASC";

        List<Task> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, projectId);
            stmt.setTimestamp(2, JdbcSchema.toTimestamp(after));
            int index = 3;
            for (TaskStatus status : statuses) {
                stmt.setString(index++, status.name());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query new tasks for project {}", projectId, e);
            throw new StoreException("Failed to query new tasks for project " + projectId, e);
        }
        return tasks;
    }

    @Override
    public List<Task> findRecent(int limit) {
        List<Task> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list recent tasks", e);
            throw new StoreException("Failed to list recent tasks", e);
        }
        return tasks;
    }

    @Override
    public Task insert(NewTask newTask) {
        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long id;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
                    stmt.setLong(1, newTask.projectId());
                    setNullableLong(stmt, 2, newTask.creatorId());
                    stmt.setString(3, newTask.title());
                    stmt.setString(4, newTask.content());
                    stmt.setString(5, newTask.status().name());
                    stmt.setBoolean(6, newTask.interactive());
                    stmt.setTimestamp(7, JdbcSchema.toTimestamp(now));
                    stmt.setTimestamp(8, JdbcSchema.toTimestamp(now));
                    stmt.executeUpdate();
                    id = generatedId(stmt);
                }
                touchProject(conn, newTask.projectId(), now);
                conn.commit();
                log.debug("Inserted task {} in project {}", id, newTask.projectId());
                return new Task(id, newTask.projectId(), newTask.creatorId(), newTask.title(), newTask.content(),
                        newTask.status(), newTask.interactive(), false, null, null, null, now, now, null, 0L);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to insert task into project {}", newTask.projectId(), e);
            throw new StoreException("Failed to insert task", e);
        }
    }

    @Override
    public TaskTransition commit(TaskTransition transition) {
        Task previous = transition.previous();
        Task next = transition.next();
        Instant at = transition.occurredAt();

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(UPDATE_VERSIONED_SQL)) {
                    stmt.setString(1, next.status().name());
                    stmt.setBoolean(2, next.aiWaitingFeedback());
                    stmt.setString(3, next.interactionSessionId());
                    stmt.setString(4, next.feedbackContent());
                    stmt.setTimestamp(5, JdbcSchema.toTimestamp(next.feedbackAt()));
                    stmt.setTimestamp(6, JdbcSchema.toTimestamp(next.completedAt()));
                    stmt.setTimestamp(7, JdbcSchema.toTimestamp(at));
                    stmt.setLong(8, previous.id());
                    stmt.setLong(9, previous.version());
                    if (stmt.executeUpdate() == 0) {
                        conn.rollback();
                        throw InteractionException.conflict("Task " + previous.id()
                                + " was modified concurrently (expected version " + previous.version() + ")");
                    }
                }

                InteractionLogEntry storedEntry = null;
                if (transition.entry() != null) {
                    storedEntry = insertEntry(conn, transition.entry());
                }
                touchProject(conn, next.projectId(), at);
                conn.commit();

                log.debug("Committed task {} at version {}", previous.id(), previous.version() + 1);
                return transition.committed(next.withCommit(at, previous.version() + 1), storedEntry);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to commit transition for task {}", previous.id(), e);
            throw new StoreException("Failed to commit transition for task " + previous.id(), e);
        }
    }

    private InteractionLogEntry insertEntry(Connection conn, InteractionLogEntry entry) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_LOG_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, entry.taskId());
            stmt.setString(2, entry.sessionId());
            stmt.setString(3, entry.type().name());
            stmt.setString(4, entry.status().name());
            stmt.setString(5, entry.content());
            stmt.setString(6, serializeMetadata(entry));
            stmt.setTimestamp(7, JdbcSchema.toTimestamp(entry.createdAt()));
            stmt.setString(8, entry.createdBy());
            stmt.executeUpdate();
            return entry.withId(generatedId(stmt));
        }
    }

    private static void touchProject(Connection conn, long projectId, Instant at) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(TOUCH_PROJECT_SQL)) {
            stmt.setTimestamp(1, JdbcSchema.toTimestamp(at));
            stmt.setLong(2, projectId);
            stmt.executeUpdate();
        }
    }

    private static long generatedId(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong("id");
        }
    }

    private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    private String serializeMetadata(InteractionLogEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.metadata());
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize metadata for task " + entry.taskId(), e);
        }
    }

    private static Task fromResultSet(ResultSet rs) throws SQLException {
        long creator = rs.getLong("creator_id");
        Long creatorId = rs.wasNull() ? null : creator;
        return new Task(
                rs.getLong("id"),
                rs.getLong("project_id"),
                creatorId,
                rs.getString("title"),
                rs.getString("content"),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getBoolean("is_interactive"),
                rs.getBoolean("ai_waiting_feedback"),
                rs.getString("interaction_session_id"),
                rs.getString("feedback_content"),
                JdbcSchema.toInstant(rs.getTimestamp("feedback_at")),
                JdbcSchema.toInstant(rs.getTimestamp("created_at")),
                JdbcSchema.toInstant(rs.getTimestamp("updated_at")),
                JdbcSchema.toInstant(rs.getTimestamp("completed_at")),
                rs.getLong("version"));
    }
}
