package com.tandem.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL DDL for the task, project and interaction log tables.
 * <p>
 * Tables are created automatically via {@link #createTables(DataSource)}.
 */
public final class JdbcSchema {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchema.class);

    static final String PROJECTS = "tandem_projects";
    static final String TASKS = "tandem_tasks";
    static final String INTERACTION_LOGS = "tandem_interaction_logs";

    private static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS %s (
                id               BIGSERIAL PRIMARY KEY,
                name             VARCHAR(255) NOT NULL UNIQUE,
                owner_id         BIGINT NOT NULL,
                last_activity_at TIMESTAMP WITH TIME ZONE
            )
            """.formatted(PROJECTS),
            """
            CREATE TABLE IF NOT EXISTS %s (
                id                     BIGSERIAL PRIMARY KEY,
                project_id             BIGINT NOT NULL REFERENCES %s(id),
                creator_id             BIGINT,
                title                  VARCHAR(500) NOT NULL,
                content                TEXT,
                status                 VARCHAR(32) NOT NULL,
                is_interactive         BOOLEAN NOT NULL DEFAULT FALSE,
                ai_waiting_feedback    BOOLEAN NOT NULL DEFAULT FALSE,
                interaction_session_id VARCHAR(100),
                feedback_content       TEXT,
                feedback_at            TIMESTAMP WITH TIME ZONE,
                created_at             TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at             TIMESTAMP WITH TIME ZONE NOT NULL,
                completed_at           TIMESTAMP WITH TIME ZONE,
                version                BIGINT NOT NULL DEFAULT 0
            )
            """.formatted(TASKS, PROJECTS),
            """
            CREATE INDEX IF NOT EXISTS idx_%1$s_project_created ON %1$s (project_id, created_at)
            """.formatted(TASKS),
            """
            CREATE TABLE IF NOT EXISTS %s (
                id               BIGSERIAL PRIMARY KEY,
                task_id          BIGINT NOT NULL REFERENCES %s(id),
                session_id       VARCHAR(100) NOT NULL,
                interaction_type VARCHAR(32) NOT NULL,
                status           VARCHAR(32) NOT NULL,
                content          TEXT NOT NULL,
                metadata         TEXT,
                created_at       TIMESTAMP WITH TIME ZONE NOT NULL,
                created_by       VARCHAR(100)
            )
            """.formatted(INTERACTION_LOGS, TASKS),
            """
            CREATE INDEX IF NOT EXISTS idx_%1$s_session ON %1$s (session_id, interaction_type, created_at)
            """.formatted(INTERACTION_LOGS),
            """
            CREATE INDEX IF NOT EXISTS idx_%1$s_task ON %1$s (task_id, created_at)
            """.formatted(INTERACTION_LOGS)
    );

    private JdbcSchema() {}

    /**
     * Creates the tables and indexes if they do not already exist.
     * Should be called once during application startup.
     */
    public static void createTables(DataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
            log.info("Tables '{}', '{}', '{}' ensured", PROJECTS, TASKS, INTERACTION_LOGS);
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
