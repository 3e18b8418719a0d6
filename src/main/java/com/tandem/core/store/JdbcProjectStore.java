package com.tandem.core.store;

import com.tandem.core.error.StoreException;
import com.tandem.core.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link ProjectStore}.
 */
public class JdbcProjectStore implements ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcProjectStore.class);

    private static final String COLUMNS = "id, name, owner_id, last_activity_at";

    private static final String SELECT_BY_ID_SQL =
            "SELECT " + COLUMNS + " FROM " + JdbcSchema.PROJECTS + " WHERE id = ?";

    private static final String SELECT_BY_NAME_SQL =
            "SELECT " + COLUMNS + " FROM " + JdbcSchema.PROJECTS + " WHERE name = ?";

    private static final String SELECT_BY_OWNER_SQL =
            "SELECT " + COLUMNS + " FROM " + JdbcSchema.PROJECTS + " WHERE owner_id = ? ORDER BY id";

    private static final String INSERT_IF_ABSENT_SQL = """
            INSERT INTO %s (name, owner_id)
            VALUES (?, ?)
            ON CONFLICT (name) DO NOTHING
            """.formatted(JdbcSchema.PROJECTS);

    private final DataSource dataSource;

    public JdbcProjectStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    @Override
    public Optional<Project> findById(long projectId) {
        return queryOne(SELECT_BY_ID_SQL, stmt -> stmt.setLong(1, projectId), "id " + projectId);
    }

    @Override
    public Optional<Project> findByName(String name) {
        return queryOne(SELECT_BY_NAME_SQL, stmt -> stmt.setString(1, name), "name '" + name + "'");
    }

    @Override
    public List<Project> findByOwner(long ownerId) {
        List<Project> projects = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_OWNER_SQL)) {
            stmt.setLong(1, ownerId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    projects.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list projects for owner {}", ownerId, e);
            throw new StoreException("Failed to list projects for owner " + ownerId, e);
        }
        return projects;
    }

    @Override
    public Project createIfAbsent(String name, long ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_IF_ABSENT_SQL)) {
            stmt.setString(1, name);
            stmt.setLong(2, ownerId);
            if (stmt.executeUpdate() > 0) {
                log.info("Created project '{}' for owner {}", name, ownerId);
            }
        } catch (SQLException e) {
            log.error("Failed to create project '{}'", name, e);
            throw new StoreException("Failed to create project '" + name + "'", e);
        }
        return findByName(name).orElseThrow(() ->
                new StoreException("Project '" + name + "' missing after insert", null));
    }

    private Optional<Project> queryOne(String sql, StatementBinder binder, String description) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Failed to load project by {}", description, e);
            throw new StoreException("Failed to load project by " + description, e);
        }
    }

    private static Project fromResultSet(ResultSet rs) throws SQLException {
        return new Project(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getLong("owner_id"),
                JdbcSchema.toInstant(rs.getTimestamp("last_activity_at")));
    }

    @FunctionalInterface
    interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }
}
