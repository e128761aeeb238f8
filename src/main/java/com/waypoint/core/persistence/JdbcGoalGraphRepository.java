package com.waypoint.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.waypoint.core.graph.GoalRecord;
import com.waypoint.core.graph.GraphChangeSet;
import com.waypoint.core.graph.GraphSnapshot;
import com.waypoint.core.model.DependencyKind;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.GoalDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC-backed {@link GoalGraphRepository}.
 * <p>
 * Each goal is one row holding its parent id and the goal serialized as JSON.
 * Dependency edges live in their own table. Upserts are a delete followed by
 * an insert so the same SQL runs on PostgreSQL and H2. A change set is written
 * in one transaction.
 */
public class JdbcGoalGraphRepository implements GoalGraphRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcGoalGraphRepository.class);

    private static final String GOALS_TABLE = "waypoint_goals";
    private static final String DEPENDENCIES_TABLE = "waypoint_dependencies";

    private static final String CREATE_GOALS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         VARCHAR(36) PRIMARY KEY,
                parent_id  VARCHAR(36),
                payload    TEXT NOT NULL,
                updated_at TIMESTAMP NOT NULL
            )
            """.formatted(GOALS_TABLE);

    private static final String CREATE_DEPENDENCIES_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id              VARCHAR(36) PRIMARY KEY,
                prerequisite_id VARCHAR(36) NOT NULL,
                dependent_id    VARCHAR(36) NOT NULL,
                kind            VARCHAR(32) NOT NULL,
                note            TEXT,
                created_at      TIMESTAMP NOT NULL
            )
            """.formatted(DEPENDENCIES_TABLE);

    private static final String SELECT_GOALS_SQL = """
            SELECT id, parent_id, payload FROM %s ORDER BY updated_at ASC
            """.formatted(GOALS_TABLE);

    private static final String SELECT_DEPENDENCIES_SQL = """
            SELECT id, prerequisite_id, dependent_id, kind, note, created_at FROM %s ORDER BY created_at ASC
            """.formatted(DEPENDENCIES_TABLE);

    private static final String DELETE_GOAL_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(GOALS_TABLE);

    private static final String INSERT_GOAL_SQL = """
            INSERT INTO %s (id, parent_id, payload, updated_at) VALUES (?, ?, ?, ?)
            """.formatted(GOALS_TABLE);

    private static final String DELETE_DEPENDENCY_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(DEPENDENCIES_TABLE);

    private static final String INSERT_DEPENDENCY_SQL = """
            INSERT INTO %s (id, prerequisite_id, dependent_id, kind, note, created_at) VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(DEPENDENCIES_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcGoalGraphRepository(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Creates both tables if they do not exist yet. Called once at startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement goals = conn.prepareStatement(CREATE_GOALS_SQL);
             PreparedStatement deps = conn.prepareStatement(CREATE_DEPENDENCIES_SQL)) {
            goals.execute();
            deps.execute();
            log.info("Goal tables '{}' and '{}' ensured", GOALS_TABLE, DEPENDENCIES_TABLE);
        }
    }

    @Override
    public GraphSnapshot loadAll() {
        var goals = new ArrayList<GoalRecord>();
        var dependencies = new ArrayList<GoalDependency>();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_GOALS_SQL);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String parent = rs.getString("parent_id");
                    goals.add(new GoalRecord(deserialize(rs.getString("payload")),
                            parent != null ? UUID.fromString(parent) : null));
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_DEPENDENCIES_SQL);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    dependencies.add(new GoalDependency(
                            UUID.fromString(rs.getString("id")),
                            UUID.fromString(rs.getString("prerequisite_id")),
                            UUID.fromString(rs.getString("dependent_id")),
                            DependencyKind.valueOf(rs.getString("kind")),
                            rs.getString("note"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load goal graph", e);
        }
        log.debug("Loaded {} goal rows and {} dependency rows", goals.size(), dependencies.size());
        return new GraphSnapshot(goals, dependencies);
    }

    @Override
    public void save(GraphChangeSet changes) {
        if (changes.isEmpty()) return;
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                deleteByIds(conn, DELETE_DEPENDENCY_SQL, changes.removedDependencyIds());
                deleteByIds(conn, DELETE_GOAL_SQL, changes.deletedGoalIds());
                upsertGoals(conn, changes.upserts());
                insertDependencies(conn, changes.addedDependencies());
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save " + changes.size() + " goal graph change(s)", e);
        }
        log.debug("Saved {} goal graph change(s)", changes.size());
    }

    private void deleteByIds(Connection conn, String sql, Iterable<UUID> ids) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (UUID id : ids) {
                stmt.setString(1, id.toString());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void upsertGoals(Connection conn, List<GoalRecord> records) throws SQLException {
        deleteByIds(conn, DELETE_GOAL_SQL, records.stream().map(r -> r.goal().getId()).toList());
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_GOAL_SQL)) {
            for (GoalRecord record : records) {
                Goal goal = record.goal();
                stmt.setString(1, goal.getId().toString());
                stmt.setString(2, record.parentId() != null ? record.parentId().toString() : null);
                stmt.setString(3, serialize(goal));
                stmt.setTimestamp(4, Timestamp.from(goal.getUpdatedAt()));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertDependencies(Connection conn, List<GoalDependency> edges) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_DEPENDENCY_SQL)) {
            for (GoalDependency edge : edges) {
                stmt.setString(1, edge.id().toString());
                stmt.setString(2, edge.prerequisiteId().toString());
                stmt.setString(3, edge.dependentId().toString());
                stmt.setString(4, edge.kind().name());
                stmt.setString(5, edge.note());
                stmt.setTimestamp(6, Timestamp.from(edge.createdAt()));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private String serialize(Goal goal) {
        try {
            return objectMapper.writeValueAsString(goal);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize goal " + goal.getId(), e);
        }
    }

    private Goal deserialize(String json) {
        try {
            return objectMapper.readValue(json, Goal.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize goal", e);
        }
    }
}
