package com.agentflow.core.store;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.model.Communication;
import com.agentflow.core.model.CommunicationType;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.HealthSeverity;
import com.agentflow.core.model.Notification;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.model.Workflow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC-backed {@link OrchestrationStore} targeting PostgreSQL.
 * <p>
 * One table per record type, named {@code <prefix>agents}, {@code <prefix>tasks}
 * and so on. Structured fields (workflow, metadata, capabilities) are stored
 * as JSON text. The SQL is kept to what PostgreSQL and H2 both accept.
 * <p>
 * Task updates run in a single transaction: a versioned {@code UPDATE ... WHERE version = ?}
 * followed by the agent load adjustments it implies.
 * <p>
 * Tables are created by {@link #createTables()}.
 */
public class JdbcOrchestrationStore implements OrchestrationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcOrchestrationStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<Set<String>> SET_TYPE = new TypeReference<>() {};

    private static final String AGENT_COLUMNS =
            "id, role, name, status, current_load, max_load, health_score, capabilities, last_activity";
    private static final String TASK_COLUMNS =
            "id, title, description, status, priority, assigned_agent_id, parent_task_id, workflow, "
                    + "metadata, created_at, updated_at, completed_at, version";
    private static final String COMMUNICATION_COLUMNS =
            "id, from_agent_id, to_agent_id, task_id, message, type, metadata, created_at";
    private static final String HEALTH_EVENT_COLUMNS =
            "id, agent_id, type, severity, message, details, resolved, created_at";
    private static final String NOTIFICATION_COLUMNS =
            "id, type, subject, message, recipient_agent_id, metadata, sent, created_at";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    private final String agentsTable;
    private final String tasksTable;
    private final String communicationsTable;
    private final String healthEventsTable;
    private final String notificationsTable;

    public JdbcOrchestrationStore(DataSource dataSource, ObjectMapper objectMapper, String tablePrefix) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        String prefix = tablePrefix == null ? "" : tablePrefix;
        this.agentsTable = prefix + "agents";
        this.tasksTable = prefix + "tasks";
        this.communicationsTable = prefix + "communications";
        this.healthEventsTable = prefix + "health_events";
        this.notificationsTable = prefix + "notifications";
    }

    /**
     * Creates the tables if they do not already exist.
     * Called once during application startup.
     */
    public void createTables() throws SQLException {
        List<String> ddl = List.of("""
                CREATE TABLE IF NOT EXISTS %s (
                    id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    role          VARCHAR(64)  NOT NULL,
                    name          VARCHAR(255) NOT NULL,
                    status        VARCHAR(32)  NOT NULL,
                    current_load  INTEGER      NOT NULL,
                    max_load      INTEGER      NOT NULL,
                    health_score  INTEGER      NOT NULL,
                    capabilities  TEXT         NOT NULL,
                    last_activity TIMESTAMP
                )
                """.formatted(agentsTable), """
                CREATE TABLE IF NOT EXISTS %s (
                    id                BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    title             VARCHAR(512) NOT NULL,
                    description       TEXT         NOT NULL,
                    status            VARCHAR(32)  NOT NULL,
                    priority          VARCHAR(16)  NOT NULL,
                    assigned_agent_id BIGINT,
                    parent_task_id    BIGINT,
                    workflow          TEXT         NOT NULL,
                    metadata          TEXT         NOT NULL,
                    created_at        TIMESTAMP    NOT NULL,
                    updated_at        TIMESTAMP    NOT NULL,
                    completed_at      TIMESTAMP,
                    version           BIGINT       NOT NULL
                )
                """.formatted(tasksTable), """
                CREATE TABLE IF NOT EXISTS %s (
                    id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    from_agent_id BIGINT,
                    to_agent_id   BIGINT,
                    task_id       BIGINT,
                    message       TEXT        NOT NULL,
                    type          VARCHAR(64) NOT NULL,
                    metadata      TEXT        NOT NULL,
                    created_at    TIMESTAMP   NOT NULL
                )
                """.formatted(communicationsTable), """
                CREATE TABLE IF NOT EXISTS %s (
                    id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    agent_id   BIGINT      NOT NULL,
                    type       VARCHAR(64) NOT NULL,
                    severity   VARCHAR(16) NOT NULL,
                    message    TEXT        NOT NULL,
                    details    TEXT        NOT NULL,
                    resolved   BOOLEAN     NOT NULL,
                    created_at TIMESTAMP   NOT NULL
                )
                """.formatted(healthEventsTable), """
                CREATE TABLE IF NOT EXISTS %s (
                    id                 BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    type               VARCHAR(64)  NOT NULL,
                    subject            VARCHAR(512) NOT NULL,
                    message            TEXT         NOT NULL,
                    recipient_agent_id BIGINT,
                    metadata           TEXT         NOT NULL,
                    sent               BOOLEAN      NOT NULL,
                    created_at         TIMESTAMP    NOT NULL
                )
                """.formatted(notificationsTable));

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : ddl) {
                stmt.execute(sql);
            }
        }
        log.info("Orchestration tables ensured ({}, {}, {}, {}, {})",
                agentsTable, tasksTable, communicationsTable, healthEventsTable, notificationsTable);
    }

    // -- agents ---------------------------------------------------------------

    @Override
    public List<Agent> findAgents() {
        return queryAgents("SELECT " + AGENT_COLUMNS + " FROM " + agentsTable + " ORDER BY id");
    }

    @Override
    public List<Agent> findAgentsByRole(AgentRole role) {
        return queryAgents("SELECT " + AGENT_COLUMNS + " FROM " + agentsTable + " WHERE role = ? ORDER BY id",
                role.tag());
    }

    @Override
    public Optional<Agent> findAgent(long id) {
        return queryAgents("SELECT " + AGENT_COLUMNS + " FROM " + agentsTable + " WHERE id = ?", id)
                .stream().findFirst();
    }

    @Override
    public Agent createAgent(Agent agent) {
        String sql = "INSERT INTO " + agentsTable
                + " (role, name, status, current_load, max_load, health_score, capabilities, last_activity)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bindAgent(stmt, agent);
            stmt.executeUpdate();
            return agent.withId(generatedId(stmt));
        } catch (SQLException e) {
            throw new StoreException("Failed to create agent " + agent.name(), e);
        }
    }

    @Override
    public Agent updateAgent(Agent agent) {
        String sql = "UPDATE " + agentsTable
                + " SET role = ?, name = ?, status = ?, current_load = ?, max_load = ?, health_score = ?,"
                + " capabilities = ?, last_activity = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bindAgent(stmt, agent);
            stmt.setLong(9, agent.id());
            if (stmt.executeUpdate() == 0) {
                throw new RecordNotFoundException("agent", agent.id());
            }
            return agent;
        } catch (SQLException e) {
            throw new StoreException("Failed to update agent " + agent.id(), e);
        }
    }

    // -- tasks ----------------------------------------------------------------

    @Override
    public List<Task> findTasks() {
        return queryTasks("SELECT " + TASK_COLUMNS + " FROM " + tasksTable + " ORDER BY created_at DESC, id DESC");
    }

    @Override
    public List<Task> findTasksByStatus(Collection<TaskStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
        Object[] params = statuses.stream().map(TaskStatus::value).toArray();
        return queryTasks("SELECT " + TASK_COLUMNS + " FROM " + tasksTable
                + " WHERE status IN (" + placeholders + ") ORDER BY created_at DESC, id DESC", params);
    }

    @Override
    public List<Task> findTasksByAgent(long agentId) {
        return queryTasks("SELECT " + TASK_COLUMNS + " FROM " + tasksTable
                + " WHERE assigned_agent_id = ? ORDER BY created_at DESC, id DESC", agentId);
    }

    @Override
    public Optional<Task> findTask(long id) {
        return queryTasks("SELECT " + TASK_COLUMNS + " FROM " + tasksTable + " WHERE id = ?", id)
                .stream().findFirst();
    }

    @Override
    public Task createTask(Task task) {
        String sql = "INSERT INTO " + tasksTable
                + " (title, description, status, priority, assigned_agent_id, parent_task_id, workflow,"
                + " metadata, created_at, updated_at, completed_at, version)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Task stored;
                try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                    bindTask(stmt, task.withVersion(0));
                    stmt.setLong(12, 0);
                    stmt.executeUpdate();
                    stored = task.withId(generatedId(stmt)).withVersion(0);
                }
                applyLoad(conn, TaskUpdateRules.loadDeltas(null, stored));
                conn.commit();
                return stored;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to create task '" + task.title() + "'", e);
        }
    }

    @Override
    public Task updateTask(Task task) {
        String sql = "UPDATE " + tasksTable
                + " SET title = ?, description = ?, status = ?, priority = ?, assigned_agent_id = ?,"
                + " parent_task_id = ?, workflow = ?, metadata = ?, created_at = ?, updated_at = ?,"
                + " completed_at = ?, version = ? WHERE id = ? AND version = ?";
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Task current = selectTask(conn, task.id())
                        .orElseThrow(() -> new RecordNotFoundException("task", task.id()));
                TaskUpdateRules.checkUpdate(current, task);
                if (task.isAssigned() && !agentExists(conn, task.assignedAgentId())) {
                    throw new RecordNotFoundException("agent", task.assignedAgentId());
                }
                Task stored = task.withVersion(current.version() + 1);
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    bindTask(stmt, stored);
                    stmt.setLong(12, stored.version());
                    stmt.setLong(13, task.id());
                    stmt.setLong(14, task.version());
                    if (stmt.executeUpdate() == 0) {
                        long actual = selectTask(conn, task.id()).map(Task::version).orElse(-1L);
                        throw new TaskVersionConflictException(task.id(), task.version(), actual);
                    }
                }
                applyLoad(conn, TaskUpdateRules.loadDeltas(current, stored));
                conn.commit();
                return stored;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update task " + task.id(), e);
        }
    }

    // -- communications -------------------------------------------------------

    @Override
    public Communication createCommunication(Communication communication) {
        String sql = "INSERT INTO " + communicationsTable
                + " (from_agent_id, to_agent_id, task_id, message, type, metadata, created_at)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            setNullableLong(stmt, 1, communication.fromAgentId());
            setNullableLong(stmt, 2, communication.toAgentId());
            setNullableLong(stmt, 3, communication.taskId());
            stmt.setString(4, communication.message());
            stmt.setString(5, communication.type().value());
            stmt.setString(6, toJson(communication.metadata()));
            stmt.setTimestamp(7, Timestamp.from(communication.createdAt()));
            stmt.executeUpdate();
            return communication.withId(generatedId(stmt));
        } catch (SQLException e) {
            throw new StoreException("Failed to record " + communication.type().value() + " communication", e);
        }
    }

    @Override
    public List<Communication> findCommunicationsByTask(long taskId) {
        return queryCommunications("SELECT " + COMMUNICATION_COLUMNS + " FROM " + communicationsTable
                + " WHERE task_id = ? ORDER BY id", taskId);
    }

    @Override
    public List<Communication> findRecentCommunications(int limit) {
        return queryCommunications("SELECT " + COMMUNICATION_COLUMNS + " FROM " + communicationsTable
                + " ORDER BY id DESC LIMIT ?", limit);
    }

    // -- health events --------------------------------------------------------

    @Override
    public HealthEvent createHealthEvent(HealthEvent event) {
        String sql = "INSERT INTO " + healthEventsTable
                + " (agent_id, type, severity, message, details, resolved, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, event.agentId());
            stmt.setString(2, event.type());
            stmt.setString(3, event.severity().value());
            stmt.setString(4, event.message());
            stmt.setString(5, toJson(event.details()));
            stmt.setBoolean(6, event.resolved());
            stmt.setTimestamp(7, Timestamp.from(event.createdAt()));
            stmt.executeUpdate();
            return event.withId(generatedId(stmt));
        } catch (SQLException e) {
            throw new StoreException("Failed to record health event for agent " + event.agentId(), e);
        }
    }

    @Override
    public List<HealthEvent> findHealthEvents(long agentId) {
        return queryHealthEvents("SELECT " + HEALTH_EVENT_COLUMNS + " FROM " + healthEventsTable
                + " WHERE agent_id = ? ORDER BY id", agentId);
    }

    @Override
    public List<HealthEvent> findUnresolvedHealthEvents() {
        return queryHealthEvents("SELECT " + HEALTH_EVENT_COLUMNS + " FROM " + healthEventsTable
                + " WHERE resolved = FALSE ORDER BY id");
    }

    @Override
    public HealthEvent resolveHealthEvent(long id) {
        executeUpdateOrNotFound("UPDATE " + healthEventsTable + " SET resolved = TRUE WHERE id = ?",
                "health event", id);
        return queryHealthEvents("SELECT " + HEALTH_EVENT_COLUMNS + " FROM " + healthEventsTable
                + " WHERE id = ?", id).get(0);
    }

    // -- notifications --------------------------------------------------------

    @Override
    public Notification createNotification(Notification notification) {
        String sql = "INSERT INTO " + notificationsTable
                + " (type, subject, message, recipient_agent_id, metadata, sent, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, notification.type());
            stmt.setString(2, notification.subject());
            stmt.setString(3, notification.message());
            setNullableLong(stmt, 4, notification.recipientAgentId());
            stmt.setString(5, toJson(notification.metadata()));
            stmt.setBoolean(6, notification.sent());
            stmt.setTimestamp(7, Timestamp.from(notification.createdAt()));
            stmt.executeUpdate();
            return notification.withId(generatedId(stmt));
        } catch (SQLException e) {
            throw new StoreException("Failed to record notification '" + notification.subject() + "'", e);
        }
    }

    @Override
    public Notification markNotificationSent(long id) {
        executeUpdateOrNotFound("UPDATE " + notificationsTable + " SET sent = TRUE WHERE id = ?",
                "notification", id);
        return queryNotifications("SELECT " + NOTIFICATION_COLUMNS + " FROM " + notificationsTable
                + " WHERE id = ?", id).get(0);
    }

    @Override
    public List<Notification> findNotifications() {
        return queryNotifications("SELECT " + NOTIFICATION_COLUMNS + " FROM " + notificationsTable + " ORDER BY id");
    }

    // -- helpers --------------------------------------------------------------

    private Optional<Task> selectTask(Connection conn, long id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT " + TASK_COLUMNS + " FROM " + tasksTable + " WHERE id = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(taskFrom(rs)) : Optional.empty();
            }
        }
    }

    private boolean agentExists(Connection conn, long agentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM " + agentsTable + " WHERE id = ?")) {
            stmt.setLong(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Applies load deltas inside the caller's transaction, re-reading each
     * agent so the active/busy toggle sees the current load.
     */
    private void applyLoad(Connection conn, Map<Long, Integer> deltas) throws SQLException {
        for (var entry : deltas.entrySet()) {
            Agent agent;
            try (PreparedStatement select = conn.prepareStatement(
                    "SELECT " + AGENT_COLUMNS + " FROM " + agentsTable + " WHERE id = ?")) {
                select.setLong(1, entry.getKey());
                try (ResultSet rs = select.executeQuery()) {
                    if (!rs.next()) {
                        throw new RecordNotFoundException("agent", entry.getKey());
                    }
                    agent = agentFrom(rs);
                }
            }
            Agent adjusted = agent.withLoad(agent.currentLoad() + entry.getValue());
            try (PreparedStatement update = conn.prepareStatement(
                    "UPDATE " + agentsTable + " SET current_load = ?, status = ? WHERE id = ?")) {
                update.setInt(1, adjusted.currentLoad());
                update.setString(2, adjusted.status().value());
                update.setLong(3, adjusted.id());
                update.executeUpdate();
            }
        }
    }

    private void executeUpdateOrNotFound(String sql, String recordType, long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, id);
            if (stmt.executeUpdate() == 0) {
                throw new RecordNotFoundException(recordType, id);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update " + recordType + " " + id, e);
        }
    }

    private void bindAgent(PreparedStatement stmt, Agent agent) throws SQLException {
        stmt.setString(1, agent.role().tag());
        stmt.setString(2, agent.name());
        stmt.setString(3, agent.status().value());
        stmt.setInt(4, agent.currentLoad());
        stmt.setInt(5, agent.maxLoad());
        stmt.setInt(6, agent.healthScore());
        stmt.setString(7, toJson(agent.capabilities()));
        setNullableTimestamp(stmt, 8, agent.lastActivity());
    }

    /** Binds parameters 1-11; the caller binds the version and any WHERE clause. */
    private void bindTask(PreparedStatement stmt, Task task) throws SQLException {
        stmt.setString(1, task.title());
        stmt.setString(2, task.description());
        stmt.setString(3, task.status().value());
        stmt.setString(4, task.priority().value());
        setNullableLong(stmt, 5, task.assignedAgentId());
        setNullableLong(stmt, 6, task.parentTaskId());
        stmt.setString(7, toJson(task.workflow()));
        stmt.setString(8, toJson(task.metadata()));
        stmt.setTimestamp(9, Timestamp.from(task.createdAt()));
        stmt.setTimestamp(10, Timestamp.from(task.updatedAt()));
        setNullableTimestamp(stmt, 11, task.completedAt());
    }

    private List<Agent> queryAgents(String sql, Object... params) {
        return query(sql, params, this::agentFrom);
    }

    private List<Task> queryTasks(String sql, Object... params) {
        return query(sql, params, this::taskFrom);
    }

    private List<Communication> queryCommunications(String sql, Object... params) {
        return query(sql, params, this::communicationFrom);
    }

    private List<HealthEvent> queryHealthEvents(String sql, Object... params) {
        return query(sql, params, this::healthEventFrom);
    }

    private List<Notification> queryNotifications(String sql, Object... params) {
        return query(sql, params, this::notificationFrom);
    }

    private <T> List<T> query(String sql, Object[] params, RowMapper<T> mapper) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + sql, e);
        }
    }

    private Agent agentFrom(ResultSet rs) throws SQLException {
        return new Agent(
                rs.getLong("id"),
                AgentRole.of(rs.getString("role")),
                rs.getString("name"),
                AgentStatus.of(rs.getString("status")),
                rs.getInt("current_load"),
                rs.getInt("max_load"),
                rs.getInt("health_score"),
                fromJson(rs.getString("capabilities"), SET_TYPE),
                instant(rs, "last_activity"));
    }

    private Task taskFrom(ResultSet rs) throws SQLException {
        return new Task(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("description"),
                TaskStatus.of(rs.getString("status")),
                TaskPriority.of(rs.getString("priority")),
                nullableLong(rs, "assigned_agent_id"),
                nullableLong(rs, "parent_task_id"),
                fromJson(rs.getString("workflow"), Workflow.class),
                fromJson(rs.getString("metadata"), MAP_TYPE),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "completed_at"),
                rs.getLong("version"));
    }

    private Communication communicationFrom(ResultSet rs) throws SQLException {
        return new Communication(
                rs.getLong("id"),
                nullableLong(rs, "from_agent_id"),
                nullableLong(rs, "to_agent_id"),
                nullableLong(rs, "task_id"),
                rs.getString("message"),
                CommunicationType.of(rs.getString("type")),
                fromJson(rs.getString("metadata"), MAP_TYPE),
                instant(rs, "created_at"));
    }

    private HealthEvent healthEventFrom(ResultSet rs) throws SQLException {
        return new HealthEvent(
                rs.getLong("id"),
                rs.getLong("agent_id"),
                rs.getString("type"),
                HealthSeverity.of(rs.getString("severity")),
                rs.getString("message"),
                fromJson(rs.getString("details"), MAP_TYPE),
                rs.getBoolean("resolved"),
                instant(rs, "created_at"));
    }

    private Notification notificationFrom(ResultSet rs) throws SQLException {
        return new Notification(
                rs.getLong("id"),
                rs.getString("type"),
                rs.getString("subject"),
                rs.getString("message"),
                nullableLong(rs, "recipient_agent_id"),
                fromJson(rs.getString("metadata"), MAP_TYPE),
                rs.getBoolean("sent"),
                instant(rs, "created_at"));
    }

    private static long generatedId(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static void setNullableTimestamp(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP);
        } else {
            stmt.setTimestamp(index, Timestamp.from(value));
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getType().getTypeName(), e);
        }
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
