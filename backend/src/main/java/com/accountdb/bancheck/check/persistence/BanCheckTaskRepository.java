package com.accountdb.bancheck.check.persistence;

import com.accountdb.bancheck.check.model.BanCheckTask;
import com.accountdb.bancheck.check.model.CheckResult;
import com.accountdb.bancheck.check.model.ProxyPoolStats;
import com.accountdb.bancheck.check.model.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Repository
public class BanCheckTaskRepository {
    private static final Logger log = LoggerFactory.getLogger(BanCheckTaskRepository.class);
    private static final TypeReference<List<CheckResult>> RESULT_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public BanCheckTaskRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public void insertTask(BanCheckTask task, int totalIdentifiers) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", task.taskId())
            .addValue("ownerId", task.ownerId())
            .addValue("status", task.status().name())
            .addValue("message", task.message())
            .addValue("progress", task.progress())
            .addValue("totalIdentifiers", totalIdentifiers)
            .addValue("results", writeJson(task.results() == null ? List.of() : task.results()))
            .addValue("proxyStats", writeJson(task.proxyStats() == null ? ProxyPoolStats.empty() : task.proxyStats()))
            .addValue("createdAt", toTimestamp(task.createdAt()))
            .addValue("updatedAt", toTimestamp(task.updatedAt()));
        jdbc.update(
            """
                INSERT INTO ban_check_tasks (
                    task_id,
                    owner_id,
                    status,
                    message,
                    progress,
                    total_identifiers,
                    results,
                    proxy_stats,
                    created_at,
                    updated_at
                )
                VALUES (
                    :taskId,
                    :ownerId,
                    :status,
                    :message,
                    :progress,
                    :totalIdentifiers,
                    :results,
                    :proxyStats,
                    :createdAt,
                    :updatedAt
                )
                """,
            params
        );
    }

    /**
     * Writes status, progress, results and proxy stats together. Rows already in a terminal state are left untouched.
     *
     * @return {@code true} when a row was updated
     */
    public boolean updateTask(
        String taskId,
        TaskStatus status,
        String message,
        double progress,
        List<CheckResult> results,
        ProxyPoolStats proxyStats,
        Instant updatedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", taskId)
            .addValue("status", status.name())
            .addValue("message", message)
            .addValue("progress", progress)
            .addValue("results", writeJson(results == null ? List.of() : results))
            .addValue("proxyStats", writeJson(proxyStats == null ? ProxyPoolStats.empty() : proxyStats))
            .addValue("updatedAt", toTimestamp(updatedAt));
        int updated = jdbc.update(
            """
                UPDATE ban_check_tasks
                SET status = :status,
                    message = :message,
                    progress = :progress,
                    results = :results,
                    proxy_stats = :proxyStats,
                    updated_at = :updatedAt
                WHERE task_id = :taskId
                  AND status NOT IN ('COMPLETED', 'FAILED')
                """,
            params
        );
        return updated > 0;
    }

    public boolean updateStatus(String taskId, TaskStatus status, String message, double progress, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", taskId)
            .addValue("status", status.name())
            .addValue("message", message)
            .addValue("progress", progress)
            .addValue("updatedAt", toTimestamp(updatedAt));
        int updated = jdbc.update(
            """
                UPDATE ban_check_tasks
                SET status = :status,
                    message = :message,
                    progress = :progress,
                    updated_at = :updatedAt
                WHERE task_id = :taskId
                  AND status NOT IN ('COMPLETED', 'FAILED')
                """,
            params
        );
        return updated > 0;
    }

    public BanCheckTask findTask(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return null;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", taskId.trim());
        List<BanCheckTask> rows = jdbc.query(
            """
                SELECT task_id,
                       owner_id,
                       status,
                       message,
                       progress,
                       results,
                       proxy_stats,
                       created_at,
                       updated_at
                FROM ban_check_tasks
                WHERE task_id = :taskId
                """,
            params,
            taskRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Newest first. A {@code null} owner lists every owner's tasks.
     */
    public List<BanCheckTask> findTasks(Long ownerId, TaskStatus status, int limit, int offset) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit))
            .addValue("offset", Math.max(0, offset));
        String sql = """
            SELECT task_id,
                   owner_id,
                   status,
                   message,
                   progress,
                   results,
                   proxy_stats,
                   created_at,
                   updated_at
            FROM ban_check_tasks
            """ + filterClause(ownerId, status, params) + """
            ORDER BY created_at DESC, task_id
            LIMIT :limit OFFSET :offset
            """;
        return jdbc.query(sql, params, taskRowMapper());
    }

    public long countTasks(Long ownerId, TaskStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT COUNT(*) FROM ban_check_tasks\n" + filterClause(ownerId, status, params);
        Long count = jdbc.queryForObject(sql, params, Long.class);
        return count == null ? 0L : count;
    }

    private String filterClause(Long ownerId, TaskStatus status, MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();
        if (ownerId != null) {
            conditions.add("owner_id = :ownerId");
            params.addValue("ownerId", ownerId);
        }
        if (status != null) {
            conditions.add("status = :status");
            params.addValue("status", status.name());
        }
        return conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + "\n";
    }

    private RowMapper<BanCheckTask> taskRowMapper() {
        return (rs, rowNum) -> new BanCheckTask(
            rs.getString("task_id"),
            parseStatus(rs.getString("status")),
            rs.getString("message"),
            rs.getDouble("progress"),
            readResults(rs.getString("results")),
            readProxyStats(rs.getString("proxy_stats")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            rs.getLong("owner_id")
        );
    }

    private TaskStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return TaskStatus.PENDING;
        }
        return TaskStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    private List<CheckResult> readResults(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<CheckResult> parsed = objectMapper.readValue(json, RESULT_LIST);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable results payload ({} chars)", json.length(), e);
            return List.of();
        }
    }

    private ProxyPoolStats readProxyStats(String json) {
        if (json == null || json.isBlank()) {
            return ProxyPoolStats.empty();
        }
        try {
            ProxyPoolStats parsed = objectMapper.readValue(json, ProxyPoolStats.class);
            return parsed == null ? ProxyPoolStats.empty() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable proxy stats payload ({} chars)", json.length(), e);
            return ProxyPoolStats.empty();
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
