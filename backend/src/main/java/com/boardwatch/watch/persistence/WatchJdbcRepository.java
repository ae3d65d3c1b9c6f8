package com.boardwatch.watch.persistence;

import com.boardwatch.watch.model.ExecutionRecord;
import com.boardwatch.watch.model.ExecutionStatus;
import com.boardwatch.watch.model.ScheduleDescriptor;
import com.boardwatch.watch.model.WatchConfiguration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class WatchJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(WatchJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public WatchJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("watch_configurations", countQuery("SELECT COUNT(*) FROM watch_configurations"));
        counts.put("active_configurations", countQuery("SELECT COUNT(*) FROM watch_configurations WHERE is_active = TRUE"));
        counts.put("execution_records", countQuery("SELECT COUNT(*) FROM execution_records"));
        return counts;
    }

    public List<WatchConfiguration> findActiveConfigurations() {
        return jdbc.query(
            """
                SELECT *
                FROM watch_configurations
                WHERE is_active = TRUE
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource(),
            configurationRowMapper()
        );
    }

    public List<WatchConfiguration> findAllConfigurations() {
        return jdbc.query(
            """
                SELECT *
                FROM watch_configurations
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource(),
            configurationRowMapper()
        );
    }

    public WatchConfiguration findConfiguration(String configurationId) {
        if (configurationId == null || configurationId.isBlank()) {
            return null;
        }
        List<WatchConfiguration> rows = jdbc.query(
            """
                SELECT *
                FROM watch_configurations
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", configurationId),
            configurationRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    void insertConfiguration(WatchConfiguration config) {
        Instant now = Instant.now();
        ScheduleDescriptor schedule = config.schedule();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", config.id())
            .addValue("name", config.name())
            .addValue("boardId", config.boardId())
            .addValue("postCount", config.postCount())
            .addValue("keywordsJson", writeKeywords(config.keywords()))
            .addValue("chatId", config.chatId())
            .addValue("scheduleType", schedule == null ? null : schedule.type())
            .addValue("scheduleTime", schedule instanceof ScheduleDescriptor.Daily daily ? daily.timeOfDay() : null)
            .addValue(
                "scheduleInterval",
                schedule instanceof ScheduleDescriptor.Custom custom ? custom.intervalMinutes() : null
            )
            .addValue("active", config.active())
            .addValue("lastExecutedAt", toTimestamp(config.lastExecutedAt()))
            .addValue("lastStatus", config.lastExecutionStatus() == null ? null : config.lastExecutionStatus().wireValue())
            .addValue("lastMessage", config.lastExecutionMessage())
            .addValue("createdAt", toTimestamp(config.createdAt() == null ? now : config.createdAt()))
            .addValue("updatedAt", toTimestamp(config.updatedAt() == null ? now : config.updatedAt()));
        jdbc.update(
            """
                INSERT INTO watch_configurations (
                    id,
                    name,
                    board_id,
                    post_count,
                    keywords_json,
                    chat_id,
                    schedule_type,
                    schedule_time,
                    schedule_interval_minutes,
                    is_active,
                    last_executed_at,
                    last_execution_status,
                    last_execution_message,
                    created_at,
                    updated_at
                )
                VALUES (
                    :id,
                    :name,
                    :boardId,
                    :postCount,
                    :keywordsJson,
                    :chatId,
                    :scheduleType,
                    :scheduleTime,
                    :scheduleInterval,
                    :active,
                    :lastExecutedAt,
                    :lastStatus,
                    :lastMessage,
                    :createdAt,
                    :updatedAt
                )
                """,
            params
        );
    }

    public int updateLastExecution(String configurationId, Instant executedAt, ExecutionStatus status, String message) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", configurationId)
            .addValue("executedAt", toTimestamp(executedAt))
            .addValue("status", status == null ? null : status.wireValue())
            .addValue("message", truncate(message))
            .addValue("updatedAt", toTimestamp(executedAt));
        return jdbc.update(
            """
                UPDATE watch_configurations
                SET last_executed_at = :executedAt,
                    last_execution_status = :status,
                    last_execution_message = :message,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
    }

    public long insertExecutionRecord(ExecutionRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("configurationId", record.configurationId())
            .addValue("executedAt", toTimestamp(record.executedAt()))
            .addValue("status", record.status().wireValue())
            .addValue("articlesFound", record.articlesFound())
            .addValue("articlesSent", record.articlesSent())
            .addValue("durationMs", record.executionDuration() == null ? 0L : record.executionDuration().toMillis())
            .addValue("errorMessage", truncate(record.errorMessage()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO execution_records (
                    configuration_id,
                    executed_at,
                    status,
                    articles_found,
                    articles_sent,
                    execution_duration_ms,
                    error_message
                )
                VALUES (
                    :configurationId,
                    :executedAt,
                    :status,
                    :articlesFound,
                    :articlesSent,
                    :durationMs,
                    :errorMessage
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? -1L : key.longValue();
    }

    public List<ExecutionRecord> findExecutionRecords(String configurationId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("configurationId", configurationId)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id,
                       configuration_id,
                       executed_at,
                       status,
                       articles_found,
                       articles_sent,
                       execution_duration_ms,
                       error_message
                FROM execution_records
                WHERE configuration_id = :configurationId
                ORDER BY executed_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            executionRecordRowMapper()
        );
    }

    public ExecutionRecord findMostRecentExecution() {
        List<ExecutionRecord> rows = jdbc.query(
            """
                SELECT id,
                       configuration_id,
                       executed_at,
                       status,
                       articles_found,
                       articles_sent,
                       execution_duration_ms,
                       error_message
                FROM execution_records
                ORDER BY executed_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            executionRecordRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private long countQuery(String sql) {
        Long value = jdbc.getJdbcTemplate().queryForObject(sql, Long.class);
        return value == null ? 0L : value;
    }

    private RowMapper<WatchConfiguration> configurationRowMapper() {
        return (rs, rowNum) -> {
            Object interval = rs.getObject("schedule_interval_minutes");
            return new WatchConfiguration(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("board_id"),
                rs.getInt("post_count"),
                readKeywords(rs.getString("keywords_json")),
                rs.getString("chat_id"),
                ScheduleDescriptor.of(
                    rs.getString("schedule_type"),
                    rs.getString("schedule_time"),
                    interval == null ? null : ((Number) interval).intValue()
                ),
                rs.getBoolean("is_active"),
                toInstant(rs.getTimestamp("last_executed_at")),
                ExecutionStatus.fromWireValue(rs.getString("last_execution_status")),
                rs.getString("last_execution_message"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            );
        };
    }

    private RowMapper<ExecutionRecord> executionRecordRowMapper() {
        return (rs, rowNum) -> new ExecutionRecord(
            rs.getLong("id"),
            rs.getString("configuration_id"),
            toInstant(rs.getTimestamp("executed_at")),
            ExecutionStatus.fromWireValue(rs.getString("status")),
            rs.getInt("articles_found"),
            rs.getInt("articles_sent"),
            Duration.ofMillis(rs.getLong("execution_duration_ms")),
            rs.getString("error_message")
        );
    }

    private List<String> readKeywords(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(raw, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable keywords_json value: {}", raw, e);
            return List.of();
        }
    }

    private String writeKeywords(List<String> keywords) {
        try {
            return objectMapper.writeValueAsString(keywords == null ? List.of() : keywords);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Keywords are not serializable", e);
        }
    }

    private String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
