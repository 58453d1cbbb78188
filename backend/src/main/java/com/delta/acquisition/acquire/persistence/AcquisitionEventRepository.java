package com.delta.acquisition.acquire.persistence;

import com.delta.acquisition.acquire.model.AcquisitionEvent;
import com.delta.acquisition.acquire.model.OutcomeKind;
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
import java.util.List;

@Repository
public class AcquisitionEventRepository {
    private static final Logger log = LoggerFactory.getLogger(AcquisitionEventRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final int MAX_ERROR_MESSAGE = 2000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public AcquisitionEventRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insert(AcquisitionEvent event) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("requestId", event.requestId())
            .addValue("target", event.target())
            .addValue("host", event.host())
            .addValue("strategy", event.strategy())
            .addValue("outcomeKind", event.outcomeKind().name())
            .addValue("cost", event.cost())
            .addValue("durationMs", event.duration() == null ? 0L : event.duration().toMillis())
            .addValue("attempts", event.attempts())
            .addValue("jobCount", event.jobCount())
            .addValue("errorCode", event.errorCode())
            .addValue("errorMessage", truncate(event.errorMessage()))
            .addValue("failures", writeFailures(event.failures()))
            .addValue("occurredAt", toTimestamp(event.occurredAt()));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO acquisition_events (
                    request_id,
                    target,
                    host,
                    strategy,
                    outcome_kind,
                    cost,
                    duration_ms,
                    attempts,
                    job_count,
                    error_code,
                    error_message,
                    failures_json,
                    occurred_at
                )
                VALUES (
                    :requestId,
                    :target,
                    :host,
                    :strategy,
                    :outcomeKind,
                    :cost,
                    :durationMs,
                    :attempts,
                    :jobCount,
                    :errorCode,
                    :errorMessage,
                    :failures,
                    :occurredAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? -1L : key.longValue();
    }

    public List<AcquisitionEvent> findRecent(int limit) {
        return jdbc.query(
            """
                SELECT request_id, target, host, strategy, outcome_kind, cost, duration_ms, attempts,
                       job_count, error_code, error_message, failures_json, occurred_at
                FROM acquisition_events
                ORDER BY occurred_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            eventRowMapper()
        );
    }

    public long countByOutcome(OutcomeKind kind) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM acquisition_events WHERE outcome_kind = :kind",
            new MapSqlParameterSource("kind", kind.name()),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private RowMapper<AcquisitionEvent> eventRowMapper() {
        return (rs, rowNum) -> new AcquisitionEvent(
            rs.getString("request_id"),
            rs.getString("target"),
            rs.getString("host"),
            rs.getString("strategy"),
            OutcomeKind.valueOf(rs.getString("outcome_kind")),
            rs.getDouble("cost"),
            Duration.ofMillis(rs.getLong("duration_ms")),
            rs.getInt("attempts"),
            rs.getInt("job_count"),
            rs.getString("error_code"),
            rs.getString("error_message"),
            readFailures(rs.getString("failures_json")),
            toInstant(rs.getTimestamp("occurred_at"))
        );
    }

    private String writeFailures(List<String> failures) {
        if (failures == null || failures.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(failures);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize event failures", e);
            return null;
        }
    }

    private List<String> readFailures(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable failures_json: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_MESSAGE) {
            return value;
        }
        return value.substring(0, MAX_ERROR_MESSAGE);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
