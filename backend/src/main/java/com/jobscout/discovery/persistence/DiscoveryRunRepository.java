package com.jobscout.discovery.persistence;

import com.jobscout.discovery.model.DiscoveryRunMeta;
import com.jobscout.discovery.model.DiscoveryStats;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class DiscoveryRunRepository {
    private static final int MAX_NOTES_LENGTH = 1000;
    private static final int MAX_KEYWORDS_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;

    public DiscoveryRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertRun(Instant startedAt, List<String> keywords) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", "RUNNING")
            .addValue("keywords", truncate(String.join(",", keywords), MAX_KEYWORDS_LENGTH));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO discovery_runs (started_at, last_heartbeat_at, status, keywords)
                VALUES (:startedAt, :startedAt, :status, :keywords)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }
        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM discovery_runs
                WHERE started_at = :startedAt
                  AND status = :status
                ORDER BY id DESC
                LIMIT 1
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to insert discovery run");
        }
        return id;
    }

    public void updateHeartbeat(long runId, Instant heartbeatAt) {
        jdbc.update(
            """
                UPDATE discovery_runs
                SET last_heartbeat_at = :heartbeatAt
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("heartbeatAt", toTimestamp(heartbeatAt))
        );
    }

    public void completeRun(long runId, String status, DiscoveryStats stats, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", toTimestamp(stats.finishedAt()))
            .addValue("status", status)
            .addValue("notes", truncate(notes, MAX_NOTES_LENGTH))
            .addValue("pagesScraped", stats.pagesScraped())
            .addValue("jobsFound", stats.jobsFound())
            .addValue("jobsSaved", stats.jobsSaved())
            .addValue("duplicatesSkipped", stats.duplicatesSkipped())
            .addValue("errorsEncountered", stats.errorsEncountered());
        jdbc.update(
            """
                UPDATE discovery_runs
                SET finished_at = :finishedAt,
                    last_heartbeat_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    pages_scraped = :pagesScraped,
                    jobs_found = :jobsFound,
                    jobs_saved = :jobsSaved,
                    duplicates_skipped = :duplicatesSkipped,
                    errors_encountered = :errorsEncountered
                WHERE id = :runId
                """,
            params
        );
    }

    public void abortRun(long runId, Instant finishedAt, String notes) {
        jdbc.update(
            """
                UPDATE discovery_runs
                SET finished_at = :finishedAt,
                    status = 'ABORTED',
                    notes = :notes
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("notes", truncate(notes, MAX_NOTES_LENGTH))
        );
    }

    public List<DiscoveryRunMeta> findRunningRuns() {
        return jdbc.query(
            """
                SELECT id, started_at, finished_at, last_heartbeat_at, status, pages_scraped, jobs_saved
                FROM discovery_runs
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> mapRun(rs)
        );
    }

    public DiscoveryRunMeta findRun(long runId) {
        List<DiscoveryRunMeta> runs = jdbc.query(
            """
                SELECT id, started_at, finished_at, last_heartbeat_at, status, pages_scraped, jobs_saved
                FROM discovery_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            (rs, rowNum) -> mapRun(rs)
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    private DiscoveryRunMeta mapRun(ResultSet rs) throws SQLException {
        return new DiscoveryRunMeta(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            toInstant(rs.getTimestamp("last_heartbeat_at")),
            rs.getString("status"),
            rs.getInt("pages_scraped"),
            rs.getInt("jobs_saved")
        );
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
