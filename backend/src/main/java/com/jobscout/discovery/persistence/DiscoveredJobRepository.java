package com.jobscout.discovery.persistence;

import com.jobscout.discovery.model.AgeBucket;
import com.jobscout.discovery.model.AtsVendor;
import com.jobscout.discovery.model.InsertResult;
import com.jobscout.discovery.model.PostedAge;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.StoredJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class DiscoveredJobRepository {
    private static final Logger log = LoggerFactory.getLogger(DiscoveredJobRepository.class);
    private static final String SELECT_COLUMNS = """
        SELECT id, fingerprint, title, company, location, summary, salary, apply_url, listing_url,
               ats_vendor, resolved, posted_text, posted_bucket, posted_amount, site, source_keyword,
               source_page, scraped_at, first_seen_at, applied, applied_at
        FROM discovered_jobs
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public DiscoveredJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public InsertResult insert(ResolvedJob job, Instant firstSeenAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprint", job.fingerprint())
            .addValue("title", job.title())
            .addValue("company", job.company())
            .addValue("location", job.location())
            .addValue("summary", job.summary())
            .addValue("salary", job.salary())
            .addValue("applyUrl", job.applyUrl())
            .addValue("listingUrl", job.listingUrl())
            .addValue("atsVendor", (job.atsVendor() == null ? AtsVendor.UNKNOWN : job.atsVendor()).name())
            .addValue("resolved", job.resolved())
            .addValue("postedText", job.postedText())
            .addValue("postedBucket", postedAge(job).bucket().name())
            .addValue("postedAmount", postedAge(job).amount())
            .addValue("site", job.site())
            .addValue("sourceKeyword", job.sourceKeyword())
            .addValue("sourcePage", job.sourcePage())
            .addValue("scrapedAt", toTimestamp(job.scrapedAt() == null ? firstSeenAt : job.scrapedAt()))
            .addValue("firstSeenAt", toTimestamp(firstSeenAt));

        String insertSql = """
            INSERT INTO discovered_jobs (
                fingerprint, title, company, location, summary, salary, apply_url, listing_url,
                ats_vendor, resolved, posted_text, posted_bucket, posted_amount, site, source_keyword,
                source_page, scraped_at, first_seen_at, applied
            )
            VALUES (
                :fingerprint, :title, :company, :location, :summary, :salary, :applyUrl, :listingUrl,
                :atsVendor, :resolved, :postedText, :postedBucket, :postedAmount, :site, :sourceKeyword,
                :sourcePage, :scrapedAt, :firstSeenAt, FALSE
            )
            """;

        if (postgres) {
            int inserted = jdbc.update(insertSql + " ON CONFLICT (fingerprint) DO NOTHING", params);
            return inserted > 0 ? InsertResult.INSERTED : InsertResult.ALREADY_PRESENT;
        }
        try {
            jdbc.update(insertSql, params);
            return InsertResult.INSERTED;
        } catch (DuplicateKeyException e) {
            log.debug("Fingerprint {} already stored", job.fingerprint());
            return InsertResult.ALREADY_PRESENT;
        }
    }

    public Optional<StoredJob> findByFingerprint(String fingerprint) {
        List<StoredJob> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE fingerprint = :fingerprint",
            new MapSqlParameterSource("fingerprint", fingerprint),
            (rs, rowNum) -> mapStoredJob(rs)
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<StoredJob> findFirstSeenSince(Instant since, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("since", toTimestamp(since))
            .addValue("limit", safeLimit(limit));
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE first_seen_at >= :since
                ORDER BY first_seen_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> mapStoredJob(rs)
        );
    }

    public List<StoredJob> findByCompany(String company, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", company == null ? "" : company.trim().toLowerCase(Locale.ROOT))
            .addValue("limit", safeLimit(limit));
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE LOWER(company) = :company
                ORDER BY first_seen_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> mapStoredJob(rs)
        );
    }

    public List<StoredJob> findUnapplied(int limit) {
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE applied = FALSE
                ORDER BY first_seen_at ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit(limit)),
            (rs, rowNum) -> mapStoredJob(rs)
        );
    }

    public boolean markApplied(String fingerprint, Instant appliedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprint", fingerprint)
            .addValue("appliedAt", toTimestamp(appliedAt));
        int updated = jdbc.update(
            """
                UPDATE discovered_jobs
                SET applied = TRUE,
                    applied_at = COALESCE(applied_at, :appliedAt)
                WHERE fingerprint = :fingerprint
                """,
            params
        );
        return updated > 0;
    }

    public int deleteFirstSeenBefore(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM discovered_jobs WHERE first_seen_at < :cutoff",
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff))
        );
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM discovered_jobs", new MapSqlParameterSource());
    }

    public long countAll() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM discovered_jobs", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }

    public long countApplied() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM discovered_jobs WHERE applied = TRUE",
            new MapSqlParameterSource(),
            Long.class
        );
        return count == null ? 0 : count;
    }

    public Map<String, Long> countBySite() {
        return groupCounts(
            """
                SELECT site AS label, COUNT(*) AS total
                FROM discovered_jobs
                GROUP BY site
                ORDER BY total DESC, label ASC
                """,
            new MapSqlParameterSource()
        );
    }

    public Map<String, Long> countByCompany(int limit) {
        return groupCounts(
            """
                SELECT company AS label, COUNT(*) AS total
                FROM discovered_jobs
                GROUP BY company
                ORDER BY total DESC, label ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit(limit))
        );
    }

    public Map<String, Long> countByAtsVendor() {
        return groupCounts(
            """
                SELECT ats_vendor AS label, COUNT(*) AS total
                FROM discovered_jobs
                GROUP BY ats_vendor
                ORDER BY total DESC, label ASC
                """,
            new MapSqlParameterSource()
        );
    }

    private Map<String, Long> groupCounts(String sql, MapSqlParameterSource params) {
        Map<String, Long> out = new LinkedHashMap<>();
        jdbc.query(sql, params, rs -> {
            out.put(rs.getString("label"), rs.getLong("total"));
        });
        return out;
    }

    private StoredJob mapStoredJob(ResultSet rs) throws SQLException {
        ResolvedJob job = new ResolvedJob(
            rs.getString("title"),
            rs.getString("company"),
            rs.getString("location"),
            rs.getString("summary"),
            rs.getString("salary"),
            rs.getString("apply_url"),
            rs.getString("listing_url"),
            parseVendor(rs.getString("ats_vendor")),
            rs.getBoolean("resolved"),
            rs.getString("posted_text"),
            new PostedAge(parseBucket(rs.getString("posted_bucket")), rs.getInt("posted_amount")),
            rs.getString("site"),
            rs.getString("source_keyword"),
            rs.getInt("source_page"),
            rs.getString("fingerprint"),
            toInstant(rs.getTimestamp("scraped_at"))
        );
        return new StoredJob(
            rs.getLong("id"),
            job,
            toInstant(rs.getTimestamp("first_seen_at")),
            rs.getBoolean("applied"),
            toInstant(rs.getTimestamp("applied_at"))
        );
    }

    private PostedAge postedAge(ResolvedJob job) {
        return job.postedAge() == null ? PostedAge.UNKNOWN : job.postedAge();
    }

    private AtsVendor parseVendor(String value) {
        if (value == null || value.isBlank()) {
            return AtsVendor.UNKNOWN;
        }
        try {
            return AtsVendor.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown ATS vendor value {} in store", value);
            return AtsVendor.UNKNOWN;
        }
    }

    private AgeBucket parseBucket(String value) {
        if (value == null || value.isBlank()) {
            return AgeBucket.UNKNOWN;
        }
        try {
            return AgeBucket.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown posted bucket value {} in store", value);
            return AgeBucket.UNKNOWN;
        }
    }

    private int safeLimit(int limit) {
        return limit <= 0 ? 50 : limit;
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; using portable insert path", e);
            return false;
        }
    }
}
