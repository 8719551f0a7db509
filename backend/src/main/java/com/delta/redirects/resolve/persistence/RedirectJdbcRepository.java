package com.delta.redirects.resolve.persistence;

import com.delta.redirects.resolve.model.ErrorRecord;
import com.delta.redirects.resolve.model.RedirectRecord;
import com.delta.redirects.resolve.model.ReferenceCode;
import com.delta.redirects.resolve.model.ResolutionRunMeta;
import com.delta.redirects.resolve.model.UrlCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class RedirectJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(RedirectJdbcRepository.class);
    private static final int IN_CLAUSE_BATCH = 1000;
    private static final int INSERT_BATCH = 500;
    private static final Set<String> COUNTED_TABLES = Set.of(
        "url_status",
        UrlCategory.PRODUCT.tableName(),
        UrlCategory.CATALOG.tableName(),
        "redirects",
        "resolution_runs"
    );

    private static final RowMapper<ResolutionRunMeta> RUN_MAPPER = (rs, rowNum) -> new ResolutionRunMeta(
        rs.getLong("id"),
        rs.getTimestamp("started_at").toInstant(),
        rs.getTimestamp("finished_at") == null ? null : rs.getTimestamp("finished_at").toInstant(),
        rs.getString("status"),
        rs.getString("notes"),
        rs.getInt("processed"),
        rs.getInt("product_matches"),
        rs.getInt("catalog_matches"),
        rs.getInt("redirected_to_404"),
        rs.getInt("skipped"),
        rs.getInt("probe_failures")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public RedirectJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("url_status", countTable("url_status"));
        counts.put("url_status_errors", countUrlsWithMinStatus(400));
        counts.put("product_codes", countTable(UrlCategory.PRODUCT.tableName()));
        counts.put("catalog_codes", countTable(UrlCategory.CATALOG.tableName()));
        counts.put("redirects", countTable("redirects"));
        counts.put("resolution_runs", countTable("resolution_runs"));
        return counts;
    }

    private long countTable(String tableName) {
        if (!COUNTED_TABLES.contains(tableName)) {
            throw new IllegalArgumentException("Unsupported table: " + tableName);
        }
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    public long countUrlsWithMinStatus(int minStatus) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM url_status
                WHERE status IS NOT NULL
                  AND status >= :minStatus
                """,
            new MapSqlParameterSource().addValue("minStatus", minStatus),
            Long.class
        );
        return count == null ? 0L : count;
    }

    /**
     * Clears the working tables of a previous run. Run history is kept.
     */
    public void resetWorkingTables() {
        jdbc.getJdbcTemplate().update("DELETE FROM redirects");
        jdbc.getJdbcTemplate().update("DELETE FROM url_status");
        jdbc.getJdbcTemplate().update("DELETE FROM " + UrlCategory.PRODUCT.tableName());
        jdbc.getJdbcTemplate().update("DELETE FROM " + UrlCategory.CATALOG.tableName());
        log.info("Working tables cleared");
    }

    /**
     * Redirects describe only the latest run, so every run starts from an empty table.
     */
    public int clearRedirects() {
        return jdbc.getJdbcTemplate().update("DELETE FROM redirects");
    }

    public boolean upsertUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        return upsertUrls(List.of(url)) > 0;
    }

    public int upsertUrls(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return 0;
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                unique.add(url);
            }
        }
        unique.removeAll(findExisting("url_status", "url", new ArrayList<>(unique)));
        if (unique.isEmpty()) {
            return 0;
        }
        List<MapSqlParameterSource> paramsList = new ArrayList<>();
        for (String url : unique) {
            paramsList.add(new MapSqlParameterSource().addValue("url", url));
        }
        batchInsert(
            """
                INSERT INTO url_status (url)
                VALUES (:url)
                """,
            paramsList
        );
        return paramsList.size();
    }

    public void updateStatus(String url, Integer status, String finalUrl) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", url)
            .addValue("status", status)
            .addValue("finalUrl", finalUrl)
            .addValue("checkedAt", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE url_status
                SET status = :status,
                    final_url = :finalUrl,
                    checked_at = :checkedAt
                WHERE url = :url
                """,
            params
        );
    }

    public List<String> findAllUrls() {
        return jdbc.query(
            """
                SELECT url
                FROM url_status
                ORDER BY id
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> rs.getString("url")
        );
    }

    public List<ErrorRecord> findByMinStatus(int minStatus) {
        return jdbc.query(
            """
                SELECT url, status, final_url
                FROM url_status
                WHERE status IS NOT NULL
                  AND status >= :minStatus
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("minStatus", minStatus),
            (rs, rowNum) -> new ErrorRecord(
                rs.getString("url"),
                rs.getObject("status", Integer.class),
                rs.getString("final_url")
            )
        );
    }

    public ErrorRecord findUrlStatus(String url) {
        List<ErrorRecord> rows = jdbc.query(
            """
                SELECT url, status, final_url
                FROM url_status
                WHERE url = :url
                """,
            new MapSqlParameterSource().addValue("url", url),
            (rs, rowNum) -> new ErrorRecord(
                rs.getString("url"),
                rs.getObject("status", Integer.class),
                rs.getString("final_url")
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public int insertCodes(UrlCategory category, List<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return 0;
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String code : codes) {
            if (code != null && !code.isEmpty()) {
                unique.add(code);
            }
        }
        unique.removeAll(findExisting(category.tableName(), "code", new ArrayList<>(unique)));
        if (unique.isEmpty()) {
            return 0;
        }
        List<MapSqlParameterSource> paramsList = new ArrayList<>();
        for (String code : unique) {
            paramsList.add(new MapSqlParameterSource().addValue("code", code));
        }
        batchInsert("INSERT INTO " + category.tableName() + " (code) VALUES (:code)", paramsList);
        return paramsList.size();
    }

    public List<ReferenceCode> findAllCodes(UrlCategory category) {
        return jdbc.query(
            "SELECT code FROM " + category.tableName() + " ORDER BY id",
            new MapSqlParameterSource(),
            (rs, rowNum) -> new ReferenceCode(rs.getString("code"))
        );
    }

    public void insertRedirects(Long runId, List<RedirectRecord> redirects) {
        if (redirects == null || redirects.isEmpty()) {
            return;
        }
        Timestamp createdAt = Timestamp.from(Instant.now());
        List<MapSqlParameterSource> paramsList = new ArrayList<>();
        for (RedirectRecord redirect : redirects) {
            paramsList.add(new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("fromUrl", redirect.from())
                .addValue("toUrl", redirect.to())
                .addValue("percent", redirect.percent())
                .addValue("createdAt", createdAt));
        }
        batchInsert(
            """
                INSERT INTO redirects (run_id, from_url, to_url, percent, created_at)
                VALUES (:runId, :fromUrl, :toUrl, :percent, :createdAt)
                """,
            paramsList
        );
        log.info("Inserted {} redirects", paramsList.size());
    }

    public List<RedirectRecord> findRedirectsByMinPercent(double minPercent) {
        return jdbc.query(
            """
                SELECT from_url, to_url, percent
                FROM redirects
                WHERE percent >= :minPercent
                ORDER BY percent DESC, id ASC
                """,
            new MapSqlParameterSource().addValue("minPercent", minPercent),
            (rs, rowNum) -> new RedirectRecord(
                rs.getString("from_url"),
                rs.getString("to_url"),
                rs.getDouble("percent")
            )
        );
    }

    public long insertRun(Instant startedAt, String status, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("notes", notes);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO resolution_runs (started_at, status, notes)
                VALUES (:startedAt, :status, :notes)
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
                FROM resolution_runs
                WHERE started_at = :startedAt
                  AND status = :status
                ORDER BY id DESC
                LIMIT 1
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to insert resolution run");
        }
        return id;
    }

    public void completeRun(
        long runId,
        Instant finishedAt,
        String status,
        String notes,
        int processed,
        int productMatches,
        int catalogMatches,
        int redirectedTo404,
        int skipped,
        int probeFailures
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("notes", notes)
            .addValue("processed", processed)
            .addValue("productMatches", productMatches)
            .addValue("catalogMatches", catalogMatches)
            .addValue("redirectedTo404", redirectedTo404)
            .addValue("skipped", skipped)
            .addValue("probeFailures", probeFailures);
        jdbc.update(
            """
                UPDATE resolution_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    processed = :processed,
                    product_matches = :productMatches,
                    catalog_matches = :catalogMatches,
                    redirected_to_404 = :redirectedTo404,
                    skipped = :skipped,
                    probe_failures = :probeFailures
                WHERE id = :runId
                """,
            params
        );
    }

    public List<ResolutionRunMeta> findRunningRuns() {
        return jdbc.query(
            """
                SELECT *
                FROM resolution_runs
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            RUN_MAPPER
        );
    }

    public ResolutionRunMeta findRunById(long runId) {
        List<ResolutionRunMeta> runs = jdbc.query(
            """
                SELECT *
                FROM resolution_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource().addValue("runId", runId),
            RUN_MAPPER
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public ResolutionRunMeta findMostRecentRun() {
        List<ResolutionRunMeta> runs = jdbc.query(
            """
                SELECT *
                FROM resolution_runs
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            RUN_MAPPER
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    private Set<String> findExisting(String tableName, String column, List<String> values) {
        Set<String> existing = new LinkedHashSet<>();
        for (int i = 0; i < values.size(); i += IN_CLAUSE_BATCH) {
            int end = Math.min(values.size(), i + IN_CLAUSE_BATCH);
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("values", values.subList(i, end));
            jdbc.query(
                "SELECT " + column + " FROM " + tableName + " WHERE " + column + " IN (:values)",
                params,
                rs -> {
                    String value = rs.getString(column);
                    if (value != null) {
                        existing.add(value);
                    }
                }
            );
        }
        return existing;
    }

    private void batchInsert(String sql, List<MapSqlParameterSource> paramsList) {
        for (int i = 0; i < paramsList.size(); i += INSERT_BATCH) {
            int end = Math.min(paramsList.size(), i + INSERT_BATCH);
            jdbc.batchUpdate(sql, paramsList.subList(i, end).toArray(new MapSqlParameterSource[0]));
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
