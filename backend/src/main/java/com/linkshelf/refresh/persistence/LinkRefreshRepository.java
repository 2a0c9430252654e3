package com.linkshelf.refresh.persistence;

import com.linkshelf.refresh.model.Link;
import com.linkshelf.refresh.model.LinkStateWrite;
import com.linkshelf.refresh.model.LinkStatus;
import com.linkshelf.refresh.model.MetadataDelta;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public class LinkRefreshRepository {
    private static final String LINK_COLUMNS = """
        id, url, domain, path, is_github_repo, status, title, description, logo,
        github_stars, github_archived, github_last_commit,
        last_checked, refreshed_at, consecutive_failures
        """;

    private static final RowMapper<Link> LINK_ROW_MAPPER = (rs, rowNum) -> new Link(
        rs.getObject("id", UUID.class),
        rs.getString("url"),
        rs.getString("domain"),
        rs.getString("path"),
        rs.getBoolean("is_github_repo"),
        LinkStatus.fromDb(rs.getString("status")),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("logo"),
        nullableInt(rs, "github_stars"),
        nullableBoolean(rs, "github_archived"),
        toInstant(rs.getTimestamp("github_last_commit")),
        toInstant(rs.getTimestamp("last_checked")),
        toInstant(rs.getTimestamp("refreshed_at")),
        rs.getInt("consecutive_failures")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public LinkRefreshRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public List<Link> findDueLinks(int limit, Instant checkedBefore, boolean includeRepoUnavailable) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit))
            .addValue("checkedBefore", Timestamp.from(checkedBefore))
            .addValue("includeRepoUnavailable", includeRepoUnavailable);
        return jdbc.query(
            "SELECT " + LINK_COLUMNS + """
                FROM links
                WHERE (
                        status IN ('active', 'inaccessible')
                        OR (:includeRepoUnavailable = TRUE AND status = 'repo_unavailable' AND is_github_repo = TRUE)
                      )
                  AND (last_checked IS NULL OR last_checked < :checkedBefore)
                ORDER BY last_checked ASC NULLS FIRST, id ASC
                LIMIT :limit
                """,
            params,
            LINK_ROW_MAPPER
        );
    }

    public Link findById(UUID linkId) {
        List<Link> results = jdbc.query(
            "SELECT " + LINK_COLUMNS + """
                FROM links
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", linkId),
            LINK_ROW_MAPPER
        );
        return results.isEmpty() ? null : results.get(0);
    }

    /**
     * Writes status, failure counter, check timestamps and changed metadata in one statement.
     * Archived links are never touched, so a user archiving a link mid-refresh wins.
     *
     * @return false when no row was updated (link deleted or archived since selection)
     */
    public boolean applyStateWrite(LinkStateWrite write) {
        MetadataDelta delta = write.delta() == null ? MetadataDelta.empty() : write.delta();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", write.linkId())
            .addValue("status", write.status().dbValue())
            .addValue("consecutiveFailures", write.consecutiveFailures())
            .addValue("lastChecked", Timestamp.from(write.lastChecked()))
            .addValue("refreshedAt", toTimestamp(write.refreshedAt()), Types.TIMESTAMP)
            .addValue("title", delta.title(), Types.VARCHAR)
            .addValue("description", delta.description(), Types.VARCHAR)
            .addValue("logo", delta.logo(), Types.VARCHAR)
            .addValue("githubStars", delta.githubStars(), Types.INTEGER)
            .addValue("githubArchived", delta.githubArchived(), Types.BOOLEAN)
            .addValue("githubLastCommit", toTimestamp(delta.githubLastCommit()), Types.TIMESTAMP)
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE links
                SET status = :status,
                    consecutive_failures = :consecutiveFailures,
                    last_checked = :lastChecked,
                    refreshed_at = COALESCE(:refreshedAt, refreshed_at),
                    title = COALESCE(:title, title),
                    description = COALESCE(:description, description),
                    logo = COALESCE(:logo, logo),
                    github_stars = COALESCE(:githubStars, github_stars),
                    github_archived = COALESCE(:githubArchived, github_archived),
                    github_last_commit = COALESCE(:githubLastCommit, github_last_commit),
                    updated_at = :now
                WHERE id = :id
                  AND status <> 'archived'
                """,
            params
        );
        return updated > 0;
    }

    public Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (LinkStatus status : LinkStatus.values()) {
            counts.put(status.dbValue(), 0L);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS total
                FROM links
                GROUP BY status
                """,
            new MapSqlParameterSource(),
            rs -> {
                String status = rs.getString("status");
                if (status != null) {
                    counts.put(status, rs.getLong("total"));
                }
            }
        );
        return counts;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Boolean nullableBoolean(ResultSet rs, String column) throws SQLException {
        boolean value = rs.getBoolean(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
