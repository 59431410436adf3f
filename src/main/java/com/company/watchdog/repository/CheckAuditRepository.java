package com.company.watchdog.repository;

import com.company.watchdog.domain.CheckAudit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.OptionalLong;

/**
 * Append-only record of (checker, minute) pairs that have been evaluated.
 * Rows are not tagged with the requirement that produced them.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class CheckAuditRepository {

    private final JdbcTemplate jdbcTemplate;

    public void save(CheckAudit audit) {
        String sql = "INSERT INTO check_audit (checker, minute_epoch) VALUES (?, ?)";
        jdbcTemplate.update(sql, audit.getChecker(), audit.getMinuteEpoch());
    }

    /**
     * Most recent evaluated minute for the checker, across all of its requirements.
     */
    public OptionalLong findLatestMinute(String checker) {
        String sql = "SELECT MAX(minute_epoch) FROM check_audit WHERE checker = ?";
        Long latest = jdbcTemplate.queryForObject(sql, Long.class, checker);
        return latest != null ? OptionalLong.of(latest) : OptionalLong.empty();
    }

    public List<CheckAudit> findRecent(String checker, int limit) {
        String sql = """
            SELECT checker, minute_epoch FROM check_audit
            WHERE checker = ?
            ORDER BY minute_epoch DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new CheckAuditRowMapper(), checker, limit);
    }

    private static class CheckAuditRowMapper implements RowMapper<CheckAudit> {
        @Override
        public CheckAudit mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CheckAudit.builder()
                    .checker(rs.getString("checker"))
                    .minuteEpoch(rs.getLong("minute_epoch"))
                    .build();
        }
    }
}
