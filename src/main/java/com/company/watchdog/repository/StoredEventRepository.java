package com.company.watchdog.repository;

import com.company.watchdog.domain.StoredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Event log merged from external sources, one row per (checker, unique id).
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class StoredEventRepository {

    private final JdbcTemplate jdbcTemplate;

    public Set<String> findUniqueIds(String checker) {
        String sql = "SELECT unique_id FROM events WHERE checker = ?";
        return new HashSet<>(jdbcTemplate.queryForList(sql, String.class, checker));
    }

    /**
     * Plain batch insert. Callers are responsible for filtering out ids already stored.
     */
    public int insertAll(List<StoredEvent> events) {
        if (events.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO events (checker, unique_id, event_ts)
            VALUES (?, ?, ?)
            """;

        List<Object[]> batch = events.stream()
                .map(e -> new Object[]{e.getChecker(), e.getUniqueId(), e.getTimestamp()})
                .collect(Collectors.toList());

        jdbcTemplate.batchUpdate(sql, batch);
        return batch.size();
    }

    /**
     * Count events of the checker with a timestamp in [lower, upper], both ends inclusive.
     */
    public long countInWindow(String checker, long lowerEpoch, long upperEpoch) {
        String sql = """
            SELECT COUNT(*) FROM events
            WHERE checker = ?
            AND event_ts BETWEEN ? AND ?
            """;

        Long count = jdbcTemplate.queryForObject(sql, Long.class, checker, lowerEpoch, upperEpoch);
        return count != null ? count : 0L;
    }

    public List<StoredEvent> findSince(String checker, long epochExclusive) {
        String sql = """
            SELECT checker, unique_id, event_ts FROM events
            WHERE checker = ?
            AND event_ts > ?
            ORDER BY event_ts ASC
            """;

        return jdbcTemplate.query(sql, new StoredEventRowMapper(), checker, epochExclusive);
    }

    public int deleteOlderThan(String checker, long epochExclusive) {
        String sql = "DELETE FROM events WHERE event_ts < ? AND checker = ?";
        int deleted = jdbcTemplate.update(sql, epochExclusive, checker);
        log.debug("Deleted {} events older than {} for checker {}", deleted, epochExclusive, checker);
        return deleted;
    }

    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM events", Long.class);
        return count != null ? count : 0L;
    }

    private static class StoredEventRowMapper implements RowMapper<StoredEvent> {
        @Override
        public StoredEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return StoredEvent.builder()
                    .checker(rs.getString("checker"))
                    .uniqueId(rs.getString("unique_id"))
                    .timestamp(rs.getLong("event_ts"))
                    .build();
        }
    }
}
