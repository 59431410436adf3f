package com.company.watchdog.plugin;

import com.company.watchdog.config.WatchdogProperties;
import com.company.watchdog.domain.FetchedRow;
import com.company.watchdog.domain.QueryDetails;
import com.company.watchdog.exception.RowFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs checker queries over JDBC against the sources declared under {@code dwmon.sources}.
 * Column 1 is read as the unique id and column 2 as epoch seconds. Rows without a timestamp
 * are skipped.
 *
 * <p>Templates built from settings carry a statement query timeout, so the driver cancels a query
 * that outlives the fetch timeout instead of leaving its worker thread blocked.
 */
@Slf4j
public class JdbcRowFetcher implements RowFetcher {

    private final Map<String, WatchdogProperties.Source> sources;
    private final Duration queryTimeout;
    private final Map<String, JdbcTemplate> templates = new ConcurrentHashMap<>();

    public JdbcRowFetcher(Map<String, WatchdogProperties.Source> sources, Duration queryTimeout) {
        this.sources = Map.copyOf(sources);
        this.queryTimeout = queryTimeout;
    }

    /**
     * Fetcher over already built templates, keyed by source name.
     */
    public static JdbcRowFetcher forTemplates(Map<String, JdbcTemplate> templates) {
        JdbcRowFetcher fetcher = new JdbcRowFetcher(Map.of(), null);
        fetcher.templates.putAll(templates);
        return fetcher;
    }

    @Override
    public List<FetchedRow> fetch(QueryDetails queryDetails) {
        String source = queryDetails.getSource();
        JdbcTemplate template = templateFor(source);

        List<FetchedRow> rows = new ArrayList<>();
        int[] skipped = {0};
        RowCallbackHandler collector = rs -> {
            long timestamp = rs.getLong(2);
            if (rs.wasNull()) {
                skipped[0]++;
                return;
            }
            rows.add(new FetchedRow(rs.getString(1), timestamp));
        };

        try {
            template.query(queryDetails.getQuery(), collector);
        } catch (DataAccessException e) {
            throw new RowFetchException("Query against source " + source + " failed", e);
        }

        if (skipped[0] > 0) {
            log.warn("Skipped {} rows without a timestamp from source {}", skipped[0], source);
        }
        log.debug("Fetched {} rows from source {}", rows.size(), source);
        return rows;
    }

    JdbcTemplate templateFor(String source) {
        JdbcTemplate template = templates.get(source);
        if (template != null) {
            return template;
        }

        WatchdogProperties.Source settings = sources.get(source);
        if (settings == null) {
            throw new RowFetchException("Unknown source: " + source);
        }

        return templates.computeIfAbsent(source, name -> {
            log.info("Opening data source {} at {}", name, settings.getUrl());
            DataSourceBuilder<?> builder = DataSourceBuilder.create()
                    .url(settings.getUrl())
                    .username(settings.getUsername())
                    .password(settings.getPassword());
            if (settings.getDriverClassName() != null) {
                builder.driverClassName(settings.getDriverClassName());
            }
            JdbcTemplate built = new JdbcTemplate(builder.build());
            if (queryTimeout != null) {
                built.setQueryTimeout(queryTimeoutSeconds(queryTimeout));
            }
            return built;
        });
    }

    /**
     * JDBC timeouts are whole seconds; round up and never go below one, since 0 means no limit.
     */
    static int queryTimeoutSeconds(Duration timeout) {
        long seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }
}
