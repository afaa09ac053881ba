/*
 *  This file is part of geoplaces.
 *
 *  Geoplaces is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Geoplaces is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Geoplaces. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.geoplaces.service;

import com.dedicatedcode.geoplaces.config.GeoPlacesConfiguration;
import com.dedicatedcode.geoplaces.dto.DailyStatsResponse;
import com.dedicatedcode.geoplaces.dto.NameStatsResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Request statistics in a local SQLite database.
 * <p>
 * Requests are queued in memory and written in batches by {@link #flushPendingStats()}. Names asked for
 * through name lookups and comparisons are counted separately. A broken stats database never fails a request:
 * without a connection nothing is queued, and a batch that cannot be written is dropped.
 */
@Service
public class StatsService {

    private static final Logger logger = LoggerFactory.getLogger(StatsService.class);
    private static final int MAX_BATCH_SIZE = 1000;

    private final GeoPlacesConfiguration config;
    private final ObjectMapper objectMapper;
    private final Queue<StatsRecord> pendingStats = new ConcurrentLinkedQueue<>();
    private final Queue<String> pendingNames = new ConcurrentLinkedQueue<>();

    private Connection connection;

    public StatsService(GeoPlacesConfiguration config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initialize() {
        try {
            initializeDatabase();
            logger.info("Stats service initialized with database at: {}", config.getStatsDbPath());
        } catch (SQLException e) {
            logger.error("Failed to initialize stats service, statistics are disabled", e);
        }
    }

    @PreDestroy
    public synchronized void cleanup() {
        try {
            flushPendingStats();
            logger.info("Flushed pending stats before shutdown");
            if (connection != null && !connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            logger.error("Error closing stats database connection", e);
        }
    }

    private synchronized void initializeDatabase() throws SQLException {
        File dbFile = new File(config.getStatsDbPath()).getAbsoluteFile();
        dbFile.getParentFile().mkdirs();

        connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.getPath());

        try (Statement stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS query_stats (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    timestamp DATETIME DEFAULT CURRENT_TIMESTAMP,
                    endpoint VARCHAR(100),
                    parameters TEXT,
                    response_time_ms INTEGER,
                    result_count INTEGER,
                    status_code INTEGER,
                    date_only DATE
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_stats_date ON query_stats(date_only)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_stats_endpoint_date ON query_stats(endpoint, date_only)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS name_stats (
                    name TEXT PRIMARY KEY,
                    query_count INTEGER DEFAULT 0,
                    last_queried DATETIME DEFAULT CURRENT_TIMESTAMP
                )
                """);
        }
    }

    @Async
    public void recordQuery(String endpoint, Map<String, String> sortedParams,
                            long responseTimeMs, int resultCount, int statusCode) {
        if (connection == null) {
            return;
        }
        try {
            pendingStats.offer(new StatsRecord(
                    endpoint,
                    objectMapper.writeValueAsString(sortedParams),
                    responseTimeMs,
                    resultCount,
                    statusCode,
                    LocalDate.now()
            ));

            if (statusCode >= 200 && statusCode < 300) {
                if ("/api/v1/compare".equals(endpoint)) {
                    offerName(sortedParams.get("name1"));
                    offerName(sortedParams.get("name2"));
                } else if ("/api/v1/places/by-name".equals(endpoint)) {
                    offerName(sortedParams.get("name"));
                }
            }
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize parameters for stats", e);
        }
    }

    private void offerName(String name) {
        if (name != null && !name.isEmpty()) {
            pendingNames.offer(name);
        }
    }

    /**
     * Writes everything queued so far, in batches of at most {@value #MAX_BATCH_SIZE}.
     */
    @Scheduled(fixedDelay = 10000)
    public synchronized void flushPendingStats() {
        if (connection == null) {
            return;
        }
        while (flushQueries()) {
            // next batch
        }
        while (flushNames()) {
            // next batch
        }
    }

    int pendingCount() {
        return pendingStats.size() + pendingNames.size();
    }

    /**
     * @return true if a full batch was taken, so more records may be waiting
     */
    private boolean flushQueries() {
        List<StatsRecord> batch = new ArrayList<>();
        StatsRecord record;
        while (batch.size() < MAX_BATCH_SIZE && (record = pendingStats.poll()) != null) {
            batch.add(record);
        }
        if (batch.isEmpty()) {
            return false;
        }

        String insertSQL = """
            INSERT INTO query_stats (endpoint, parameters, response_time_ms, result_count, status_code, date_only)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        try (PreparedStatement pstmt = connection.prepareStatement(insertSQL)) {
            for (StatsRecord statsRecord : batch) {
                pstmt.setString(1, statsRecord.endpoint());
                pstmt.setString(2, statsRecord.parametersJson());
                pstmt.setLong(3, statsRecord.responseTimeMs());
                pstmt.setInt(4, statsRecord.resultCount());
                pstmt.setInt(5, statsRecord.statusCode());
                pstmt.setString(6, statsRecord.dateOnly().toString());
                pstmt.addBatch();
            }
            pstmt.executeBatch();
            logger.debug("Flushed {} stats records to database", batch.size());
        } catch (SQLException e) {
            logger.error("Failed to flush stats to database, dropping {} records", batch.size(), e);
        }
        return batch.size() == MAX_BATCH_SIZE;
    }

    private boolean flushNames() {
        List<String> batch = new ArrayList<>();
        String name;
        while (batch.size() < MAX_BATCH_SIZE && (name = pendingNames.poll()) != null) {
            batch.add(name);
        }
        if (batch.isEmpty()) {
            return false;
        }

        String upsertSQL = """
            INSERT INTO name_stats (name, query_count, last_queried)
            VALUES (?, 1, CURRENT_TIMESTAMP)
            ON CONFLICT(name)
            DO UPDATE SET
                query_count = query_count + 1,
                last_queried = CURRENT_TIMESTAMP
            """;

        try (PreparedStatement pstmt = connection.prepareStatement(upsertSQL)) {
            for (String queriedName : batch) {
                pstmt.setString(1, queriedName);
                pstmt.addBatch();
            }
            pstmt.executeBatch();
        } catch (SQLException e) {
            logger.error("Failed to flush name stats to database, dropping {} names", batch.size(), e);
        }
        return batch.size() == MAX_BATCH_SIZE;
    }

    public synchronized List<DailyStatsResponse> getDailyStats(LocalDate startDate, LocalDate endDate, String endpoint) {
        boolean filterEndpoint = endpoint != null && !endpoint.isEmpty();
        String sql = """
            SELECT date_only, COUNT(*) as query_count,
                   AVG(response_time_ms) as avg_response_time,
                   MIN(response_time_ms) as min_response_time,
                   MAX(response_time_ms) as max_response_time,
                   AVG(result_count) as avg_result_count,
                   SUM(CASE WHEN status_code >= 200 AND status_code < 300 THEN 1 ELSE 0 END) as success_count,
                   SUM(CASE WHEN status_code >= 400 THEN 1 ELSE 0 END) as error_count
            FROM query_stats
            WHERE date_only BETWEEN ? AND ?
            """ + (filterEndpoint ? "  AND endpoint = ?\n" : "") + """
            GROUP BY date_only
            ORDER BY date_only
            """;

        List<DailyStatsResponse> results = new ArrayList<>();
        if (connection == null) {
            return results;
        }

        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setString(1, startDate.toString());
            pstmt.setString(2, endDate.toString());
            if (filterEndpoint) {
                pstmt.setString(3, endpoint);
            }

            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new DailyStatsResponse(
                            LocalDate.parse(rs.getString("date_only")),
                            rs.getLong("query_count"),
                            rs.getDouble("avg_response_time"),
                            rs.getLong("min_response_time"),
                            rs.getLong("max_response_time"),
                            rs.getDouble("avg_result_count"),
                            rs.getLong("success_count"),
                            rs.getLong("error_count")
                    ));
                }
            }
        } catch (SQLException e) {
            logger.error("Failed to retrieve daily stats", e);
        }

        return results;
    }

    public synchronized List<String> getAvailableEndpoints() {
        List<String> endpoints = new ArrayList<>();
        if (connection == null) {
            return endpoints;
        }

        try (PreparedStatement pstmt = connection.prepareStatement("SELECT DISTINCT endpoint FROM query_stats ORDER BY endpoint");
             ResultSet rs = pstmt.executeQuery()) {
            while (rs.next()) {
                endpoints.add(rs.getString("endpoint"));
            }
        } catch (SQLException e) {
            logger.error("Failed to retrieve available endpoints", e);
        }

        return endpoints;
    }

    /**
     * Most requested names, highest count first.
     */
    public synchronized List<NameStatsResponse> getTopNames(int limit) {
        List<NameStatsResponse> results = new ArrayList<>();
        if (connection == null) {
            return results;
        }

        String sql = "SELECT name, query_count, last_queried FROM name_stats ORDER BY query_count DESC, name LIMIT ?";
        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setInt(1, limit);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new NameStatsResponse(
                            rs.getString("name"),
                            rs.getLong("query_count"),
                            rs.getString("last_queried")
                    ));
                }
            }
        } catch (SQLException e) {
            logger.error("Failed to retrieve name stats", e);
        }

        return results;
    }

    @Scheduled(cron = "0 0 2 * * ?") // Daily at 2 AM
    public synchronized void cleanupOldStats() {
        if (connection == null) {
            return;
        }
        LocalDate cutoffDate = LocalDate.now().minusYears(1);

        try (PreparedStatement pstmt = connection.prepareStatement("DELETE FROM query_stats WHERE date_only < ?")) {
            pstmt.setString(1, cutoffDate.toString());
            int deleted = pstmt.executeUpdate();
            if (deleted > 0) {
                logger.info("Cleaned up {} old stats records older than {}", deleted, cutoffDate);
            }
        } catch (SQLException e) {
            logger.error("Failed to cleanup old stats", e);
        }
    }

    /**
     * Drops everything recorded so far, queued records included.
     */
    public synchronized void clearDatabase() {
        pendingStats.clear();
        pendingNames.clear();
        if (connection == null) {
            return;
        }
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("DELETE FROM query_stats");
            stmt.execute("DELETE FROM name_stats");
        } catch (SQLException e) {
            logger.error("Failed to clear stats database", e);
        }
    }

    private record StatsRecord(String endpoint, String parametersJson, long responseTimeMs,
                               int resultCount, int statusCode, LocalDate dateOnly) {
    }
}
