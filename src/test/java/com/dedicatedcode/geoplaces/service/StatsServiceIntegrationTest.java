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

import com.dedicatedcode.geoplaces.IntegrationTest;
import com.dedicatedcode.geoplaces.dto.DailyStatsResponse;
import com.dedicatedcode.geoplaces.dto.NameStatsResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@IntegrationTest
class StatsServiceIntegrationTest {

    @Autowired
    private StatsService statsService;

    @BeforeEach
    void setUp() {
        statsService.clearDatabase();
    }

    @Test
    void testRecordQueryAndRetrieveDailyStats() {
        statsService.recordQuery("/api/v1/places/{id}", Map.of(), 150L, 1, 200);
        statsService.recordQuery("/api/v1/places/{id}", Map.of(), 250L, 1, 200);
        statsService.recordQuery("/api/v1/suggest", Map.of("prefix", "Mos"), 100L, 2, 200);

        await().atMost(15, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .until(() -> {
                    statsService.flushPendingStats();
                    return totalQueries(null) >= 3;
                });

        List<DailyStatsResponse> dailyStats = statsService.getDailyStats(
                LocalDate.now().minusDays(1), LocalDate.now(), null);
        DailyStatsResponse today = dailyStats.stream()
                .filter(s -> s.date().equals(LocalDate.now()))
                .findFirst()
                .orElseThrow();

        assertThat(today.queryCount()).isEqualTo(3);
        assertThat(today.minResponseTime()).isEqualTo(100L);
        assertThat(today.maxResponseTime()).isEqualTo(250L);
        assertThat(today.avgResponseTime()).isBetween(100.0, 250.0);
        assertThat(today.successCount()).isEqualTo(3);
        assertThat(today.errorCount()).isZero();
        assertThat(statsService.getAvailableEndpoints())
                .containsExactly("/api/v1/places/{id}", "/api/v1/suggest");
    }

    @Test
    void testFilterByEndpoint() {
        statsService.recordQuery("/api/v1/places/{id}", Map.of(), 10L, 1, 200);
        statsService.recordQuery("/api/v1/suggest", Map.of("prefix", "K"), 20L, 2, 200);

        await().atMost(15, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .until(() -> {
                    statsService.flushPendingStats();
                    return totalQueries(null) >= 2;
                });

        assertThat(totalQueries("/api/v1/suggest")).isEqualTo(1);
    }

    @Test
    void testRecordQueryWithErrorStatus() {
        statsService.recordQuery("/api/v1/places/{id}", Map.of(), 5L, 0, 404);
        statsService.recordQuery("/api/v1/places", Map.of("limit", "0"), 5L, 0, 400);

        await().atMost(15, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .until(() -> {
                    statsService.flushPendingStats();
                    return totalQueries(null) >= 2;
                });

        List<DailyStatsResponse> stats = statsService.getDailyStats(LocalDate.now(), LocalDate.now(), null);
        assertThat(stats).hasSize(1);
        assertThat(stats.get(0).errorCount()).isEqualTo(2);
        assertThat(stats.get(0).successCount()).isZero();
    }

    @Test
    void testNamesOfSuccessfulLookupsAreCounted() {
        statsService.recordQuery("/api/v1/compare", Map.of("name1", "Moscow", "name2", "Kaliningrad"), 3L, 2, 200);
        statsService.recordQuery("/api/v1/places/by-name", Map.of("name", "Moscow"), 3L, 1, 200);
        statsService.recordQuery("/api/v1/places/by-name", Map.of("name", "Atlantis"), 3L, 0, 404);

        await().atMost(15, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .until(() -> {
                    statsService.flushPendingStats();
                    return statsService.getTopNames(10).stream()
                            .anyMatch(n -> n.name().equals("Moscow") && n.queryCount() == 2);
                });

        List<NameStatsResponse> names = statsService.getTopNames(10);
        assertThat(names).extracting(NameStatsResponse::name).containsExactly("Moscow", "Kaliningrad");
        assertThat(names.get(0).queryCount()).isEqualTo(2);
        assertThat(statsService.getTopNames(1)).hasSize(1);
    }

    private long totalQueries(String endpoint) {
        return statsService.getDailyStats(LocalDate.now().minusDays(1), LocalDate.now(), endpoint).stream()
                .mapToLong(DailyStatsResponse::queryCount)
                .sum();
    }
}
