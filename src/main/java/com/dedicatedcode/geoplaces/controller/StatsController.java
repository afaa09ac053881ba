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

package com.dedicatedcode.geoplaces.controller;

import com.dedicatedcode.geoplaces.dto.DailyStatsResponse;
import com.dedicatedcode.geoplaces.dto.NameStatsResponse;
import com.dedicatedcode.geoplaces.exception.InvalidQueryException;
import com.dedicatedcode.geoplaces.service.StatsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/stats")
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/daily")
    public ResponseEntity<Map<String, Object>> daily(
            @RequestParam(defaultValue = "") String startDate,
            @RequestParam(defaultValue = "") String endDate,
            @RequestParam(defaultValue = "") String endpoint) {

        // last 30 days unless given
        LocalDate end = endDate.isEmpty() ? LocalDate.now() : parseDate(endDate);
        LocalDate start = startDate.isEmpty() ? end.minusDays(30) : parseDate(startDate);

        List<DailyStatsResponse> stats = statsService.getDailyStats(start, end, endpoint.isEmpty() ? null : endpoint);

        Map<String, Object> response = new HashMap<>();
        response.put("stats", stats);
        response.put("availableEndpoints", statsService.getAvailableEndpoints());
        response.put("startDate", start.toString());
        response.put("endDate", end.toString());
        response.put("selectedEndpoint", endpoint);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/names")
    public ResponseEntity<List<NameStatsResponse>> names(@RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0) {
            throw new InvalidQueryException("limit must be > 0");
        }
        return ResponseEntity.ok(statsService.getTopNames(limit));
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException("Invalid date '" + value + "'. Expected yyyy-MM-dd.");
        }
    }
}
