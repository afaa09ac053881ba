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

package com.dedicatedcode.geoplaces.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DailyStatsResponse(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("queryCount") long queryCount,
        @JsonProperty("avgResponseTime") double avgResponseTime,
        @JsonProperty("minResponseTime") long minResponseTime,
        @JsonProperty("maxResponseTime") long maxResponseTime,
        @JsonProperty("avgResultCount") double avgResultCount,
        @JsonProperty("successCount") long successCount,
        @JsonProperty("errorCount") long errorCount
) {
}
