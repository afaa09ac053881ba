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

/**
 * How often a place name was asked for by name lookups and comparisons.
 */
public record NameStatsResponse(
        @JsonProperty("name") String name,
        @JsonProperty("queryCount") long queryCount,
        @JsonProperty("lastQueried") String lastQueried
) {
}
