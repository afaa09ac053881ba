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

package com.dedicatedcode.geoplaces.index;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * One populated place from the GeoNames dump. Components follow the column order of the file.
 */
public record PlaceRecord(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("ascii_name") String asciiName,
        @JsonProperty("alternate_names") List<String> alternateNames,
        @JsonProperty("latitude") double latitude,
        @JsonProperty("longitude") double longitude,
        @JsonProperty("feature_class") String featureClass,
        @JsonProperty("feature_code") String featureCode,
        @JsonProperty("country_code") String countryCode,
        @JsonProperty("cc2") String alternateCountryCodes,
        @JsonProperty("admin1_code") String admin1Code,
        @JsonProperty("admin2_code") String admin2Code,
        @JsonProperty("admin3_code") String admin3Code,
        @JsonProperty("admin4_code") String admin4Code,
        @JsonProperty("population") long population,
        @JsonProperty("elevation") Integer elevation, // nullable, often missing in the dump
        @JsonProperty("dem") Integer digitalElevationModel,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("modification_date") LocalDate modificationDate
) {
    public PlaceRecord {
        alternateNames = alternateNames == null ? List.of() : List.copyOf(alternateNames);
    }
}
