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

import java.util.List;

/**
 * Builds GeoNames lines for tests.
 */
public final class TestPlaces {

    private TestPlaces() {
    }

    public static String line(long id, String name, String alternateNames, double latitude,
                              String featureClass, long population, String timezone) {
        return String.join("\t", List.of(
                String.valueOf(id),
                name,
                name,
                alternateNames,
                String.valueOf(latitude),
                "37.0",
                featureClass,
                "PPL",
                "RU",
                "",
                "48",
                "",
                "",
                "",
                String.valueOf(population),
                "",
                "150",
                timezone,
                "2022-12-10"
        ));
    }

    public static String place(long id, String name, String alternateNames, double latitude,
                               long population, String timezone) {
        return line(id, name, alternateNames, latitude, "P", population, timezone);
    }

    /**
     * Moscow and Saint Petersburg, both on Moscow time.
     */
    public static List<String> moscowAndSaintPetersburg() {
        return List.of(
                place(524901, "Moscow", "Moscow,Moskva", 55.75, 10_000_000, "Europe/Moscow"),
                place(498817, "Saint Petersburg", "Saint Petersburg,SPB", 59.93, 5_000_000, "Europe/Moscow")
        );
    }
}
