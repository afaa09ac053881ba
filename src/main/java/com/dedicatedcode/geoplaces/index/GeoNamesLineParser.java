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

import com.dedicatedcode.geoplaces.exception.MalformedRecordException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parser for lines of the GeoNames main table ({@code allCountries.txt}, {@code RU.txt}, ...).
 *
 * <h2>Column Structure</h2>
 * <table>
 *   <tr><th>Index</th><th>Name</th></tr>
 *   <tr><td>0</td><td>geonameid</td></tr>
 *   <tr><td>1</td><td>name</td></tr>
 *   <tr><td>2</td><td>asciiname</td></tr>
 *   <tr><td>3</td><td>alternatenames, comma separated</td></tr>
 *   <tr><td>4-5</td><td>latitude, longitude (WGS84)</td></tr>
 *   <tr><td>6-7</td><td>feature class, feature code</td></tr>
 *   <tr><td>8-9</td><td>country code, alternate country codes</td></tr>
 *   <tr><td>10-13</td><td>admin1 to admin4 codes</td></tr>
 *   <tr><td>14</td><td>population</td></tr>
 *   <tr><td>15-16</td><td>elevation, dem</td></tr>
 *   <tr><td>17</td><td>IANA timezone id</td></tr>
 *   <tr><td>18</td><td>modification date, yyyy-MM-dd</td></tr>
 * </table>
 *
 * Every line must have exactly {@link #FIELD_COUNT} fields. Only rows of the configured feature class
 * are converted to {@link PlaceRecord}; the rest are skipped without looking at their content.
 */
public class GeoNamesLineParser {

    public static final int FIELD_COUNT = 19;

    private static final int COL_ID = 0;
    private static final int COL_NAME = 1;
    private static final int COL_ASCII_NAME = 2;
    private static final int COL_ALTERNATE_NAMES = 3;
    private static final int COL_LATITUDE = 4;
    private static final int COL_LONGITUDE = 5;
    private static final int COL_FEATURE_CLASS = 6;
    private static final int COL_FEATURE_CODE = 7;
    private static final int COL_COUNTRY_CODE = 8;
    private static final int COL_CC2 = 9;
    private static final int COL_ADMIN1 = 10;
    private static final int COL_ADMIN2 = 11;
    private static final int COL_ADMIN3 = 12;
    private static final int COL_ADMIN4 = 13;
    private static final int COL_POPULATION = 14;
    private static final int COL_ELEVATION = 15;
    private static final int COL_DEM = 16;
    private static final int COL_TIMEZONE = 17;
    private static final int COL_MODIFICATION_DATE = 18;

    private final String populatedFeatureClass;

    public GeoNamesLineParser(String populatedFeatureClass) {
        this.populatedFeatureClass = populatedFeatureClass;
    }

    /**
     * Parse a single line.
     *
     * @param lineNumber 1-based line number, used in error messages
     * @param line raw line without the line terminator
     * @return the record, or empty if the row is not a populated place
     * @throws MalformedRecordException if the field count is wrong or a retained row has an unparsable value
     */
    public Optional<PlaceRecord> parse(long lineNumber, String line) {
        // -1 keeps trailing empty columns, GeoNames rows often end with empty fields
        String[] cols = line.split("\t", -1);
        if (cols.length != FIELD_COUNT) {
            throw new MalformedRecordException(lineNumber,
                    String.format("expected %d tab separated fields but found %d", FIELD_COUNT, cols.length));
        }

        if (!populatedFeatureClass.equals(cols[COL_FEATURE_CLASS])) {
            return Optional.empty();
        }

        long id = parseLong(lineNumber, cols, COL_ID, "geonameid");
        if (id < 0) {
            throw new MalformedRecordException(lineNumber, "negative geonameid " + id);
        }

        return Optional.of(new PlaceRecord(
                id,
                cols[COL_NAME],
                cols[COL_ASCII_NAME],
                splitAlternateNames(cols[COL_ALTERNATE_NAMES]),
                parseDouble(lineNumber, cols, COL_LATITUDE, "latitude"),
                parseDouble(lineNumber, cols, COL_LONGITUDE, "longitude"),
                cols[COL_FEATURE_CLASS],
                cols[COL_FEATURE_CODE],
                cols[COL_COUNTRY_CODE],
                cols[COL_CC2],
                cols[COL_ADMIN1],
                cols[COL_ADMIN2],
                cols[COL_ADMIN3],
                cols[COL_ADMIN4],
                cols[COL_POPULATION].isEmpty() ? 0L : parseLong(lineNumber, cols, COL_POPULATION, "population"),
                parseOptionalInt(lineNumber, cols, COL_ELEVATION, "elevation"),
                parseOptionalInt(lineNumber, cols, COL_DEM, "dem"),
                parseTimezone(lineNumber, cols[COL_TIMEZONE]),
                parseDate(lineNumber, cols[COL_MODIFICATION_DATE])
        ));
    }

    static List<String> splitAlternateNames(String value) {
        List<String> names = new ArrayList<>();
        if (value.isEmpty()) {
            return names;
        }
        for (String name : value.split(",")) {
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static long parseLong(long lineNumber, String[] cols, int col, String field) {
        try {
            return Long.parseLong(cols[col].trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(lineNumber, "invalid " + field + " '" + cols[col] + "'", e);
        }
    }

    private static double parseDouble(long lineNumber, String[] cols, int col, String field) {
        try {
            return Double.parseDouble(cols[col].trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(lineNumber, "invalid " + field + " '" + cols[col] + "'", e);
        }
    }

    private static Integer parseOptionalInt(long lineNumber, String[] cols, int col, String field) {
        String value = cols[col].trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(lineNumber, "invalid " + field + " '" + value + "'", e);
        }
    }

    private static String parseTimezone(long lineNumber, String value) {
        if (value.isEmpty()) {
            throw new MalformedRecordException(lineNumber,
                    "missing timezone in column " + (COL_TIMEZONE + 1) + ", populated places need an IANA zone id");
        }
        try {
            return ZoneId.of(value).getId();
        } catch (DateTimeException e) {
            throw new MalformedRecordException(lineNumber,
                    "unknown timezone '" + value + "' in column " + (COL_TIMEZONE + 1)
                            + ", expected an IANA zone id such as Europe/Moscow", e);
        }
    }

    private static LocalDate parseDate(long lineNumber, String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException(lineNumber, "invalid modification date '" + value + "'", e);
        }
    }
}
