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

import com.dedicatedcode.geoplaces.index.PlaceRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of comparing two places by name.
 */
public class ComparisonResponse {

    @JsonProperty("north")
    private String north;

    @JsonProperty("is_same_time")
    private boolean sameTime;

    @JsonProperty("timezone_diff")
    private String timezoneDiff;

    @JsonProperty("timezone_diff_minutes")
    private int timezoneDiffMinutes;

    @JsonProperty("name_1")
    private PlaceRecord name1;

    @JsonProperty("name_2")
    private PlaceRecord name2;

    public ComparisonResponse() {}

    public ComparisonResponse(String north, boolean sameTime, String timezoneDiff, int timezoneDiffMinutes,
                              PlaceRecord name1, PlaceRecord name2) {
        this.north = north;
        this.sameTime = sameTime;
        this.timezoneDiff = timezoneDiff;
        this.timezoneDiffMinutes = timezoneDiffMinutes;
        this.name1 = name1;
        this.name2 = name2;
    }

    public String getNorth() { return north; }
    public void setNorth(String north) { this.north = north; }

    public boolean isSameTime() { return sameTime; }
    public void setSameTime(boolean sameTime) { this.sameTime = sameTime; }

    public String getTimezoneDiff() { return timezoneDiff; }
    public void setTimezoneDiff(String timezoneDiff) { this.timezoneDiff = timezoneDiff; }

    public int getTimezoneDiffMinutes() { return timezoneDiffMinutes; }
    public void setTimezoneDiffMinutes(int timezoneDiffMinutes) { this.timezoneDiffMinutes = timezoneDiffMinutes; }

    public PlaceRecord getName1() { return name1; }
    public void setName1(PlaceRecord name1) { this.name1 = name1; }

    public PlaceRecord getName2() { return name2; }
    public void setName2(PlaceRecord name2) { this.name2 = name2; }
}
