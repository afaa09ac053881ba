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

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * UTC offset arithmetic between IANA timezones.
 * <p>
 * Offsets depend on the instant because of daylight saving time, so nothing here is cached.
 */
@Service
public class TimezoneService {

    private final Clock clock;

    public TimezoneService(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Offset of the zone from UTC at the given instant, in minutes.
     */
    public int offsetMinutes(String timezone, Instant instant) {
        return ZoneId.of(timezone).getRules().getOffset(instant).getTotalSeconds() / 60;
    }

    /**
     * {@code offset(timezone1) - offset(timezone2)} at the given instant, in minutes.
     */
    public int differenceMinutes(String timezone1, String timezone2, Instant instant) {
        return offsetMinutes(timezone1, instant) - offsetMinutes(timezone2, instant);
    }

    /**
     * Formats minutes as {@code ±HH:MM}. Zero is {@code +00:00}.
     */
    public static String format(int minutes) {
        char sign = minutes >= 0 ? '+' : '-';
        int abs = Math.abs(minutes);
        return String.format("%c%02d:%02d", sign, abs / 60, abs % 60);
    }
}
