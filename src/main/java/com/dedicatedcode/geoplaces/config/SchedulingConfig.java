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

package com.dedicatedcode.geoplaces.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Async recording and periodic flushing of request statistics.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class SchedulingConfig {
}
