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

package com.dedicatedcode.geoplaces;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeoPlacesApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(GeoPlacesApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GeoPlacesApplication.class, args);
    }

    private void printApiInfo() {
        logger.info("GEOPLACES is now serving data under the following endpoints:");
        logger.info("  Health Check:      GET  /api/v1/health");
        logger.info("  Place by id:       GET  /api/v1/places/524901");
        logger.info("  List places:       GET  /api/v1/places?skip=0&limit=10");
        logger.info("  Places by name:    GET  /api/v1/places/by-name?name=Moskva");
        logger.info("  Compare places:    GET  /api/v1/compare?name1=Moscow&name2=Novosibirsk");
        logger.info("  Name suggestions:  GET  /api/v1/suggest?prefix=Mos&limit=10");
        logger.info("  Statistics:        GET  /api/v1/stats/daily, /api/v1/stats/names");
        logger.info("");
        logger.info("Sample requests:");
        logger.info("  curl 'http://localhost:8080/api/v1/health'");
        logger.info("  curl 'http://localhost:8080/api/v1/compare?name1=Moscow&name2=Saint%20Petersburg'");
        logger.info("");
    }

    @Override
    public void run(String... args) {
        printApiInfo();
    }
}
