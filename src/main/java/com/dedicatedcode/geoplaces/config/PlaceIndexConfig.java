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

import com.dedicatedcode.geoplaces.index.PlaceIndex;
import com.dedicatedcode.geoplaces.index.PlaceIndexBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Builds the place index once while the context starts. A load failure aborts startup,
 * so the web server never accepts requests against a partial index.
 */
@Configuration
public class PlaceIndexConfig {

    @Bean
    public PlaceIndex placeIndex(GeoPlacesConfiguration config) {
        GeoPlacesConfiguration.IndexConfiguration indexConfig = config.getIndex();
        PlaceIndexBuilder builder = new PlaceIndexBuilder(
                indexConfig.getPopulatedFeatureClass(),
                indexConfig.isFailOnDuplicateId());
        return builder.load(Paths.get(config.getDataFile()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
