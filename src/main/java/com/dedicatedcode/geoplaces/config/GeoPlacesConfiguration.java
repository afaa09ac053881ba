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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "geoplaces")
public class GeoPlacesConfiguration {

    private String dataFile = "./data/RU.txt";

    private String statsDbPath = "./data/stats.db";

    @NestedConfigurationProperty
    private IndexConfiguration index = new IndexConfiguration();

    @NestedConfigurationProperty
    private QueryConfiguration query = new QueryConfiguration();

    public String getDataFile() {
        return dataFile;
    }

    public void setDataFile(String dataFile) {
        this.dataFile = dataFile;
    }

    public String getStatsDbPath() {
        return statsDbPath;
    }

    public void setStatsDbPath(String statsDbPath) {
        this.statsDbPath = statsDbPath;
    }

    public IndexConfiguration getIndex() {
        return index;
    }

    public void setIndex(IndexConfiguration index) {
        this.index = index;
    }

    public QueryConfiguration getQuery() {
        return query;
    }

    public void setQuery(QueryConfiguration query) {
        this.query = query;
    }

    public static class IndexConfiguration {

        /**
         * GeoNames feature class of the rows to keep. "P" covers cities, towns and villages.
         */
        private String populatedFeatureClass = "P";

        /**
         * Abort the load on a repeated geonameid instead of letting the later row win.
         */
        private boolean failOnDuplicateId = false;

        public String getPopulatedFeatureClass() {
            return populatedFeatureClass;
        }

        public void setPopulatedFeatureClass(String populatedFeatureClass) {
            this.populatedFeatureClass = populatedFeatureClass;
        }

        public boolean isFailOnDuplicateId() {
            return failOnDuplicateId;
        }

        public void setFailOnDuplicateId(boolean failOnDuplicateId) {
            this.failOnDuplicateId = failOnDuplicateId;
        }
    }

    public static class QueryConfiguration {

        /**
         * Number of results for listing and suggestion queries when no limit is given.
         */
        private int defaultLimit = 10;

        /**
         * Largest accepted limit for listing and suggestion queries.
         */
        private int maxLimit = 1000;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }
    }
}
