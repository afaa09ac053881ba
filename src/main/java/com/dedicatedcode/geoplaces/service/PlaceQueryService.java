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

import com.dedicatedcode.geoplaces.config.GeoPlacesConfiguration;
import com.dedicatedcode.geoplaces.dto.ComparisonResponse;
import com.dedicatedcode.geoplaces.exception.InvalidQueryException;
import com.dedicatedcode.geoplaces.exception.PlaceNotFoundException;
import com.dedicatedcode.geoplaces.index.PlaceIndex;
import com.dedicatedcode.geoplaces.index.PlaceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only queries over the {@link PlaceIndex}. Input is validated before the index is touched.
 */
@Service
public class PlaceQueryService {

    private static final Logger logger = LoggerFactory.getLogger(PlaceQueryService.class);

    private final PlaceIndex index;
    private final TimezoneService timezoneService;
    private final GeoPlacesConfiguration.QueryConfiguration queryConfig;

    public PlaceQueryService(PlaceIndex index, TimezoneService timezoneService, GeoPlacesConfiguration config) {
        this.index = index;
        this.timezoneService = timezoneService;
        this.queryConfig = config.getQuery();
    }

    /**
     * Look up a place by its geonameid.
     *
     * @throws InvalidQueryException if the id is negative
     * @throws PlaceNotFoundException if no populated place has this id
     */
    public PlaceRecord getById(long id) {
        if (id < 0) {
            throw new InvalidQueryException("id must be >= 0");
        }
        return index.findById(id)
                .orElseThrow(() -> new PlaceNotFoundException("No place found with id " + id));
    }

    /**
     * Page through all places in index order.
     *
     * @param skip number of places to skip
     * @param limit page size, the configured default if null
     */
    public List<PlaceRecord> getPage(long skip, Integer limit) {
        int effectiveLimit = resolveLimit(limit);
        if (skip < 0) {
            throw new InvalidQueryException("skip must be >= 0");
        }
        return index.slice(skip, effectiveLimit);
    }

    /**
     * The most populous place carrying the given name. Case-sensitive, exact match.
     */
    public PlaceRecord getByName(String name) {
        return index.bestMatch(name)
                .orElseThrow(() -> new PlaceNotFoundException("No place found with name '" + name + "'"));
    }

    /**
     * Every place carrying the given name, most populous first.
     */
    public List<PlaceRecord> getCandidates(String name) {
        List<PlaceRecord> candidates = new ArrayList<>(index.candidates(name));
        if (candidates.isEmpty()) {
            throw new PlaceNotFoundException("No place found with name '" + name + "'");
        }
        Collections.reverse(candidates);
        return candidates;
    }

    /**
     * Names starting with the prefix, for autocompletion. No ranking beyond the index order.
     */
    public List<String> prefixSearch(String prefix, Integer limit) {
        int effectiveLimit = resolveLimit(limit);
        if (prefix == null || prefix.isEmpty()) {
            throw new InvalidQueryException("prefix must not be empty");
        }
        return index.namesStartingWith(prefix, effectiveLimit);
    }

    /**
     * Compare two places by name: which one lies further north and how far apart their clocks are right now.
     */
    public ComparisonResponse compare(String name1, String name2) {
        PlaceRecord place1 = getByName(name1);
        PlaceRecord place2 = getByName(name2);

        Instant now = timezoneService.now();
        int diffMinutes = timezoneService.differenceMinutes(place1.timezone(), place2.timezone(), now);
        String north = place1.latitude() >= place2.latitude() ? name1 : name2;

        logger.debug("Compared '{}' ({}) and '{}' ({}) at {}: {} minutes", name1, place1.timezone(),
                name2, place2.timezone(), now, diffMinutes);

        return new ComparisonResponse(
                north,
                diffMinutes == 0,
                TimezoneService.format(diffMinutes),
                diffMinutes,
                place1,
                place2
        );
    }

    public int placeCount() {
        return index.size();
    }

    public int nameCount() {
        return index.nameCount();
    }

    private int resolveLimit(Integer limit) {
        int effectiveLimit = limit != null ? limit : queryConfig.getDefaultLimit();
        if (effectiveLimit <= 0 || effectiveLimit > queryConfig.getMaxLimit()) {
            throw new InvalidQueryException("limit must be > 0 and <= " + queryConfig.getMaxLimit());
        }
        return effectiveLimit;
    }
}
