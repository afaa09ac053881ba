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

package com.dedicatedcode.geoplaces.controller;

import com.dedicatedcode.geoplaces.dto.ComparisonResponse;
import com.dedicatedcode.geoplaces.index.PlaceRecord;
import com.dedicatedcode.geoplaces.service.PlaceQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for place lookups, listing, comparison and name suggestions.
 */
@RestController
@RequestMapping("/api/v1")
public class PlaceController {

    private static final Logger logger = LoggerFactory.getLogger(PlaceController.class);
    private static final String NO_CACHE = "no-store, no-cache, must-revalidate, proxy-revalidate, max-age=0";

    private final PlaceQueryService placeQueryService;

    public PlaceController(PlaceQueryService placeQueryService) {
        this.placeQueryService = placeQueryService;
    }

    /**
     * Get a place by its geonameid.
     *
     * @param id GeoNames identifier, must be >= 0
     * @return the place
     */
    @GetMapping("/places/{id}")
    public ResponseEntity<PlaceRecord> getById(@PathVariable long id) {
        logger.debug("Place request for id {}", id);
        return ResponseEntity.ok()
                .header("X-Result-Count", "1")
                .body(placeQueryService.getById(id));
    }

    /**
     * List places page by page.
     *
     * @param skip number of places to skip (optional, defaults to 0)
     * @param limit page size (optional, defaults to the configured default)
     */
    @GetMapping("/places")
    public ResponseEntity<List<PlaceRecord>> list(
            @RequestParam(defaultValue = "0") long skip,
            @RequestParam(required = false) Integer limit) {
        logger.debug("Listing places: skip={}, limit={}", skip, limit);
        List<PlaceRecord> results = placeQueryService.getPage(skip, limit);
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(results.size()))
                .body(results);
    }

    /**
     * All places carrying a name, most populous first.
     */
    @GetMapping("/places/by-name")
    public ResponseEntity<List<PlaceRecord>> byName(@RequestParam String name) {
        List<PlaceRecord> results = placeQueryService.getCandidates(name);
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(results.size()))
                .body(results);
    }

    /**
     * Compare two places by name.
     *
     * @param name1 first place name
     * @param name2 second place name
     * @return which one is further north and the current difference of their UTC offsets
     */
    @GetMapping("/compare")
    public ResponseEntity<ComparisonResponse> compare(@RequestParam String name1, @RequestParam String name2) {
        logger.debug("Comparing '{}' and '{}'", name1, name2);
        ComparisonResponse comparison = placeQueryService.compare(name1, name2);
        // depends on the current time, never cache
        return ResponseEntity.ok()
                .header("X-Result-Count", "2")
                .header("Cache-Control", NO_CACHE)
                .body(comparison);
    }

    /**
     * Suggest names starting with a prefix.
     *
     * @param prefix non-empty name prefix, case-sensitive
     * @param limit maximum number of names (optional)
     */
    @GetMapping("/suggest")
    public ResponseEntity<List<String>> suggest(
            @RequestParam String prefix,
            @RequestParam(required = false) Integer limit) {
        List<String> names = placeQueryService.prefixSearch(prefix, limit);
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(names.size()))
                .body(names);
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("service", "geoplaces");
        response.put("places", placeQueryService.placeCount());
        response.put("names", placeQueryService.nameCount());
        return ResponseEntity.ok()
                .header("Cache-Control", NO_CACHE)
                .body(response);
    }
}
