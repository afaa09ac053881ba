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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * Immutable in-memory index over the populated places of a GeoNames dump.
 * <p>
 * Holds a primary index by geonameid, kept in insertion order, and a name index from alternate name to
 * every place carrying that name. Candidate lists are sorted ascending by population, so the last entry
 * is the most populous one. Instances are built by {@link PlaceIndexBuilder} and never change afterwards,
 * which makes them safe to share between request threads without locking.
 */
public final class PlaceIndex {

    private final Map<Long, PlaceRecord> byId;
    private final List<PlaceRecord> inIdOrder;
    private final NavigableMap<String, List<PlaceRecord>> byName;

    PlaceIndex(Map<Long, PlaceRecord> byId, NavigableMap<String, List<PlaceRecord>> byName) {
        this.byId = Collections.unmodifiableMap(byId);
        this.inIdOrder = List.copyOf(byId.values());
        this.byName = Collections.unmodifiableNavigableMap(byName);
    }

    public Optional<PlaceRecord> findById(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Slice of the primary index in iteration order. Returns an empty list if {@code skip} is past the end.
     */
    public List<PlaceRecord> slice(long skip, int limit) {
        if (skip >= inIdOrder.size() || limit <= 0) {
            return List.of();
        }
        int from = (int) skip;
        int to = (int) Math.min((long) from + limit, inIdOrder.size());
        return inIdOrder.subList(from, to);
    }

    /**
     * All places with the given alternate name, ascending by population. Empty if the name is unknown.
     */
    public List<PlaceRecord> candidates(String name) {
        List<PlaceRecord> candidates = byName.get(name);
        return candidates == null ? List.of() : candidates;
    }

    /**
     * The most populous place for the name.
     */
    public Optional<PlaceRecord> bestMatch(String name) {
        List<PlaceRecord> candidates = candidates(name);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(candidates.size() - 1));
    }

    /**
     * Up to {@code limit} distinct names starting with {@code prefix}, in lexicographic order.
     */
    public List<String> namesStartingWith(String prefix, int limit) {
        List<String> names = new ArrayList<>();
        for (String name : byName.tailMap(prefix, true).keySet()) {
            if (names.size() >= limit || !name.startsWith(prefix)) {
                break;
            }
            names.add(name);
        }
        return names;
    }

    public int size() {
        return byId.size();
    }

    public int nameCount() {
        return byName.size();
    }
}
