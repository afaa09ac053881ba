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

import com.dedicatedcode.geoplaces.exception.DatasetLoadException;
import com.dedicatedcode.geoplaces.exception.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds a {@link PlaceIndex} from GeoNames lines. The input is consumed once, sequentially.
 */
public class PlaceIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PlaceIndexBuilder.class);

    private final GeoNamesLineParser parser;
    private final boolean failOnDuplicateId;

    public PlaceIndexBuilder(String populatedFeatureClass, boolean failOnDuplicateId) {
        this.parser = new GeoNamesLineParser(populatedFeatureClass);
        this.failOnDuplicateId = failOnDuplicateId;
    }

    /**
     * Read and index a dataset file.
     *
     * @throws DatasetLoadException if the file cannot be read
     * @throws MalformedRecordException if any line does not match the schema
     */
    public PlaceIndex load(Path datasetFile) {
        logger.info("Loading places from {}", datasetFile.toAbsolutePath());
        long start = System.currentTimeMillis();

        PlaceIndex index;
        try (BufferedReader reader = Files.newBufferedReader(datasetFile, StandardCharsets.UTF_8)) {
            index = build(reader.lines().iterator());
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read dataset " + datasetFile, e);
        } catch (UncheckedIOException e) {
            throw new DatasetLoadException("Failed to read dataset " + datasetFile, e.getCause());
        } catch (MalformedRecordException e) {
            logger.error("Rejected dataset {}: {}", datasetFile.toAbsolutePath(), e.getMessage());
            throw e;
        }

        logger.info("Indexed {} places under {} names in {} ms",
                index.size(), index.nameCount(), System.currentTimeMillis() - start);
        return index;
    }

    public PlaceIndex build(Iterable<String> lines) {
        return build(lines.iterator());
    }

    private PlaceIndex build(Iterator<String> lines) {
        Map<Long, PlaceRecord> byId = new LinkedHashMap<>();
        long lineNumber = 0;
        long skipped = 0;
        int duplicates = 0;

        while (lines.hasNext()) {
            String line = lines.next();
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }

            Optional<PlaceRecord> parsed = parser.parse(lineNumber, line);
            if (parsed.isEmpty()) {
                skipped++;
                continue;
            }

            PlaceRecord place = parsed.get();
            PlaceRecord previous = byId.put(place.id(), place);
            if (previous != null) {
                if (failOnDuplicateId) {
                    throw new MalformedRecordException(lineNumber, "duplicate geonameid " + place.id());
                }
                duplicates++;
                logger.warn("Line {}: duplicate geonameid {} replaces '{}' with '{}'",
                        lineNumber, place.id(), previous.name(), place.name());
            }
        }

        logger.debug("Read {} lines, skipped {} rows that are not populated places, {} duplicate ids",
                lineNumber, skipped, duplicates);

        return new PlaceIndex(byId, buildNameIndex(byId.values()));
    }

    /**
     * Candidate lists end up ascending by population. The sort is stable, so among equally populated places
     * the one that came later in the primary index wins.
     */
    private static TreeMap<String, List<PlaceRecord>> buildNameIndex(Iterable<PlaceRecord> places) {
        List<PlaceRecord> byPopulation = new ArrayList<>();
        places.forEach(byPopulation::add);
        byPopulation.sort(Comparator.comparingLong(PlaceRecord::population));

        TreeMap<String, List<PlaceRecord>> byName = new TreeMap<>();
        for (PlaceRecord place : byPopulation) {
            for (String name : place.alternateNames()) {
                byName.computeIfAbsent(name, k -> new ArrayList<>()).add(place);
            }
        }
        byName.replaceAll((name, candidates) -> List.copyOf(candidates));
        return byName;
    }
}
