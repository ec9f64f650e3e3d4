package org.gathermine.aggregate;

import org.gathermine.codec.CoordinateCodec;
import org.gathermine.model.Category;
import org.gathermine.model.CategoryTable;
import org.gathermine.model.Entry;
import org.gathermine.model.InvalidObservationException;
import org.gathermine.model.RawObservation;
import org.gathermine.model.Zone;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups observations of one category into per-zone entries.
 * <p>
 * Every observation yields exactly one entry. When its packed coordinate is already taken in the
 * zone, it is moved to the next free value, so the result depends on the order observations
 * are added in. Callers pass them in source object registration order.
 * <p>
 * An aggregator is single-use: add observations, then {@link #build()}.
 */
public class RecordAggregator {

    private final Category category;
    private final Map<Zone, List<Entry>> entriesByZone = new LinkedHashMap<>();
    private final Map<Zone, Set<Long>> occupiedByZone = new HashMap<>();

    /**
     * Creates an empty aggregator.
     * @param category the category the entries are collected for
     */
    public RecordAggregator(Category category) {
        this.category = category;
    }

    /**
     * Aggregates a complete sequence of observations.
     *
     * @param category the category of all observations
     * @param observations the observations in registration order
     * @return the aggregated table
     * @throws org.gathermine.model.InvalidObservationException if a coordinate is out of range or a zone id is not numeric
     */
    public static CategoryTable aggregate(Category category, Iterable<RawObservation> observations) {
        RecordAggregator aggregator = new RecordAggregator(category);
        for (RawObservation observation : observations) {
            aggregator.add(observation);
        }
        return aggregator.build();
    }

    /**
     * Places one observation.
     *
     * @param observation the observation
     * @return the entry it was placed as
     * @throws org.gathermine.model.InvalidObservationException if a coordinate is out of range, or the zone id
     *         or the source id is not numeric
     */
    public Entry add(RawObservation observation) {
        Zone zone = observation.zone();
        zone.numericId();
        if (!Zone.isNumeric(observation.sourceId())) {
            throw new InvalidObservationException(String.format(
                    "Source id '%s' in zone %s is not a decimal integer", observation.sourceId(), zone.canonicalId()));
        }
        long hint = CoordinateCodec.encode(observation.x(), observation.y());

        Set<Long> occupied = occupiedByZone.computeIfAbsent(zone, z -> new HashSet<>());
        long packed = CoordinateCodec.allocate(hint, occupied);
        occupied.add(packed);

        Entry entry = new Entry(packed, observation.sourceId());
        entriesByZone.computeIfAbsent(zone, z -> new ArrayList<>()).add(entry);
        return entry;
    }

    /**
     * @return the number of entries placed so far
     */
    public int size() {
        return entriesByZone.values().stream().mapToInt(List::size).sum();
    }

    /**
     * @return the aggregated table of everything added so far
     */
    public CategoryTable build() {
        return new CategoryTable(category, entriesByZone);
    }
}
