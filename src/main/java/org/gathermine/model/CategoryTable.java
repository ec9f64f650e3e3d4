package org.gathermine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The aggregated records of one category, grouped by zone.
 * <p>
 * Zones iterate in ascending numeric canonical id and entries in ascending packed coordinate,
 * which is the order the persisted format requires. Within a zone all packed coordinates are distinct.
 */
public final class CategoryTable {

    private final Category category;
    private final Map<Zone, List<Entry>> zones;

    /**
     * Creates a table from per-zone entries.
     *
     * @param category the category the entries belong to
     * @param entriesByZone entries per zone, in any order
     * @throws IllegalArgumentException if a zone contains the same packed coordinate twice
     * @throws InvalidObservationException if a zone has a non-numeric canonical id
     */
    public CategoryTable(Category category, Map<Zone, List<Entry>> entriesByZone) {
        this.category = category;
        List<Zone> ordered = new ArrayList<>(entriesByZone.keySet());
        ordered.sort(Comparator.comparingLong(Zone::numericId));

        Map<Zone, List<Entry>> sorted = new LinkedHashMap<>();
        for (Zone zone : ordered) {
            List<Entry> entries = new ArrayList<>(entriesByZone.get(zone));
            Collections.sort(entries);
            for (int i = 1; i < entries.size(); i++) {
                if (entries.get(i).packedCoordinate() == entries.get(i - 1).packedCoordinate()) {
                    throw new IllegalArgumentException(String.format(
                            "Duplicate packed coordinate %d in zone %s of %s",
                            entries.get(i).packedCoordinate(), zone.canonicalId(), category.key()));
                }
            }
            sorted.put(zone, Collections.unmodifiableList(entries));
        }
        this.zones = Collections.unmodifiableMap(sorted);
    }

    public Category category() {
        return category;
    }

    /**
     * @return the zones in ascending numeric canonical id
     */
    public Set<Zone> zones() {
        return zones.keySet();
    }

    /**
     * @param zone the zone
     * @return the entries of the zone in ascending packed coordinate, empty if the zone is absent
     */
    public List<Entry> entries(Zone zone) {
        return zones.getOrDefault(zone, List.of());
    }

    /**
     * @return the number of entries over all zones
     */
    public int size() {
        return zones.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return zones.isEmpty();
    }
}
