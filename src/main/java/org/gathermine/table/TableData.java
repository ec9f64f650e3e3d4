package org.gathermine.table;

import org.gathermine.model.CategoryTable;
import org.gathermine.model.Entry;
import org.gathermine.model.Zone;

import java.util.Collections;
import java.util.Comparator;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The structured, diff-able form of one category table: zone id to packed coordinate to source id.
 * <p>
 * All keys and source ids are non-negative decimal integers stored in canonical form (no leading
 * zeros). Keys iterate in numeric order, which is the order the table is written in.
 */
public final class TableData {

    /** Orders canonical decimal keys numerically. */
    public static final Comparator<String> NUMERIC_ORDER =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private final NavigableMap<String, NavigableMap<String, String>> zones = new TreeMap<>(NUMERIC_ORDER);

    /**
     * Creates an empty table.
     */
    public TableData() {
    }

    /**
     * Converts an aggregated table.
     * @param table the aggregated table
     * @return the structured form
     */
    public static TableData from(CategoryTable table) {
        TableData data = new TableData();
        for (Zone zone : table.zones()) {
            for (Entry entry : table.entries(zone)) {
                data.put(zone.canonicalId(), Long.toString(entry.packedCoordinate()), entry.sourceId());
            }
        }
        return data;
    }

    /**
     * Sets the source id at a coordinate, replacing any previous value.
     *
     * @param zoneId the canonical zone id
     * @param coordinate the packed coordinate
     * @param sourceId the source id
     * @throws IllegalArgumentException if a key or the source id is not a non-negative decimal integer
     */
    public void put(String zoneId, String coordinate, String sourceId) {
        Objects.requireNonNull(sourceId, "sourceId");
        String value = canonical(sourceId);
        zones.computeIfAbsent(canonical(zoneId), z -> new TreeMap<>(NUMERIC_ORDER))
                .put(canonical(coordinate), value);
    }

    /**
     * Copies every entry of another table into this one; entries of {@code other} win.
     * @param other the table to copy from
     */
    public void putAll(TableData other) {
        other.zones.forEach((zoneId, coordinates) ->
                zones.computeIfAbsent(zoneId, z -> new TreeMap<>(NUMERIC_ORDER)).putAll(coordinates));
    }

    /**
     * @param zoneId the canonical zone id
     * @param coordinate the packed coordinate
     * @return the source id, or {@code null} if the coordinate is not present
     */
    public String get(String zoneId, String coordinate) {
        NavigableMap<String, String> coordinates = zones.get(canonical(zoneId));
        return coordinates == null ? null : coordinates.get(canonical(coordinate));
    }

    /**
     * @return an unmodifiable view of the zones in numeric order
     */
    public NavigableMap<String, NavigableMap<String, String>> zones() {
        return Collections.unmodifiableNavigableMap(zones);
    }

    /**
     * @param zoneId the canonical zone id
     * @return an unmodifiable view of the zone's coordinates in numeric order, empty if absent
     */
    public NavigableMap<String, String> coordinates(String zoneId) {
        NavigableMap<String, String> coordinates = zones.get(canonical(zoneId));
        return coordinates == null
                ? Collections.emptyNavigableMap()
                : Collections.unmodifiableNavigableMap(coordinates);
    }

    /**
     * @return the number of coordinates over all zones
     */
    public int size() {
        return zones.values().stream().mapToInt(NavigableMap::size).sum();
    }

    public boolean isEmpty() {
        return zones.isEmpty();
    }

    /**
     * @return an independent deep copy
     */
    public TableData copy() {
        TableData copy = new TableData();
        copy.putAll(this);
        return copy;
    }

    static String canonical(String key) {
        if (!Zone.isNumeric(key)) {
            throw new IllegalArgumentException("Not a non-negative decimal integer: " + key);
        }
        int firstSignificant = 0;
        while (firstSignificant < key.length() - 1 && key.charAt(firstSignificant) == '0') {
            firstSignificant++;
        }
        return key.substring(firstSignificant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableData)) return false;
        return zones.equals(((TableData) o).zones);
    }

    @Override
    public int hashCode() {
        return zones.hashCode();
    }

    @Override
    public String toString() {
        return zones.toString();
    }
}
