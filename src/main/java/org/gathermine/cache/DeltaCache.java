package org.gathermine.cache;

import org.gathermine.model.Category;
import org.gathermine.model.Entry;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tells new records from records seen in an earlier run, and collects the snapshots that
 * replace the persisted ones at the end of the run.
 * <p>
 * A record is new when its coordinate is absent under its {@code zoneId_category} key in every
 * prior snapshot. A coordinate that is present with a different source id counts as seen.
 * The cache only drives the new-record counts; it is never the source of the merged output.
 */
public class DeltaCache {

    private final Map<String, Map<String, String>> prior = new HashMap<>();
    private final Map<String, Map<String, Map<String, String>>> current = new LinkedHashMap<>();

    /**
     * @param priorSnapshots the snapshots loaded at the start of the run, one per partition
     */
    public DeltaCache(Collection<CacheSnapshot> priorSnapshots) {
        for (CacheSnapshot snapshot : priorSnapshots) {
            snapshot.nodes().forEach((key, coordinates) ->
                    prior.computeIfAbsent(key, k -> new HashMap<>()).putAll(coordinates));
        }
    }

    /**
     * Builds the key records are grouped under, e.g. {@code 63_herbs}.
     *
     * @param zoneId the canonical zone id
     * @param category the category
     * @return the composite key
     */
    public static String compositeKey(String zoneId, Category category) {
        return zoneId + "_" + category.key();
    }

    /**
     * Checks a coordinate against prior snapshots.
     *
     * @param priorSnapshots the union of prior snapshots by composite key
     * @param zoneId the canonical zone id
     * @param category the category
     * @param packedCoordinate the packed coordinate
     * @return {@code true} if no prior snapshot holds the coordinate
     */
    public static boolean isNew(Map<String, Map<String, String>> priorSnapshots, String zoneId, Category category, long packedCoordinate) {
        Map<String, String> seen = priorSnapshots.get(compositeKey(zoneId, category));
        return seen == null || !seen.containsKey(Long.toString(packedCoordinate));
    }

    /**
     * Records a placed entry for its partition and classifies it.
     *
     * @param partition the partition the source object belongs to
     * @param zoneId the canonical zone id
     * @param category the category
     * @param entry the placed entry
     * @return {@code true} if the entry is new
     */
    public boolean classify(String partition, String zoneId, Category category, Entry entry) {
        current.computeIfAbsent(partition, p -> new LinkedHashMap<>())
                .computeIfAbsent(compositeKey(zoneId, category), k -> new LinkedHashMap<>())
                .put(Long.toString(entry.packedCoordinate()), entry.sourceId());
        return isNew(prior, zoneId, category, entry.packedCoordinate());
    }

    /**
     * @return {@code true} if any prior snapshot held data
     */
    public boolean hasPriorData() {
        return !prior.isEmpty();
    }

    /**
     * @return an unmodifiable view of the union of prior snapshots
     */
    public Map<String, Map<String, String>> priorView() {
        return Collections.unmodifiableMap(prior);
    }

    /**
     * @return the partitions that recorded at least one entry in this run
     */
    public Set<String> recordedPartitions() {
        return Collections.unmodifiableSet(current.keySet());
    }

    /**
     * Builds the snapshot that replaces a partition's persisted one.
     *
     * @param partition the partition
     * @param timestamp the run time to store
     * @return everything recorded for the partition in this run
     */
    public CacheSnapshot snapshotFor(String partition, String timestamp) {
        return new CacheSnapshot(partition, timestamp, current.getOrDefault(partition, Map.of()));
    }
}
