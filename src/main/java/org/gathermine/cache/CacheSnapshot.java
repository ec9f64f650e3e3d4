package org.gathermine.cache;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Everything a partition produced in its last run: {@code zoneId_category} to packed coordinate
 * to source id, plus the time of that run.
 */
public final class CacheSnapshot {

    @SerializedName("expansion")
    private final String partition;

    @SerializedName("last_run")
    private final String lastRun;

    @SerializedName("nodes")
    private final Map<String, Map<String, String>> nodes;

    /**
     * @param partition the partition key
     * @param lastRun the time of the run that produced the snapshot, or {@code null} if unknown
     * @param nodes the recorded coordinates per composite key
     */
    public CacheSnapshot(String partition, String lastRun, Map<String, Map<String, String>> nodes) {
        this.partition = partition;
        this.lastRun = lastRun;
        Map<String, Map<String, String>> sorted = new TreeMap<>();
        nodes.forEach((key, coordinates) -> sorted.put(key, new TreeMap<>(coordinates)));
        this.nodes = sorted;
    }

    /**
     * @param partition the partition key
     * @return a snapshot of a partition that was never run
     */
    public static CacheSnapshot empty(String partition) {
        return new CacheSnapshot(partition, null, Map.of());
    }

    public String partition() {
        return partition;
    }

    public String lastRun() {
        return lastRun;
    }

    /**
     * @return the recorded coordinates; never {@code null}, even for snapshots read from incomplete files
     */
    public Map<String, Map<String, String>> nodes() {
        return nodes == null ? Map.of() : Collections.unmodifiableMap(nodes);
    }

    /**
     * @return the number of recorded coordinates over all keys
     */
    public int nodeCount() {
        return nodes().values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return nodes().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheSnapshot)) return false;
        CacheSnapshot that = (CacheSnapshot) o;
        return Objects.equals(partition, that.partition)
                && Objects.equals(lastRun, that.lastRun)
                && nodes().equals(that.nodes());
    }

    @Override
    public int hashCode() {
        return Objects.hash(partition, lastRun, nodes());
    }
}
