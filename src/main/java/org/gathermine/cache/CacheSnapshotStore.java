package org.gathermine.cache;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Stores one cache snapshot per partition as {@code node_cache_<partition>.json}.
 * <p>
 * Failures never abort a run: an unreadable snapshot is treated as empty and a snapshot that
 * cannot be written is reported and skipped.
 */
public class CacheSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(CacheSnapshotStore.class);
    private static final Pattern PARTITION_KEY = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final Gson gson;

    /**
     * @param directory the directory holding the snapshot files
     */
    public CacheSnapshotStore(Path directory) {
        this.directory = directory;
        this.gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();
    }

    /**
     * Checks whether a partition key can be part of a snapshot file name.
     *
     * @param partition the partition key
     * @return {@code true} for non-empty keys of letters, digits, {@code .}, {@code _} and {@code -}
     */
    public static boolean isValidPartition(String partition) {
        return partition != null && PARTITION_KEY.matcher(partition).matches();
    }

    /**
     * Gets the file path of a partition's snapshot.
     *
     * @param partition the partition key
     * @return the snapshot file
     * @throws IllegalArgumentException if the partition key is not usable as part of a file name
     */
    public Path fileFor(String partition) {
        if (!isValidPartition(partition)) {
            throw new IllegalArgumentException("Invalid partition key: " + partition);
        }
        return directory.resolve("node_cache_" + partition + ".json");
    }

    /**
     * Loads a partition's snapshot.
     *
     * @param partition the partition key
     * @return the snapshot, or an empty one if the file is missing or unreadable
     */
    public CacheSnapshot load(String partition) {
        Path file = fileFor(partition);
        if (!Files.exists(file)) {
            log.info("{}: no cache found (first run)", partition);
            return CacheSnapshot.empty(partition);
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CacheSnapshot snapshot = gson.fromJson(reader, CacheSnapshot.class);
            if (snapshot == null) {
                log.warn("{}: cache file {} is empty, treating all records as new", partition, file);
                return CacheSnapshot.empty(partition);
            }
            String corruptKey = findNullEntry(snapshot);
            if (corruptKey != null) {
                log.warn("{}: could not load cache {}, treating all records as new: null entry under '{}'",
                        partition, file, corruptKey);
                return CacheSnapshot.empty(partition);
            }
            log.info("{}: {} cached nodes (last run: {})", partition, snapshot.nodeCount(),
                    snapshot.lastRun() == null ? "never" : snapshot.lastRun());
            return new CacheSnapshot(partition, snapshot.lastRun(), snapshot.nodes());
        } catch (IOException | JsonParseException e) {
            log.warn("{}: could not load cache {}, treating all records as new: {}", partition, file, e.getMessage());
            return CacheSnapshot.empty(partition);
        }
    }

    private static String findNullEntry(CacheSnapshot snapshot) {
        for (Map.Entry<String, Map<String, String>> entry : snapshot.nodes().entrySet()) {
            if (entry.getValue() == null || entry.getValue().containsValue(null)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Replaces a partition's snapshot file.
     *
     * @param snapshot the snapshot to store
     * @return {@code true} if the file was written
     */
    public boolean save(CacheSnapshot snapshot) {
        Path file = fileFor(snapshot.partition());
        try {
            Files.createDirectories(directory);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                gson.toJson(snapshot, writer);
            }
            log.info("{}: {} nodes saved", snapshot.partition(), snapshot.nodeCount());
            return true;
        } catch (IOException e) {
            log.warn("{}: failed to save cache {}: {}", snapshot.partition(), file, e.getMessage());
            return false;
        }
    }
}
