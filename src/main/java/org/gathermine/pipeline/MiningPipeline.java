package org.gathermine.pipeline;

import org.gathermine.aggregate.RecordAggregator;
import org.gathermine.cache.CacheSnapshot;
import org.gathermine.cache.CacheSnapshotStore;
import org.gathermine.cache.DeltaCache;
import org.gathermine.config.MinerConfiguration;
import org.gathermine.merge.DocumentCodec;
import org.gathermine.merge.SavedVariablesFile;
import org.gathermine.model.Category;
import org.gathermine.model.CategoryTable;
import org.gathermine.model.Entry;
import org.gathermine.model.InvalidObservationException;
import org.gathermine.model.RawObservation;
import org.gathermine.model.SourceObject;
import org.gathermine.table.TableData;
import org.gathermine.table.TableSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a batch of source objects into table files, an optional SavedVariables merge and
 * refreshed cache snapshots.
 * <p>
 * A run is single-threaded and processes objects and their observations in input order, which
 * is what makes collision resolution reproducible. Steps:
 * <ol>
 *   <li>load the cache snapshots of every partition in the input</li>
 *   <li>place every observation and classify it against the cached data</li>
 *   <li>write {@code Mined_*.lua} for every category with at least one source object</li>
 *   <li>merge into the SavedVariables file, if one is configured</li>
 *   <li>replace the snapshot of every partition that recorded data</li>
 * </ol>
 * A failed merge or cache save is reported and the run goes on; the table files stay usable.
 */
public class MiningPipeline {

    private static final Logger log = LoggerFactory.getLogger(MiningPipeline.class);
    private static final DateTimeFormatter LAST_RUN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final MinerConfiguration configuration;
    private final CacheSnapshotStore cacheStore;
    private final DocumentCodec codec;
    private final RunListener listener;
    private final Clock clock;

    public MiningPipeline(MinerConfiguration configuration, RunListener listener) {
        this(configuration, listener, Clock.systemDefaultZone());
    }

    /**
     * @param configuration directories, table prefix and merge target
     * @param listener receives progress events
     * @param clock the clock for cache and backup time stamps
     */
    public MiningPipeline(MinerConfiguration configuration, RunListener listener, Clock clock) {
        this.configuration = configuration;
        this.cacheStore = new CacheSnapshotStore(configuration.getCacheDirectory());
        this.codec = new DocumentCodec(configuration.getTablePrefix());
        this.listener = listener;
        this.clock = clock;
    }

    /**
     * Runs the pipeline.
     *
     * @param objects the source objects in registration order
     * @return the run report
     * @throws IOException if a table file cannot be written
     * @throws InvalidObservationException if an observation has an invalid coordinate, zone id or
     *         source id, or an object has an invalid partition key; nothing is written in that case
     */
    public RunReport run(List<SourceObject> objects) throws IOException {
        Set<String> partitions = new LinkedHashSet<>();
        for (SourceObject object : objects) {
            if (!CacheSnapshotStore.isValidPartition(object.partition())) {
                throw new InvalidObservationException(String.format(
                        "Source object '%s' has a partition key that cannot name a cache file: '%s'",
                        object.name(), object.partition()));
            }
            partitions.add(object.partition());
        }

        List<CacheSnapshot> prior = new ArrayList<>();
        for (String partition : partitions) {
            prior.add(cacheStore.load(partition));
        }
        DeltaCache deltaCache = new DeltaCache(prior);
        boolean firstRun = !deltaCache.hasPriorData();
        listener.runStarted(objects.size(), partitions, firstRun);

        Map<Category, RecordAggregator> aggregators = new EnumMap<>(Category.class);
        Map<Category, CategoryCounter> counters = new EnumMap<>(Category.class);

        for (SourceObject object : objects) {
            Category category = object.category();
            RecordAggregator aggregator = aggregators.computeIfAbsent(category, RecordAggregator::new);
            int records = 0;
            int newRecords = 0;
            for (RawObservation observation : object.observations()) {
                Entry entry = aggregator.add(observation);
                records++;
                if (deltaCache.classify(object.partition(), observation.zone().canonicalId(), category, entry)) {
                    newRecords++;
                }
            }
            CategoryCounter counter = counters.computeIfAbsent(category, c -> new CategoryCounter());
            counter.objects++;
            counter.records += records;
            counter.newRecords += newRecords;
            listener.objectProcessed(object, records, newRecords);
        }

        Map<Category, RunReport.CategorySummary> summaries = new EnumMap<>(Category.class);
        Map<Category, TableData> tables = new EnumMap<>(Category.class);
        List<Path> written = new ArrayList<>();
        if (!aggregators.isEmpty()) {
            Files.createDirectories(configuration.getOutputDirectory());
        }
        for (Map.Entry<Category, RecordAggregator> aggregated : aggregators.entrySet()) {
            Category category = aggregated.getKey();
            CategoryTable table = aggregated.getValue().build();
            Path file = configuration.getOutputDirectory().resolve(category.outputFileName());
            writeTable(file, TableSerializer.serialize(table, category.tableName(configuration.getTablePrefix())));
            written.add(file);
            tables.put(category, TableData.from(table));

            CategoryCounter counter = counters.get(category);
            RunReport.CategorySummary summary =
                    new RunReport.CategorySummary(category, counter.objects, counter.records, counter.newRecords);
            summaries.put(category, summary);
            listener.tableWritten(category, file, summary);
        }

        SavedVariablesFile.MergeResult mergeResult = null;
        String mergeError = null;
        if (configuration.getSavedVariablesPath().isPresent() && !tables.isEmpty()) {
            Path target = configuration.getSavedVariablesPath().get();
            try {
                mergeResult = new SavedVariablesFile(target, codec, clock).merge(tables);
                listener.mergeCompleted(mergeResult);
            } catch (IOException e) {
                mergeError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.error("Failed to write SavedVariables file {}: {}. The table files in {} are still usable.",
                        target, mergeError, configuration.getOutputDirectory());
                listener.mergeFailed(target, e);
            }
        }

        String timestamp = LocalDateTime.now(clock).format(LAST_RUN);
        for (String partition : deltaCache.recordedPartitions()) {
            cacheStore.save(deltaCache.snapshotFor(partition, timestamp));
        }

        RunReport report = new RunReport(summaries, firstRun, written, mergeResult, mergeError);
        listener.runFinished(report);
        return report;
    }

    private static void writeTable(Path file, String content) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(content);
        }
    }

    private static final class CategoryCounter {
        int objects;
        int records;
        int newRecords;
    }
}
