package org.gathermine.pipeline;

import org.gathermine.merge.SavedVariablesFile;
import org.gathermine.model.Category;
import org.gathermine.model.SourceObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Reports run progress through SLF4J.
 */
public class LoggingRunListener implements RunListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRunListener.class);

    @Override
    public void runStarted(int objectCount, Set<String> partitions, boolean firstRun) {
        log.info("Processing {} source objects in partitions {}", objectCount, partitions);
        if (firstRun) {
            log.info("No previous caches found, all records count as new");
        }
    }

    @Override
    public void objectProcessed(SourceObject object, int records, int newRecords) {
        if (newRecords > 0) {
            log.info("[{}] {} -> {} nodes ({} NEW)", object.partition(), object.name(), records, newRecords);
        } else {
            log.info("[{}] {} -> {} nodes", object.partition(), object.name(), records);
        }
    }

    @Override
    public void tableWritten(Category category, Path file, RunReport.CategorySummary summary) {
        log.info("Saved: {} ({} {} nodes, {} new)", file, summary.records(), category.key(), summary.newRecords());
    }

    @Override
    public void mergeCompleted(SavedVariablesFile.MergeResult result) {
        log.info("Merged data into {}", result.target());
        for (Map.Entry<Category, Integer> zones : result.zonesPerCategory().entrySet()) {
            log.info("  {} zones: {}", zones.getKey().tableLabel(), zones.getValue());
        }
    }

    @Override
    public void runFinished(RunReport report) {
        if (report.firstRun()) {
            log.info("First run: {} nodes cached", report.totalRecords());
        } else if (report.totalNewRecords() > 0) {
            log.info("{} new nodes found since last run", report.totalNewRecords());
        } else {
            log.info("No new nodes since last run");
        }
    }
}
