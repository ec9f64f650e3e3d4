package org.gathermine.pipeline;

import org.gathermine.merge.SavedVariablesFile;
import org.gathermine.model.Category;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link MiningPipeline} run.
 *
 * @param categories   Totals per category that had at least one source object.
 * @param firstRun     {@code true} if no cached data existed, so every record counts as new.
 * @param writtenFiles The table files written, in category order.
 * @param mergeResult  The merge outcome, or {@code null} if no merge was attempted or it failed.
 * @param mergeError   The merge failure message, or {@code null}.
 */
public record RunReport(
        Map<Category, CategorySummary> categories,
        boolean firstRun,
        List<Path> writtenFiles,
        SavedVariablesFile.MergeResult mergeResult,
        String mergeError
) {

    public RunReport {
        Map<Category, CategorySummary> copy = new EnumMap<>(Category.class);
        copy.putAll(categories);
        categories = Collections.unmodifiableMap(copy);
        writtenFiles = List.copyOf(writtenFiles);
    }

    /**
     * @return the number of records over all categories
     */
    public int totalRecords() {
        return categories.values().stream().mapToInt(CategorySummary::records).sum();
    }

    /**
     * @return the number of new records over all categories
     */
    public int totalNewRecords() {
        return categories.values().stream().mapToInt(CategorySummary::newRecords).sum();
    }

    public boolean mergeFailed() {
        return mergeError != null;
    }

    /**
     * Totals of one category.
     *
     * @param category   The category.
     * @param objects    Number of source objects.
     * @param records    Number of placed records.
     * @param newRecords Number of records no earlier run has seen.
     */
    public record CategorySummary(Category category, int objects, int records, int newRecords) {
    }
}
