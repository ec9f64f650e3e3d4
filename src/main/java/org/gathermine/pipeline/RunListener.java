package org.gathermine.pipeline;

import org.gathermine.merge.SavedVariablesFile;
import org.gathermine.model.Category;
import org.gathermine.model.SourceObject;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Receives progress events of a {@link MiningPipeline} run. All events are delivered on the
 * thread that runs the pipeline, in run order.
 */
public interface RunListener {

    /**
     * @param objectCount the number of source objects in the run
     * @param partitions the partitions present in the input
     * @param firstRun {@code true} if no partition had cached data
     */
    default void runStarted(int objectCount, Set<String> partitions, boolean firstRun) {
    }

    /**
     * @param object the source object
     * @param records the number of records placed for it
     * @param newRecords how many of them no earlier run has seen
     */
    default void objectProcessed(SourceObject object, int records, int newRecords) {
    }

    /**
     * @param category the category
     * @param file the table file that was written
     * @param summary the category totals
     */
    default void tableWritten(Category category, Path file, RunReport.CategorySummary summary) {
    }

    default void mergeCompleted(SavedVariablesFile.MergeResult result) {
    }

    /**
     * @param target the SavedVariables file
     * @param cause why the merge failed
     */
    default void mergeFailed(Path target, IOException cause) {
    }

    default void runFinished(RunReport report) {
    }
}
