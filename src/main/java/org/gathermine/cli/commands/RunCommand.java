package org.gathermine.cli.commands;

import org.gathermine.cli.CommandLineInterface;
import org.gathermine.config.MinerConfiguration;
import org.gathermine.feed.FeedFormatException;
import org.gathermine.feed.ObservationFeedReader;
import org.gathermine.model.InvalidObservationException;
import org.gathermine.model.SourceObject;
import org.gathermine.pipeline.LoggingRunListener;
import org.gathermine.pipeline.MiningPipeline;
import org.gathermine.pipeline.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Builds the Mined_*.lua tables from an observation feed and refreshes the caches."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--feed"}, required = true, description = "The observation feed JSON file.")
    private File feedFile;

    @Option(names = {"-o", "--output"}, description = "Directory for the table files (default: gathermine.output-directory).")
    private File outputDirectory;

    @Option(names = "--saved-variables", description = "Merge the result into this SavedVariables file.")
    private File savedVariables;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        MinerConfiguration configuration = MinerConfiguration.from(parent.getConfig());
        if (outputDirectory != null) {
            configuration = configuration.withOutputDirectory(outputDirectory.toPath());
        }
        if (savedVariables != null) {
            configuration = configuration.withSavedVariables(savedVariables.toPath());
        }

        if (!feedFile.isFile()) {
            LOGGER.error("Observation feed not found: {}", feedFile.getAbsolutePath());
            return 1;
        }

        final List<SourceObject> objects;
        try {
            objects = new ObservationFeedReader(configuration.zoneRegistry()).read(feedFile.toPath());
        } catch (FeedFormatException e) {
            LOGGER.error("Invalid observation feed: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOGGER.error("Could not read observation feed {}: {}", feedFile, e.getMessage());
            return 1;
        }

        final RunReport report;
        try {
            report = new MiningPipeline(configuration, new LoggingRunListener()).run(objects);
        } catch (InvalidObservationException e) {
            LOGGER.error("Run aborted, nothing was written: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOGGER.error("Could not write table files to {}: {}", configuration.getOutputDirectory(), e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        for (RunReport.CategorySummary summary : report.categories().values()) {
            out.printf("%s: %d records, %d new%n", summary.category().key(), summary.records(), summary.newRecords());
        }
        if (report.mergeResult() != null) {
            out.printf("merged into %s%n", report.mergeResult().target());
        }
        out.flush();
        return 0;
    }
}
