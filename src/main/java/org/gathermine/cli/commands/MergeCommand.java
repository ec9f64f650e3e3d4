package org.gathermine.cli.commands;

import org.gathermine.cli.CommandLineInterface;
import org.gathermine.config.MinerConfiguration;
import org.gathermine.diagnostics.DiagnosticsEngine;
import org.gathermine.merge.DocumentCodec;
import org.gathermine.merge.SavedVariablesFile;
import org.gathermine.model.Category;
import org.gathermine.table.TableData;
import org.gathermine.table.TableFormatException;
import org.gathermine.table.TableSerializer;
import org.gathermine.table.parser.Section;
import org.gathermine.table.parser.TableParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Merges previously written table files into a SavedVariables file without running the pipeline.
 */
@Command(
    name = "merge",
    description = "Merges Mined_*.lua table files into a SavedVariables file."
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MergeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--saved-variables", required = true, description = "The SavedVariables file to merge into.")
    private File savedVariables;

    @Parameters(arity = "1..*", paramLabel = "TABLE_FILE", description = "Table files written by 'run'.")
    private List<File> tableFiles;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        MinerConfiguration configuration = MinerConfiguration.from(parent.getConfig());
        String prefix = configuration.getTablePrefix();

        Map<Category, TableData> tables = new EnumMap<>(Category.class);
        for (File file : tableFiles) {
            try {
                if (readTables(file, prefix, tables) == 0) {
                    LOGGER.warn("{} holds no {} tables", file, prefix);
                }
            } catch (IOException e) {
                LOGGER.error("Could not read table file {}: {}", file, e.getMessage());
                return 1;
            } catch (TableFormatException e) {
                LOGGER.error("Malformed table file {}: {}", file, e.getMessage());
                return 1;
            }
        }
        if (tables.isEmpty()) {
            LOGGER.error("Nothing to merge");
            return 1;
        }

        try {
            SavedVariablesFile target = new SavedVariablesFile(savedVariables.toPath(), new DocumentCodec(prefix), Clock.systemDefaultZone());
            SavedVariablesFile.MergeResult result = target.merge(tables);
            result.zonesPerCategory().forEach((category, zones) ->
                    spec.commandLine().getOut().printf("%s: %d zones%n", category.key(), zones));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException e) {
            LOGGER.error("Failed to write SavedVariables file {}: {}", savedVariables, e.getMessage());
            return 1;
        }
    }

    private static int readTables(File file, String prefix, Map<Category, TableData> tables) throws IOException, TableFormatException {
        String text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        int found = 0;
        for (Section section : TableParser.parseDocument(text, diagnostics).values()) {
            Optional<Category> category = Category.fromTableName(prefix, section.name());
            if (category.isPresent()) {
                TableData data = TableSerializer.extract(section, diagnostics);
                tables.computeIfAbsent(category.get(), c -> new TableData()).putAll(data);
                found++;
            }
        }
        return found;
    }
}
