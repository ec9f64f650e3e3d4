package org.gathermine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.gathermine.zone.ZoneRegistry;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Typed view of the {@code gathermine} configuration block.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * gathermine {
 *   table-prefix = "GatherMate2"
 *   output-directory = "."
 *   cache-directory = "."
 *   saved-variables { enabled = false, path = "" }
 *   zones { map { ... }, suppressed = [ ... ] }
 * }
 * </pre>
 * Paths may contain {@code ${VAR}} references, see {@link PathExpansion}.
 */
public final class MinerConfiguration {

    public static final String ROOT_PATH = "gathermine";

    private final String tablePrefix;
    private final Path outputDirectory;
    private final Path cacheDirectory;
    private final Path savedVariablesPath;
    private final Config zonesConfig;

    private MinerConfiguration(String tablePrefix, Path outputDirectory, Path cacheDirectory,
                               Path savedVariablesPath, Config zonesConfig) {
        if (tablePrefix == null || tablePrefix.isBlank()) {
            throw new IllegalArgumentException("table-prefix must not be empty");
        }
        this.tablePrefix = tablePrefix;
        this.outputDirectory = outputDirectory;
        this.cacheDirectory = cacheDirectory;
        this.savedVariablesPath = savedVariablesPath;
        this.zonesConfig = zonesConfig;
    }

    /**
     * Reads the typed view from the application configuration.
     *
     * @param config the resolved application configuration
     * @return the view
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type
     * @throws IllegalArgumentException if a path references an undefined variable
     */
    public static MinerConfiguration from(Config config) {
        Config miner = config.getConfig(ROOT_PATH);
        Path savedVariables = null;
        if (miner.getBoolean("saved-variables.enabled")) {
            String path = miner.getString("saved-variables.path");
            if (path.isBlank()) {
                throw new IllegalArgumentException("saved-variables.enabled is set but saved-variables.path is empty");
            }
            savedVariables = expand(path);
        }
        return new MinerConfiguration(
                miner.getString("table-prefix"),
                expand(miner.getString("output-directory")),
                expand(miner.getString("cache-directory")),
                savedVariables,
                miner.hasPath("zones") ? miner.getConfig("zones") : ConfigFactory.empty());
    }

    private static Path expand(String path) {
        return Path.of(PathExpansion.expandPath(path));
    }

    /**
     * @param directory the directory the table files go to
     * @return a copy with the output directory replaced
     */
    public MinerConfiguration withOutputDirectory(Path directory) {
        return new MinerConfiguration(tablePrefix, directory, cacheDirectory, savedVariablesPath, zonesConfig);
    }

    /**
     * @param path the SavedVariables file to merge into
     * @return a copy with merging enabled for the given file
     */
    public MinerConfiguration withSavedVariables(Path path) {
        return new MinerConfiguration(tablePrefix, outputDirectory, cacheDirectory, path, zonesConfig);
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    /**
     * @return the SavedVariables file, if merging is enabled
     */
    public Optional<Path> getSavedVariablesPath() {
        return Optional.ofNullable(savedVariablesPath);
    }

    /**
     * Builds the zone registry from the {@code zones} block.
     *
     * @return the registry
     */
    public ZoneRegistry zoneRegistry() {
        return ZoneRegistry.fromConfig(zonesConfig);
    }
}
