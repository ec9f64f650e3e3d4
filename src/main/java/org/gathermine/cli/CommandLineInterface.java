package org.gathermine.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.gathermine.cli.commands.MergeCommand;
import org.gathermine.cli.commands.RunCommand;
import org.gathermine.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "gathermine",
    mixinStandardHelpOptions = true,
    version = "GatherMine 1.0",
    description = "Builds GatherMate2 node tables from observation feeds and merges them into SavedVariables",
    subcommands = {
        RunCommand.class,
        MergeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "gathermine.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: gathermine.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * Builds the command line with the exception handler used by {@link #main(String[])}: failures
     * that escape a subcommand are logged and end the command with exit code 1.
     *
     * @return the configured command line
     */
    public static CommandLine commandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("gathermine");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            LOGGER.error("{} failed: {}", cmd.getCommandName(), ex.getMessage());
            LOGGER.debug("Failure details", ex);
            return 1;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new IllegalStateException("Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
                }
                LOGGER.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = load(ConfigFactory.parseFile(this.configFile));
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    if (!systemConfigFile.exists()) {
                        throw new IllegalStateException("Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
                    }
                    LOGGER.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
                    this.config = load(ConfigFactory.parseFile(systemConfigFile));
                } else {
                    // 3) Then: gathermine.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        LOGGER.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = load(ConfigFactory.parseFile(cwdConfigFile));
                    } else {
                        // 4) Finally: classpath defaults only
                        LOGGER.debug("No '{}' found in current directory, using default configuration from classpath.", CONFIG_FILE_NAME);
                        this.config = load(ConfigFactory.empty());
                    }
                }
            }
        } catch (ConfigException e) {
            throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        // Logging setup
        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config load(final Config fileConfig) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Gets the application configuration, loading it on first access.
     *
     * @return the resolved configuration
     * @throws IllegalStateException if the configuration file is missing or cannot be parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
