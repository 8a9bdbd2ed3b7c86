package org.tensorlatex.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorlatex.cli.commands.ExpressionCommand;
import org.tensorlatex.cli.commands.TranslateCommand;
import org.tensorlatex.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tensorlatex",
    mixinStandardHelpOptions = true,
    version = "tensorlatex 1.0",
    description = "Translates LaTeX tensor equations into symbolic component expressions",
    subcommands = {
        TranslateCommand.class,
        ExpressionCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "tensorlatex.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: tensorlatex.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tensorlatex");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Config load order: System Props > Env Vars > File > Classpath defaults
        final File file = resolveConfigFile();
        Config loaded = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            logger.debug("Using configuration file: {}", file.getAbsolutePath());
            loaded = loaded.withFallback(ConfigFactory.parseFile(file));
        }
        this.config = loaded.withFallback(ConfigFactory.load()).resolve();

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Finds the configuration file: {@code --config}, then {@code -Dconfig.file}, then
     * {@code tensorlatex.conf} in the working directory.
     *
     * @return The file, or {@code null} to use the classpath defaults only.
     * @throws CommandLine.ParameterException if an explicitly named file does not exist.
     */
    private File resolveConfigFile() {
        if (configFile != null) {
            return requireExisting(configFile, "--config");
        }
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return requireExisting(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
        }
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }

    private File requireExisting(File file, String source) {
        if (!file.exists()) {
            throw new CommandLine.ParameterException(spec != null ? spec.commandLine() : new CommandLine(this),
                    String.format("Configuration file specified via %s was not found: %s", source, file.getAbsolutePath()));
        }
        return file;
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     *
     * @return The configuration.
     * @throws ConfigException if a configuration file cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
