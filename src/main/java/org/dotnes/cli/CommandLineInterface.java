package org.dotnes.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.dotnes.cli.commands.CompileCommand;
import org.dotnes.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "dotnes",
    mixinStandardHelpOptions = true,
    version = "dotnes 1.0",
    description = "Compiles .NET IL programs into NES cartridge images.",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "dotnes.conf";

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"--config"},
        description = "Path to a configuration file (default: ./dotnes.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("dotnes");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @return The resolved configuration.
     * @throws ConfigException if a configuration file is missing or cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig(configFile);
            if (config.hasPath("logging.format")) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                        LoggingConfigurator.appenderFor(config.getString("logging.format")));
                reconfigureLogback();
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * Resolves the configuration. Precedence: system properties, environment, then the first of
     * {@code explicitFile}, {@code -Dconfig.file} and {@code ./dotnes.conf} that applies, then the
     * classpath defaults.
     *
     * @param explicitFile The file given with {@code --config}, or {@code null}.
     * @return The resolved configuration.
     * @throws ConfigException if a named file does not exist or cannot be parsed.
     */
    static Config loadConfig(final File explicitFile) {
        File file = explicitFile;
        if (file == null) {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = new File(systemConfigPath).getAbsoluteFile();
            }
        }
        if (file != null && !file.exists()) {
            throw new ConfigException.Generic("Configuration file not found: " + file.getAbsolutePath());
        }
        if (file == null) {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.exists()) {
                file = cwdConfigFile;
            }
        }

        Config fileConfig = ConfigFactory.empty();
        if (file != null) {
            LOGGER.debug("Using configuration file {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            LOGGER.debug("No {} found, using defaults from the classpath", CONFIG_FILE_NAME);
        }
        // Config load order: System Props > Env Vars > File > Classpath defaults
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
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
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
