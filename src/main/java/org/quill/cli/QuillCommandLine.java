package org.quill.cli;

import com.typesafe.config.Config;
import org.quill.cli.commands.CheckCommand;
import org.quill.cli.commands.ReplCommand;
import org.quill.cli.commands.RunCommand;
import org.quill.cli.config.ConfigLoader;
import org.quill.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "quill",
    mixinStandardHelpOptions = true,
    version = "Quill 1.0",
    description = "Quill - a line-oriented interpreter for a small expression language",
    subcommands = {
        RunCommand.class,
        ReplCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class QuillCommandLine implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        final CommandLine commandLine = new CommandLine(new QuillCommandLine());
        commandLine.setCommandName("quill");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file given with --config does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
