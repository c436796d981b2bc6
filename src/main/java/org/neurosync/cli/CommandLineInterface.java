package org.neurosync.cli;

import com.typesafe.config.Config;
import org.neurosync.cli.commands.AddPointCommand;
import org.neurosync.cli.commands.DeleteCommand;
import org.neurosync.cli.commands.ListCommand;
import org.neurosync.config.ConfigLoader;
import org.neurosync.config.LoggingConfigurator;
import org.neurosync.source.NeurosyncContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "neurosync",
    mixinStandardHelpOptions = true,
    version = "Neurosync 1.0",
    description = "Neurosync - synchronize volumetric annotations with remote annotation backends",
    subcommands = {
        ListCommand.class,
        AddPointCommand.class,
        DeleteCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private NeurosyncContext context;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("neurosync");
        System.exit(commandLine.execute(args));
    }

    public synchronized Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public synchronized NeurosyncContext getContext() {
        if (context == null) {
            context = new NeurosyncContext(getConfig());
        }
        return context;
    }
}
