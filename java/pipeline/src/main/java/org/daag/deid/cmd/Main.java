package org.daag.deid.cmd;

import lombok.extern.java.Log;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;

@Log
@Command(
    name = "deid",
    mixinStandardHelpOptions = true,
    description = "De-identifies person/purchase tables before they're shared.",
    subcommands = {
        JoinCommand.class,
        CleanCommand.class,
    })
public class Main implements Runnable {

    static final int EXIT_FAILURE = 1;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new Main())
            .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                // one line for the operator; trace only if they've turned up logging
                log.severe(e.getClass().getSimpleName() + ": " + e.getMessage());
                log.log(Level.FINE, "run failed", e);
                return EXIT_FAILURE;
            });
    }

    static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "failed to load logging.properties; using JVM defaults", e);
        }
    }
}
