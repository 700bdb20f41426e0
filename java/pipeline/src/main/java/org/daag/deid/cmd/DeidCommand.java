package org.daag.deid.cmd;

import lombok.extern.java.Log;
import org.daag.deid.DaggerDeidComponent;
import org.daag.deid.DeidComponent;
import org.daag.deid.gateway.CompositeConfigService;
import org.daag.deid.gateway.ConfigService;
import org.daag.deid.gateway.EnvVarsConfigService;
import org.daag.deid.gateway.MapConfigService;
import org.daag.deid.gateway.ProcessingConfigProperty;
import org.daag.deid.pipeline.RunSummary;
import picocli.CommandLine.Option;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * common to join/clean commands: config, wiring, output
 */
@Log
abstract class DeidCommand implements Callable<Integer> {

    @Option(
        names = {"-o", "--output"},
        description = "File to write de-identified table to. Defaults to stdout.")
    Path output;

    interface PreparedRun {
        RunSummary run(Writer output) throws IOException;
    }

    /**
     * @return salt given on command line, if any
     */
    abstract String getSalt();

    /**
     * validate inputs, check headers and load whatever the run needs up front; anything that can
     * fail at startup must fail here, before output is opened (and an existing file truncated)
     */
    abstract PreparedRun prepare(DeidComponent component) throws IOException;

    @Override
    public Integer call() throws IOException {
        DeidComponent component = DaggerDeidComponent.builder()
            .configService(configService())
            .build();

        PreparedRun run = prepare(component);

        RunSummary summary;
        if (output == null) {
            Writer stdout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            summary = run.run(stdout);
            stdout.flush();
        } else {
            try (Writer file = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                summary = run.run(file);
            }
        }

        log.info(String.format("done: %d tables, %d rows read, %d records written, %d skipped",
            summary.getTables(), summary.getRowsRead(), summary.getRecordsWritten(), summary.getRowsSkipped()));
        return 0;
    }

    /**
     * salt from command line if given, else from PSEUDONYMIZATION_SALT env var
     */
    ConfigService configService() {
        MapConfigService.MapConfigServiceBuilder commandLine = MapConfigService.builder();
        if (getSalt() != null) {
            commandLine.value(ProcessingConfigProperty.PSEUDONYMIZATION_SALT.name(), getSalt());
        }
        return CompositeConfigService.builder()
            .source(commandLine.build())
            .source(new EnvVarsConfigService())
            .build();
    }
}
