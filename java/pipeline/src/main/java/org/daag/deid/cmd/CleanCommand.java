package org.daag.deid.cmd;

import lombok.Getter;
import org.daag.deid.DeidComponent;
import org.daag.deid.csv.MergedTableSchema;
import org.daag.deid.csv.TableSources;
import org.daag.deid.pipeline.CleanerPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Command(
    name = "clean",
    mixinStandardHelpOptions = true,
    description = "Cleans already-merged tables in place: pseudonymizes raw person ids, generalizes postal codes. Safe to re-run.")
public class CleanCommand extends DeidCommand {

    @Parameters(index = "0", description = "The merged csv to clean, or a directory of them")
    Path input;

    @Getter
    @Parameters(index = "1", arity = "0..1",
        description = "The salt to use for id hashing. Defaults to env var PSEUDONYMIZATION_SALT.")
    String salt;

    @Option(
        names = {"--first-row-only"},
        description = "Clean only the first row of each csv, as earlier releases did.")
    boolean firstRowOnly = false;

    @Override
    PreparedRun prepare(DeidComponent component) throws IOException {
        CleanerPipeline pipeline = component.cleanerPipeline();
        List<Path> tables = TableSources.list(input);
        if (tables.isEmpty()) {
            return output -> pipeline.run(tables, output, firstRowOnly);
        }
        MergedTableSchema schema = pipeline.checkHeaders(tables);
        return output -> pipeline.run(schema, tables, output, firstRowOnly);
    }
}
