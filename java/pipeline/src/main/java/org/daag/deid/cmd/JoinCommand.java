package org.daag.deid.cmd;

import lombok.Getter;
import org.daag.deid.DeidComponent;
import org.daag.deid.core.InvalidConfigurationException;
import org.daag.deid.csv.TableSources;
import org.daag.deid.pipeline.DuplicatePersonPolicy;
import org.daag.deid.pipeline.JoinPipeline;
import org.daag.deid.pipeline.RecordBuilder;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Command(
    name = "join",
    mixinStandardHelpOptions = true,
    description = "Joins purchases to people, writing one de-identified record per purchase.")
public class JoinCommand extends DeidCommand {

    @Parameters(index = "0", description = "The csv file containing the people")
    Path people;

    @Parameters(index = "1", description = "The directory containing the purchases csvs (or a single csv)")
    Path purchases;

    @Getter
    @Parameters(index = "2", arity = "0..1",
        description = "The salt to use for id hashing. Defaults to env var PSEUDONYMIZATION_SALT.")
    String salt;

    @Option(
        names = {"--strict-people"},
        description = "Fail if the people csv has duplicate ids, rather than using the last row for each.")
    boolean strictPeople = false;

    @Override
    PreparedRun prepare(DeidComponent component) throws IOException {
        JoinPipeline pipeline = component.joinPipeline();

        if (!Files.isRegularFile(people) || !Files.isReadable(people)) {
            throw new InvalidConfigurationException("can't read people csv " + people);
        }
        List<Path> purchaseTables = TableSources.list(purchases);
        DuplicatePersonPolicy policy =
            strictPeople ? DuplicatePersonPolicy.REJECT : DuplicatePersonPolicy.LAST_WRITE_WINS;

        RecordBuilder recordBuilder = pipeline.prepare(people, purchaseTables, policy);
        return output -> pipeline.run(recordBuilder, purchaseTables, output);
    }
}
