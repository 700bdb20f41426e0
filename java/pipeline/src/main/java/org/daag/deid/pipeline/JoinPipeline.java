package org.daag.deid.pipeline;

import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.extern.java.Log;
import org.daag.deid.core.geo.ZctaGeneralizer;
import org.daag.deid.core.pseudonyms.PseudonymCodec;
import org.daag.deid.csv.CsvTables;
import org.daag.deid.csv.MalformedTableException;
import org.daag.deid.csv.TableReader;
import org.daag.deid.csv.TableWriter;
import org.daag.deid.model.DeidentifiedRecord;
import org.daag.deid.model.Person;
import org.daag.deid.model.Purchase;

import javax.inject.Inject;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * join run: people table loaded into memory, then purchase tables streamed through it, one
 * de-identified record out per purchase whose person is known
 */
@Log
@NoArgsConstructor(onConstructor_ = @Inject)
@AllArgsConstructor
public class JoinPipeline {

    @Inject
    CsvTables csvTables;

    @Inject
    PseudonymCodec pseudonymCodec;

    @Inject
    ZctaGeneralizer zctaGeneralizer;

    /**
     * @param peopleTable    people, loaded in full before any purchase is read
     * @param purchaseTables processed in given order
     * @param output         records written here as they're produced
     * @param policy         for duplicate person ids
     * @return counts for run
     */
    public RunSummary run(Path peopleTable, List<Path> purchaseTables, Writer output,
                          DuplicatePersonPolicy policy) throws IOException {
        return run(prepare(peopleTable, purchaseTables, policy), purchaseTables, output);
    }

    /**
     * everything that can fail a run at startup: every purchase table's header is checked, then
     * people are loaded. call before opening output, so a bad input leaves no output behind.
     *
     * @param peopleTable    people, loaded in full
     * @param purchaseTables whose headers to check
     * @param policy         for duplicate person ids
     * @return builder over loaded people
     * @throws MalformedTableException if a header lacks columns, or policy rejects a duplicate id
     */
    public RecordBuilder prepare(Path peopleTable, List<Path> purchaseTables,
                                 DuplicatePersonPolicy policy) throws IOException {
        for (Path table : purchaseTables) {
            csvTables.openPurchases(table).close();
        }

        PersonLookup lookup;
        try (TableReader<Person> people = csvTables.openPeople(peopleTable)) {
            lookup = PersonLookup.of(people.getTable(), people, policy);
        }
        log.info("loaded " + lookup.size() + " people from " + peopleTable);

        return new RecordBuilder(lookup, pseudonymCodec, zctaGeneralizer);
    }

    /**
     * @param recordBuilder  from {@link #prepare}
     * @param purchaseTables processed in given order
     * @param output         records written here as they're produced
     * @return counts for run
     */
    public RunSummary run(RecordBuilder recordBuilder, List<Path> purchaseTables, Writer output) throws IOException {
        RunSummary summary = RunSummary.EMPTY;
        try (TableWriter<DeidentifiedRecord> writer = csvTables.recordWriter(output)) {
            for (Path table : purchaseTables) {
                try (TableReader<Purchase> purchases = csvTables.openPurchases(table)) {
                    RunSummary tableSummary = join(recordBuilder, purchases, writer::write);
                    log.info(table + ": " + tableSummary.getRecordsWritten() + " records written, "
                        + tableSummary.getRowsSkipped() + " purchases skipped");
                    summary = summary.plus(tableSummary);
                }
            }
        }
        return summary;
    }

    /**
     * join one table's worth of purchases
     *
     * a purchase whose person is missing is logged and skipped; it never fails the run.
     */
    public RunSummary join(RecordBuilder recordBuilder, Iterator<Purchase> purchases,
                           Consumer<DeidentifiedRecord> sink) {
        long read = 0;
        long written = 0;
        long skipped = 0;
        while (purchases.hasNext()) {
            Purchase purchase = purchases.next();
            read++;
            try {
                sink.accept(recordBuilder.withPurchase(purchase));
                written++;
            } catch (MissingPersonException e) {
                log.warning("skipping purchase: " + e.getMessage());
                skipped++;
            }
        }
        return RunSummary.builder()
            .tables(1)
            .rowsRead(read)
            .recordsWritten(written)
            .rowsSkipped(skipped)
            .build();
    }
}
