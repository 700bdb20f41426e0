package org.daag.deid.pipeline;

import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.extern.java.Log;
import org.daag.deid.core.pseudonyms.PseudonymCodec;
import org.daag.deid.csv.CsvTables;
import org.daag.deid.csv.MalformedRecordException;
import org.daag.deid.csv.MalformedTableException;
import org.daag.deid.csv.MergedTableSchema;
import org.daag.deid.csv.TableReader;
import org.daag.deid.csv.TableWriter;
import org.daag.deid.model.MergedRecord;

import javax.inject.Inject;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * clean run: already-merged tables rewritten row by row, raw person ids pseudonymized and postal
 * codes generalized; rows already clean pass through unchanged
 */
@Log
@NoArgsConstructor(onConstructor_ = @Inject)
@AllArgsConstructor
public class CleanerPipeline {

    @Inject
    CsvTables csvTables;

    @Inject
    PseudonymCodec pseudonymCodec;

    @Inject
    RecordCleaner recordCleaner;

    /**
     * @param tables       processed in given order; all must share first table's header
     * @param output       rows written here as they're cleaned, under first table's header
     * @param firstRowOnly clean only first row of each table (behavior of earlier releases)
     * @return counts for run
     */
    public RunSummary run(List<Path> tables, Writer output, boolean firstRowOnly) throws IOException {
        if (tables.isEmpty()) {
            log.warning("no tables to clean");
            return RunSummary.EMPTY;
        }
        return run(checkHeaders(tables), tables, output, firstRowOnly);
    }

    /**
     * @param schema       from {@link #checkHeaders}
     * @param tables       processed in given order
     * @param output       rows written here as they're cleaned
     * @param firstRowOnly clean only first row of each table
     * @return counts for run
     */
    public RunSummary run(MergedTableSchema schema, List<Path> tables, Writer output,
                          boolean firstRowOnly) throws IOException {
        RunSummary summary = RunSummary.EMPTY;
        try (TableWriter<Map<String, String>> writer = csvTables.rowWriter(output, schema.getHeader())) {
            for (Path table : tables) {
                try (TableReader<Map<String, String>> rows = csvTables.openRows(table)) {
                    RunSummary tableSummary = clean(schema, rows, writer::write, firstRowOnly);
                    log.info(table + ": " + tableSummary.getRecordsWritten() + " rows cleaned");
                    summary = summary.plus(tableSummary);
                }
            }
        }
        return summary;
    }

    /**
     * clean one table's worth of rows
     */
    public RunSummary clean(MergedTableSchema schema, TableReader<Map<String, String>> rows,
                            Consumer<Map<String, String>> sink, boolean firstRowOnly) {
        long written = 0;
        while (rows.hasNext()) {
            Map<String, String> row = rows.next();

            MergedRecord record;
            try {
                record = schema.fromRow(row, pseudonymCodec);
            } catch (IllegalArgumentException e) {
                throw new MalformedRecordException(rows.getTable(), rows.getRowsRead(), e.getMessage(), e);
            }

            sink.accept(schema.toRow(recordCleaner.clean(record)));
            written++;

            if (firstRowOnly) {
                break;
            }
        }
        return RunSummary.builder()
            .tables(1)
            .rowsRead(rows.getRowsRead())
            .recordsWritten(written)
            .build();
    }

    /**
     * call before opening output, so a bad input leaves no output behind
     *
     * @param tables to check; at least one
     * @return schema of first table, shared by all
     * @throws MalformedTableException if a table lacks required columns or differs from first
     */
    public MergedTableSchema checkHeaders(List<Path> tables) throws IOException {
        MergedTableSchema schema = null;
        for (Path table : tables) {
            try (TableReader<Map<String, String>> rows = csvTables.openRows(table)) {
                if (schema == null) {
                    schema = MergedTableSchema.of(rows.getTable(), rows.getHeader());
                } else if (!schema.getHeader().equals(rows.getHeader())) {
                    throw new MalformedTableException(rows.getTable(),
                        "header " + rows.getHeader() + " differs from " + schema.getHeader());
                }
            }
        }
        return schema;
    }
}
