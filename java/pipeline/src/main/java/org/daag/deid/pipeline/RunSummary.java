package org.daag.deid.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * counts from a completed run
 */
@Builder(toBuilder = true)
@Value
public class RunSummary {

    public static final RunSummary EMPTY = RunSummary.builder().build();

    int tables;

    long rowsRead;

    long recordsWritten;

    /**
     * rows dropped because their person was missing (join runs only)
     */
    long rowsSkipped;

    public RunSummary plus(RunSummary other) {
        return RunSummary.builder()
            .tables(tables + other.tables)
            .rowsRead(rowsRead + other.rowsRead)
            .recordsWritten(recordsWritten + other.recordsWritten)
            .rowsSkipped(rowsSkipped + other.rowsSkipped)
            .build();
    }
}
