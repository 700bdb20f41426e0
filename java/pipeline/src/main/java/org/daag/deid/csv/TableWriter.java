package org.daag.deid.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import lombok.Getter;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * writes rows to output as they're produced; flushed after each row, so nothing accumulates
 *
 * closing flushes, but leaves the underlying output open.
 */
public class TableWriter<T> implements Closeable {

    final SequenceWriter writer;

    @Getter
    long rowsWritten = 0;

    TableWriter(SequenceWriter writer) {
        this.writer = writer;
    }

    public void write(T row) {
        try {
            writer.write(row);
            rowsWritten++;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
