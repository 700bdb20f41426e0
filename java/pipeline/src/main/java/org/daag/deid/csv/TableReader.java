package org.daag.deid.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * streams rows of one table, one at a time
 *
 * parse failures surface as {@link MalformedRecordException}, naming table and row.
 */
public class TableReader<T> implements Iterator<T>, Closeable {

    @Getter
    final String table;

    @Getter
    final List<String> header;

    final MappingIterator<T> rows;

    final Consumer<T> validator;

    /**
     * rows returned so far
     */
    @Getter
    long rowsRead = 0;

    TableReader(String table, List<String> header, MappingIterator<T> rows, Consumer<T> validator) {
        this.table = table;
        this.header = ImmutableList.copyOf(header);
        this.rows = rows;
        this.validator = validator;
    }

    @Override
    public boolean hasNext() {
        try {
            return rows.hasNextValue();
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(table, rowsRead + 1, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        long row = rowsRead + 1;
        try {
            T value = rows.nextValue();
            validator.accept(value);
            rowsRead = row;
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(table, row, e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(table, row, e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }
}
