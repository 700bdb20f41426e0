package org.daag.deid.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.extern.java.Log;
import org.daag.deid.core.InvalidConfigurationException;
import org.daag.deid.model.DeidentifiedRecord;
import org.daag.deid.model.Person;
import org.daag.deid.model.Purchase;

import javax.inject.Inject;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.stream.Collectors;

/**
 * reads/writes the CSV tables of a run; all tables have a header row, columns matched by name
 */
@Log
@NoArgsConstructor(onConstructor_ = @Inject)
@AllArgsConstructor
public class CsvTables {

    @Inject
    CsvMapper csvMapper;

    public TableReader<Person> openPeople(Path path) {
        return open(path.toString(), reader(path), Person.class, Person.COLUMNS, person -> { });
    }

    public TableReader<Purchase> openPurchases(Path path) {
        return open(path.toString(), reader(path), Purchase.class, Purchase.COLUMNS, Purchase::validate);
    }

    /**
     * open table as untyped rows, every cell as a string, for rewriting in place
     */
    public TableReader<Map<String, String>> openRows(Path path) {
        return openRows(path.toString(), reader(path));
    }

    public <T> TableReader<T> open(String table, Reader source, Class<T> rowClass,
                                   List<String> requiredColumns, Consumer<T> validator) {
        ObjectReader objectReader = csvMapper.readerFor(rowClass)
            .with(CsvSchema.emptySchema().withHeader())
            // so absent optional cells (eg, birth_date) read as null, while absent required
            // primitives fail
            .with(CsvParser.Feature.EMPTY_STRING_AS_NULL);
        TableReader<T> tableReader = startReading(table, source, objectReader, validator);
        try {
            requireColumns(tableReader, requiredColumns);
        } catch (MalformedTableException e) {
            closeQuietly(tableReader);
            throw e;
        }
        return tableReader;
    }

    public TableReader<Map<String, String>> openRows(String table, Reader source) {
        ObjectReader objectReader = csvMapper.readerForMapOf(String.class)
            .with(CsvSchema.emptySchema().withHeader());
        return startReading(table, source, objectReader, row -> { });
    }

    public TableWriter<DeidentifiedRecord> recordWriter(Writer output) {
        CsvSchema schema = csvMapper.schemaFor(DeidentifiedRecord.class).withHeader();
        return writer(output, csvMapper.writerFor(DeidentifiedRecord.class).with(schema));
    }

    /**
     * @param output to write to
     * @param header columns, in order
     */
    public TableWriter<Map<String, String>> rowWriter(Writer output, List<String> header) {
        CsvSchema.Builder schema = CsvSchema.builder();
        header.forEach(schema::addColumn);
        return writer(output, csvMapper.writer(schema.build().withHeader()));
    }

    <T> TableWriter<T> writer(Writer output, ObjectWriter objectWriter) {
        try {
            return new TableWriter<>(objectWriter
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(output));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    <T> TableReader<T> startReading(String table, Reader source, ObjectReader objectReader, Consumer<T> validator) {
        try {
            MappingIterator<T> rows = objectReader.readValues(source);

            // header is parsed lazily, on first token
            rows.hasNextValue();

            CsvSchema headerSchema = ((CsvParser) rows.getParser()).getSchema();
            List<String> header = new ArrayList<>();
            for (int i = 0; i < headerSchema.size(); i++) {
                header.add(headerSchema.columnName(i));
            }
            log.fine(() -> "opened " + table + " with columns " + header);
            return new TableReader<>(table, header, rows, validator);
        } catch (JsonProcessingException e) {
            closeQuietly(source);
            throw new MalformedTableException(table, "unreadable header: " + e.getOriginalMessage());
        } catch (IOException e) {
            closeQuietly(source);
            throw new UncheckedIOException(e);
        }
    }

    // only on paths already failing; the original failure is what gets reported
    void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.log(Level.FINE, "failed to close table after earlier failure", e);
        }
    }

    void requireColumns(TableReader<?> tableReader, List<String> requiredColumns) {
        List<String> missing = requiredColumns.stream()
            .filter(column -> !tableReader.getHeader().contains(column))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new MalformedTableException(tableReader.getTable(), "missing columns " + missing);
        }
    }

    Reader reader(Path path) {
        try {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidConfigurationException("can't read table " + path, e);
        }
    }
}
