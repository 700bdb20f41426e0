package org.daag.deid.csv;

import lombok.SneakyThrows;
import org.daag.deid.core.InvalidConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableSourcesTest {

    @TempDir
    Path dir;

    @SneakyThrows
    @Test
    void list_directorySortedByName() {
        Files.writeString(dir.resolve("2019-02.csv"), "");
        Files.writeString(dir.resolve("2019-01.csv"), "");
        Files.writeString(dir.resolve("2018-12.csv"), "");
        Files.writeString(dir.resolve(".DS_Store"), "");
        Files.createDirectory(dir.resolve("archive"));

        List<Path> tables = TableSources.list(dir);

        assertEquals(List.of(dir.resolve("2018-12.csv"), dir.resolve("2019-01.csv"), dir.resolve("2019-02.csv")),
            tables);
    }

    @SneakyThrows
    @Test
    void list_singleFile() {
        Path table = Files.writeString(dir.resolve("purchases.csv"), "");

        assertEquals(List.of(table), TableSources.list(table));
    }

    @Test
    void list_emptyDirectory() {
        assertTrue(TableSources.list(dir).isEmpty());
    }

    @Test
    void list_missing() {
        assertThrows(InvalidConfigurationException.class, () -> TableSources.list(dir.resolve("missing")));
    }
}
