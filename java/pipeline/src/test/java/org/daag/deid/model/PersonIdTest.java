package org.daag.deid.model;

import org.daag.deid.core.pseudonyms.HashidsPseudonymCodec;
import org.daag.deid.core.pseudonyms.PseudonymCodec;
import org.daag.deid.test.TestTables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PersonIdTest {

    PseudonymCodec codec = HashidsPseudonymCodec.of(TestTables.SALT);

    @CsvSource({
        "1,     1",
        "12345, 12345",
        "-7,    -7",
        "+12,   12",
        "' 42 ', 42",
        "9223372036854775807, 9223372036854775807",
    })
    @ParameterizedTest
    void parse_raw(String cell, long expected) {
        assertEquals(PersonId.raw(expected), PersonId.parse(cell, codec));
    }

    @ValueSource(longs = {0, 1, 42, -7, Long.MAX_VALUE})
    @ParameterizedTest
    void parse_pseudonymized(long id) {
        String cell = codec.encode(id);

        PersonId personId = PersonId.parse(cell, codec);

        assertEquals(PersonId.pseudonymized(cell), personId);
        assertEquals(cell, personId.asCell());
    }

    @ValueSource(strings = {
        "",
        "  ",
        "99999999999999999999",
        // ids in shapes exports produce; must not pass through as if already clean
        "12.0",
        "1 234",
        "1,234",
        "1e3",
        "abc123",
    })
    @ParameterizedTest
    void parse_invalid(String cell) {
        assertThrows(IllegalArgumentException.class, () -> PersonId.parse(cell, codec));
    }

    @Test
    void parse_pseudonymUnderOtherSalt() {
        String foreign = HashidsPseudonymCodec.of("some other salt").encode(42);

        assertThrows(IllegalArgumentException.class, () -> PersonId.parse(foreign, codec));
    }

    @Test
    void parse_null() {
        assertThrows(IllegalArgumentException.class, () -> PersonId.parse(null, codec));
    }

    @Test
    void match() {
        assertEquals("raw 5",
            PersonId.raw(5).match(raw -> "raw " + raw.getId(), clean -> "clean " + clean.getPseudonym()));
        assertEquals("clean jR",
            PersonId.pseudonymized("jR").match(raw -> "raw " + raw.getId(), clean -> "clean " + clean.getPseudonym()));
    }

    @Test
    void asCell_raw() {
        assertEquals("-12", PersonId.raw(-12).asCell());
    }
}
