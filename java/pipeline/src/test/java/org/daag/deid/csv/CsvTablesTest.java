package org.daag.deid.csv;

import com.google.common.collect.Lists;
import lombok.SneakyThrows;
import org.daag.deid.core.InvalidConfigurationException;
import org.daag.deid.model.DeidentifiedRecord;
import org.daag.deid.model.Person;
import org.daag.deid.model.Purchase;
import org.daag.deid.test.TestTables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.daag.deid.test.TestTables.PURCHASES_HEADER;
import static org.daag.deid.test.TestTables.csv;
import static org.junit.jupiter.api.Assertions.*;

class CsvTablesTest {

    CsvTables csvTables = TestTables.csvTables();

    static final String VALID_PURCHASE =
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.5,0.0,0.0,paid,2019-01-02 10:15:00,3";

    @SneakyThrows
    @Test
    void openPeople() {
        try (TableReader<Person> people = csvTables.openPeople(TestTables.resource("people.csv"))) {
            List<Person> all = Lists.newArrayList(people);

            assertEquals(3, all.size());
            assertEquals(Person.builder()
                    .id(1)
                    .birthDate(LocalDate.of(1990, 5, 4))
                    .gender("F")
                    .postalCode("02138-1234")
                    .build(),
                all.get(0));

            // blank birth_date is absent
            assertEquals(2, all.get(1).getId());
            assertFalse(all.get(1).getBirthDateOptional().isPresent());
            assertEquals(3, people.getRowsRead());
        }
    }

    @SneakyThrows
    @Test
    void openPurchases() {
        try (TableReader<Purchase> purchases = read(PURCHASES_HEADER, VALID_PURCHASE)) {
            Purchase purchase = purchases.next();

            assertEquals(1L, purchase.getPersonId());
            assertEquals(100L, purchase.getProductId());
            assertEquals(Long.valueOf(7L), purchase.getEventId());
            assertEquals(LocalDate.of(2019, 1, 5), purchase.getStart());
            assertEquals(LocalDate.of(2019, 1, 6), purchase.getEnd());
            assertEquals("Day pass", purchase.getProduct());
            assertEquals("registered", purchase.getRegistrationStatus());
            assertEquals(25.5, purchase.getTotalPaid());
            assertEquals(LocalDateTime.of(2019, 1, 2, 10, 15, 0), purchase.getProcessedAt());
            assertEquals(3L, purchase.getQuantity());
            assertFalse(purchases.hasNext());
        }
    }

    @SneakyThrows
    @Test
    void openPurchases_leapDay() {
        try (TableReader<Purchase> purchases = read(PURCHASES_HEADER,
            "1,100,7,2020-02-29,2020-02-29,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2020-02-29 23:59:59,1")) {
            assertEquals(LocalDateTime.of(2020, 2, 29, 23, 59, 59), purchases.next().getProcessedAt());
        }
    }

    @SneakyThrows
    @Test
    void openPurchases_optionalsBlank() {
        try (TableReader<Purchase> purchases = read(PURCHASES_HEADER,
            "99,101,,,,Membership,,Adult,,50.0,0.0,0.0,50.0,waived,2019-01-03 09:00:00,1")) {
            Purchase purchase = purchases.next();

            assertNull(purchase.getEventId());
            assertNull(purchase.getStart());
            assertNull(purchase.getEnd());
        }
    }

    @SneakyThrows
    @Test
    void openPurchases_extraColumnsIgnored() {
        try (TableReader<Purchase> purchases = read(PURCHASES_HEADER + ",notes", VALID_PURCHASE + ",vip")) {
            assertEquals(100L, purchases.next().getProductId());
        }
    }

    @ValueSource(strings = {
        // ISO, not the export format
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2019-01-02T10:15:00,1",
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,01/02/2019 10:15,1",
        // no such date/time; must not roll over to a real one
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2019-02-30 10:00:00,1",
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2019-04-31 10:00:00,1",
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2019-01-02 24:00:00,1",
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2019-01-02 10:60:00,1",
        "abc,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2019-01-02 10:15:00,1",
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,,25.0,0.0,0.0,paid,2019-01-02 10:15:00,1",
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,2019-01-02 10:15:00,-1",
        "1,100,7,2019-01-05,2019-01-06,Day pass,Winter Open,Adult,registered,25.0,25.0,0.0,0.0,paid,,1",
    })
    @ParameterizedTest
    void openPurchases_malformedRow(String row) {
        TableReader<Purchase> purchases = read(PURCHASES_HEADER, VALID_PURCHASE, row);
        purchases.next();

        MalformedRecordException e = assertThrows(MalformedRecordException.class, purchases::next);
        assertEquals("purchases.csv", e.getTable());
        assertEquals(2, e.getRow());
    }

    @Test
    void openPurchases_missingColumns() {
        String header = PURCHASES_HEADER.replace(",processed_at", "");

        MalformedTableException e = assertThrows(MalformedTableException.class, () -> read(header));
        assertTrue(e.getMessage().contains("processed_at"), e.getMessage());
    }

    @Test
    void openPeople_missingFile() {
        assertThrows(InvalidConfigurationException.class,
            () -> csvTables.openPeople(Paths.get("does", "not", "exist.csv")));
    }

    @SneakyThrows
    @Test
    void recordWriter() {
        StringWriter output = new StringWriter();
        try (TableWriter<DeidentifiedRecord> writer = csvTables.recordWriter(output)) {
            writer.write(DeidentifiedRecord.builder()
                .personId("jR")
                .gender("F")
                .birthYear(null)
                .zcta("021")
                .productId(100)
                .product("Shirt, large")
                .start(LocalDate.of(2019, 1, 5))
                .totalCost(12.5)
                .totalPaid(10000000.0)
                .totalPaidRefund(0.0001)
                .processedAt(LocalDateTime.of(2019, 1, 2, 10, 15, 0))
                .quantity(2)
                .build());
            assertEquals(1, writer.getRowsWritten());
        }

        String[] lines = output.toString().split("\n");
        assertEquals(String.join(",", DeidentifiedRecord.COLUMNS), lines[0]);

        Map<String, String> row = TestTables.readRows(output.toString()).get(0);
        assertEquals("jR", row.get("person_id"));
        assertEquals("", row.get("birth_year"));
        assertEquals("Shirt, large", row.get("product"));
        assertEquals("", row.get("event_id"));
        assertEquals("2019-01-05", row.get("start"));
        assertEquals("12.5", row.get("total_cost"));
        assertEquals("10000000.0", row.get("total_paid"));
        assertEquals("0.0001", row.get("total_paid_refund"));
        assertEquals("0.0", row.get("total_paid_waived"));
        assertEquals("2019-01-02T10:15:00", row.get("processed_at"));
        assertEquals("2", row.get("quantity"));
    }

    @SneakyThrows
    @Test
    void openRows_keepsEverythingAsText() {
        try (TableReader<Map<String, String>> rows = csvTables.openRows("merged.csv",
            new StringReader(csv("person_id,postal_code,total_cost,event_id", "1,02138,25.0,")))) {

            assertEquals(List.of("person_id", "postal_code", "total_cost", "event_id"), rows.getHeader());
            Map<String, String> row = rows.next();
            assertEquals("25.0", row.get("total_cost"));
            assertEquals("", row.get("event_id"));
        }
    }

    @SneakyThrows
    @Test
    void rowWriter_headerOrder() {
        StringWriter output = new StringWriter();
        try (TableWriter<Map<String, String>> writer =
                 csvTables.rowWriter(output, List.of("person_id", "postal_code", "total_cost"))) {
            writer.write(Map.of("total_cost", "25.0", "person_id", "jR", "postal_code", "021"));
        }

        assertEquals(csv("person_id,postal_code,total_cost", "jR,021,25.0"), output.toString());
    }

    TableReader<Purchase> read(String... lines) {
        return csvTables.open("purchases.csv", new StringReader(csv(lines)), Purchase.class,
            Purchase.COLUMNS, Purchase::validate);
    }
}
