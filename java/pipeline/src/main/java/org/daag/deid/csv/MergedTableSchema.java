package org.daag.deid.csv;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import org.daag.deid.core.pseudonyms.PseudonymCodec;
import org.daag.deid.model.MergedRecord;
import org.daag.deid.model.PersonId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * columns of an already-merged table, and how its rows map to {@link MergedRecord}
 *
 * postal code is read from 'postal_code' if the table has one, else from 'zcta' (as written by a
 * join run); it's written back to the same column.
 */
@Value
public class MergedTableSchema {

    public static final String PERSON_ID_COLUMN = "person_id";

    public static final List<String> POSTAL_CODE_COLUMNS = ImmutableList.of("postal_code", "zcta");

    List<String> header;

    String postalCodeColumn;

    /**
     * @throws MalformedTableException if header lacks person id or postal code column
     */
    public static MergedTableSchema of(String table, List<String> header) {
        if (!header.contains(PERSON_ID_COLUMN)) {
            throw new MalformedTableException(table, "missing column " + PERSON_ID_COLUMN);
        }
        String postalCodeColumn = POSTAL_CODE_COLUMNS.stream()
            .filter(header::contains)
            .findFirst()
            .orElseThrow(() -> new MalformedTableException(table, "missing one of columns " + POSTAL_CODE_COLUMNS));
        return new MergedTableSchema(ImmutableList.copyOf(header), postalCodeColumn);
    }

    /**
     * @param row   of table
     * @param codec person_id cells are checked against, to tell pseudonyms from raw ids
     * @throws IllegalArgumentException if person_id cell is blank, or neither a raw id nor a pseudonym
     */
    public MergedRecord fromRow(Map<String, String> row, PseudonymCodec codec) {
        Map<String, String> otherColumns = new LinkedHashMap<>(row);
        String personId = otherColumns.remove(PERSON_ID_COLUMN);
        String postalCode = otherColumns.remove(postalCodeColumn);
        return MergedRecord.builder()
            .personId(PersonId.parse(personId, codec))
            .postalCode(postalCode)
            .otherColumns(Collections.unmodifiableMap(otherColumns))
            .build();
    }

    public Map<String, String> toRow(MergedRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : header) {
            if (column.equals(PERSON_ID_COLUMN)) {
                row.put(column, record.getPersonId().asCell());
            } else if (column.equals(postalCodeColumn)) {
                row.put(column, record.getPostalCode());
            } else {
                row.put(column, record.getOtherColumns().get(column));
            }
        }
        return row;
    }
}
