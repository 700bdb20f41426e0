package org.daag.deid.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.daag.deid.core.pseudonyms.PseudonymCodec;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * person_id cell of an already-merged table: either still the raw numeric id ("dirty"), or
 * already replaced by its pseudonym ("clean")
 *
 * only two variants exist; callers handle both through {@link #match}.
 */
public abstract class PersonId {

    static final Pattern RAW_ID = Pattern.compile("[+-]?\\d+");

    private PersonId() {
    }

    public abstract <T> T match(Function<Raw, T> onRaw, Function<Pseudonymized, T> onPseudonymized);

    /**
     * @return value as written in a table cell
     */
    public abstract String asCell();

    /**
     * a cell that is an integer is a raw id; a cell that decodes under the codec's salt is a
     * pseudonym. anything else (eg, '12.0', '1 234', a pseudonym under some other salt) is
     * rejected, so an id in an unexpected shape can't pass through in the clear.
     *
     * @param cell  value of person_id column
     * @param codec pseudonyms are recognized against
     * @return id parsed from cell
     * @throws IllegalArgumentException if cell is blank, neither an integer nor a pseudonym, or
     *                                  an integer that overflows 64 bits
     */
    public static PersonId parse(String cell, PseudonymCodec codec) {
        if (StringUtils.isBlank(cell)) {
            throw new IllegalArgumentException("person_id must not be blank");
        }
        String trimmed = cell.trim();
        if (RAW_ID.matcher(trimmed).matches()) {
            // NumberFormatException is an IllegalArgumentException
            return raw(Long.parseLong(trimmed));
        } else if (codec.isPseudonym(trimmed)) {
            return pseudonymized(trimmed);
        } else {
            throw new IllegalArgumentException("person_id is neither a numeric id nor a pseudonym: " + cell);
        }
    }

    public static Raw raw(long id) {
        return new Raw(id);
    }

    public static Pseudonymized pseudonymized(String pseudonym) {
        return new Pseudonymized(pseudonym);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Raw extends PersonId {

        long id;

        @Override
        public <T> T match(Function<Raw, T> onRaw, Function<Pseudonymized, T> onPseudonymized) {
            return onRaw.apply(this);
        }

        @Override
        public String asCell() {
            return Long.toString(id);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Pseudonymized extends PersonId {

        @NonNull
        String pseudonym;

        @Override
        public <T> T match(Function<Raw, T> onRaw, Function<Pseudonymized, T> onPseudonymized) {
            return onPseudonymized.apply(this);
        }

        @Override
        public String asCell() {
            return pseudonym;
        }
    }
}
