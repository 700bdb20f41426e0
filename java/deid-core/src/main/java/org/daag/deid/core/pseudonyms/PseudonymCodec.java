package org.daag.deid.core.pseudonyms;

/**
 * keyed, reversible encoding of numeric identifiers
 *
 * NOTE: this is NOT a one-way hash; anyone holding the salt can recover the original id. That is
 * how the data controller re-identifies records for follow-up.
 */
public interface PseudonymCodec {

    /**
     * @param id to pseudonymize; any signed 64-bit value
     * @return pseudonym for id; same (salt, id) always gives same pseudonym
     */
    String encode(long id);

    /**
     * @param pseudonym previously produced by {@link #encode(long)} under same salt
     * @return original id
     * @throws IllegalArgumentException if pseudonym isn't one produced under this salt
     */
    long decode(String pseudonym);

    /**
     * @param value to test
     * @return whether value is a canonical pseudonym under this codec's salt
     */
    default boolean isPseudonym(String value) {
        try {
            decode(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
