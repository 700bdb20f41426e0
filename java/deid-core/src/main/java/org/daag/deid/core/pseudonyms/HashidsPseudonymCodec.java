package org.daag.deid.core.pseudonyms;

import com.google.common.annotations.VisibleForTesting;
import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;
import org.daag.deid.core.InvalidConfigurationException;
import org.hashids.Hashids;

/**
 * pseudonyms as Hashids, salted with a per-deployment secret
 *
 * Hashids only encodes numbers in [0, 2^53], so ids outside that range (negatives, very large
 * values) are encoded as two numbers: the high and low 32 bits of the id. Decoding tells the two
 * forms apart by how many numbers come back.
 */
public class HashidsPseudonymCodec implements PseudonymCodec {

    /**
     * letters only; a pseudonym must never parse as a raw numeric id
     */
    @VisibleForTesting
    static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    /**
     * largest value Hashids will encode as a single number (2^53)
     */
    @VisibleForTesting
    static final long MAX_SINGLE_NUMBER = 9007199254740992L;

    static final long LOW_32_BITS = 0xFFFFFFFFL;

    final Hashids hashids;

    HashidsPseudonymCodec(Hashids hashids) {
        this.hashids = hashids;
    }

    /**
     * @param salt secret salt; must not be blank
     * @return codec keyed by salt
     * @throws InvalidConfigurationException if salt is blank or rejected by Hashids
     */
    public static HashidsPseudonymCodec of(String salt) {
        if (StringUtils.isBlank(salt)) {
            throw new InvalidConfigurationException("pseudonymization salt must not be blank");
        }
        try {
            return new HashidsPseudonymCodec(new Hashids(salt, 0, ALPHABET));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("salt rejected by pseudonym encoding: " + e.getMessage(), e);
        }
    }

    @Override
    public String encode(long id) {
        if (id >= 0 && id <= MAX_SINGLE_NUMBER) {
            return hashids.encode(id);
        } else {
            return hashids.encode(id >>> 32, id & LOW_32_BITS);
        }
    }

    @Override
    public long decode(@NonNull String pseudonym) {
        if (!StringUtils.isAlpha(pseudonym)) {
            throw new IllegalArgumentException("not a pseudonym: " + pseudonym);
        }

        long[] numbers;
        try {
            numbers = hashids.decode(pseudonym);
        } catch (RuntimeException e) {
            // Hashids can trip over some malformed inputs instead of returning empty
            throw new IllegalArgumentException("not a pseudonym: " + pseudonym, e);
        }

        long id;
        if (numbers.length == 1) {
            id = numbers[0];
        } else if (numbers.length == 2 && numbers[0] <= LOW_32_BITS && numbers[1] <= LOW_32_BITS) {
            id = (numbers[0] << 32) | numbers[1];
        } else {
            throw new IllegalArgumentException("not a pseudonym: " + pseudonym);
        }

        // only the canonical form counts; eg, a small id written in two-number form
        if (!encode(id).equals(pseudonym)) {
            throw new IllegalArgumentException("not a pseudonym: " + pseudonym);
        }
        return id;
    }
}
