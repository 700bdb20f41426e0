package org.daag.deid.core.geo;

import com.google.common.collect.ImmutableSet;
import lombok.NoArgsConstructor;

import javax.inject.Inject;
import java.util.Set;

/**
 * generalizes postal codes to 3-character ZCTA buckets
 *
 * buckets whose population is too small to report are suppressed, replaced with
 * {@link #NULL_ZCTA}.
 */
@NoArgsConstructor(onConstructor_ = @Inject)
public class ZctaGeneralizer {

    public static final int ZCTA_LENGTH = 3;

    /**
     * value reported in place of a suppressed bucket
     */
    public static final String NULL_ZCTA = "000";

    /**
     * 3-digit ZCTAs with population under 20,000
     */
    public static final Set<String> RESTRICTED_ZCTAS = ImmutableSet.of(
        "036", "692", "878", "059", "790", "879", "063", "821", "884",
        "102", "823", "890", "203", "830", "893", "556", "831");

    /**
     * @param postalCode free text; may be shorter than 3 characters, or null
     * @return first 3 characters of postalCode (all of it, if shorter), or {@link #NULL_ZCTA} if
     *         that bucket is restricted
     */
    public String generalize(String postalCode) {
        String zcta = prefix(postalCode == null ? "" : postalCode);
        return RESTRICTED_ZCTAS.contains(zcta) ? NULL_ZCTA : zcta;
    }

    // counts code points, not chars, so a surrogate pair is never split
    String prefix(String value) {
        int codePoints = value.codePointCount(0, value.length());
        if (codePoints <= ZCTA_LENGTH) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, ZCTA_LENGTH));
    }
}
