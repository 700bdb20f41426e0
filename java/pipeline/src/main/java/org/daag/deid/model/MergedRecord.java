package org.daag.deid.model;

import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * row of an already-merged table, as cleaned in place
 *
 * only person id and postal code are interpreted; every other column passes through untouched.
 */
@Builder(toBuilder = true)
@Value
@With
public class MergedRecord {

    @NonNull
    PersonId personId;

    /**
     * full postal code, or an already-generalized ZCTA if the row was cleaned before
     */
    String postalCode;

    /**
     * all other cells, by column name
     */
    @NonNull
    @Builder.Default
    Map<String, String> otherColumns = ImmutableMap.of();
}
