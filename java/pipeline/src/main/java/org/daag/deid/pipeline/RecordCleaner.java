package org.daag.deid.pipeline;

import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import org.daag.deid.core.geo.ZctaGeneralizer;
import org.daag.deid.core.pseudonyms.PseudonymCodec;
import org.daag.deid.model.MergedRecord;
import org.daag.deid.model.PersonId;

import javax.inject.Inject;

/**
 * de-identifies a row of an already-merged table in place
 *
 * idempotent: cleaning a cleaned record gives the same record.
 */
@NoArgsConstructor(onConstructor_ = @Inject)
@AllArgsConstructor
public class RecordCleaner {

    @Inject
    PseudonymCodec pseudonymCodec;

    @Inject
    ZctaGeneralizer zctaGeneralizer;

    public MergedRecord clean(MergedRecord record) {
        PersonId personId = record.getPersonId().match(
            raw -> PersonId.pseudonymized(pseudonymCodec.encode(raw.getId())),
            pseudonymized -> pseudonymized);

        return record
            .withPersonId(personId)
            .withPostalCode(zctaGeneralizer.generalize(record.getPostalCode()));
    }
}
