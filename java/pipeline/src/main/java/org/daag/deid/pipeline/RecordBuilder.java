package org.daag.deid.pipeline;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import org.daag.deid.core.geo.ZctaGeneralizer;
import org.daag.deid.core.pseudonyms.PseudonymCodec;
import org.daag.deid.model.DeidentifiedRecord;
import org.daag.deid.model.Person;
import org.daag.deid.model.Purchase;

import java.time.LocalDate;

/**
 * joins purchases to their person, de-identifying the person side of the join
 */
@AllArgsConstructor
public class RecordBuilder {

    @NonNull
    final PersonLookup people;

    @NonNull
    final PseudonymCodec pseudonymCodec;

    @NonNull
    final ZctaGeneralizer zctaGeneralizer;

    /**
     * @param purchase to augment with its person
     * @return record for purchase, person identified only by pseudonym
     * @throws MissingPersonException if purchase's person isn't in lookup
     */
    public DeidentifiedRecord withPurchase(Purchase purchase) throws MissingPersonException {
        Person person = people.get(purchase.getPersonId())
            .orElseThrow(() -> new MissingPersonException(purchase.getPersonId()));

        return DeidentifiedRecord.builder()
            .personId(pseudonymCodec.encode(person.getId()))
            .gender(person.getGender())
            .birthYear(person.getBirthDateOptional().map(LocalDate::getYear).orElse(null))
            .zcta(zctaGeneralizer.generalize(person.getPostalCode()))
            .productId(purchase.getProductId())
            .product(purchase.getProduct())
            .eventId(purchase.getEventId())
            .event(purchase.getEvent())
            .start(purchase.getStart())
            .end(purchase.getEnd())
            .division(purchase.getDivision())
            .registrationStatus(purchase.getRegistrationStatus())
            .totalCost(purchase.getTotalCost())
            .totalPaid(purchase.getTotalPaid())
            .totalPaidRefund(purchase.getTotalPaidRefund())
            .totalPaidWaived(purchase.getTotalPaidWaived())
            .status(purchase.getStatus())
            .processedAt(purchase.getProcessedAt())
            .quantity(purchase.getQuantity())
            .build();
    }
}
