package org.daag.deid.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * de-identified output row: purchase joined with its person, identified only by pseudonym
 *
 * gender, birth year and ZCTA are the only person attributes that survive the join.
 */
@Builder
@Value
@JsonPropertyOrder({
    "person_id", "gender", "birth_year", "zcta", "product_id", "product", "event_id", "event",
    "start", "end", "division", "registration_status", "total_cost", "total_paid",
    "total_paid_refund", "total_paid_waived", "status", "processed_at", "quantity",
})
public class DeidentifiedRecord {

    public static final List<String> COLUMNS = ImmutableList.of(
        "person_id", "gender", "birth_year", "zcta", "product_id", "product", "event_id", "event",
        "start", "end", "division", "registration_status", "total_cost", "total_paid",
        "total_paid_refund", "total_paid_waived", "status", "processed_at", "quantity");

    public static final String PROCESSED_AT_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";

    @JsonProperty("person_id")
    String personId;

    @JsonProperty("gender")
    String gender;

    @JsonProperty("birth_year")
    Integer birthYear;

    @JsonProperty("zcta")
    String zcta;

    @JsonProperty("product_id")
    long productId;

    @JsonProperty("product")
    String product;

    @JsonProperty("event_id")
    Long eventId;

    @JsonProperty("event")
    String event;

    @JsonProperty("start")
    LocalDate start;

    @JsonProperty("end")
    LocalDate end;

    @JsonProperty("division")
    String division;

    @JsonProperty("registration_status")
    String registrationStatus;

    @JsonSerialize(using = PlainDecimalSerializer.class)
    @JsonProperty("total_cost")
    double totalCost;

    @JsonSerialize(using = PlainDecimalSerializer.class)
    @JsonProperty("total_paid")
    double totalPaid;

    @JsonSerialize(using = PlainDecimalSerializer.class)
    @JsonProperty("total_paid_refund")
    double totalPaidRefund;

    @JsonSerialize(using = PlainDecimalSerializer.class)
    @JsonProperty("total_paid_waived")
    double totalPaidWaived;

    @JsonProperty("status")
    String status;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = PROCESSED_AT_PATTERN)
    @JsonProperty("processed_at")
    LocalDateTime processedAt;

    @JsonProperty("quantity")
    long quantity;
}
