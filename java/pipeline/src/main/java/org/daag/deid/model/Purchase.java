package org.daag.deid.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.collect.ImmutableList;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * row of a purchases table; one transaction, still carrying raw person id
 */
@Builder
@AllArgsConstructor //for builder
@NoArgsConstructor //for Jackson
@Getter
@ToString
@EqualsAndHashCode
public class Purchase {

    /**
     * format of processed_at in purchase exports; NOT ISO-8601
     *
     * 'uuuu' as strict resolution needs a proleptic year, not year-of-era
     */
    public static final String PROCESSED_AT_PATTERN = "uuuu-MM-dd HH:mm:ss";

    public static final List<String> COLUMNS = ImmutableList.of(
        "person_id", "product_id", "event_id", "start", "end", "product", "event", "division",
        "registration_status", "total_cost", "total_paid", "total_paid_refund",
        "total_paid_waived", "status", "processed_at", "quantity");

    @JsonProperty("person_id")
    long personId;

    @JsonProperty("product_id")
    long productId;

    @JsonProperty("event_id")
    Long eventId;

    @JsonProperty("start")
    LocalDate start;

    @JsonProperty("end")
    LocalDate end;

    @JsonProperty("product")
    String product;

    @JsonProperty("event")
    String event;

    @JsonProperty("division")
    String division;

    @JsonProperty("registration_status")
    String registrationStatus;

    @JsonProperty("total_cost")
    double totalCost;

    @JsonProperty("total_paid")
    double totalPaid;

    @JsonProperty("total_paid_refund")
    double totalPaidRefund;

    @JsonProperty("total_paid_waived")
    double totalPaidWaived;

    @JsonProperty("status")
    String status;

    @JsonDeserialize(using = ProcessedAtDeserializer.class)
    @JsonProperty("processed_at")
    LocalDateTime processedAt;

    @JsonProperty("quantity")
    long quantity;

    /**
     * @throws IllegalArgumentException if a field exports treat as unsigned is negative
     */
    public void validate() {
        if (productId < 0) {
            throw new IllegalArgumentException("product_id must not be negative: " + productId);
        }
        if (eventId != null && eventId < 0) {
            throw new IllegalArgumentException("event_id must not be negative: " + eventId);
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must not be negative: " + quantity);
        }
        if (processedAt == null) {
            throw new IllegalArgumentException("processed_at is required");
        }
    }
}
