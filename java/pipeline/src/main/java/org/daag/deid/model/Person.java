package org.daag.deid.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import lombok.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * row of people table; reference data for a join run
 */
@Builder
@AllArgsConstructor //for builder
@NoArgsConstructor //for Jackson
@Getter
@ToString
@EqualsAndHashCode
public class Person {

    public static final List<String> COLUMNS = ImmutableList.of("id", "birth_date", "gender", "postal_code");

    @JsonProperty("id")
    long id;

    @JsonProperty("birth_date")
    LocalDate birthDate;

    @JsonProperty("gender")
    String gender;

    @JsonProperty("postal_code")
    String postalCode;

    public Optional<LocalDate> getBirthDateOptional() {
        return Optional.ofNullable(birthDate);
    }
}
