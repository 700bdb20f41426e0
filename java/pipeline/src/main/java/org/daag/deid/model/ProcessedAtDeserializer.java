package org.daag.deid.model;

import com.fasterxml.jackson.datatype.jsr310.deser.LocalDateTimeDeserializer;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

/**
 * reads processed_at in export format, rejecting timestamps that don't exist (eg, Feb 30,
 * hour 24) rather than rolling them over to the nearest valid one
 */
public class ProcessedAtDeserializer extends LocalDateTimeDeserializer {

    private static final long serialVersionUID = 1L;

    static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(Purchase.PROCESSED_AT_PATTERN)
        .withResolverStyle(ResolverStyle.STRICT);

    public ProcessedAtDeserializer() {
        super(FORMATTER);
    }
}
