package org.daag.deid.csv;

import lombok.Getter;

/**
 * table whose shape can't be processed: required columns missing, header differs from the other
 * tables of the run, duplicate keys where they're not allowed
 */
public class MalformedTableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    @Getter
    private final String table;

    public MalformedTableException(String table, String message) {
        super(table + ": " + message);
        this.table = table;
    }
}
