package org.daag.deid.csv;

import lombok.Getter;

/**
 * row with a cell that doesn't parse as its column's type (eg, processed_at not in
 * 'yyyy-MM-dd HH:mm:ss')
 *
 * not skippable: bad source data means the export is broken upstream, so the run stops.
 */
public class MalformedRecordException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    @Getter
    private final String table;

    /**
     * 1-based, not counting header
     */
    @Getter
    private final long row;

    public MalformedRecordException(String table, long row, String message, Throwable cause) {
        super(table + ", row " + row + ": " + message, cause);
        this.table = table;
        this.row = row;
    }
}
