package org.daag.deid.pipeline;

/**
 * what to do when the people table has more than one row with the same id
 */
public enum DuplicatePersonPolicy {

    /**
     * later row replaces earlier one; each replacement is logged
     */
    LAST_WRITE_WINS,

    /**
     * fail the run before any output is written
     */
    REJECT,
    ;
}
