package org.daag.deid.pipeline;

import lombok.Getter;

/**
 * purchase references a person not in the people table
 *
 * recoverable: the purchase is reported and skipped, and the run continues.
 */
public class MissingPersonException extends Exception {

    private static final long serialVersionUID = 1L;

    @Getter
    private final long id;

    public MissingPersonException(long id) {
        super("missing person with id: " + id);
        this.id = id;
    }
}
