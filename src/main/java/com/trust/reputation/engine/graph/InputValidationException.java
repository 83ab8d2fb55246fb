package com.trust.reputation.engine.graph;

/**
 * Fatal input error. The run that raised it produces no partial result.
 */
public class InputValidationException extends IllegalArgumentException {

    private final String subject;
    private final String field;

    public InputValidationException(String message, String subject, String field) {
        super(message);
        this.subject = subject;
        this.field = field;
    }

    /** Offending node id, edge reference or account id. */
    public String getSubject() {
        return subject;
    }

    public String getField() {
        return field;
    }
}
