package com.hcltech.cpm.dag;

import java.util.Objects;

/**
 * Fatal scheduling failure. Carries the kind of failure and the task identifier
 * that the input has to be fixed at.
 */
public class CpmException extends RuntimeException {
    private final ErrorKind kind;
    private final String identifier;

    public CpmException(ErrorKind kind, String identifier, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.identifier = identifier;
    }

    public ErrorKind kind() { return kind; }

    public String identifier() { return identifier; }
}
