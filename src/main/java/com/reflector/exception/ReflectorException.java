package com.reflector.exception;

import com.reflector.model.ErrorKind;

/**
 * Base runtime exception for failures raised while describing an operation.
 * <p>
 * Every failure stems from a static mistake in a type or its annotations, so nothing is retried.
 * Besides the message, the exception keeps its {@link ErrorKind} and, where known, the location
 * and field it concerns, so callers can inspect failures without parsing messages.
 */
public class ReflectorException extends RuntimeException {

    private final ErrorKind kind;
    private final String location;
    private final String fieldName;

    /**
     * Constructs a new ReflectorException.
     *
     * @param kind      The category of the failure.
     * @param location  The location being processed ({@code query}, {@code body}, ...), or {@code null}.
     * @param fieldName The parameter, header or field name involved, or {@code null}.
     * @param message   The detail message.
     * @param cause     The underlying cause, or {@code null}.
     */
    public ReflectorException(ErrorKind kind, String location, String fieldName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.location = location;
        this.fieldName = fieldName;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getLocation() {
        return location;
    }

    public String getFieldName() {
        return fieldName;
    }
}
