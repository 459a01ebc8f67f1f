package com.reflector.exception;

import com.reflector.model.ErrorKind;

/**
 * Thrown when a type cannot be turned into a schema, e.g. an unsupported type shape or a failing
 * interceptor.
 */
public class SchemaReflectionException extends ReflectorException {

    public SchemaReflectionException(String message) {
        this(message, null, null);
    }

    public SchemaReflectionException(String message, String fieldName, Throwable cause) {
        super(ErrorKind.REFLECTION_FAILURE, null, fieldName, message, cause);
    }
}
