package com.reflector.exception;

import com.reflector.model.ErrorKind;

/**
 * Thrown when a declarative field option cannot be applied to a parameter or header, typically an
 * {@code @Example} value that does not match the field's schema type.
 */
public class FieldPopulationException extends ReflectorException {

    public FieldPopulationException(String fieldName, String message, Throwable cause) {
        super(ErrorKind.FIELD_POPULATION_FAILURE, null, fieldName, message, cause);
    }
}
