package com.reflector.exception;

import com.reflector.model.ErrorKind;

/**
 * Thrown when an operation would get two parameters with the same name in the same location.
 */
public class DuplicateParameterException extends ReflectorException {

    public DuplicateParameterException(String name, String location) {
        super(ErrorKind.DUPLICATE_PARAMETER, location, name,
                "parameter " + name + " in " + location + " is already defined", null);
    }
}
