package com.reflector.model;

/**
 * Categories of failures raised while describing an operation.
 */
public enum ErrorKind {
    /** The same (location, name) pair was added twice to one operation. */
    DUPLICATE_PARAMETER,
    /** The type inspector could not produce a schema for a type. */
    REFLECTION_FAILURE,
    /** A declarative field option could not be applied to a parameter or header. */
    FIELD_POPULATION_FAILURE
}
