package com.reflector.service.api;

import io.swagger.v3.oas.models.OpenAPI;

/**
 * Creates one {@link OperationReflector} per document build session.
 */
public interface OperationReflectorFactory {

    /**
     * Creates a reflector writing into a new document with the configured OpenAPI version.
     */
    OperationReflector create();

    /**
     * Creates a reflector writing into an existing document. Schemas already present in its
     * components take precedence over reflected ones with the same name.
     */
    OperationReflector create(OpenAPI document);
}
