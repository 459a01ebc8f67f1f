package com.reflector.service.api;

import com.reflector.model.OperationContext;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Schema;
import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Describes API operations from their request and response types into one OpenAPI document.
 * <p>
 * A reflector is bound to a single document and its {@link DefinitionRegistry}. It is not
 * thread-safe: operations of one document must be built sequentially, or callers must serialize
 * access to the reflector.
 */
public interface OperationReflector {

    /**
     * Describes the request side of an operation: query, path, cookie and header parameters, then
     * the JSON and form request bodies.
     *
     * @throws com.reflector.exception.OperationSetupException carrying every individual failure.
     */
    void setupRequest(OperationContext context);

    /**
     * Shorthand for {@link #setupRequest} without name mappings.
     */
    void setRequest(Operation operation, Type input, String httpMethod);

    /**
     * Describes one response of an operation.
     *
     * @throws com.reflector.exception.ReflectorException if the output type cannot be described.
     */
    void setupResponse(OperationContext context);

    /**
     * Shorthand for {@link #setupResponse} with the default content type.
     */
    void setJsonResponse(Operation operation, Type output, int httpStatus);

    /**
     * Returns the document this reflector writes into.
     */
    OpenAPI getDocument();

    DefinitionRegistry getRegistry();

    /**
     * Resolves a {@code #/components/schemas/...} reference against this document.
     */
    Optional<Schema<?>> resolveSchemaRef(String ref);
}
