package com.reflector.service.api;

import com.reflector.model.OperationContext;

/**
 * Describes the response of an operation for one status code: body content, response headers and
 * description.
 */
public interface ResponseBuilder {

    /**
     * Builds the response for {@code context.httpStatus} and stores it in the operation's responses,
     * replacing a previous entry for the same status code.
     *
     * @throws com.reflector.exception.ReflectorException if the output type cannot be described.
     */
    void buildResponse(OperationContext context, DefinitionRegistry registry);
}
