package com.reflector.service.impl;

import com.reflector.exception.OperationSetupException;
import com.reflector.exception.ReflectorException;
import com.reflector.model.BodyEncoding;
import com.reflector.model.FieldLocation;
import com.reflector.model.OperationContext;
import com.reflector.service.api.DefinitionRegistry;
import com.reflector.service.api.OperationReflector;
import com.reflector.service.api.ParameterExtractor;
import com.reflector.service.api.RequestBodyBuilder;
import com.reflector.service.api.ResponseBuilder;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Schema;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles operations of one document from the parameter, request body and response builders.
 */
@Slf4j
public class OperationReflectorImpl implements OperationReflector {

    private final OpenAPI document;
    private final DefinitionRegistry registry;
    private final ParameterExtractor parameterExtractor;
    private final RequestBodyBuilder requestBodyBuilder;
    private final ResponseBuilder responseBuilder;

    public OperationReflectorImpl(OpenAPI document, DefinitionRegistry registry, ParameterExtractor parameterExtractor,
                                  RequestBodyBuilder requestBodyBuilder, ResponseBuilder responseBuilder) {
        this.document = document;
        this.registry = registry;
        this.parameterExtractor = parameterExtractor;
        this.requestBodyBuilder = requestBodyBuilder;
        this.responseBuilder = responseBuilder;
    }

    /**
     * Runs every parameter location and both body encodings even when an earlier one fails, then
     * reports all failures together. Whatever was written before a failure stays on the operation.
     */
    @Override
    public void setupRequest(OperationContext context) {
        List<ReflectorException> errors = new ArrayList<>();

        for (FieldLocation location : FieldLocation.PARAMETER_LOCATIONS) {
            collectFailure(errors, () -> parameterExtractor.extractParameters(
                    context, location, context.requestMapping(location), registry));
        }
        collectFailure(errors, () -> requestBodyBuilder.buildRequestBody(
                context, BodyEncoding.JSON, context.getHttpMethod(), null, registry));
        collectFailure(errors, () -> requestBodyBuilder.buildRequestBody(
                context, BodyEncoding.FORM_DATA, context.getHttpMethod(), context.getReqFormDataMapping(), registry));

        if (!errors.isEmpty()) {
            throw new OperationSetupException(errors);
        }
    }

    @Override
    public void setRequest(Operation operation, Type input, String httpMethod) {
        setupRequest(OperationContext.builder()
                .operation(operation)
                .input(input)
                .httpMethod(httpMethod)
                .build());
    }

    @Override
    public void setupResponse(OperationContext context) {
        responseBuilder.buildResponse(context, registry);
    }

    @Override
    public void setJsonResponse(Operation operation, Type output, int httpStatus) {
        setupResponse(OperationContext.builder()
                .operation(operation)
                .output(output)
                .httpStatus(httpStatus)
                .build());
    }

    @Override
    public OpenAPI getDocument() {
        return document;
    }

    @Override
    public DefinitionRegistry getRegistry() {
        return registry;
    }

    @Override
    public Optional<Schema<?>> resolveSchemaRef(String ref) {
        return registry.resolve(ref);
    }

    private void collectFailure(List<ReflectorException> errors, Runnable step) {
        try {
            step.run();
        } catch (ReflectorException e) {
            log.debug("Request setup step failed: {}", e.getMessage());
            errors.add(e);
        }
    }
}
