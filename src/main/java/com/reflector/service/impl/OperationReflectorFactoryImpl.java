package com.reflector.service.impl;

import com.reflector.config.ReflectorProperties;
import com.reflector.service.api.OperationReflector;
import com.reflector.service.api.OperationReflectorFactory;
import com.reflector.service.api.ParameterExtractor;
import com.reflector.service.api.RequestBodyBuilder;
import com.reflector.service.api.ResponseBuilder;
import io.swagger.v3.oas.models.OpenAPI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OperationReflectorFactoryImpl implements OperationReflectorFactory {

    private final ParameterExtractor parameterExtractor;
    private final RequestBodyBuilder requestBodyBuilder;
    private final ResponseBuilder responseBuilder;
    private final ReflectorProperties properties;

    public OperationReflectorFactoryImpl(ParameterExtractor parameterExtractor, RequestBodyBuilder requestBodyBuilder,
                                         ResponseBuilder responseBuilder, ReflectorProperties properties) {
        this.parameterExtractor = parameterExtractor;
        this.requestBodyBuilder = requestBodyBuilder;
        this.responseBuilder = responseBuilder;
        this.properties = properties;
    }

    @Override
    public OperationReflector create() {
        log.info("Creating OpenAPI {} document", properties.getOpenapiVersion());
        return create(new OpenAPI().openapi(properties.getOpenapiVersion()));
    }

    @Override
    public OperationReflector create(OpenAPI document) {
        return new OperationReflectorImpl(document, new ComponentsDefinitionRegistry(document),
                parameterExtractor, requestBodyBuilder, responseBuilder);
    }
}
