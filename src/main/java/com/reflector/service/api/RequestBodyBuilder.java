package com.reflector.service.api;

import com.reflector.model.BodyEncoding;
import com.reflector.model.OperationContext;
import java.util.Map;

/**
 * Decides whether an input type contributes a request body in one encoding and, if so, writes the
 * matching content entry into the operation's request body.
 */
public interface RequestBodyBuilder {

    /**
     * @param context     The operation being described.
     * @param encoding    The body encoding to build.
     * @param httpMethod  The operation's HTTP method, case-insensitive.
     * @param nameMapping Java field name to property name overrides, may be {@code null}.
     * @param registry    The document's definition registry.
     * @throws com.reflector.exception.SchemaReflectionException if the input type cannot be described.
     */
    void buildRequestBody(OperationContext context, BodyEncoding encoding, String httpMethod,
                          Map<String, String> nameMapping, DefinitionRegistry registry);
}
