package com.reflector.service.impl;

import com.reflector.config.ReflectorProperties;
import com.reflector.exception.ReflectorException;
import com.reflector.model.FieldLocation;
import com.reflector.model.OperationContext;
import com.reflector.model.ReflectOptions;
import com.reflector.model.ReflectedSchema;
import com.reflector.service.api.DefinitionRegistry;
import com.reflector.service.api.ResponseBuilder;
import com.reflector.service.api.TypeInspector;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class ResponseBuilderImpl implements ResponseBuilder {

    private final TypeInspector typeInspector;
    private final TrivialSchemaPolicy trivialSchemaPolicy;
    private final FieldOptionsPopulator fieldOptionsPopulator;
    private final ReflectorProperties properties;

    public ResponseBuilderImpl(TypeInspector typeInspector, TrivialSchemaPolicy trivialSchemaPolicy,
                               FieldOptionsPopulator fieldOptionsPopulator, ReflectorProperties properties) {
        this.typeInspector = typeInspector;
        this.trivialSchemaPolicy = trivialSchemaPolicy;
        this.fieldOptionsPopulator = fieldOptionsPopulator;
        this.properties = properties;
    }

    @Override
    public void buildResponse(OperationContext context, DefinitionRegistry registry) {
        ApiResponse response = new ApiResponse();
        String contentType = context.getRespContentType() == null
                ? ""
                : context.getRespContentType().split(";")[0].trim();

        if (context.getOutput() != null) {
            OperationContext resolved = context.toBuilder().respContentType(contentType).build();
            addBody(response, resolved, registry);
            addHeaders(response, resolved);
        }

        // A requested content type is advertised even without a body schema.
        if (!contentType.isEmpty()) {
            ensureContentType(response, contentType);
        }

        if (!StringUtils.hasLength(response.getDescription())) {
            response.setDescription(statusText(context.getHttpStatus()));
        }

        Operation operation = context.getOperation();
        if (operation.getResponses() == null) {
            operation.setResponses(new ApiResponses());
        }
        operation.getResponses().addApiResponse(String.valueOf(context.getHttpStatus()), response);
    }

    private void addBody(ApiResponse response, OperationContext context, DefinitionRegistry registry) {
        if (!hasMeaningfulSchema(context.getOutput())) {
            log.debug("Response type {} adds no schema information, skipping body", context.getOutput().getTypeName());
            return;
        }

        ReflectedSchema reflected = typeInspector.reflect(context.getOutput(), ReflectOptions.builder()
                .operationContext(context.forProcessing(true, "body"))
                .rootRef(true)
                .definitionsPrefix(DefinitionRegistry.REF_PREFIX)
                .build());
        reflected.definitions().forEach(registry::collect);

        Schema<?> schema = reflected.schema();
        schema.setNullable(null);

        String contentType = StringUtils.hasLength(context.getRespContentType())
                ? context.getRespContentType()
                : properties.getDefaultResponseContentType();
        if (response.getContent() == null) {
            response.setContent(new Content());
        }
        response.getContent().addMediaType(contentType, new MediaType().schema(schema));

        if (reflected.description() != null && !StringUtils.hasLength(response.getDescription())) {
            response.setDescription(reflected.description());
        }
    }

    private void addHeaders(ApiResponse response, OperationContext context) {
        Map<String, Header> headers = new LinkedHashMap<>();

        ReflectedSchema reflected = typeInspector.reflect(context.getOutput(), ReflectOptions.builder()
                .operationContext(context.forProcessing(true, FieldLocation.HEADER.tag()))
                .inlineRefs(true)
                .nameMapping(context.getRespHeaderMapping())
                .propertyTag(FieldLocation.HEADER)
                .propertyInterceptor((reflectContext, name, field, fieldType, propertySchema) -> {
                    Header header = new Header()
                            .description(propertySchema.getDescription())
                            .deprecated(propertySchema.getDeprecated())
                            .schema(propertySchema);
                    fieldOptionsPopulator.populate(header, name, field, propertySchema);
                    headers.put(name, header);
                })
                .build());

        response.setHeaders(headers.isEmpty() ? null : headers);

        if (reflected.description() != null && !StringUtils.hasLength(response.getDescription())) {
            response.setDescription(reflected.description());
        }
    }

    /**
     * Tells whether the output type reflects to anything more than an empty or bare object schema.
     * A type that cannot be reflected here is treated as meaningful, the body step reports the failure.
     */
    private boolean hasMeaningfulSchema(Type output) {
        try {
            ReflectedSchema reflected = typeInspector.reflect(output, ReflectOptions.defaults());
            return !trivialSchemaPolicy.isTrivial(reflected.schema());
        } catch (ReflectorException e) {
            log.debug("Could not check response schema of {}: {}", output.getTypeName(), e.getMessage());
            return true;
        }
    }

    private void ensureContentType(ApiResponse response, String contentType) {
        if (response.getContent() == null) {
            response.setContent(new Content());
        }
        if (!response.getContent().containsKey(contentType)) {
            response.getContent().addMediaType(contentType, new MediaType().schema(new Schema<>()));
        }
    }

    private static String statusText(int httpStatus) {
        HttpStatus status = HttpStatus.resolve(httpStatus);
        return status == null ? "" : status.getReasonPhrase();
    }
}
