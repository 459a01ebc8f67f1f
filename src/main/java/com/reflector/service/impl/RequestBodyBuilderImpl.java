package com.reflector.service.impl;

import com.reflector.config.ReflectorProperties;
import com.reflector.model.BodyEncoding;
import com.reflector.model.OperationContext;
import com.reflector.model.ReflectOptions;
import com.reflector.model.ReflectedSchema;
import com.reflector.model.RequestBodyEnforcer;
import com.reflector.service.api.DefinitionRegistry;
import com.reflector.service.api.RequestBodyBuilder;
import com.reflector.service.api.TypeInspector;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.parameters.RequestBody;
import java.lang.reflect.Type;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ResolvableType;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class RequestBodyBuilderImpl implements RequestBodyBuilder {

    private static final Set<HttpMethod> BODILESS_METHODS =
            Set.of(HttpMethod.GET, HttpMethod.HEAD, HttpMethod.DELETE, HttpMethod.TRACE);

    private final TypeInspector typeInspector;
    private final ReflectorProperties properties;

    public RequestBodyBuilderImpl(TypeInspector typeInspector, ReflectorProperties properties) {
        this.typeInspector = typeInspector;
        this.properties = properties;
    }

    @Override
    public void buildRequestBody(OperationContext context, BodyEncoding encoding, String httpMethod,
                                 Map<String, String> nameMapping, DefinitionRegistry registry) {
        Type input = context.getInput();
        if (input == null) {
            return;
        }
        if (isBodiless(httpMethod) && !forcesRequestBody(input)) {
            log.debug("Skipping {} request body of {} for {} method", encoding, input.getTypeName(), httpMethod);
            return;
        }
        if (!contributesBody(input, encoding, nameMapping)) {
            return;
        }

        String definitionPrefix = encoding == BodyEncoding.JSON ? "" : StringUtils.capitalize(encoding.location().tag());
        FileUploadInterceptor fileUploads = new FileUploadInterceptor(properties.getFileUploadTypes());

        ReflectedSchema reflected = typeInspector.reflect(input, ReflectOptions.builder()
                .operationContext(context.forProcessing(false, "body"))
                .definitionsPrefix(DefinitionRegistry.REF_PREFIX + definitionPrefix)
                .rootRef(true)
                .nameMapping(nameMapping)
                .propertyTag(encoding.location())
                .typeInterceptor(fileUploads)
                .build());

        reflected.definitions().forEach((name, schema) -> registry.collect(definitionPrefix + name, schema));

        String mimeType = encoding.mimeType();
        if (encoding == BodyEncoding.FORM_DATA && fileUploads.hasFileUpload()) {
            log.debug("Request body of {} contains a file upload, using {}", input.getTypeName(),
                    org.springframework.http.MediaType.MULTIPART_FORM_DATA_VALUE);
            mimeType = org.springframework.http.MediaType.MULTIPART_FORM_DATA_VALUE;
        }

        Operation operation = context.getOperation();
        if (operation.getRequestBody() == null) {
            operation.setRequestBody(new RequestBody());
        }
        if (operation.getRequestBody().getContent() == null) {
            operation.getRequestBody().setContent(new Content());
        }
        operation.getRequestBody().getContent().addMediaType(mimeType, new MediaType().schema(reflected.schema()));
    }

    /**
     * Form bodies need bound fields or a name mapping. JSON bodies may also be bare collections and
     * maps, or structures embedding one.
     */
    private boolean contributesBody(Type input, BodyEncoding encoding, Map<String, String> nameMapping) {
        if (TypeIntrospection.hasTaggedFields(input, encoding.location())
                || (nameMapping != null && !nameMapping.isEmpty())) {
            return true;
        }
        return encoding == BodyEncoding.JSON
                && (TypeIntrospection.isSliceOrMap(input) || TypeIntrospection.hasEmbeddedSliceOrMap(input));
    }

    private static boolean isBodiless(String httpMethod) {
        return StringUtils.hasText(httpMethod) && BODILESS_METHODS.contains(HttpMethod.valueOf(httpMethod.toUpperCase(Locale.ROOT)));
    }

    private static boolean forcesRequestBody(Type input) {
        return RequestBodyEnforcer.class.isAssignableFrom(ResolvableType.forType(input).resolve(Object.class));
    }
}
