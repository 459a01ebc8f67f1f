package com.reflector.service.impl;

import com.reflector.annotation.CollectionFormat;
import com.reflector.exception.DuplicateParameterException;
import com.reflector.model.FieldLocation;
import com.reflector.model.OperationContext;
import com.reflector.model.ReflectOptions;
import com.reflector.model.ReflectedSchema;
import com.reflector.service.api.DefinitionRegistry;
import com.reflector.service.api.ParameterExtractor;
import com.reflector.service.api.TypeInspector;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import java.lang.reflect.Field;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ResolvableType;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ParameterExtractorImpl implements ParameterExtractor {

    /**
     * Prefix of the operation extension flagging a location that rejects unknown parameters.
     */
    public static final String FORBID_UNKNOWN_EXTENSION = "x-forbid-unknown-";

    private final TypeInspector typeInspector;
    private final FieldOptionsPopulator fieldOptionsPopulator;

    public ParameterExtractorImpl(TypeInspector typeInspector, FieldOptionsPopulator fieldOptionsPopulator) {
        this.typeInspector = typeInspector;
        this.fieldOptionsPopulator = fieldOptionsPopulator;
    }

    @Override
    public void extractParameters(OperationContext context, FieldLocation location, Map<String, String> nameMapping,
                                  DefinitionRegistry registry) {
        if (!location.isParameter()) {
            throw new IllegalArgumentException(location + " is not a parameter location");
        }
        if (context.getInput() == null || TypeIntrospection.isSliceOrMap(context.getInput())) {
            return;
        }

        OperationContext marked = context.forProcessing(false, location.tag());
        ReflectOptions options = ReflectOptions.builder()
                .operationContext(marked)
                .propertyTag(location)
                .nameMapping(nameMapping)
                .propertyInterceptor((reflectContext, name, field, fieldType, propertySchema) ->
                        addParameter(marked, location, name, field, fieldType, propertySchema, registry))
                .build();

        ReflectedSchema reflected = typeInspector.reflect(context.getInput(), options);
        reflected.definitions().forEach(registry::collect);

        if (reflected.forbidsUnknownProperties()) {
            context.getOperation().addExtension(FORBID_UNKNOWN_EXTENSION + location.tag(), true);
        }
    }

    private void addParameter(OperationContext context, FieldLocation location, String name, Field field,
                              ResolvableType type, Schema<?> propertySchema, DefinitionRegistry registry) {
        propertySchema.setNullable(null);

        Parameter parameter = new Parameter()
                .name(name)
                .in(location.tag())
                .description(propertySchema.getDescription())
                .schema(propertySchema);

        CollectionFormat collectionFormat = field.getAnnotation(CollectionFormat.class);
        if (collectionFormat != null) {
            switch (collectionFormat.value()) {
                case CSV -> parameter.style(Parameter.StyleEnum.FORM).explode(false);
                case SSV -> parameter.style(Parameter.StyleEnum.SPACEDELIMITED).explode(false);
                case PIPES -> parameter.style(Parameter.StyleEnum.PIPEDELIMITED).explode(false);
                case MULTI -> parameter.style(Parameter.StyleEnum.FORM).explode(true);
            }
        }

        ResolvableType fieldType = TypeIntrospection.unwrapOptional(type);
        if (TypeIntrospection.hasTaggedFields(fieldType, FieldLocation.JSON)) {
            // Structured value sent as one JSON encoded parameter.
            ReflectedSchema content = typeInspector.reflect(fieldType.getType(), ReflectOptions.builder()
                    .operationContext(context)
                    .rootRef(true)
                    .build());
            content.definitions().forEach(registry::collect);
            parameter.setSchema(null);
            parameter.setContent(new Content().addMediaType(
                    org.springframework.http.MediaType.APPLICATION_JSON_VALUE, new MediaType().schema(content.schema())));
        } else {
            ReflectedSchema inline = typeInspector.reflect(fieldType.getType(), ReflectOptions.builder()
                    .operationContext(context)
                    .inlineRefs(true)
                    .build());
            if ("object".equals(inline.schema().getType())) {
                log.debug("Parameter '{}' in {} uses deepObject style", name, location.tag());
                parameter.style(Parameter.StyleEnum.DEEPOBJECT).explode(true);
            }
        }

        fieldOptionsPopulator.populate(parameter, field, propertySchema);

        if (location == FieldLocation.PATH) {
            parameter.setRequired(true);
        }

        Operation operation = context.getOperation();
        if (operation.getParameters() != null && operation.getParameters().stream()
                .anyMatch(existing -> location.tag().equals(existing.getIn()) && name.equals(existing.getName()))) {
            throw new DuplicateParameterException(name, location.tag());
        }
        operation.addParametersItem(parameter);
    }
}
