package com.reflector.model;

import com.reflector.service.api.DefinitionRegistry;
import com.reflector.service.api.PropertyInterceptor;
import com.reflector.service.api.TypeInterceptor;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Options of a single {@link com.reflector.service.api.TypeInspector#reflect} call.
 */
@Getter
@Builder(toBuilder = true)
public class ReflectOptions {

    /**
     * Which fields of the root type become properties and under which name: fields annotated for
     * this location, or for {@link FieldLocation#JSON}, every field without a non-JSON binding
     * annotation. Nested structures always select their JSON fields.
     */
    @Builder.Default
    private final FieldLocation propertyTag = FieldLocation.JSON;

    /**
     * Java field name to property name overrides for the root type. A mapped field is selected even
     * when it carries no annotation for {@link #propertyTag}.
     */
    @Builder.Default
    private final Map<String, String> nameMapping = Map.of();

    /**
     * Prefix of the {@code $ref} pointers emitted for named sub-schemas.
     */
    @Builder.Default
    private final String definitionsPrefix = DefinitionRegistry.REF_PREFIX;

    /**
     * Hoist the root type into the definitions as well and return a reference to it.
     */
    private final boolean rootRef;

    /**
     * Inline nested types instead of hoisting them into named definitions.
     */
    private final boolean inlineRefs;

    /**
     * Hooks called before a type is reflected, after the inspector's globally registered ones.
     */
    @Singular
    private final List<TypeInterceptor> typeInterceptors;

    /**
     * Hooks called for every property of the root type, after the inspector's globally registered ones.
     */
    @Singular
    private final List<PropertyInterceptor> propertyInterceptors;

    /**
     * The operation being described, with its processing marker set; {@code null} outside an operation.
     */
    private final OperationContext operationContext;

    public static ReflectOptions defaults() {
        return ReflectOptions.builder().build();
    }

    public Map<String, String> getNameMapping() {
        return nameMapping == null ? Map.of() : nameMapping;
    }
}
