package com.reflector.service.impl;

import com.reflector.annotation.Description;
import com.reflector.annotation.ForbidUnknown;
import com.reflector.annotation.Required;
import com.reflector.exception.ReflectorException;
import com.reflector.exception.SchemaReflectionException;
import com.reflector.model.FieldBinding;
import com.reflector.model.FieldLocation;
import com.reflector.model.ReflectContext;
import com.reflector.model.ReflectOptions;
import com.reflector.model.ReflectedSchema;
import com.reflector.service.api.PropertyInterceptor;
import com.reflector.service.api.TypeInspector;
import com.reflector.service.api.TypeInterceptor;
import io.swagger.v3.oas.models.media.Schema;
import jakarta.annotation.Nullable;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ResolvableType;
import org.springframework.stereotype.Service;

/**
 * Reflection based {@link TypeInspector}. Walks the fields of a type, maps JDK value types onto
 * schema types and formats, and hoists nested structures into named definitions.
 * <p>
 * Interceptors registered as Spring beans run before the ones passed with each call, in
 * {@link org.springframework.core.annotation.Order} order.
 */
@Service
@Slf4j
public class FieldTypeInspector implements TypeInspector {

    private static final Map<Class<?>, ScalarType> SCALARS = scalarTypes();

    private final List<TypeInterceptor> typeInterceptors;
    private final List<PropertyInterceptor> propertyInterceptors;

    @Autowired
    public FieldTypeInspector(ObjectProvider<TypeInterceptor> typeInterceptors,
                              ObjectProvider<PropertyInterceptor> propertyInterceptors) {
        this(typeInterceptors.orderedStream().collect(Collectors.toList()),
                propertyInterceptors.orderedStream().collect(Collectors.toList()));
    }

    public FieldTypeInspector(List<TypeInterceptor> typeInterceptors, List<PropertyInterceptor> propertyInterceptors) {
        this.typeInterceptors = List.copyOf(typeInterceptors);
        this.propertyInterceptors = List.copyOf(propertyInterceptors);
    }

    public FieldTypeInspector() {
        this(List.of(), List.of());
    }

    @Override
    public ReflectedSchema reflect(Type type, ReflectOptions options) {
        if (type == null) {
            throw new SchemaReflectionException("cannot reflect a null type");
        }
        Reflection reflection = new Reflection(options == null ? ReflectOptions.defaults() : options);
        return reflection.reflectRoot(ResolvableType.forType(type));
    }

    /**
     * State of one {@link #reflect} call.
     */
    private final class Reflection {

        private final ReflectOptions options;
        private final ReflectContext context;
        private final List<TypeInterceptor> typeHooks = new ArrayList<>();
        private final List<PropertyInterceptor> propertyHooks = new ArrayList<>();
        private final Map<String, Schema<?>> definitions = new LinkedHashMap<>();
        private final Set<Class<?>> inlineStack = new HashSet<>();

        Reflection(ReflectOptions options) {
            this.options = options;
            this.context = new ReflectContext(options);
            typeHooks.addAll(typeInterceptors);
            typeHooks.addAll(options.getTypeInterceptors());
            propertyHooks.addAll(propertyInterceptors);
            propertyHooks.addAll(options.getPropertyInterceptors());
        }

        ReflectedSchema reflectRoot(ResolvableType type) {
            ResolvableType root = TypeIntrospection.unwrapOptional(type);
            Class<?> raw = root.resolve(Object.class);
            String description = raw.isAnnotationPresent(Description.class)
                    ? raw.getAnnotation(Description.class).value()
                    : null;

            Schema<Object> schema = new Schema<>();
            if (intercept(root, null, schema)) {
                return new ReflectedSchema(schema, definitions, description);
            }
            if (!isStructure(raw)) {
                return new ReflectedSchema(describeValue(root, null, schema), definitions, description);
            }

            if (options.isRootRef() && !options.isInlineRefs()) {
                String name = definitionName(root);
                definitions.put(name, schema);
                describeStructure(root, raw, schema, true);
                return new ReflectedSchema(reference(name), definitions, description);
            }
            inlineStack.add(raw);
            describeStructure(root, raw, schema, true);
            return new ReflectedSchema(schema, definitions, description);
        }

        /**
         * Describes a nested type: a property type, a collection item or a map value.
         */
        private Schema<?> describe(ResolvableType type, Field field) {
            ResolvableType unwrapped = TypeIntrospection.unwrapOptional(type);
            Schema<Object> schema = new Schema<>();
            if (intercept(unwrapped, field, schema)) {
                return schema;
            }
            Class<?> raw = unwrapped.resolve(Object.class);
            if (!isStructure(raw)) {
                return describeValue(unwrapped, field, schema);
            }

            if (options.isInlineRefs()) {
                if (!inlineStack.add(raw)) {
                    // Recursive occurrence, no name to point at.
                    return schema.type("object");
                }
                describeStructure(unwrapped, raw, schema, false);
                inlineStack.remove(raw);
                return schema;
            }

            String name = definitionName(unwrapped);
            if (!definitions.containsKey(name)) {
                definitions.put(name, schema);
                describeStructure(unwrapped, raw, schema, false);
            }
            return reference(name);
        }

        private Schema<?> describeValue(ResolvableType type, Field field, Schema<Object> schema) {
            Class<?> raw = type.resolve(Object.class);

            ScalarType scalar = scalarType(raw);
            if (scalar != null) {
                schema.setType(scalar.type());
                schema.setFormat(scalar.format());
                return schema;
            }
            if (raw.isEnum()) {
                List<Object> values = Arrays.stream(raw.getEnumConstants())
                        .<Object>map(constant -> ((Enum<?>) constant).name())
                        .collect(Collectors.toList());
                schema.setType("string");
                schema.setEnum(values);
                return schema;
            }
            if (raw.isArray()) {
                schema.setType("array");
                schema.setItems(describe(type.getComponentType(), null));
                return schema;
            }
            if (Collection.class.isAssignableFrom(raw)) {
                schema.setType("array");
                schema.setItems(describe(type.asCollection().getGeneric(0), null));
                if (Set.class.isAssignableFrom(raw)) {
                    schema.setUniqueItems(true);
                }
                return schema;
            }
            if (Map.class.isAssignableFrom(raw)) {
                schema.setType("object");
                schema.setAdditionalProperties(describe(type.asMap().getGeneric(1), null));
                return schema;
            }
            if (raw == Object.class) {
                return schema;
            }
            throw new SchemaReflectionException("unsupported type " + type,
                    field == null ? null : field.getName(), null);
        }

        private void describeStructure(ResolvableType type, Class<?> raw, Schema<?> schema, boolean root) {
            schema.setType("object");
            if (raw.isAnnotationPresent(Description.class)) {
                schema.setDescription(raw.getAnnotation(Description.class).value());
            }

            // Location tag and name mapping select the root's fields, nested structures are JSON values.
            FieldLocation location = root ? options.getPropertyTag() : FieldLocation.JSON;
            Map<String, String> nameMapping = root ? options.getNameMapping() : Map.of();
            for (FieldBinding binding : TypeIntrospection.bindings(type, location, nameMapping)) {
                Field field = binding.field();
                Schema<?> propertySchema = describe(binding.type(), field);
                applyFieldOptions(field, binding.type(), propertySchema);
                schema.addProperty(binding.name(), propertySchema);
                if (isRequired(field, location)) {
                    schema.addRequiredItem(binding.name());
                }
                if (root) {
                    interceptProperty(binding.name(), field, binding.type(), propertySchema);
                }
            }

            if (raw.isAnnotationPresent(ForbidUnknown.class)) {
                schema.setAdditionalProperties(false);
            } else if (location == FieldLocation.JSON) {
                TypeIntrospection.anySetterField(type).ifPresent(anySetter ->
                        schema.setAdditionalProperties(describe(anySetter.type().asMap().getGeneric(1), null)));
            }
        }

        private void applyFieldOptions(Field field, ResolvableType type, Schema<?> propertySchema) {
            if (field.isAnnotationPresent(Description.class)) {
                propertySchema.setDescription(field.getAnnotation(Description.class).value());
            }
            if (field.isAnnotationPresent(Deprecated.class)) {
                propertySchema.setDeprecated(true);
            }
            if (field.isAnnotationPresent(Nullable.class) || type.resolve(Object.class) == Optional.class) {
                propertySchema.setNullable(true);
            }
        }

        private boolean isRequired(Field field, FieldLocation location) {
            if (location == FieldLocation.PATH) {
                return true;
            }
            Required required = field.getAnnotation(Required.class);
            return required != null && required.value();
        }

        private boolean intercept(ResolvableType type, Field field, Schema<?> schema) {
            for (TypeInterceptor interceptor : typeHooks) {
                try {
                    if (interceptor.intercept(context, type, field, schema)) {
                        return true;
                    }
                } catch (ReflectorException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new SchemaReflectionException("type interceptor failed on " + type + ": " + e.getMessage(),
                            field == null ? null : field.getName(), e);
                }
            }
            return false;
        }

        private void interceptProperty(String name, Field field, ResolvableType type, Schema<?> propertySchema) {
            for (PropertyInterceptor interceptor : propertyHooks) {
                try {
                    interceptor.intercept(context, name, field, type, propertySchema);
                } catch (ReflectorException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new SchemaReflectionException("property interceptor failed on " + name + ": " + e.getMessage(),
                            name, e);
                }
            }
        }

        private Schema<?> reference(String name) {
            return new Schema<>().$ref(options.getDefinitionsPrefix() + name);
        }
    }

    private static boolean isStructure(Class<?> raw) {
        return TypeIntrospection.isBeanType(raw) && !TypeIntrospection.isSliceOrMap(raw) && scalarType(raw) == null;
    }

    /**
     * Builds the definition name of a structure: the simple names of the enclosing classes and the
     * class itself, followed by the names of its generic arguments ({@code Page<Item>} is {@code PageItem}).
     */
    static String definitionName(ResolvableType type) {
        Class<?> raw = type.resolve(Object.class);
        StringBuilder name = new StringBuilder();
        if (raw.isArray()) {
            name.append(definitionName(type.getComponentType())).append("List");
        } else {
            for (Class<?> current = raw; current != null; current = current.getEnclosingClass()) {
                name.insert(0, current.getSimpleName());
            }
        }
        for (ResolvableType generic : type.getGenerics()) {
            name.append(generic.resolve() == null ? "Object" : definitionName(generic));
        }
        return name.toString();
    }

    private static ScalarType scalarType(Class<?> raw) {
        ScalarType scalar = SCALARS.get(raw);
        if (scalar != null) {
            return scalar;
        }
        if (CharSequence.class.isAssignableFrom(raw)) {
            return new ScalarType("string", null);
        }
        if (Date.class.isAssignableFrom(raw)) {
            return new ScalarType("string", "date-time");
        }
        return null;
    }

    private static Map<Class<?>, ScalarType> scalarTypes() {
        Map<Class<?>, ScalarType> scalars = new LinkedHashMap<>();
        ScalarType string = new ScalarType("string", null);
        ScalarType int32 = new ScalarType("integer", "int32");
        ScalarType int64 = new ScalarType("integer", "int64");
        ScalarType dateTime = new ScalarType("string", "date-time");
        scalars.put(String.class, string);
        scalars.put(char.class, string);
        scalars.put(Character.class, string);
        scalars.put(UUID.class, new ScalarType("string", "uuid"));
        scalars.put(boolean.class, new ScalarType("boolean", null));
        scalars.put(Boolean.class, new ScalarType("boolean", null));
        scalars.put(byte.class, int32);
        scalars.put(Byte.class, int32);
        scalars.put(short.class, int32);
        scalars.put(Short.class, int32);
        scalars.put(int.class, int32);
        scalars.put(Integer.class, int32);
        scalars.put(long.class, int64);
        scalars.put(Long.class, int64);
        scalars.put(BigInteger.class, new ScalarType("integer", null));
        scalars.put(float.class, new ScalarType("number", "float"));
        scalars.put(Float.class, new ScalarType("number", "float"));
        scalars.put(double.class, new ScalarType("number", "double"));
        scalars.put(Double.class, new ScalarType("number", "double"));
        scalars.put(BigDecimal.class, new ScalarType("number", null));
        scalars.put(LocalDate.class, new ScalarType("string", "date"));
        scalars.put(LocalTime.class, new ScalarType("string", "time"));
        scalars.put(Instant.class, dateTime);
        scalars.put(OffsetDateTime.class, dateTime);
        scalars.put(ZonedDateTime.class, dateTime);
        scalars.put(LocalDateTime.class, dateTime);
        scalars.put(byte[].class, new ScalarType("string", "byte"));
        scalars.put(URI.class, new ScalarType("string", "uri"));
        scalars.put(URL.class, new ScalarType("string", "uri"));
        return Map.copyOf(scalars);
    }

    private record ScalarType(String type, String format) {
    }
}
