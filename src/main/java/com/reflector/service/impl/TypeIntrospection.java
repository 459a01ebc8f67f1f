package com.reflector.service.impl;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.reflector.model.FieldBinding;
import com.reflector.model.FieldLocation;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.core.ResolvableType;

/**
 * Static helpers answering structural questions about Java types: which fields bind to a location,
 * whether a type is a bare collection or map, and whether it embeds one.
 */
final class TypeIntrospection {

    private TypeIntrospection() {
    }

    /**
     * Tells whether a type is an array, a collection or a map, including classes extending one.
     */
    static boolean isSliceOrMap(Type type) {
        Class<?> raw = ResolvableType.forType(type).resolve(Object.class);
        return isSliceOrMap(raw);
    }

    static boolean isSliceOrMap(Class<?> raw) {
        return (raw.isArray() && raw != byte[].class)
                || Collection.class.isAssignableFrom(raw)
                || Map.class.isAssignableFrom(raw);
    }

    /**
     * Tells whether a class is a user-declared structure whose fields can be turned into properties.
     */
    static boolean isBeanType(Class<?> raw) {
        if (raw.isPrimitive() || raw.isArray() || raw.isEnum() || raw.isInterface() || raw.isAnnotation()) {
            return false;
        }
        String name = raw.getName();
        return !name.startsWith("java.") && !name.startsWith("javax.") && !name.startsWith("jdk.")
                && !name.startsWith("sun.");
    }

    /**
     * Tells whether a type declares at least one field bound to a location. {@code Optional} wrappers
     * are looked through.
     */
    static boolean hasTaggedFields(Type type, FieldLocation location) {
        return hasTaggedFields(ResolvableType.forType(type), location);
    }

    static boolean hasTaggedFields(ResolvableType type, FieldLocation location) {
        ResolvableType unwrapped = unwrapOptional(type);
        Class<?> raw = unwrapped.resolve(Object.class);
        if (!isBeanType(raw) || isSliceOrMap(raw)) {
            return false;
        }
        return !bindings(unwrapped, location, Map.of()).isEmpty();
    }

    /**
     * Tells whether a structure carries its own collection of unnamed entries: a {@link JsonAnySetter}
     * map, possibly reached through {@link JsonUnwrapped} fields.
     */
    static boolean hasEmbeddedSliceOrMap(Type type) {
        return anySetterField(ResolvableType.forType(type)).isPresent();
    }

    /**
     * Returns the {@link JsonAnySetter} map field of a structure, searching unwrapped fields and superclasses.
     */
    static Optional<FieldBinding> anySetterField(ResolvableType type) {
        Class<?> raw = type.resolve(Object.class);
        if (!isBeanType(raw) || isSliceOrMap(raw)) {
            return Optional.empty();
        }
        for (Field field : declaredFields(raw)) {
            if (!isCandidate(field)) {
                continue;
            }
            ResolvableType fieldType = ResolvableType.forField(field, type);
            if (field.isAnnotationPresent(JsonAnySetter.class) && Map.class.isAssignableFrom(field.getType())) {
                return Optional.of(new FieldBinding(field.getName(), field, fieldType));
            }
            if (field.isAnnotationPresent(JsonUnwrapped.class)) {
                Optional<FieldBinding> nested = anySetterField(fieldType);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Lists the fields of a structure bound to a location, in declaration order with superclass
     * fields first and {@link JsonUnwrapped} fields flattened in place.
     * <p>
     * A field is selected when the name mapping names it, when it carries the location's annotation,
     * or, for {@link FieldLocation#JSON}, when it carries no other binding annotation.
     */
    static List<FieldBinding> bindings(ResolvableType type, FieldLocation location, Map<String, String> nameMapping) {
        List<FieldBinding> result = new ArrayList<>();
        collectBindings(type, location, nameMapping == null ? Map.of() : nameMapping, result);
        return result;
    }

    private static void collectBindings(ResolvableType type, FieldLocation location, Map<String, String> nameMapping,
                                        List<FieldBinding> result) {
        Class<?> raw = type.resolve(Object.class);
        for (Field field : declaredFields(raw)) {
            if (!isCandidate(field) || field.isAnnotationPresent(JsonAnySetter.class)) {
                continue;
            }
            ResolvableType fieldType = ResolvableType.forField(field, type);
            if (field.isAnnotationPresent(JsonUnwrapped.class) && isBeanType(fieldType.resolve(Object.class))) {
                collectBindings(fieldType, location, nameMapping, result);
                continue;
            }
            propertyName(field, location, nameMapping)
                    .ifPresent(name -> result.add(new FieldBinding(name, field, fieldType)));
        }
    }

    private static Optional<String> propertyName(Field field, FieldLocation location, Map<String, String> nameMapping) {
        String mapped = nameMapping.get(field.getName());
        if (mapped != null) {
            return Optional.of(mapped);
        }
        Optional<String> declared = location.declaredName(field);
        if (declared.isPresent()) {
            return declared;
        }
        if (location == FieldLocation.JSON && !FieldLocation.hasBindingAnnotation(field)) {
            return Optional.of(field.getName());
        }
        return Optional.empty();
    }

    private static boolean isCandidate(Field field) {
        int modifiers = field.getModifiers();
        return !Modifier.isStatic(modifiers)
                && !Modifier.isTransient(modifiers)
                && !field.isSynthetic()
                && !field.isAnnotationPresent(JsonIgnore.class);
    }

    /**
     * Returns the fields of a class and its superclasses, superclass fields first.
     */
    private static List<Field> declaredFields(Class<?> raw) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> current = raw; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.add(0, current);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> current : hierarchy) {
            fields.addAll(List.of(current.getDeclaredFields()));
        }
        return fields;
    }

    /**
     * Returns the wrapped type of an {@code Optional}, or the type itself.
     */
    static ResolvableType unwrapOptional(ResolvableType type) {
        if (type.resolve(Object.class) == Optional.class) {
            return type.getGeneric(0);
        }
        return type;
    }
}
