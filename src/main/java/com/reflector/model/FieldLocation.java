package com.reflector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reflector.annotation.CookieParam;
import com.reflector.annotation.FormField;
import com.reflector.annotation.HeaderParam;
import com.reflector.annotation.PathParam;
import com.reflector.annotation.QueryParam;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.List;
import java.util.Optional;

/**
 * The transmission channels a field of an input or output type can be bound to.
 * <p>
 * The first four are parameter locations and their {@link #tag()} is the OpenAPI {@code in} value.
 * {@link #FORM_DATA} and {@link #JSON} are request body encodings.
 */
public enum FieldLocation {

    QUERY("query", QueryParam.class),
    PATH("path", PathParam.class),
    COOKIE("cookie", CookieParam.class),
    HEADER("header", HeaderParam.class),
    FORM_DATA("formData", FormField.class),
    JSON("json", JsonProperty.class);

    /**
     * Parameter locations in the order an operation's parameters are extracted.
     */
    public static final List<FieldLocation> PARAMETER_LOCATIONS = List.of(QUERY, PATH, COOKIE, HEADER);

    private static final List<Class<? extends Annotation>> BINDING_ANNOTATIONS = List.of(
            QueryParam.class, PathParam.class, CookieParam.class, HeaderParam.class, FormField.class);

    private final String tag;
    private final Class<? extends Annotation> annotationType;

    FieldLocation(String tag, Class<? extends Annotation> annotationType) {
        this.tag = tag;
        this.annotationType = annotationType;
    }

    public String tag() {
        return tag;
    }

    public Class<? extends Annotation> annotationType() {
        return annotationType;
    }

    public boolean isParameter() {
        return PARAMETER_LOCATIONS.contains(this);
    }

    /**
     * Returns the name a field declares for this location, the Java field name when the
     * annotation leaves it blank, or empty when the field is not annotated for this location.
     */
    public Optional<String> declaredName(Field field) {
        String name = switch (this) {
            case QUERY -> field.isAnnotationPresent(QueryParam.class) ? field.getAnnotation(QueryParam.class).value() : null;
            case PATH -> field.isAnnotationPresent(PathParam.class) ? field.getAnnotation(PathParam.class).value() : null;
            case COOKIE -> field.isAnnotationPresent(CookieParam.class) ? field.getAnnotation(CookieParam.class).value() : null;
            case HEADER -> field.isAnnotationPresent(HeaderParam.class) ? field.getAnnotation(HeaderParam.class).value() : null;
            case FORM_DATA -> field.isAnnotationPresent(FormField.class) ? field.getAnnotation(FormField.class).value() : null;
            case JSON -> field.isAnnotationPresent(JsonProperty.class) ? field.getAnnotation(JsonProperty.class).value() : null;
        };
        if (name == null) {
            return Optional.empty();
        }
        return Optional.of(name.isEmpty() ? field.getName() : name);
    }

    /**
     * Tells whether a field carries any of the non-JSON binding annotations. Fields without one
     * are JSON properties by default.
     */
    public static boolean hasBindingAnnotation(Field field) {
        return BINDING_ANNOTATIONS.stream().anyMatch(field::isAnnotationPresent);
    }
}
