package com.reflector.service.impl;

import com.reflector.annotation.Description;
import com.reflector.annotation.Example;
import com.reflector.annotation.Required;
import com.reflector.exception.FieldPopulationException;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import java.lang.reflect.Field;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Copies the declarative field options ({@link Description}, {@link Required}, {@link Deprecated}
 * and {@link Example}) onto parameter and header descriptors.
 */
@Component
public class FieldOptionsPopulator {

    public void populate(Parameter parameter, Field field, Schema<?> schema) {
        if (field.isAnnotationPresent(Description.class)) {
            parameter.setDescription(field.getAnnotation(Description.class).value());
        }
        if (field.isAnnotationPresent(Required.class)) {
            parameter.setRequired(field.getAnnotation(Required.class).value());
        }
        if (field.isAnnotationPresent(Deprecated.class)) {
            parameter.setDeprecated(true);
        }
        if (field.isAnnotationPresent(Example.class)) {
            parameter.setExample(parseExample(parameter.getName(), field.getAnnotation(Example.class).value(), schema));
        }
    }

    public void populate(Header header, String name, Field field, Schema<?> schema) {
        if (field.isAnnotationPresent(Description.class)) {
            header.setDescription(field.getAnnotation(Description.class).value());
        }
        if (field.isAnnotationPresent(Required.class)) {
            header.setRequired(field.getAnnotation(Required.class).value());
        }
        if (field.isAnnotationPresent(Deprecated.class)) {
            header.setDeprecated(true);
        }
        if (field.isAnnotationPresent(Example.class)) {
            header.setExample(parseExample(name, field.getAnnotation(Example.class).value(), schema));
        }
    }

    /**
     * Converts an example to the value type of the schema it illustrates. Values of referenced or
     * untyped schemas stay strings.
     *
     * @throws FieldPopulationException if the value does not match the schema type.
     */
    Object parseExample(String name, String value, Schema<?> schema) {
        String type = schema == null ? null : schema.getType();
        try {
            if ("integer".equals(type)) {
                return Long.valueOf(value.trim());
            }
            if ("number".equals(type)) {
                return new BigDecimal(value.trim());
            }
        } catch (NumberFormatException e) {
            throw new FieldPopulationException(name, "invalid " + type + " example '" + value + "' for " + name, e);
        }
        if ("boolean".equals(type)) {
            if ("true".equals(value) || "false".equals(value)) {
                return Boolean.valueOf(value);
            }
            throw new FieldPopulationException(name, "invalid boolean example '" + value + "' for " + name, null);
        }
        return value;
    }
}
