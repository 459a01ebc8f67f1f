package com.reflector.model;

import java.lang.reflect.Field;
import org.springframework.core.ResolvableType;

/**
 * A field selected for a location, together with the property name it is published under and
 * its type resolved against the declaring type's generics.
 *
 * @param name  The published property name.
 * @param field The Java field.
 * @param type  The field type with type variables resolved where possible.
 */
public record FieldBinding(String name, Field field, ResolvableType type) {
}
