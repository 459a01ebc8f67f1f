package com.reflector.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes a field or a type. On a field the text ends up on the produced parameter, header or
 * property schema; on a type it becomes the schema description and, for response types, the
 * response description.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.FIELD})
public @interface Description {

    String value();
}
