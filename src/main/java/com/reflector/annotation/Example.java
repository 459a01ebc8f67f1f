package com.reflector.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * An example value for a parameter or header. The text is converted to the parameter's schema
 * type, so {@code @Example("42")} on an {@code int} field is documented as the number 42.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Example {

    String value();
}
