package com.reflector.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field as an HTTP header.
 * <p>
 * On an input type the field becomes a header parameter of the operation; on an output type it
 * becomes a response header.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface HeaderParam {

    /**
     * The header name, e.g. {@code X-Request-Id}. Defaults to the Java field name.
     */
    String value() default "";
}
