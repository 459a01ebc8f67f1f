package com.reflector.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field as a form body field, sent either as
 * {@code application/x-www-form-urlencoded} or, when the type carries a file upload, as
 * {@code multipart/form-data}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface FormField {

    /**
     * The form field name. Defaults to the Java field name.
     */
    String value() default "";
}
