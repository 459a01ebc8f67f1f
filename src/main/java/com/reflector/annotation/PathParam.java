package com.reflector.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field as a path template parameter (<code>/items/{id}</code>).
 * <p>
 * Path parameters are always documented as required, whatever the field's other annotations say.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface PathParam {

    /**
     * The name of the path template variable. Defaults to the Java field name.
     */
    String value() default "";
}
