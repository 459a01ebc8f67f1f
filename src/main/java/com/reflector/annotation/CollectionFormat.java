package com.reflector.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Selects how a multi-valued parameter is serialized, using the Swagger 2 collection format names.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface CollectionFormat {

    Format value();

    enum Format {
        /** Comma separated values, {@code style: form, explode: false}. */
        CSV,
        /** Space separated values, {@code style: spaceDelimited, explode: false}. */
        SSV,
        /** Pipe separated values, {@code style: pipeDelimited, explode: false}. */
        PIPES,
        /** One parameter instance per value, {@code style: form, explode: true}. */
        MULTI
    }
}
