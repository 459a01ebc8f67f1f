package com.reflector.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares that a type accepts no properties besides its own fields. The reflected schema gets
 * {@code additionalProperties: false}; when the type is an operation input, each parameter
 * location it is reflected for is flagged with an {@code x-forbid-unknown-<location>} extension.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ForbidUnknown {
}
