package com.reflector.service.api;

import com.reflector.model.ReflectOptions;
import com.reflector.model.ReflectedSchema;
import java.lang.reflect.Type;

/**
 * Turns a Java type into a schema fragment plus the named sub-schemas it references.
 */
public interface TypeInspector {

    /**
     * Reflects a type.
     *
     * @param type    A {@code Class} or parameterized type.
     * @param options Property selection, naming and interception options for this call.
     * @return The root schema with its named sub-schemas, keyed without the definitions prefix.
     * @throws com.reflector.exception.SchemaReflectionException if the type cannot be described.
     */
    ReflectedSchema reflect(Type type, ReflectOptions options);
}
