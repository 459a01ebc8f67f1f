package com.reflector.service.api;

import com.reflector.model.ReflectContext;
import io.swagger.v3.oas.models.media.Schema;
import java.lang.reflect.Field;
import org.springframework.core.ResolvableType;

/**
 * Hook called for every property of the root type once its schema has been built.
 */
@FunctionalInterface
public interface PropertyInterceptor {

    /**
     * @param context        The reflection in progress.
     * @param name           The published property name.
     * @param field          The Java field behind the property.
     * @param type           The field type, resolved against the reflected root type.
     * @param propertySchema The property's schema.
     * @throws com.reflector.exception.ReflectorException to abort the reflection.
     */
    void intercept(ReflectContext context, String name, Field field, ResolvableType type, Schema<?> propertySchema);
}
