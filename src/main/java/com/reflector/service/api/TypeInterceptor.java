package com.reflector.service.api;

import com.reflector.model.ReflectContext;
import io.swagger.v3.oas.models.media.Schema;
import java.lang.reflect.Field;
import org.springframework.core.ResolvableType;

/**
 * Hook called before the inspector reflects a type. Register one as a Spring bean to apply it to
 * every reflection, or pass it in {@link com.reflector.model.ReflectOptions} for a single call.
 */
@FunctionalInterface
public interface TypeInterceptor {

    /**
     * @param context The reflection in progress.
     * @param type    The type about to be reflected.
     * @param field   The field declaring the type, {@code null} for the root type and for
     *                collection items or map values.
     * @param schema  The empty schema the type is reflected into; the interceptor may fill it.
     * @return {@code true} when the schema is complete and default handling must be skipped.
     */
    boolean intercept(ReflectContext context, ResolvableType type, Field field, Schema<?> schema);
}
