package com.reflector.model;

import io.swagger.v3.oas.models.media.Schema;
import java.util.Map;

/**
 * The result of reflecting a type: the root schema (inline, or a reference when root-ref was
 * requested), the named sub-schemas met on the way, and the root type's own description.
 *
 * @param schema      The root schema fragment.
 * @param definitions Named sub-schemas keyed by their unprefixed definition name, in discovery order.
 * @param description The root type's description, {@code null} when it declares none.
 */
public record ReflectedSchema(Schema<?> schema, Map<String, Schema<?>> definitions, String description) {

    /**
     * Tells whether the root schema declares a closed set of properties.
     */
    public boolean forbidsUnknownProperties() {
        return Boolean.FALSE.equals(schema.getAdditionalProperties());
    }
}
