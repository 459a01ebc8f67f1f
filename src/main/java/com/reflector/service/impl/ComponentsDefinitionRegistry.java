package com.reflector.service.impl;

import com.reflector.service.api.DefinitionRegistry;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link DefinitionRegistry} backed by the {@code components.schemas} section of an OpenAPI document.
 * Schemas already present in the document when the registry is created take precedence.
 */
@Slf4j
public class ComponentsDefinitionRegistry implements DefinitionRegistry {

    private final OpenAPI document;

    public ComponentsDefinitionRegistry(OpenAPI document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    @Override
    public boolean collect(String name, Schema<?> schema) {
        Map<String, Schema> schemas = schemas();
        Schema<?> existing = schemas.get(name);
        if (existing != null) {
            if (!existing.equals(schema)) {
                log.warn("Schema '{}' is already defined, ignoring a different definition with the same name", name);
            }
            return false;
        }
        schemas.put(name, schema);
        log.debug("Registered schema '{}'", name);
        return true;
    }

    @Override
    public boolean contains(String name) {
        return document.getComponents() != null
                && document.getComponents().getSchemas() != null
                && document.getComponents().getSchemas().containsKey(name);
    }

    @Override
    public Optional<Schema<?>> resolve(String ref) {
        if (ref == null || !ref.startsWith(REF_PREFIX) || !contains(ref.substring(REF_PREFIX.length()))) {
            return Optional.empty();
        }
        return Optional.of(document.getComponents().getSchemas().get(ref.substring(REF_PREFIX.length())));
    }

    @Override
    public Map<String, Schema<?>> definitions() {
        Map<String, Schema<?>> definitions = new LinkedHashMap<>();
        if (document.getComponents() != null && document.getComponents().getSchemas() != null) {
            document.getComponents().getSchemas().forEach(definitions::put);
        }
        return Collections.unmodifiableMap(definitions);
    }

    private Map<String, Schema> schemas() {
        if (document.getComponents() == null) {
            document.setComponents(new Components());
        }
        if (document.getComponents().getSchemas() == null) {
            document.getComponents().setSchemas(new LinkedHashMap<>());
        }
        return document.getComponents().getSchemas();
    }
}
