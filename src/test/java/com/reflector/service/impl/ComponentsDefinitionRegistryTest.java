package com.reflector.service.impl;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentsDefinitionRegistryTest {

    @Test
    void collect_shouldCreateComponentsOnFirstWrite() {
        OpenAPI document = new OpenAPI();
        ComponentsDefinitionRegistry registry = new ComponentsDefinitionRegistry(document);

        assertThat(registry.definitions()).isEmpty();
        assertThat(registry.collect("Item", new Schema<>().type("object"))).isTrue();

        assertThat(document.getComponents().getSchemas()).containsOnlyKeys("Item");
        assertThat(registry.contains("Item")).isTrue();
    }

    @Test
    void collect_shouldKeepFirstWrittenSchema() {
        ComponentsDefinitionRegistry registry = new ComponentsDefinitionRegistry(new OpenAPI());
        Schema<?> first = new Schema<>().type("object").description("first");
        Schema<?> second = new Schema<>().type("string");

        registry.collect("Item", first);
        boolean added = registry.collect("Item", second);

        assertThat(added).isFalse();
        assertThat(registry.definitions()).hasSize(1);
        assertThat(registry.definitions().get("Item")).isSameAs(first);
    }

    @Test
    void collect_shouldNotOverrideSchemasAlreadyInDocument() {
        Map<String, Schema> schemas = new LinkedHashMap<>();
        Schema<?> handWritten = new Schema<>().type("object").description("hand written");
        schemas.put("Item", handWritten);
        OpenAPI document = new OpenAPI().components(new Components().schemas(schemas));
        ComponentsDefinitionRegistry registry = new ComponentsDefinitionRegistry(document);

        registry.collect("Item", new Schema<>().type("object"));
        registry.collect("Tag", new Schema<>().type("string"));

        assertThat(document.getComponents().getSchemas()).containsOnlyKeys("Item", "Tag");
        assertThat(document.getComponents().getSchemas().get("Item")).isSameAs(handWritten);
    }

    @Test
    void resolve_shouldFindRegisteredSchemasByReference() {
        ComponentsDefinitionRegistry registry = new ComponentsDefinitionRegistry(new OpenAPI());
        Schema<?> item = new Schema<>().type("object");
        registry.collect("Item", item);

        assertThat(registry.resolve("#/components/schemas/Item")).containsSame(item);
        assertThat(registry.resolve("#/components/schemas/Missing")).isEmpty();
        assertThat(registry.resolve("#/definitions/Item")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
    }

    @Test
    void definitions_shouldBeReadOnly() {
        ComponentsDefinitionRegistry registry = new ComponentsDefinitionRegistry(new OpenAPI());
        registry.collect("Item", new Schema<>().type("object"));

        assertThatThrownBy(() -> registry.definitions().put("Tag", new Schema<>()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
