package com.reflector.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reflector.config.ReflectorProperties;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.media.Schema;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides whether a reflected response schema carries any information worth publishing as a
 * response body.
 * <p>
 * The schema is serialized with the swagger {@link Json} mapper, stripped of the configured
 * non-constraining keywords and of {@code x-} extensions, and compared with the configured
 * trivial patterns.
 */
@Component
public class TrivialSchemaPolicy {

    private final List<JsonNode> trivialPatterns = new ArrayList<>();
    private final List<String> nonConstrainingKeywords;

    public TrivialSchemaPolicy(ReflectorProperties properties) {
        for (String pattern : properties.getTrivialSchemaPatterns()) {
            try {
                trivialPatterns.add(Json.mapper().readTree(pattern));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Invalid trivial schema pattern: " + pattern, e);
            }
        }
        this.nonConstrainingKeywords = List.copyOf(properties.getNonConstrainingKeywords());
    }

    public boolean isTrivial(Schema<?> schema) {
        JsonNode node = Json.mapper().valueToTree(schema);
        if (node instanceof ObjectNode objectNode) {
            List<String> extensions = new ArrayList<>();
            objectNode.fieldNames().forEachRemaining(name -> {
                if (name.startsWith("x-")) {
                    extensions.add(name);
                }
            });
            objectNode.remove(extensions);
            objectNode.remove(nonConstrainingKeywords);
        }
        return trivialPatterns.contains(node);
    }
}
