package com.reflector.service.api;

import io.swagger.v3.oas.models.media.Schema;
import java.util.Map;
import java.util.Optional;

/**
 * The document-wide store of named schemas, shared by every operation built into one document.
 * <p>
 * {@link #collect} is the only mutation: the first fragment registered under a name wins and later
 * writes are ignored, which keeps repeated traversals of shared nested types idempotent.
 * <p>
 * Implementations are not thread-safe. Callers that build operations of one document from several
 * threads must serialize access themselves.
 */
public interface DefinitionRegistry {

    /**
     * Pointer prefix of references to registered schemas.
     */
    String REF_PREFIX = "#/components/schemas/";

    /**
     * Registers a schema unless the name is already taken.
     *
     * @return {@code true} if the schema was added, {@code false} if the name already existed.
     */
    boolean collect(String name, Schema<?> schema);

    boolean contains(String name);

    /**
     * Resolves a {@code #/components/schemas/...} reference against the registry.
     *
     * @return The registered schema, or empty for unknown names and references with another prefix.
     */
    Optional<Schema<?>> resolve(String ref);

    /**
     * Returns a read-only snapshot of the registered schemas.
     */
    Map<String, Schema<?>> definitions();
}
