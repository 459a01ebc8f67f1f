package com.reflector.service.api;

import com.reflector.model.FieldLocation;
import com.reflector.model.OperationContext;
import java.util.Map;

/**
 * Turns the fields of an input type bound to one parameter location into operation parameters.
 */
public interface ParameterExtractor {

    /**
     * Appends one parameter per field of {@code context.input} bound to {@code location}.
     * <p>
     * Bare collection or map inputs are skipped. Parameters added before a failure stay on the
     * operation.
     *
     * @param context     The operation being described.
     * @param location    One of {@link FieldLocation#PARAMETER_LOCATIONS}.
     * @param nameMapping Java field name to parameter name overrides, may be {@code null}.
     * @param registry    The document's definition registry.
     * @throws com.reflector.exception.DuplicateParameterException if a (location, name) pair repeats.
     * @throws com.reflector.exception.SchemaReflectionException if a field type cannot be described.
     * @throws com.reflector.exception.FieldPopulationException if a field option is malformed.
     */
    void extractParameters(OperationContext context, FieldLocation location, Map<String, String> nameMapping,
                           DefinitionRegistry registry);
}
