package com.reflector.model;

import io.swagger.v3.oas.models.Operation;
import java.lang.reflect.Type;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The unit of work for describing one API operation: the operation record being populated, the
 * request and response types, and the per-location name remapping tables.
 * <p>
 * A context is built per call and never stored. The builders hand interceptors a copy carrying the
 * processing marker ({@link #isProcessingResponse()} and {@link #getProcessingIn()}), so hooks can
 * tell which phase and location triggered them.
 * <p>
 * Lombok's {@code @Data} and {@code @Builder} generate accessors and the fluent builder.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OperationContext {

    /**
     * The operation record that parameters, request body and responses are written into.
     */
    private Operation operation;

    /**
     * The request type. Either a {@code Class} or a parameterized type such as
     * {@code new TypeReference<List<Item>>() {}.getType()}.
     */
    private Type input;

    /**
     * The HTTP method of the operation; decides whether a request body is allowed.
     */
    private String httpMethod;

    private Map<String, String> reqQueryMapping;
    private Map<String, String> reqPathMapping;
    private Map<String, String> reqCookieMapping;
    private Map<String, String> reqHeaderMapping;
    private Map<String, String> reqFormDataMapping;

    /**
     * The response type, or {@code null} for a response without body and headers.
     */
    private Type output;

    /**
     * The HTTP status code the response is documented under.
     */
    private int httpStatus;

    /**
     * The requested response content type. Parameters after {@code ;} are ignored.
     */
    private String respContentType;

    private Map<String, String> respHeaderMapping;

    /**
     * Set on the copies handed to interceptors: {@code true} while a response is being reflected.
     */
    private boolean processingResponse;

    /**
     * Set on the copies handed to interceptors: the location being reflected
     * ({@code query}, {@code path}, {@code cookie}, {@code header} or {@code body}).
     */
    private String processingIn;

    /**
     * Returns a copy of this context carrying the given processing marker.
     */
    public OperationContext forProcessing(boolean response, String in) {
        return toBuilder()
                .processingResponse(response)
                .processingIn(in)
                .build();
    }

    /**
     * Returns the request name mapping configured for a location, {@code null} when there is none.
     */
    public Map<String, String> requestMapping(FieldLocation location) {
        return switch (location) {
            case QUERY -> reqQueryMapping;
            case PATH -> reqPathMapping;
            case COOKIE -> reqCookieMapping;
            case HEADER -> reqHeaderMapping;
            case FORM_DATA -> reqFormDataMapping;
            case JSON -> null;
        };
    }
}
