package com.reflector.service.impl;

import com.reflector.annotation.Description;
import com.reflector.annotation.Example;
import com.reflector.annotation.HeaderParam;
import com.reflector.config.ReflectorProperties;
import com.reflector.exception.SchemaReflectionException;
import com.reflector.fixtures.Item;
import com.reflector.model.OperationContext;
import com.reflector.service.api.TypeInterceptor;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseBuilderImplTest {

    static class Empty {
    }

    @Description("Carries nothing")
    static class DescribedEmpty {
    }

    static class CreatedResponse {
        @HeaderParam("Location")
        @Description("URL of the new item")
        String location;

        @HeaderParam("X-Rate-Limit")
        @Example("100")
        int rateLimit;

        String id;
    }

    static class HeadersOnly {
        @HeaderParam("ETag")
        String etag;
    }

    static class Broken {
        Runnable task;
    }

    private ComponentsDefinitionRegistry registry;
    private Operation operation;
    private ReflectorProperties properties;

    @BeforeEach
    void setUp() {
        registry = new ComponentsDefinitionRegistry(new OpenAPI());
        operation = new Operation();
        properties = new ReflectorProperties();
    }

    @Test
    void buildResponse_shouldUseStatusTextWhenOutputIsMissing() {
        builder().buildResponse(context(null, 204, null), registry);

        ApiResponse response = operation.getResponses().get("204");
        assertThat(response.getDescription()).isEqualTo("No Content");
        assertThat(response.getContent()).isNull();
        assertThat(response.getHeaders()).isNull();
    }

    @Test
    void buildResponse_shouldSkipBodyOfTrivialOutput() {
        builder().buildResponse(context(Empty.class, 204, null), registry);

        ApiResponse response = operation.getResponses().get("204");
        assertThat(response.getContent()).isNull();
        assertThat(response.getDescription()).isEqualTo("No Content");
        assertThat(registry.definitions()).isEmpty();
    }

    @Test
    void buildResponse_shouldAdoptTypeDescriptionOfTrivialOutput() {
        builder().buildResponse(context(DescribedEmpty.class, 204, null), registry);

        ApiResponse response = operation.getResponses().get("204");
        assertThat(response.getContent()).isNull();
        assertThat(response.getDescription()).isEqualTo("Carries nothing");
    }

    @Test
    void buildResponse_shouldReferenceOutputSchema() {
        builder().buildResponse(context(Item.class, 200, null), registry);

        ApiResponse response = operation.getResponses().get("200");
        assertThat(response.getDescription()).isEqualTo("A catalog item");
        assertThat(response.getContent()).containsOnlyKeys("application/json");
        assertThat(response.getContent().get("application/json").getSchema().get$ref())
                .isEqualTo("#/components/schemas/Item");
        assertThat(registry.contains("Item")).isTrue();
    }

    @Test
    void buildResponse_shouldDescribeResponseHeaders() {
        builder().buildResponse(context(CreatedResponse.class, 201, null), registry);

        ApiResponse response = operation.getResponses().get("201");
        assertThat(response.getDescription()).isEqualTo("Created");
        assertThat(response.getHeaders()).containsOnlyKeys("Location", "X-Rate-Limit");

        Header location = response.getHeaders().get("Location");
        assertThat(location.getDescription()).isEqualTo("URL of the new item");
        assertThat(location.getSchema().getType()).isEqualTo("string");

        Header rateLimit = response.getHeaders().get("X-Rate-Limit");
        assertThat(rateLimit.getSchema().getType()).isEqualTo("integer");
        assertThat(rateLimit.getExample()).isEqualTo(100L);

        Schema<?> body = registry.definitions().get("ResponseBuilderImplTestCreatedResponse");
        assertThat(body.getProperties()).containsOnlyKeys("id");
    }

    @Test
    void buildResponse_shouldApplyHeaderNameMapping() {
        OperationContext context = context(HeadersOnly.class, 200, null).toBuilder()
                .respHeaderMapping(Map.of("etag", "X-Version"))
                .build();

        builder().buildResponse(context, registry);

        assertThat(operation.getResponses().get("200").getHeaders()).containsOnlyKeys("X-Version");
    }

    @Test
    void buildResponse_shouldAdvertiseRequestedContentTypeWithoutSchema() {
        builder().buildResponse(context(HeadersOnly.class, 200, "text/csv; charset=utf-8"), registry);

        ApiResponse response = operation.getResponses().get("200");
        assertThat(response.getContent()).containsOnlyKeys("text/csv");
        Schema<?> schema = response.getContent().get("text/csv").getSchema();
        assertThat(schema.getType()).isNull();
        assertThat(schema.get$ref()).isNull();
        assertThat(response.getHeaders()).containsOnlyKeys("ETag");
    }

    @Test
    void buildResponse_shouldAdvertiseRequestedContentTypeWhenOutputIsMissing() {
        builder().buildResponse(context(null, 200, "text/csv"), registry);

        ApiResponse response = operation.getResponses().get("200");
        assertThat(response.getDescription()).isEqualTo("OK");
        assertThat(response.getContent()).containsOnlyKeys("text/csv");
        assertThat(response.getContent().get("text/csv").getSchema().getType()).isNull();
        assertThat(response.getHeaders()).isNull();
    }

    @Test
    void buildResponse_shouldPublishBodyUnderRequestedContentType() {
        builder().buildResponse(context(String.class, 200, "text/plain;charset=UTF-8"), registry);

        ApiResponse response = operation.getResponses().get("200");
        assertThat(response.getContent()).containsOnlyKeys("text/plain");
        assertThat(response.getContent().get("text/plain").getSchema().getType()).isEqualTo("string");
        assertThat(response.getDescription()).isEqualTo("OK");
    }

    @Test
    void buildResponse_shouldUseConfiguredDefaultContentType() {
        properties.setDefaultResponseContentType("application/hal+json");

        builder().buildResponse(context(Item.class, 200, null), registry);

        assertThat(operation.getResponses().get("200").getContent()).containsOnlyKeys("application/hal+json");
    }

    @Test
    void buildResponse_shouldReplacePreviousResponseForSameStatus() {
        builder().buildResponse(context(Item.class, 200, null), registry);
        builder().buildResponse(context(null, 200, null), registry);

        assertThat(operation.getResponses()).containsOnlyKeys("200");
        assertThat(operation.getResponses().get("200").getContent()).isNull();
    }

    @Test
    void buildResponse_shouldFallBackToEmptyDescriptionForUnknownStatus() {
        builder().buildResponse(context(null, 299, null), registry);

        assertThat(operation.getResponses().get("299").getDescription()).isEmpty();
    }

    @Test
    void buildResponse_shouldPropagateReflectionFailure() {
        assertThatThrownBy(() -> builder().buildResponse(context(Broken.class, 200, null), registry))
                .isInstanceOf(SchemaReflectionException.class);

        assertThat(operation.getResponses()).isNull();
    }

    @Test
    void buildResponse_shouldExposeProcessingMarkerToInterceptors() {
        List<String> markers = new ArrayList<>();
        TypeInterceptor recorder = (reflectContext, type, field, schema) -> {
            reflectContext.getOperationContext().ifPresent(marked ->
                    markers.add(marked.isProcessingResponse() + "/" + marked.getProcessingIn()));
            return false;
        };
        FieldTypeInspector inspector = new FieldTypeInspector(List.of(recorder), List.of());
        ResponseBuilderImpl recording = new ResponseBuilderImpl(inspector,
                new TrivialSchemaPolicy(properties), new FieldOptionsPopulator(), properties);

        recording.buildResponse(context(Item.class, 200, null), registry);

        assertThat(markers).contains("true/body", "true/header").doesNotContain("false/body");
    }

    private ResponseBuilderImpl builder() {
        return new ResponseBuilderImpl(new FieldTypeInspector(), new TrivialSchemaPolicy(properties),
                new FieldOptionsPopulator(), properties);
    }

    private OperationContext context(Type output, int status, String contentType) {
        return OperationContext.builder()
                .operation(operation)
                .output(output)
                .httpStatus(status)
                .respContentType(contentType)
                .build();
    }
}
