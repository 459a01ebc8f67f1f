package com.reflector.config;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.http.MediaType;

/**
 * Settings of the operation reflector, bound from the {@code reflector.*} properties.
 * <p>
 * Plain Java callers can create an instance directly; every property has a working default.
 */
@Data
@ConfigurationProperties(prefix = "reflector")
public class ReflectorProperties {

    /**
     * The {@code openapi} version written into documents the reflector creates itself.
     */
    private String openapiVersion = "3.0.3";

    /**
     * The content type a response body is published under when the operation does not request one.
     */
    private String defaultResponseContentType = MediaType.APPLICATION_JSON_VALUE;

    /**
     * JSON forms of a response schema that carry no information. A response type reflecting to one
     * of them, once non-constraining keywords are removed, gets no response body.
     */
    private List<String> trivialSchemaPatterns = new ArrayList<>(List.of("{}", "{\"type\":\"object\"}"));

    /**
     * Schema keywords removed before comparing against {@link #trivialSchemaPatterns}, in addition
     * to every {@code x-} extension.
     */
    private List<String> nonConstrainingKeywords = new ArrayList<>(
            List.of("title", "description", "$comment", "$id", "example", "examples"));

    /**
     * Types reflected as {@code string/binary} in request bodies. A form body containing one is
     * published as {@code multipart/form-data}.
     */
    private List<Class<?>> fileUploadTypes = new ArrayList<>(
            List.of(InputStream.class, File.class, Path.class, Resource.class, MultipartFile.class));
}
