package com.reflector.service.impl;

import com.reflector.model.ReflectContext;
import com.reflector.service.api.TypeInterceptor;
import io.swagger.v3.oas.models.media.Schema;
import java.lang.reflect.Field;
import java.util.List;
import org.springframework.core.ResolvableType;

/**
 * Reflects file and stream types as binary strings and remembers whether it met one. Created for a
 * single request body reflection.
 */
class FileUploadInterceptor implements TypeInterceptor {

    private final List<Class<?>> uploadTypes;
    private boolean fileUpload;

    FileUploadInterceptor(List<Class<?>> uploadTypes) {
        this.uploadTypes = uploadTypes;
    }

    @Override
    public boolean intercept(ReflectContext context, ResolvableType type, Field field, Schema<?> schema) {
        Class<?> raw = type.resolve();
        if (raw == null || uploadTypes.stream().noneMatch(uploadType -> uploadType.isAssignableFrom(raw))) {
            return false;
        }
        schema.setType("string");
        schema.setFormat("binary");
        fileUpload = true;
        return true;
    }

    boolean hasFileUpload() {
        return fileUpload;
    }
}
