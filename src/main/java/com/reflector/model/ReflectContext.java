package com.reflector.model;

import java.util.Optional;

/**
 * State shared with interceptors during one reflection call.
 */
public class ReflectContext {

    private final ReflectOptions options;
    private final OperationContext operationContext;

    public ReflectContext(ReflectOptions options) {
        this.options = options;
        this.operationContext = options.getOperationContext();
    }

    public ReflectOptions getOptions() {
        return options;
    }

    /**
     * Returns the operation being described, with its processing marker set, when the reflection
     * was started by one of the operation builders.
     */
    public Optional<OperationContext> getOperationContext() {
        return Optional.ofNullable(operationContext);
    }
}
