package com.reflector.exception;

import com.reflector.model.ErrorKind;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregates the independent failures of one request setup.
 * <p>
 * The individual exceptions keep their kind and field context; the message joins their messages
 * with {@code ", "}.
 */
public class OperationSetupException extends ReflectorException {

    private final List<ReflectorException> errors;

    public OperationSetupException(List<ReflectorException> errors) {
        super(errors.size() == 1 ? errors.get(0).getKind() : null, null, null, joinMessages(errors), errors.get(0));
        this.errors = List.copyOf(errors);
        errors.stream().skip(1).forEach(this::addSuppressed);
    }

    /**
     * Returns the individual failures in the order the locations were processed.
     */
    public List<ReflectorException> getErrors() {
        return errors;
    }

    /**
     * Returns the individual failures of one kind.
     */
    public List<ReflectorException> getErrors(ErrorKind kind) {
        return errors.stream()
                .filter(error -> error.getKind() == kind)
                .collect(Collectors.toList());
    }

    private static String joinMessages(List<ReflectorException> errors) {
        return errors.stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining(", "));
    }
}
