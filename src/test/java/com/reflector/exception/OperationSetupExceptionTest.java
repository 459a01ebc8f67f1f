package com.reflector.exception;

import com.reflector.model.ErrorKind;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperationSetupExceptionTest {

    @Test
    void constructor_shouldKeepEveryFailureInspectable() {
        DuplicateParameterException duplicate = new DuplicateParameterException("q", "query");
        SchemaReflectionException reflection = new SchemaReflectionException("unsupported type", "task", null);

        OperationSetupException error = new OperationSetupException(List.of(duplicate, reflection));

        assertThat(error.getMessage()).isEqualTo("parameter q in query is already defined, unsupported type");
        assertThat(error.getKind()).isNull();
        assertThat(error.getCause()).isSameAs(duplicate);
        assertThat(error.getSuppressed()).containsExactly(reflection);
        assertThat(error.getErrors(ErrorKind.REFLECTION_FAILURE)).containsExactly(reflection);
        assertThat(error.getErrors(ErrorKind.FIELD_POPULATION_FAILURE)).isEmpty();
    }

    @Test
    void constructor_shouldAdoptKindOfSingleFailure() {
        FieldPopulationException population = new FieldPopulationException("limit", "invalid integer example", null);

        OperationSetupException error = new OperationSetupException(List.of(population));

        assertThat(error.getKind()).isEqualTo(ErrorKind.FIELD_POPULATION_FAILURE);
        assertThat(error.getErrors()).containsExactly(population);
        assertThat(error.getSuppressed()).isEmpty();
    }
}
