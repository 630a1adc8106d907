package org.quill.interpreter.runtime;

import org.quill.interpreter.api.ErrorKind;
import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Contains unit tests for the {@link VariableStore}.
 */
public class VariableStoreTest {

    /**
     * Verifies that a set value can be read back and is overwritten by a later set.
     */
    @Test
    @Tag("unit")
    void testSetAndOverwrite() {
        // Arrange
        VariableStore store = new VariableStore();

        // Act
        store.set("x", Value.of(1.0));
        store.set("x", Value.of("one"));

        // Assert
        assertThat(store.get("x")).isEqualTo(Value.of("one"));
        assertThat(store.contains("x")).isTrue();
        assertThat(store.size()).isEqualTo(1);
    }

    /**
     * Verifies that reading an unbound name raises an evaluation error.
     */
    @Test
    @Tag("unit")
    void testUndefinedVariable() {
        VariableStore store = new VariableStore();

        InterpreterException e = assertThrows(InterpreterException.class, () -> store.get("missing"));

        assertThat(e.getCode()).isEqualTo(InterpreterErrorCode.UNDEFINED_VARIABLE);
        assertThat(e.getKind()).isEqualTo(ErrorKind.EVAL);
        assertThat(e.getColumn()).isEqualTo(InterpreterException.NO_COLUMN);
        assertThat(store.contains("missing")).isFalse();
    }

    /**
     * Verifies that the snapshot is sorted by name and cannot be modified.
     */
    @Test
    @Tag("unit")
    void testSnapshotIsSortedAndReadOnly() {
        // Arrange
        VariableStore store = new VariableStore();
        store.set("b", Value.of(2.0));
        store.set("a", Value.of(true));

        // Act
        Map<String, Value> snapshot = store.snapshot();
        store.set("c", Value.of(3.0));

        // Assert
        assertThat(snapshot.keySet()).containsExactly("a", "b");
        assertThatThrownBy(() -> snapshot.put("z", Value.of(0.0))).isInstanceOf(UnsupportedOperationException.class);
    }
}
