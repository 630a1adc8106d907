package org.quill.interpreter.runtime;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Contains unit tests for the coercions of {@link Value}.
 */
public class ValueTest {

    /**
     * Verifies that whole numbers render without a fractional part and that large and small
     * magnitudes are written out in plain notation.
     */
    @Test
    @Tag("unit")
    void testNumberRendering() {
        assertThat(Value.of(7.0).toText()).isEqualTo("7");
        assertThat(Value.of(-0.5).toText()).isEqualTo("-0.5");
        assertThat(Value.of(1e20).toText()).isEqualTo("100000000000000000000");
        assertThat(Value.of(0.0001).toText()).isEqualTo("0.0001");
        assertThat(Value.of(Double.POSITIVE_INFINITY).toText()).isEqualTo("Infinity");
        assertThat(Value.of(Double.NaN).toText()).isEqualTo("NaN");
    }

    /**
     * Verifies the number and boolean coercions of numbers and booleans.
     */
    @Test
    @Tag("unit")
    void testNumericAndBooleanCoercions() {
        assertThat(Value.of(0.0).toBoolean()).isFalse();
        assertThat(Value.of(-2.0).toBoolean()).isTrue();
        assertThat(Value.of(true).toNumber()).isEqualTo(1.0);
        assertThat(Value.of(false).toNumber()).isEqualTo(0.0);
        assertThat(Value.of(false).toText()).isEqualTo("false");
        assertThat(Value.of(true)).isSameAs(Value.of(true));
    }

    /**
     * Verifies that text converts to a number only when it is a plain decimal.
     */
    @Test
    @Tag("unit")
    void testTextToNumber() {
        assertThat(Value.of(" 42 ").toNumber()).isEqualTo(42.0);
        assertThat(Value.of("-3.25").toNumber()).isEqualTo(-3.25);
        assertThat(Value.of(".5").toNumber()).isEqualTo(0.5);

        InterpreterException e = assertThrows(InterpreterException.class, () -> Value.of("abc").toNumber());
        assertThat(e.getCode()).isEqualTo(InterpreterErrorCode.INVALID_COERCION);
        assertThat(e.getMessage()).isEqualTo("Cannot convert text \"abc\" to a number.");
        assertThrows(InterpreterException.class, () -> Value.of("NaN").toNumber());
        assertThrows(InterpreterException.class, () -> Value.of("1e3").toNumber());
        assertThrows(InterpreterException.class, () -> Value.of("").toNumber());
    }

    /**
     * Verifies that text converts to a boolean only when it reads "true" or "false".
     */
    @Test
    @Tag("unit")
    void testTextToBoolean() {
        assertThat(Value.of("True").toBoolean()).isTrue();
        assertThat(Value.of(" false ").toBoolean()).isFalse();

        InterpreterException e = assertThrows(InterpreterException.class, () -> Value.of("yes").toBoolean());
        assertThat(e.getCode()).isEqualTo(InterpreterErrorCode.INVALID_COERCION);
    }

    /**
     * Verifies that only text values report themselves as text.
     */
    @Test
    @Tag("unit")
    void testIsText() {
        assertThat(Value.of("1").isText()).isTrue();
        assertThat(Value.of(1.0).isText()).isFalse();
        assertThat(Value.of(true).isText()).isFalse();
    }
}
