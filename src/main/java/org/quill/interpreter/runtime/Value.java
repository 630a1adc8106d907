package org.quill.interpreter.runtime;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * The dynamically typed result of evaluating an expression. Values are produced only by
 * evaluation, never by the parser. Every operator that needs a particular type goes through
 * one of the explicit coercions {@link #toNumber()}, {@link #toBoolean()} and {@link #toText()}.
 */
public sealed interface Value permits Value.NumberValue, Value.BooleanValue, Value.TextValue {

    /**
     * Coerces this value to a number.
     * @return The numeric value. Booleans become 1 or 0, text is parsed as a decimal number.
     * @throws InterpreterException with {@link InterpreterErrorCode#INVALID_COERCION} if text is not numeric.
     */
    double toNumber();

    /**
     * Coerces this value to a boolean.
     * @return The truth value. Numbers are true when non-zero, text must read "true" or "false".
     * @throws InterpreterException with {@link InterpreterErrorCode#INVALID_COERCION} for any other text.
     */
    boolean toBoolean();

    /**
     * Renders this value as text, the way {@code print} shows it.
     * @return The textual rendering.
     */
    String toText();

    /**
     * @return {@code true} if this value is text.
     */
    default boolean isText() {
        return this instanceof TextValue;
    }

    static Value of(double number) {
        return new NumberValue(number);
    }

    static Value of(boolean bool) {
        return bool ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static Value of(String text) {
        return new TextValue(text);
    }

    /**
     * A double-precision number.
     * @param value The number.
     */
    record NumberValue(double value) implements Value {
        @Override
        public double toNumber() {
            return value;
        }

        @Override
        public boolean toBoolean() {
            return value != 0;
        }

        @Override
        public String toText() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            // Shortest plain decimal: 7 rather than 7.0, 1E+20 spelled out.
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    /**
     * A boolean.
     * @param value The truth value.
     */
    record BooleanValue(boolean value) implements Value {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public double toNumber() {
            return value ? 1 : 0;
        }

        @Override
        public boolean toBoolean() {
            return value;
        }

        @Override
        public String toText() {
            return Boolean.toString(value);
        }
    }

    /**
     * A piece of text.
     * @param value The text, never {@code null}.
     */
    record TextValue(String value) implements Value {
        @Override
        public double toNumber() {
            String trimmed = value.trim();
            // Double.parseDouble also accepts "NaN", hex floats and type suffixes; only plain decimals count.
            if (!trimmed.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)")) {
                throw new InterpreterException(InterpreterErrorCode.INVALID_COERCION,
                        "Cannot convert text \"" + value + "\" to a number.");
            }
            return Double.parseDouble(trimmed);
        }

        @Override
        public boolean toBoolean() {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "true" -> true;
                case "false" -> false;
                default -> throw new InterpreterException(InterpreterErrorCode.INVALID_COERCION,
                        "Cannot convert text \"" + value + "\" to a boolean.");
            };
        }

        @Override
        public String toText() {
            return value;
        }
    }
}
