package org.quill.interpreter.api;

import org.quill.interpreter.diagnostics.Diagnostic;
import org.quill.interpreter.runtime.Value;

import java.util.Optional;

/**
 * The outcome of running one line through the interpreter: either success, with the value
 * the line produced (if any), or failure with the {@link Diagnostic} that explains it.
 *
 * @param value The produced value; {@code null} on failure or for statements without a value.
 * @param diagnostic The error; {@code null} on success.
 */
public record ExecutionResult(
        Value value,
        Diagnostic diagnostic
) {

    /**
     * @param value The value the line produced.
     * @return A successful result carrying the value.
     */
    public static ExecutionResult success(Value value) {
        return new ExecutionResult(value, null);
    }

    /**
     * @return A successful result without a value, e.g. after {@code print}.
     */
    public static ExecutionResult noValue() {
        return new ExecutionResult(null, null);
    }

    /**
     * @param diagnostic The error that aborted the line.
     * @return A failed result.
     */
    public static ExecutionResult failure(Diagnostic diagnostic) {
        return new ExecutionResult(null, diagnostic);
    }

    public boolean isSuccess() {
        return diagnostic == null;
    }

    public Optional<Value> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Diagnostic> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    /**
     * @return The error kind of a failed result, or empty on success.
     */
    public Optional<ErrorKind> errorKind() {
        return getDiagnostic().map(Diagnostic::kind);
    }
}
