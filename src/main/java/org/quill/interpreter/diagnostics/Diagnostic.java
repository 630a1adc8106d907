package org.quill.interpreter.diagnostics;

import org.quill.interpreter.api.ErrorKind;
import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;

/**
 * Represents a single error that stopped the processing of a line.
 *
 * @param code The error code.
 * @param message The diagnostic message.
 * @param sourceName The name of the source (a file name, or "&lt;repl&gt;").
 * @param lineNumber The 1-based line number, or 0 if unknown.
 * @param column The 1-based column, or {@link InterpreterException#NO_COLUMN}.
 */
public record Diagnostic(
        InterpreterErrorCode code,
        String message,
        String sourceName,
        int lineNumber,
        int column
) {

    /**
     * Creates a diagnostic from a pipeline exception.
     * @param exception The exception that aborted the line.
     * @param sourceName The name of the source.
     * @param lineNumber The line number.
     * @return The diagnostic.
     */
    public static Diagnostic from(InterpreterException exception, String sourceName, int lineNumber) {
        return new Diagnostic(exception.getCode(), exception.getMessage(), sourceName, lineNumber, exception.getColumn());
    }

    /**
     * @return The pipeline stage that produced this diagnostic.
     */
    public ErrorKind kind() {
        return code.kind();
    }

    /**
     * Returns a copy of this diagnostic attributed to a different source position.
     * @param newSourceName The source name.
     * @param newLineNumber The line number.
     * @return The relocated diagnostic.
     */
    public Diagnostic at(String newSourceName, int newLineNumber) {
        return new Diagnostic(code, message, newSourceName, newLineNumber, column);
    }

    @Override
    public String toString() {
        if (column == InterpreterException.NO_COLUMN) {
            return String.format("[%s] %s:%d: %s", kind(), sourceName, lineNumber, message);
        }
        return String.format("[%s] %s:%d:%d: %s", kind(), sourceName, lineNumber, column, message);
    }
}
