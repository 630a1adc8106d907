package org.quill.interpreter.api;

/**
 * Thrown by the lexer, the parser and the evaluator when a line cannot be processed.
 * <p>
 * The exception aborts the current line only. It is caught by the {@link IInterpreter}
 * implementation and turned into a failed {@link ExecutionResult}, so callers of the
 * public API never see it.
 */
public class InterpreterException extends RuntimeException {

    /** Column value used when an error has no meaningful source position. */
    public static final int NO_COLUMN = -1;

    private final InterpreterErrorCode code;
    private final int column;

    /**
     * Constructs a new exception without source position.
     * @param code The error code.
     * @param message The detail message.
     */
    public InterpreterException(InterpreterErrorCode code, String message) {
        this(code, message, NO_COLUMN);
    }

    /**
     * Constructs a new exception pointing at a column of the current line.
     * @param code The error code.
     * @param message The detail message.
     * @param column The 1-based column, or {@link #NO_COLUMN}.
     */
    public InterpreterException(InterpreterErrorCode code, String message, int column) {
        super(message);
        this.code = code;
        this.column = column;
    }

    public InterpreterErrorCode getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return code.kind();
    }

    public int getColumn() {
        return column;
    }
}
