package org.quill.interpreter.api;

/**
 * The pipeline stage that rejected a line.
 */
public enum ErrorKind {
    /** The lexer met a character or literal it cannot tokenize. */
    LEX,
    /** The parser met a token that violates the grammar. */
    PARSE,
    /** Evaluation failed, e.g. an undefined variable or a type mismatch. */
    EVAL
}
