package org.quill.interpreter.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A numeric literal, possibly signed. The value is the unconverted numeric text. */
    NUMBER,
    /** A string literal. The value is the raw content between the quotes. */
    STRING,
    /** The keyword {@code true}. */
    TRUE,
    /** The keyword {@code false}. */
    FALSE,
    /** A variable name. */
    IDENTIFIER,

    // Keywords.
    /** The keyword {@code print}. */
    PRINT,

    // Arithmetic operators.
    /** The '+' character, used for addition and unary plus. */
    PLUS,
    /** The '-' character, used for subtraction and negation. */
    MINUS,
    /** The '*' character. */
    STAR,
    /** The '/' character. */
    SLASH,

    // Punctuation.
    LEFT_PAREN,
    RIGHT_PAREN,
    /** The ';' statement terminator. */
    SEMICOLON,
    /** A single '=' used for assignment. */
    ASSIGN,

    // Comparison operators.
    /** The '==' operator. */
    EQUAL_EQUAL,
    /** The '!=' operator. */
    BANG_EQUAL,
    /** The '<' operator. */
    LESS,
    /** The '>' operator. */
    GREATER,

    // Logical operators.
    /** The keyword {@code and} or a bare '&amp;'. */
    AND,
    /** The keyword {@code or} or a bare '|'. */
    OR,
    /** A bare '!'. */
    NOT,

    /** Represents the end of the input line. Every token stream ends with it. */
    END_OF_INPUT
}
