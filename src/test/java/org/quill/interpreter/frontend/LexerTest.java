package org.quill.interpreter.frontend;

import org.quill.interpreter.api.ErrorKind;
import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.quill.interpreter.frontend.lexer.Lexer;
import org.quill.interpreter.frontend.lexer.Token;
import org.quill.interpreter.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer turns a source line into the expected pull-based token stream,
 * including signed numbers, two-character operators, keywords and string literals.
 * These are unit tests and do not require external resources.
 */
public class LexerTest {

    private static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        tokens.add(lexer.current());
        while (lexer.current().type() != TokenType.END_OF_INPUT) {
            tokens.add(lexer.advance());
        }
        return tokens;
    }

    private static List<TokenType> types(String source) {
        return tokenize(source).stream().map(Token::type).toList();
    }

    /**
     * Verifies that an assignment statement is split into identifier, operator, literal and
     * terminator tokens, and that literal payloads are attached.
     */
    @Test
    @Tag("unit")
    void testAssignmentTokenization() {
        // Act
        List<Token> tokens = tokenize("total = 3.5 + y;");

        // Assert
        assertThat(tokens).hasSize(7);
        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::value).containsExactly(TokenType.IDENTIFIER, "total", "total");
        assertThat(tokens.get(1)).extracting(Token::type).isEqualTo(TokenType.ASSIGN);
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.NUMBER, "3.5");
        assertThat(tokens.get(3)).extracting(Token::type).isEqualTo(TokenType.PLUS);
        assertThat(tokens.get(4)).extracting(Token::type, Token::text).containsExactly(TokenType.IDENTIFIER, "y");
        assertThat(tokens.get(5)).extracting(Token::type).isEqualTo(TokenType.SEMICOLON);
        assertThat(tokens.get(6)).extracting(Token::type).isEqualTo(TokenType.END_OF_INPUT);
    }

    /**
     * Verifies the one- and two-character operators, including the bare '&amp;' and '|' forms
     * of 'and' and 'or'.
     */
    @Test
    @Tag("unit")
    void testOperators() {
        assertThat(types("== != = ! < > & | and or * / ( )")).containsExactly(
                TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.ASSIGN, TokenType.NOT,
                TokenType.LESS, TokenType.GREATER, TokenType.AND, TokenType.OR, TokenType.AND, TokenType.OR,
                TokenType.STAR, TokenType.SLASH, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN,
                TokenType.END_OF_INPUT);
    }

    /**
     * Verifies that a sign directly followed by a digit becomes part of the number,
     * while a sign followed by anything else is an operator.
     */
    @Test
    @Tag("unit")
    void testSignedNumbers() {
        // Act
        List<Token> tokens = tokenize("-5 - 3 +2 --1");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NUMBER, TokenType.MINUS, TokenType.NUMBER, TokenType.NUMBER,
                TokenType.MINUS, TokenType.NUMBER, TokenType.END_OF_INPUT);
        assertThat(tokens.get(0).value()).isEqualTo("-5");
        assertThat(tokens.get(2).value()).isEqualTo("3");
        assertThat(tokens.get(3).value()).isEqualTo("+2");
        assertThat(tokens.get(5).value()).isEqualTo("-1");
    }

    /**
     * Verifies that the lexer does not validate numeric text; "1.2.3" is one NUMBER token.
     */
    @Test
    @Tag("unit")
    void testMalformedNumberIsDeferred() {
        List<Token> tokens = tokenize("1.2.3");

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.NUMBER, "1.2.3");
    }

    /**
     * Verifies the reserved words and that a word merely starting with a keyword is an identifier.
     */
    @Test
    @Tag("unit")
    void testKeywords() {
        // Act
        List<Token> tokens = tokenize("print true false printer x2");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.PRINT, TokenType.TRUE, TokenType.FALSE, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.END_OF_INPUT);
        assertThat(tokens.get(1).value()).isEqualTo(Boolean.TRUE);
        assertThat(tokens.get(2).value()).isEqualTo(Boolean.FALSE);
        assertThat(tokens.get(4).text()).isEqualTo("x2");
    }

    /**
     * Verifies that logical negation is spelled '!' only; the word "not" is an ordinary identifier.
     */
    @Test
    @Tag("unit")
    void testNotIsAnIdentifier() {
        // Act
        List<Token> tokens = tokenize("not !x");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.NOT, TokenType.IDENTIFIER, TokenType.END_OF_INPUT);
        assertThat(tokens.get(0).text()).isEqualTo("not");
    }

    /**
     * Verifies that string literals keep their content verbatim: spaces are preserved and
     * backslashes are not escape characters.
     */
    @Test
    @Tag("unit")
    void testStringLiteralWithoutEscapes() {
        // Act
        List<Token> tokens = tokenize("\"a b\" \"c:\\n\"");

        // Assert
        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::value)
                .containsExactly(TokenType.STRING, "\"a b\"", "a b");
        assertThat(tokens.get(1).value()).isEqualTo("c:\\n");
    }

    /**
     * Verifies that a string without closing quote raises a lexical error once the lexer reaches it.
     */
    @Test
    @Tag("unit")
    void testUnterminatedString() {
        // Arrange
        Lexer lexer = new Lexer("print \"abc;");
        assertThat(lexer.current().type()).isEqualTo(TokenType.PRINT);

        // Act
        InterpreterException e = assertThrows(InterpreterException.class, lexer::advance);

        // Assert
        assertThat(e.getCode()).isEqualTo(InterpreterErrorCode.UNTERMINATED_STRING);
        assertThat(e.getKind()).isEqualTo(ErrorKind.LEX);
        assertThat(e.getColumn()).isEqualTo(7);
    }

    /**
     * Verifies that an unknown character is reported with its column, even as the very first token.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacter() {
        InterpreterException first = assertThrows(InterpreterException.class, () -> new Lexer("#"));
        assertThat(first.getCode()).isEqualTo(InterpreterErrorCode.UNEXPECTED_CHARACTER);
        assertThat(first.getColumn()).isEqualTo(1);

        Lexer lexer = new Lexer("x @");
        InterpreterException later = assertThrows(InterpreterException.class, lexer::advance);
        assertThat(later.getMessage()).isEqualTo("Unexpected character: @");
        assertThat(later.getColumn()).isEqualTo(3);
    }

    /**
     * Verifies that the end-of-input token is sticky and that an empty line yields only the sentinel.
     */
    @Test
    @Tag("unit")
    void testEndOfInputIsSticky() {
        Lexer lexer = new Lexer("   ");

        assertThat(lexer.current().type()).isEqualTo(TokenType.END_OF_INPUT);
        assertThat(lexer.advance().type()).isEqualTo(TokenType.END_OF_INPUT);
        assertThat(lexer.advance().type()).isEqualTo(TokenType.END_OF_INPUT);
    }
}
