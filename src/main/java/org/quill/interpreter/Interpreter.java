package org.quill.interpreter;

import org.quill.interpreter.api.ExecutionResult;
import org.quill.interpreter.api.IInterpreter;
import org.quill.interpreter.api.IOutputSink;
import org.quill.interpreter.api.InterpreterException;
import org.quill.interpreter.diagnostics.Diagnostic;
import org.quill.interpreter.frontend.lexer.Lexer;
import org.quill.interpreter.frontend.parser.Parser;
import org.quill.interpreter.frontend.parser.ast.Expression;
import org.quill.interpreter.frontend.parser.ast.Statement;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The main interpreter implementation. Each call runs a fresh lexer and parser over one
 * line, so instances hold no per-line state and can be reused for a whole session.
 * This is the only place where {@link InterpreterException}s are caught.
 */
public class Interpreter implements IInterpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);
    private static final String SOURCE_NAME = "<input>";

    @Override
    public ExecutionResult executeStatement(String line, VariableStore store, IOutputSink output) {
        try {
            Statement statement = parseStatement(line);
            log.debug("Executing statement {}", statement);
            Optional<Value> value = statement.execute(store, output);
            return value.map(ExecutionResult::success).orElseGet(ExecutionResult::noValue);
        } catch (InterpreterException e) {
            log.debug("Statement attempt failed with {}: {}", e.getCode(), e.getMessage());
            return ExecutionResult.failure(Diagnostic.from(e, SOURCE_NAME, 0));
        }
    }

    @Override
    public ExecutionResult evaluateExpression(String line, VariableStore store) {
        try {
            Expression expression = parseExpression(line);
            log.debug("Evaluating expression {}", expression);
            return ExecutionResult.success(expression.evaluate(store));
        } catch (InterpreterException e) {
            log.debug("Expression attempt failed with {}: {}", e.getCode(), e.getMessage());
            return ExecutionResult.failure(Diagnostic.from(e, SOURCE_NAME, 0));
        }
    }

    @Override
    public Statement parseStatement(String line) {
        Parser parser = new Parser(new Lexer(line));
        Statement statement = parser.parseStatement();
        parser.expectEndOfLine(false);
        return statement;
    }

    @Override
    public Expression parseExpression(String line) {
        Parser parser = new Parser(new Lexer(line));
        Expression expression = parser.parseExpression();
        parser.expectEndOfLine(true);
        return expression;
    }
}
