package org.quill.interpreter.api;

import org.quill.interpreter.frontend.parser.ast.Expression;
import org.quill.interpreter.frontend.parser.ast.Statement;
import org.quill.interpreter.runtime.VariableStore;

/**
 * Defines the public interface for interpreting single source lines.
 * <p>
 * The execution methods never throw for malformed input: lexical, syntax and evaluation
 * errors are reported in the returned {@link ExecutionResult}. A failed line leaves the
 * store exactly as it was before the line.
 */
public interface IInterpreter {

    /**
     * Parses the line as a statement ({@code x = expr;} or {@code print expr;}) and executes it.
     *
     * @param line The source line.
     * @param store The variable store of the session.
     * @param output The sink that receives printed text.
     * @return The assigned value for an assignment, no value for a print, or the failure.
     */
    ExecutionResult executeStatement(String line, VariableStore store, IOutputSink output);

    /**
     * Parses the whole line as an expression (a trailing {@code ;} is tolerated) and evaluates it.
     * Nothing is printed; the value is returned to the caller.
     *
     * @param line The source line.
     * @param store The variable store of the session.
     * @return The value of the expression, or the failure.
     */
    ExecutionResult evaluateExpression(String line, VariableStore store);

    /**
     * Parses a statement line without executing it.
     *
     * @param line The source line.
     * @return The statement AST.
     * @throws InterpreterException if the line is not a valid statement.
     */
    Statement parseStatement(String line);

    /**
     * Parses an expression line without evaluating it.
     *
     * @param line The source line.
     * @return The expression AST.
     * @throws InterpreterException if the line is not a valid expression.
     */
    Expression parseExpression(String line);
}
