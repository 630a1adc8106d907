package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.api.IOutputSink;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

import java.util.List;
import java.util.Optional;

/**
 * An AST node for {@code name = expression;}.
 * The store is only written after the expression evaluated successfully.
 *
 * @param name The variable being assigned.
 * @param expression The assigned expression.
 */
public record AssignmentNode(
        String name,
        Expression expression
) implements Statement {

    @Override
    public Optional<Value> execute(VariableStore store, IOutputSink output) {
        Value value = expression.evaluate(store);
        store.set(name, value);
        return Optional.of(value);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
