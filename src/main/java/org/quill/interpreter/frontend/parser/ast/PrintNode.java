package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.api.IOutputSink;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

import java.util.List;
import java.util.Optional;

/**
 * An AST node for {@code print expression;}.
 * This is the only place where a statement produces output; it yields no value,
 * so callers have nothing to print a second time.
 *
 * @param expression The printed expression.
 */
public record PrintNode(
        Expression expression
) implements Statement {

    @Override
    public Optional<Value> execute(VariableStore store, IOutputSink output) {
        Value value = expression.evaluate(store);
        output.println(value.toText());
        return Optional.empty();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
