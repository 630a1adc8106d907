package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

/**
 * An AST node that evaluates to a {@link Value}.
 */
public sealed interface Expression extends AstNode permits NumberLiteralNode, BooleanLiteralNode,
        StringLiteralNode, VariableNode, UnaryOpNode, BinaryOpNode, LogicalOpNode, ComparisonOpNode {

    /**
     * Evaluates this expression. Operands are evaluated before the operator is applied.
     *
     * @param store The variable store of the session.
     * @return The resulting value.
     * @throws org.quill.interpreter.api.InterpreterException if evaluation fails.
     */
    Value evaluate(VariableStore store);
}
