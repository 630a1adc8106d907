package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.api.IOutputSink;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

import java.util.Optional;

/**
 * An AST node that is executed for its side effect: an assignment or a print.
 */
public sealed interface Statement extends AstNode permits AssignmentNode, PrintNode {

    /**
     * Executes this statement.
     *
     * @param store The variable store of the session.
     * @param output The sink that receives printed text.
     * @return The value the statement yields, or empty if it yields none.
     * @throws org.quill.interpreter.api.InterpreterException if evaluation fails.
     */
    Optional<Value> execute(VariableStore store, IOutputSink output);
}
