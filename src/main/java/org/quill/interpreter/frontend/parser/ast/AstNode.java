package org.quill.interpreter.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * The set of nodes is closed: every node is either an {@link Expression} or a {@link Statement}.
 * Nodes are immutable once the parser has built them.
 */
public sealed interface AstNode permits Expression, Statement {
    /**
     * Returns a list of the direct child nodes.
     * This allows tooling and tests to walk the tree without knowing the
     * specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
