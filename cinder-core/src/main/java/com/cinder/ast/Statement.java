package com.cinder.ast;

/**
 * Base interface for all statement nodes.
 *
 * <p>Nodes are immutable and own their children; a tree is built bottom-up and rendered once.
 * {@link #render()} has no side effects, so rendering the same node twice yields the same text.</p>
 */
public sealed interface Statement permits
    EmptyStatement,
    BlockStatement,
    ModuleStatement,
    FunctionStatement,
    IfStatement,
    ReturnStatement,
    VariableStatement,
    PlusEqualStatement,
    WhileStatement,
    ForStatement,
    ExpressionStatement,
    ArrayStatement,
    IndexOperatorStatement,
    FunctionCallStatement,
    StructStatement {

    StatementKind kind();

    /**
     * @return the C source text for this node
     */
    String render();
}
