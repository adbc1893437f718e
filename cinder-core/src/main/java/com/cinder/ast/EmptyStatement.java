package com.cinder.ast;

/**
 * Explicit "no body" marker, for instance the else branch of an if without one.
 */
public record EmptyStatement() implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.EMPTY;
    }

    @Override
    public String render() {
        return "";
    }
}
