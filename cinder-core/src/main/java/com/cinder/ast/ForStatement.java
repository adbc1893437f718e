package com.cinder.ast;

import java.util.Objects;

/**
 * C-style for loop.
 *
 * <p>The init statement is rendered in place and brings its own {@code ;}. The condition and
 * increment are pre-rendered text joined with nothing in between, so the condition must already
 * end in {@code ;} (for example {@code "i < n; "} and {@code "i += 1"}).</p>
 */
public record ForStatement(
    Statement init,
    String condition,
    String increment,
    BlockStatement body
) implements Statement {

    public ForStatement {
        Objects.requireNonNull(init, "init");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(increment, "increment");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.FOR;
    }

    @Override
    public String render() {
        return "for (" + init.render() + " " + condition + increment + ") {\n"
            + body.render()
            + "}\n";
    }
}
