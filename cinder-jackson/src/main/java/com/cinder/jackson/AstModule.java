package com.cinder.jackson;

import com.cinder.ast.BlockStatement;
import com.cinder.ast.Statement;
import com.cinder.jackson.mixins.StatementMixin;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Jackson module that configures serialization/deserialization for the statement classes.
 *
 * This module handles:
 * - Polymorphic type handling via StatementMixin
 * - Hiding derived accessors such as BlockStatement.isEmpty()
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.cinder", "cinder-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Statement.class, StatementMixin.class);

        // isEmpty() is derived from statements and must not be written as "empty"
        context.setMixInAnnotations(BlockStatement.class, BlockStatementMixin.class);
    }

    @JsonIgnoreProperties({"empty"})
    private abstract static class BlockStatementMixin {
    }
}
