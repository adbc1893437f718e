package com.cinder.jackson.mixins;

import com.cinder.ast.ArrayStatement;
import com.cinder.ast.BlockStatement;
import com.cinder.ast.EmptyStatement;
import com.cinder.ast.ExpressionStatement;
import com.cinder.ast.ForStatement;
import com.cinder.ast.FunctionCallStatement;
import com.cinder.ast.FunctionStatement;
import com.cinder.ast.IfStatement;
import com.cinder.ast.IndexOperatorStatement;
import com.cinder.ast.ModuleStatement;
import com.cinder.ast.PlusEqualStatement;
import com.cinder.ast.ReturnStatement;
import com.cinder.ast.StructStatement;
import com.cinder.ast.VariableStatement;
import com.cinder.ast.WhileStatement;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic type handling for {@code Statement}: the {@code kind} property carries the
 * {@code StatementKind} name of the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EmptyStatement.class, name = "EMPTY"),
    @JsonSubTypes.Type(value = BlockStatement.class, name = "BLOCK"),
    @JsonSubTypes.Type(value = ModuleStatement.class, name = "MODULE"),
    @JsonSubTypes.Type(value = FunctionStatement.class, name = "FUNCTION"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "IF"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "RETURN"),
    @JsonSubTypes.Type(value = VariableStatement.class, name = "VARIABLE"),
    @JsonSubTypes.Type(value = PlusEqualStatement.class, name = "PLUS_EQUAL"),
    @JsonSubTypes.Type(value = WhileStatement.class, name = "WHILE"),
    @JsonSubTypes.Type(value = ForStatement.class, name = "FOR"),
    @JsonSubTypes.Type(value = ExpressionStatement.class, name = "EXPRESSION"),
    @JsonSubTypes.Type(value = ArrayStatement.class, name = "ARRAY"),
    @JsonSubTypes.Type(value = IndexOperatorStatement.class, name = "INDEX_OPERATOR"),
    @JsonSubTypes.Type(value = FunctionCallStatement.class, name = "FUNCTION_CALL"),
    @JsonSubTypes.Type(value = StructStatement.class, name = "STRUCT")
})
public abstract class StatementMixin {
}
