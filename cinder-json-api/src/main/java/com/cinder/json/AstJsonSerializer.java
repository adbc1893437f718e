package com.cinder.json;

import com.cinder.Token;
import com.cinder.ast.Statement;

import java.util.List;

/**
 * Interface for serializing statement trees and token streams to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a statement tree to a JSON string.
     *
     * @param statement the root of the tree
     * @return the JSON representation of the tree
     * @throws AstJsonException if serialization fails
     */
    String serialize(Statement statement) throws AstJsonException;

    /**
     * Serializes a statement tree to a pretty-printed JSON string.
     *
     * @param statement the root of the tree
     * @return the pretty-printed JSON representation of the tree
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Statement statement) throws AstJsonException;

    /**
     * Serializes lexer output as a JSON array of {@code {type, text, span}} objects.
     *
     * @param tokens tokens in source order
     * @return the JSON array
     * @throws AstJsonException if serialization fails
     */
    String serializeTokens(List<Token> tokens) throws AstJsonException;
}
