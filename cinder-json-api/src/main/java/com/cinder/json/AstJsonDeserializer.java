package com.cinder.json;

import com.cinder.Token;
import com.cinder.ast.Statement;

import java.util.List;

/**
 * Interface for reading statement trees and token streams back from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON object to a statement of whatever kind its {@code kind} property names.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized statement
     * @throws AstJsonException if deserialization fails
     */
    Statement deserializeStatement(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific statement type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected statement type
     * @param <T> the statement type
     * @return the deserialized statement
     * @throws AstJsonException if deserialization fails or the JSON holds another kind
     */
    <T extends Statement> T deserialize(String json, Class<T> type) throws AstJsonException;

    /**
     * Deserializes a JSON array written by {@link AstJsonSerializer#serializeTokens(List)}.
     *
     * @param json the JSON array
     * @return the tokens in array order
     * @throws AstJsonException if deserialization fails
     */
    List<Token> deserializeTokens(String json) throws AstJsonException;
}
