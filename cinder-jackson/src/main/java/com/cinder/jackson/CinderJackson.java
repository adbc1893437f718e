package com.cinder.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for statement trees and tokens.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CinderJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(module);
 * Statement statement = mapper.readValue(json, Statement.class);
 * </pre>
 */
public final class CinderJackson {

    private CinderJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for statement serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic Statement types via the "kind" property
     * - Leaves null values out (no statement component is ever null)
     * - Writes records with no components, such as EmptyStatement, without failing
     * - Ignores unknown properties during deserialization
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // EmptyStatement has no components
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
