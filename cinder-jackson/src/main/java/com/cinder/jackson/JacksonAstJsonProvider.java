package com.cinder.jackson;

import com.cinder.Token;
import com.cinder.ast.Statement;
import com.cinder.json.AstJsonDeserializer;
import com.cinder.json.AstJsonException;
import com.cinder.json.AstJsonProvider;
import com.cinder.json.AstJsonSerializer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final TypeReference<List<Token>> TOKEN_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = CinderJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Statement statement) throws AstJsonException {
            try {
                // Write through the Statement type so the root carries its "kind"
                return mapper.writerFor(Statement.class).writeValueAsString(statement);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize statement", e);
            }
        }

        @Override
        public String serializePretty(Statement statement) throws AstJsonException {
            try {
                return mapper.writerFor(Statement.class).withDefaultPrettyPrinter().writeValueAsString(statement);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize statement", e);
            }
        }

        @Override
        public String serializeTokens(List<Token> tokens) throws AstJsonException {
            try {
                return mapper.writerFor(TOKEN_LIST).writeValueAsString(tokens);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize tokens", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Statement deserializeStatement(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, Statement.class);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize Statement", e);
            }
        }

        @Override
        public <T extends Statement> T deserialize(String json, Class<T> type) throws AstJsonException {
            Statement statement = deserializeStatement(json);
            if (!type.isInstance(statement)) {
                throw new AstJsonException(
                    "Expected " + type.getSimpleName() + " but found " + statement.kind() + " statement");
            }
            return type.cast(statement);
        }

        @Override
        public List<Token> deserializeTokens(String json) throws AstJsonException {
            try {
                return List.copyOf(mapper.readValue(json, TOKEN_LIST));
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize tokens", e);
            }
        }
    }
}
