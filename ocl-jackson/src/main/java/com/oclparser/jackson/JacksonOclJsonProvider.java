package com.oclparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.oclparser.ast.Node;
import com.oclparser.json.*;
import com.oclparser.view.ViewValue;

/**
 * Jackson-based implementation of OclJsonProvider.
 */
public class JacksonOclJsonProvider implements OclJsonProvider {

    private final OclJsonSerializer serializer;
    private final OclJsonDeserializer deserializer;

    public JacksonOclJsonProvider() {
        ObjectMapper mapper = OclJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public OclJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public OclJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements OclJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws OclJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new OclJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws OclJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new OclJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serialize(ViewValue view) throws OclJsonException {
            try {
                return mapper.writeValueAsString(view);
            } catch (Exception e) {
                throw new OclJsonException("Failed to serialize view", e);
            }
        }

        @Override
        public String serializePretty(ViewValue view) throws OclJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(view);
            } catch (Exception e) {
                throw new OclJsonException("Failed to serialize view", e);
            }
        }
    }

    private static class JacksonDeserializer implements OclJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Object readTree(String json) throws OclJsonException {
            try {
                return mapper.readValue(json, Object.class);
            } catch (Exception e) {
                throw new OclJsonException("Failed to read JSON", e);
            }
        }
    }
}
