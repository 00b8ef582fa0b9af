package com.oclparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for OCL documents and views.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = OclJackson.createObjectMapper();
 * String ast = mapper.writeValueAsString(Parser.parse(source));
 * String view = mapper.writeValueAsString(Views.parse(source));
 * </pre>
 */
public final class OclJackson {

    private OclJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for OCL serialization.
     *
     * The returned mapper:
     * - Serializes AST nodes with type and loc properties (instead of startLine/startCol/endLine/endCol)
     * - Leaves out the node arena and parent ids
     * - Serializes views as plain objects and arrays following their keys
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Configure serialization - exclude null values
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new AstModule());
        mapper.registerModule(new ViewModule());

        return mapper;
    }
}
