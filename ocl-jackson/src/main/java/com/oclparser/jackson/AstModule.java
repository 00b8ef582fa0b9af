package com.oclparser.jackson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.oclparser.ast.*;

/**
 * Jackson module that configures serialization for the AST records.
 *
 * This module handles:
 * - The type and loc properties on every node
 * - Hiding startLine/startCol/endLine/endCol, the arena ids and the document's node arena
 * - The decoded value of literals
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.oclparser", "ocl-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixins go on the concrete records; interface mixins are not picked up reliably for records
        context.setMixInAnnotations(Document.class, DocumentMixin.class);
        context.setMixInAnnotations(Block.class, SerializationMixin.class);
        context.setMixInAnnotations(Attribute.class, SerializationMixin.class);
        context.setMixInAnnotations(Dictionary.class, SerializationMixin.class);
        context.setMixInAnnotations(ArrayValue.class, SerializationMixin.class);
        context.setMixInAnnotations(Recovery.class, SerializationMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
    }

    // ==================== Serialization Mixins ====================

    // Base mixin that adds type and loc
    @JsonPropertyOrder({"type", "start", "end", "loc"})
    @JsonIgnoreProperties({"id", "parent", "startLine", "startCol", "endLine", "endCol"})
    private abstract static class SerializationMixin {
        @JsonProperty("type")
        abstract String type();

        @JsonProperty("loc")
        abstract SourceLocation loc();
    }

    @JsonIgnoreProperties({"id", "parent", "startLine", "startCol", "endLine", "endCol", "nodes"})
    private abstract static class DocumentMixin extends SerializationMixin {
    }

    @JsonPropertyOrder({"type", "start", "end", "loc", "literalType", "raw", "value"})
    private abstract static class LiteralMixin extends SerializationMixin {
        @JsonProperty("value")
        abstract Object value();
    }
}
