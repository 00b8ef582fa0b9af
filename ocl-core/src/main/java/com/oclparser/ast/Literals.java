package com.oclparser.ast;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.json.JsonReadFeature;

import java.io.IOException;

/**
 * Decodes OCL string, number and boolean literals with JSON semantics.
 *
 * <p>Integral numbers decode to the narrowest of Integer, Long and BigInteger. Fractional or
 * exponent forms decode to Double.</p>
 */
public final class Literals {

    private static final JsonFactory FACTORY = JsonFactory.builder()
        .enable(JsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS)
        .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
        // The lexer puts no bound on literal length, so neither does decoding
        .streamReadConstraints(StreamReadConstraints.builder()
            .maxNumberLength(Integer.MAX_VALUE)
            .maxStringLength(Integer.MAX_VALUE)
            .build())
        .build();

    private Literals() {
        // Utility class
    }

    /**
     * Decodes a single JSON scalar.
     *
     * @throws IllegalStateException if {@code text} is not exactly one string, number or boolean
     */
    public static Object decode(String text) {
        try (JsonParser parser = FACTORY.createParser(text)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IllegalStateException("Empty literal");
            }
            Object value = switch (token) {
                case VALUE_STRING -> parser.getText();
                case VALUE_NUMBER_INT -> parser.getNumberValue();
                case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
                case VALUE_TRUE -> Boolean.TRUE;
                case VALUE_FALSE -> Boolean.FALSE;
                default -> throw new IllegalStateException("Not a scalar literal: " + text);
            };
            if (parser.nextToken() != null) {
                throw new IllegalStateException("Unexpected content after literal: " + text);
            }
            return value;
        } catch (IOException e) {
            throw new IllegalStateException("Malformed literal: " + text, e);
        }
    }

    /**
     * Decodes a double-quoted string literal into its text.
     */
    public static String decodeString(String quoted) {
        Object value = decode(quoted);
        if (value instanceof String s) {
            return s;
        }
        throw new IllegalStateException("Not a string literal: " + quoted);
    }
}
