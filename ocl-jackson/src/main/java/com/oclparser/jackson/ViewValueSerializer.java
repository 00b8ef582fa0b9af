package com.oclparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.oclparser.view.NodeView;
import com.oclparser.view.Scalar;
import com.oclparser.view.ViewValue;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Writes a view following its keys: node views become objects, the root, block collections and
 * value lists become arrays, and scalars become JSON primitives.
 */
public class ViewValueSerializer extends StdSerializer<ViewValue> {

    public ViewValueSerializer() {
        super(ViewValue.class);
    }

    @Override
    public void serialize(ViewValue view, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (view instanceof Scalar scalar) {
            provider.defaultSerializeValue(scalar.value(), gen);
        } else if (view instanceof NodeView node) {
            gen.writeStartObject();
            for (Map.Entry<String, ViewValue> entry : node.entries().entrySet()) {
                gen.writeFieldName(entry.getKey());
                serialize(entry.getValue(), gen, provider);
            }
            gen.writeEndObject();
        } else {
            gen.writeStartArray();
            int size = view.size();
            for (int i = 0; i < size; i++) {
                serialize(resolve(view.get(i), i), gen, provider);
            }
            gen.writeEndArray();
        }
    }

    private static ViewValue resolve(Optional<ViewValue> value, Object key) {
        return value.orElseThrow(() -> new IllegalStateException("View key does not resolve: " + key));
    }
}
