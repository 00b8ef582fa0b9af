package com.oclparser.view;

import com.oclparser.ast.Attribute;
import com.oclparser.ast.Document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * View over a single attribute, as returned when indexing the document root. The attribute's own
 * name resolves to its value. Attributes nested in a block or dictionary also expose
 * {@code __name}; floating ones expose only their name.
 */
public final class AttributeView extends NodeView {

    private final Attribute attribute;

    AttributeView(Document document, Attribute attribute) {
        super(document, attribute);
        this.attribute = attribute;
    }

    public Attribute attribute() {
        return attribute;
    }

    /**
     * The attribute's value, absent when it could not be parsed.
     */
    public Optional<ViewValue> value() {
        return Lookups.attributeValue(document, attribute);
    }

    @Override
    public Optional<String> name() {
        return Optional.of(attribute.name());
    }

    @Override
    public Optional<ViewValue> get(String name) {
        if (attribute.name().equals(name)) {
            return value();
        }
        if (BlockView.NAME_KEY.equals(name) && !attribute.floating()) {
            return Optional.of(Scalar.of(attribute.name()));
        }
        return Optional.empty();
    }

    @Override
    Map<String, ViewValue> resolveEntries() {
        Map<String, ViewValue> entries = new LinkedHashMap<>();
        value().ifPresent(value -> entries.put(attribute.name(), value));
        if (!attribute.floating()) {
            entries.putIfAbsent(BlockView.NAME_KEY, Scalar.of(attribute.name()));
        }
        return entries;
    }
}
