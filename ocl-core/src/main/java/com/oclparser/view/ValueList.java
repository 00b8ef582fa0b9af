package com.oclparser.view;

import java.util.List;
import java.util.Optional;

/**
 * An ordered list of values: array elements, duplicated attributes, blocks sharing a label, or a
 * block's labels.
 */
public record ValueList(List<ViewValue> items) implements ViewValue {

    public ValueList {
        items = List.copyOf(items);
    }

    @Override
    public Optional<ViewValue> get(int index) {
        if (index < 0 || index >= items.size()) {
            return Optional.empty();
        }
        return Optional.of(items.get(index));
    }

    @Override
    public List<String> keys() {
        return Lookups.indices(items.size());
    }

    @Override
    public List<Object> toInterchangeTree() {
        return items.stream()
            .map(ViewValue::toInterchangeTree)
            .toList();
    }
}
