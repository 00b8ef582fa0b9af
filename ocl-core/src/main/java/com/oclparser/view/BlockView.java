package com.oclparser.view;

import com.oclparser.ast.Block;
import com.oclparser.ast.Document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class BlockView extends NodeView {

    static final String NAME_KEY = "__name";
    static final String LABELS_KEY = "__labels";

    private final Block block;

    BlockView(Document document, Block block) {
        super(document, block);
        this.block = block;
    }

    public Block block() {
        return block;
    }

    @Override
    public Optional<String> name() {
        return Optional.of(block.name());
    }

    @Override
    public List<String> labels() {
        return block.labelValues();
    }

    private ValueList labelList() {
        return new ValueList(labels().stream().<ViewValue>map(Scalar::of).toList());
    }

    @Override
    public Optional<ViewValue> get(String name) {
        if (NAME_KEY.equals(name)) {
            return Optional.of(Scalar.of(block.name()));
        }
        if (LABELS_KEY.equals(name)) {
            return Optional.of(labelList());
        }
        return Lookups.member(document, block.children(), name);
    }

    @Override
    Map<String, ViewValue> resolveEntries() {
        Map<String, ViewValue> entries = new LinkedHashMap<>(Lookups.members(document, block.children()));
        entries.put(NAME_KEY, Scalar.of(block.name()));
        entries.put(LABELS_KEY, labelList());
        return entries;
    }
}
