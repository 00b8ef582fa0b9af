package com.oclparser.view;

import com.oclparser.ast.Block;
import com.oclparser.ast.Document;

import java.util.List;
import java.util.Optional;

/**
 * Sibling blocks sharing a name, in source order. Indexable by position, and by label: a label
 * matches the <em>last</em> label of a block.
 */
public final class BlockCollection implements ViewValue {

    private final Document document;
    private final List<Block> blocks;
    private volatile List<Object> tree;

    BlockCollection(Document document, List<Block> blocks) {
        this.document = document;
        this.blocks = List.copyOf(blocks);
    }

    public List<Block> blocks() {
        return blocks;
    }

    @Override
    public Optional<ViewValue> get(int index) {
        if (index < 0 || index >= blocks.size()) {
            return Optional.empty();
        }
        return Optional.of(new BlockView(document, blocks.get(index)));
    }

    @Override
    public Optional<ViewValue> get(String label) {
        List<ViewValue> matches = blocks.stream()
            .filter(block -> hasLastLabel(block, label))
            .<ViewValue>map(block -> new BlockView(document, block))
            .toList();
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() == 1) {
            return Optional.of(matches.get(0));
        }
        return Optional.of(new ValueList(matches));
    }

    private static boolean hasLastLabel(Block block, String label) {
        List<String> labels = block.labelValues();
        return !labels.isEmpty() && labels.get(labels.size() - 1).equals(label);
    }

    @Override
    public List<String> keys() {
        return Lookups.indices(blocks.size());
    }

    @Override
    public List<Object> toInterchangeTree() {
        List<Object> result = tree;
        if (result == null) {
            result = blocks.stream()
                .map(block -> (Object) new BlockView(document, block).toInterchangeTree())
                .toList();
            tree = result;
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BlockCollection other
            && toInterchangeTree().equals(other.toInterchangeTree());
    }

    @Override
    public int hashCode() {
        return toInterchangeTree().hashCode();
    }

    @Override
    public String toString() {
        return "BlockCollection[size=" + blocks.size() + "]";
    }
}
