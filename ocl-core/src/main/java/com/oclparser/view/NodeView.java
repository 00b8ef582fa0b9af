package com.oclparser.view;

import com.oclparser.ast.Document;
import com.oclparser.ast.Node;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A view wrapping a single AST node. Two node views are equal when their interchange trees are
 * equal, regardless of which document or source position they come from. The tree is built on
 * first use and kept, so repeated equality checks and hashing do not rebuild it.
 */
public abstract sealed class NodeView implements ViewValue
    permits BlockView, DictionaryView, AttributeView, OpaqueView {

    protected final Document document;
    private final Node node;
    private volatile Map<String, Object> tree;

    NodeView(Document document, Node node) {
        this.document = Objects.requireNonNull(document, "document");
        this.node = Objects.requireNonNull(node, "node");
    }

    public Node node() {
        return node;
    }

    /**
     * The name exposed as {@code __name}, if the node has one.
     */
    public Optional<String> name() {
        return Optional.empty();
    }

    /**
     * The decoded labels exposed as {@code __labels}. Empty for anything but blocks.
     */
    public List<String> labels() {
        return List.of();
    }

    abstract Map<String, ViewValue> resolveEntries();

    /**
     * The keys of this view bound to their values, in key order. Resolves the whole body once,
     * where calling {@link #get(String)} per key would rescan it for every key.
     */
    public final Map<String, ViewValue> entries() {
        return Collections.unmodifiableMap(resolveEntries());
    }

    @Override
    public final List<String> keys() {
        return List.copyOf(resolveEntries().keySet());
    }

    @Override
    public final Map<String, Object> toInterchangeTree() {
        Map<String, Object> result = tree;
        if (result == null) {
            result = Lookups.tree(resolveEntries());
            tree = result;
        }
        return result;
    }

    @Override
    public final boolean equals(Object obj) {
        return obj instanceof NodeView other
            && toInterchangeTree().equals(other.toInterchangeTree());
    }

    @Override
    public final int hashCode() {
        return toInterchangeTree().hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + node.type() + " at " + node.loc().start().line()
            + ":" + node.loc().start().column() + "]";
    }
}
