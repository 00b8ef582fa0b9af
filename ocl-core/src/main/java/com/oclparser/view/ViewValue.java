package com.oclparser.view;

import java.util.List;
import java.util.Optional;

/**
 * Read-only, navigable view over a parsed OCL document.
 *
 * <p>Lookups never throw for missing data: a name, index or label that does not resolve yields
 * {@link Optional#empty()}. {@link #keys()} enumerates exactly the keys that resolve, and
 * {@link #toInterchangeTree()} binds each of them to its value, so the tree is a faithful
 * plain-data copy of the view.</p>
 *
 * <p>Node views are keyed by name, and each key resolves through {@link #get(String)}. The root,
 * block collections and lists are keyed by position: their keys are the decimal indices
 * {@code "0"} to {@code size() - 1}, which resolve through {@link #get(int)}. On those views
 * {@link #get(String)} keeps its own meaning (a member name on the root, a label on a block
 * collection) and does not parse index strings.</p>
 */
public sealed interface ViewValue permits DocumentView, NodeView, BlockCollection, ValueList, Scalar {

    /**
     * Looks up a child by name, or a block by label on a {@link BlockCollection}.
     */
    default Optional<ViewValue> get(String name) {
        return Optional.empty();
    }

    /**
     * Looks up an element by position. Out-of-range indices are absent.
     */
    default Optional<ViewValue> get(int index) {
        return Optional.empty();
    }

    /**
     * Shorthand for {@code get(name)} followed by label dispatch on the resulting block collection.
     */
    default Optional<ViewValue> getByLabel(String name, String label) {
        return get(name)
            .filter(BlockCollection.class::isInstance)
            .flatMap(blocks -> blocks.get(label));
    }

    /**
     * Chained lookup. {@code String} segments are names or labels, {@code Integer} segments are
     * indices.
     *
     * @throws IllegalArgumentException if a segment is neither a String nor an Integer
     */
    default Optional<ViewValue> at(Object... path) {
        Optional<ViewValue> result = Optional.of(this);
        for (Object segment : path) {
            if (segment instanceof String name) {
                result = result.flatMap(view -> view.get(name));
            } else if (segment instanceof Integer index) {
                result = result.flatMap(view -> view.get(index.intValue()));
            } else {
                throw new IllegalArgumentException("Path segments must be String or Integer, got: " + segment);
            }
        }
        return result;
    }

    List<String> keys();

    default int size() {
        return keys().size();
    }

    /**
     * Converts the view into unmodifiable plain data: insertion-ordered maps, lists, strings,
     * numbers and booleans.
     */
    Object toInterchangeTree();
}
