package com.oclparser.view;

import com.oclparser.ast.Document;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The root view. Top-level members are reachable by index, and blocks and floating attributes by
 * name. The interchange tree is built once and reused for equality and hashing.
 */
public final class DocumentView implements ViewValue {

    private final Document document;
    private volatile List<Object> tree;

    DocumentView(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    public Document document() {
        return document;
    }

    @Override
    public Optional<ViewValue> get(int index) {
        if (index < 0 || index >= document.body().size()) {
            return Optional.empty();
        }
        return Optional.of(Lookups.wrapMember(document, document.body().get(index)));
    }

    @Override
    public Optional<ViewValue> get(String name) {
        return Lookups.member(document, document.body(), name);
    }

    @Override
    public List<String> keys() {
        return Lookups.indices(document.body().size());
    }

    @Override
    public List<Object> toInterchangeTree() {
        List<Object> result = tree;
        if (result == null) {
            result = document.body().stream()
                .map(member -> (Object) Lookups.wrapMember(document, member).toInterchangeTree())
                .toList();
            tree = result;
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DocumentView other
            && toInterchangeTree().equals(other.toInterchangeTree());
    }

    @Override
    public int hashCode() {
        return toInterchangeTree().hashCode();
    }

    @Override
    public String toString() {
        return "DocumentView[members=" + document.body().size() + "]";
    }
}
