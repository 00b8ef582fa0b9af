package com.oclparser.ast;

import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed OCL source.
 *
 * @param body  the top-level members in source order
 * @param nodes the node arena: every node in the tree, indexed by {@link Node#id()}
 */
public record Document(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Member> body,
    List<Node> nodes
) implements Node {

    public Document {
        body = List.copyOf(body);
        nodes = List.copyOf(nodes);
    }

    public int size() {
        return body.size();
    }

    /**
     * Returns the node with the given arena id.
     *
     * @throws IndexOutOfBoundsException if no node has that id
     */
    public Node node(int id) {
        return nodes.get(id);
    }

    public Optional<Node> parentOf(Node node) {
        if (node.parent() == NO_PARENT) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(node.parent()));
    }

    /**
     * Whether {@code node} is the instance stored in this document's arena.
     */
    public boolean owns(Node node) {
        if (node == this) {
            return true;
        }
        int id = node.id();
        return id >= 0 && id < nodes.size() && nodes.get(id) == node;
    }

    @Override
    public int id() {
        return NO_PARENT;
    }

    @Override
    public int parent() {
        return NO_PARENT;
    }

    @Override
    public SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine, startCol),
            new SourceLocation.Position(endLine, endCol)
        );
    }

    @Override
    public String type() {
        return "Document";
    }
}
