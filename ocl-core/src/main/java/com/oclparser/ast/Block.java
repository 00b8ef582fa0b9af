package com.oclparser.ast;

import java.util.List;

/**
 * {@code name "label1" "label2" { ... }}
 */
public record Block(
    int id,
    int parent,
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name,
    List<Literal> labels,
    List<Member> children
) implements Member {

    public Block {
        labels = List.copyOf(labels);
        children = List.copyOf(children);
    }

    public Block(
        int id,
        int parent,
        int start,
        int end,
        SourceLocation loc,
        String name,
        List<Literal> labels,
        List<Member> children
    ) {
        this(id,
             parent,
             start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             name,
             labels,
             children);
    }

    /**
     * Returns the labels decoded to plain text, in source order.
     */
    public List<String> labelValues() {
        return labels.stream()
            .map(label -> Literals.decodeString(label.raw()))
            .toList();
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
        return "Block";
    }
}
