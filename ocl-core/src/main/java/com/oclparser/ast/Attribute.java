package com.oclparser.ast;

import java.util.Objects;

/**
 * {@code name = value}
 */
public record Attribute(
    int id,
    int parent,
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name,
    Value value
) implements Member {

    public Attribute {
        Objects.requireNonNull(value, "value");
    }

    public Attribute(
        int id,
        int parent,
        int start,
        int end,
        SourceLocation loc,
        String name,
        Value value
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
             value);
    }

    /**
     * A floating attribute sits directly in the document body rather than in a block or dictionary.
     */
    public boolean floating() {
        return parent == NO_PARENT;
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
        return "Attribute";
    }
}
