package com.oclparser.ast;

/**
 * Placeholder for a span of input that could not be parsed. It has no children and no value.
 * A zero-width recovery ({@code start == end}) marks a missing attribute value.
 */
public record Recovery(
    int id,
    int parent,
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Member, Value {

    public Recovery(int id, int parent, int start, int end, SourceLocation loc) {
        this(id,
             parent,
             start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0);
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
        return "Recovery";
    }
}
