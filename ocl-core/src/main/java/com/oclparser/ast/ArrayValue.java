package com.oclparser.ast;

import java.util.List;

public record ArrayValue(
    int id,
    int parent,
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Value> elements
) implements Value {

    public ArrayValue {
        elements = List.copyOf(elements);
    }

    public ArrayValue(
        int id,
        int parent,
        int start,
        int end,
        SourceLocation loc,
        List<Value> elements
    ) {
        this(id,
             parent,
             start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             elements);
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
        return "Array";
    }
}
