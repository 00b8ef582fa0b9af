package com.oclparser.ast;

import java.util.List;

/**
 * The {@code { ... }} value form. Its body has the same shape as a block body, but the
 * dictionary has no name or labels of its own.
 */
public record Dictionary(
    int id,
    int parent,
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Member> children
) implements Value {

    public Dictionary {
        children = List.copyOf(children);
    }

    public Dictionary(
        int id,
        int parent,
        int start,
        int end,
        SourceLocation loc,
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
             children);
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
        return "Dictionary";
    }
}
