package com.oclparser.ast;

/**
 * A scalar literal. {@code raw} is the quoted source text for strings, the digits for numbers,
 * the keyword for booleans and the captured body for heredocs (already indent-stripped for
 * {@link LiteralType#INDENTED_HEREDOC}).
 */
public record Literal(
    int id,
    int parent,
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    LiteralType literalType,
    String raw
) implements Value {

    public Literal(
        int id,
        int parent,
        int start,
        int end,
        SourceLocation loc,
        LiteralType literalType,
        String raw
    ) {
        this(id,
             parent,
             start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             literalType,
             raw);
    }

    /**
     * Decodes the literal into a String, Number or Boolean. Heredoc bodies are returned as captured.
     */
    public Object value() {
        if (literalType.isHeredoc()) {
            return raw;
        }
        return Literals.decode(raw);
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
        return "Literal";
    }
}
