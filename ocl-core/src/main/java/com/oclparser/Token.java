package com.oclparser;

/**
 * @param type        the token kind
 * @param lexeme      the raw source slice
 * @param literal     the processed heredoc body for {@link TokenType#HEREDOC_BODY}, otherwise null
 * @param line        1-based start line
 * @param column      0-based start column
 * @param position    start offset in the source
 * @param endPosition end offset (exclusive)
 * @param endLine     1-based end line
 * @param endColumn   0-based end column
 */
public record Token(
    TokenType type,
    String lexeme,
    String literal,
    int line,
    int column,
    int position,
    int endPosition,
    int endLine,
    int endColumn
) {

    @Override
    public String toString() {
        return String.format("Token[%s '%s' at %d:%d]", type, lexeme, line, column);
    }
}
