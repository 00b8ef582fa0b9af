package com.oclparser;

public enum TokenType {
    // Literals and names
    IDENTIFIER,
    STRING,
    NUMBER,
    TRUE,
    FALSE,

    // Heredoc: <<ID / <<-ID, the captured body, the terminator line
    HEREDOC_START,
    HEREDOC_BODY,
    HEREDOC_END,

    // Punctuation
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    EQUAL,
    COMMA,

    // A character the grammar has no use for; the parser recovers around it
    ILLEGAL,

    EOF
}
