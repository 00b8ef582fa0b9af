package com.oclparser.ast;

public enum LiteralType {
    STRING,
    NUMBER,
    BOOLEAN,
    HEREDOC,
    INDENTED_HEREDOC;

    public boolean isHeredoc() {
        return this == HEREDOC || this == INDENTED_HEREDOC;
    }
}
