package com.oclparser;

/**
 * Thrown when source text cannot be tokenized: an unterminated string, heredoc or block comment,
 * or an invalid escape sequence. Structural problems never raise this; the parser records them
 * as recovery nodes instead.
 */
public class ParseException extends RuntimeException {

    public static final String LEXICAL_ERROR = "LexicalError";

    private final String errorType;
    private final int line;
    private final int column;
    private final int position;
    private final String reason;

    public ParseException(String errorType, int line, int column, int position, String reason) {
        super(String.format("%s at line %d, column %d: %s", errorType, line, column, reason));
        this.errorType = errorType;
        this.line = line;
        this.column = column;
        this.position = position;
        this.reason = reason;
    }

    public String getErrorType() {
        return errorType;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getPosition() {
        return position;
    }

    /**
     * The cause without the position prefix.
     */
    public String getReason() {
        return reason;
    }
}
