package com.oclparser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for OCL source text.
 *
 * <p>Whitespace and comments ({@code #}, {@code //} and {@code /* ... *}{@code /}) are skipped.
 * Heredocs ({@code <<ID} and {@code <<-ID}) are captured line by line up to their terminator and
 * emitted as a start/body/end token triple. The body token's {@link Token#literal()} holds the text
 * a reader sees: verbatim for {@code <<}, and with the terminator line's indentation removed from
 * each line for {@code <<-}.</p>
 */
public class Lexer {

    private final String source;
    private final int length;
    private int position = 0;
    private int line = 1;
    private int column = 0;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    /**
     * Tokenizes the whole source. The returned list always ends with an EOF token.
     *
     * @throws ParseException on an unterminated string, heredoc or block comment, or an invalid escape
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (position >= length) {
                tokens.add(new Token(TokenType.EOF, "", null, line, column, position, position, line, column));
                return tokens;
            }
            if (peekChar(0) == '<' && peekChar(1) == '<' && scanHeredoc(tokens)) {
                continue;
            }
            tokens.add(nextToken());
        }
    }

    private Token nextToken() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        char ch = peekChar(0);

        if (ch == '"') {
            return readString();
        }
        if (isDigit(ch) || (ch == '-' && isDigit(peekChar(1)))) {
            return readNumber();
        }
        if (isIdentifierStart(ch)) {
            return readIdentifier();
        }

        TokenType type = switch (ch) {
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '=' -> TokenType.EQUAL;
            case ',' -> TokenType.COMMA;
            default -> TokenType.ILLEGAL;
        };
        // Keep surrogate pairs together in a single ILLEGAL token
        int width = Character.charCount(source.codePointAt(position));
        advanceTo(position + width);
        return makeToken(type, startPos, startLine, startCol, null);
    }

    private Token readString() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        advance(); // opening quote

        while (true) {
            if (position >= length || peekChar(0) == '\n' || peekChar(0) == '\r') {
                throw error(startLine, startCol, startPos, "Unterminated string literal");
            }
            char c = peekChar(0);
            if (c == '"') {
                advance();
                return makeToken(TokenType.STRING, startPos, startLine, startCol, null);
            }
            if (c == '\\') {
                readEscape(startLine, startCol, startPos);
            } else {
                advance();
            }
        }
    }

    private void readEscape(int stringLine, int stringCol, int stringPos) {
        int escLine = line;
        int escCol = column;
        int escPos = position;
        advance(); // backslash
        if (position >= length) {
            throw error(stringLine, stringCol, stringPos, "Unterminated string literal");
        }
        char e = peekChar(0);
        switch (e) {
            case '"', '\\', '/', 'b', 'f', 'n', 'r', 't' -> advance();
            case 'u' -> {
                advance();
                for (int i = 0; i < 4; i++) {
                    if (!isHexDigit(peekChar(0))) {
                        throw error(escLine, escCol, escPos, "Invalid unicode escape sequence");
                    }
                    advance();
                }
            }
            default -> throw error(escLine, escCol, escPos, "Invalid escape sequence '\\" + e + "'");
        }
    }

    private Token readNumber() {
        int startPos = position;
        int startLine = line;
        int startCol = column;

        if (peekChar(0) == '-') {
            advance();
        }
        readDigits();
        if (peekChar(0) == '.' && isDigit(peekChar(1))) {
            advance();
            readDigits();
        }
        char e = peekChar(0);
        if (e == 'e' || e == 'E') {
            char next = peekChar(1);
            if (isDigit(next)) {
                advance();
                readDigits();
            } else if ((next == '+' || next == '-') && isDigit(peekChar(2))) {
                advance();
                advance();
                readDigits();
            }
        }
        return makeToken(TokenType.NUMBER, startPos, startLine, startCol, null);
    }

    private void readDigits() {
        while (isDigit(peekChar(0))) {
            advance();
        }
    }

    private Token readIdentifier() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        while (position < length && isIdentifierPart(peekChar(0))) {
            advance();
        }
        String text = source.substring(startPos, position);
        TokenType type = switch (text) {
            case "true" -> TokenType.TRUE;
            case "false" -> TokenType.FALSE;
            default -> TokenType.IDENTIFIER;
        };
        return makeToken(type, startPos, startLine, startCol, null);
    }

    /**
     * Scans a heredoc starting at the current {@code <<}. Returns false, consuming nothing, when the
     * marker is not followed by a delimiter and end of line.
     */
    private boolean scanHeredoc(List<Token> tokens) {
        int markerStart = position;
        int i = position + 2;
        boolean indented = i < length && source.charAt(i) == '-';
        if (indented) {
            i++;
        }
        int delimiterStart = i;
        if (i >= length || !isIdentifierStart(source.charAt(i))) {
            return false;
        }
        while (i < length && isDelimiterPart(source.charAt(i))) {
            i++;
        }
        String delimiter = source.substring(delimiterStart, i);
        int markerEnd = i;
        while (i < length && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++;
        }
        if (i < length && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
            return false;
        }

        int startLine = line;
        int startCol = column;
        advanceTo(markerEnd);
        tokens.add(makeToken(TokenType.HEREDOC_START, markerStart, startLine, startCol, null));
        if (i >= length) {
            throw error(startLine, startCol, markerStart, "Unterminated heredoc, expected '" + delimiter + "'");
        }
        advanceTo(i);
        skipNewline();

        int bodyStart = position;
        int bodyLine = line;
        int bodyCol = column;
        while (true) {
            int lineStart = position;
            int lineEnd = lineStart;
            while (lineEnd < length && source.charAt(lineEnd) != '\n' && source.charAt(lineEnd) != '\r') {
                lineEnd++;
            }
            String content = source.substring(lineStart, lineEnd);
            if (isTerminator(content, delimiter, indented)) {
                String body = source.substring(bodyStart, lineStart);
                String text = indented ? stripIndent(body, leadingWhitespace(content)) : body;
                tokens.add(new Token(TokenType.HEREDOC_BODY, body, text,
                    bodyLine, bodyCol, bodyStart, lineStart, line, column));
                int endLine = line;
                int endCol = column;
                advanceTo(lineEnd);
                tokens.add(makeToken(TokenType.HEREDOC_END, lineStart, endLine, endCol, null));
                return true;
            }
            if (lineEnd >= length) {
                throw error(startLine, startCol, markerStart, "Unterminated heredoc, expected '" + delimiter + "'");
            }
            advanceTo(lineEnd);
            skipNewline();
        }
    }

    private static boolean isTerminator(String content, String delimiter, boolean indented) {
        String candidate = content.stripTrailing();
        if (indented) {
            candidate = candidate.stripLeading();
        }
        return candidate.equals(delimiter);
    }

    private static int leadingWhitespace(String content) {
        int count = 0;
        while (count < content.length() && (content.charAt(count) == ' ' || content.charAt(count) == '\t')) {
            count++;
        }
        return count;
    }

    // Removes up to `indent` spaces/tabs from the start of every line
    static String stripIndent(String body, int indent) {
        if (indent == 0 || body.isEmpty()) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        boolean atLineStart = true;
        int stripped = 0;
        for (int k = 0; k < body.length(); k++) {
            char c = body.charAt(k);
            if (atLineStart) {
                if ((c == ' ' || c == '\t') && stripped < indent) {
                    stripped++;
                    continue;
                }
                atLineStart = false;
            }
            sb.append(c);
            if (c == '\n' || c == '\r') {
                atLineStart = true;
                stripped = 0;
            }
        }
        return sb.toString();
    }

    private void skipWhitespaceAndComments() {
        while (position < length) {
            char c = peekChar(0);
            if (Character.isWhitespace(c) || c == '\uFEFF') {
                advance();
            } else if (c == '#' || (c == '/' && peekChar(1) == '/')) {
                while (position < length && peekChar(0) != '\n' && peekChar(0) != '\r') {
                    advance();
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        advance();
        advance();
        while (true) {
            if (position >= length) {
                throw error(startLine, startCol, startPos, "Unterminated block comment");
            }
            if (peekChar(0) == '*' && peekChar(1) == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
    }

    private void skipNewline() {
        if (peekChar(0) == '\r') {
            advance();
            if (peekChar(0) == '\n') {
                advance();
            }
        } else if (peekChar(0) == '\n') {
            advance();
        }
    }

    private Token makeToken(TokenType type, int startPos, int startLine, int startCol, String literal) {
        return new Token(type, source.substring(startPos, position), literal,
            startLine, startCol, startPos, position, line, column);
    }

    private void advance() {
        char c = source.charAt(position++);
        // CRLF counts as one line break, taken at the LF
        if (c == '\n' || (c == '\r' && peekChar(0) != '\n')) {
            line++;
            column = 0;
        } else {
            column++;
        }
    }

    private void advanceTo(int target) {
        while (position < target) {
            advance();
        }
    }

    private char peekChar(int offset) {
        int index = position + offset;
        return index < length ? source.charAt(index) : '\0';
    }

    private ParseException error(int errorLine, int errorCol, int errorPos, String reason) {
        return new ParseException(ParseException.LEXICAL_ERROR, errorLine, errorCol, errorPos, reason);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }

    private static boolean isDelimiterPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
