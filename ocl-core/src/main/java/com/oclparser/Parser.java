package com.oclparser;

import com.oclparser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for OCL.
 *
 * <pre>
 * Document    := (Block | Attribute)*
 * Block       := IDENT STRING* '{' (Block | Attribute)* '}'
 * Attribute   := IDENT '=' Value
 * Value       := Literal | Array | Dictionary
 * Dictionary  := '{' (Block | Attribute)* '}'
 * Array       := '[' (Value (','? Value)*)? ']'
 * Literal     := STRING | NUMBER | BOOLEAN | HEREDOC
 * </pre>
 *
 * <p>The parser never fails on a malformed construct. Anything that is not a block or attribute
 * where one is expected becomes a {@link Recovery} node, and parsing resumes at the next member
 * start or at the brace closing the enclosing body. Only lexical errors escape, as
 * {@link ParseException}.</p>
 *
 * <p>Blocks, dictionaries and arrays nested deeper than {@code maxDepth} are skipped as a single
 * recovery node, so deeply nested input cannot exhaust the call stack.</p>
 *
 * <p>Instances are single-use and not thread-safe.</p>
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final String source;
    private final List<Token> tokens;
    private final int maxDepth;
    // Node arena, indexed by node id. Slots are reserved before children are parsed.
    private final List<Node> nodes = new ArrayList<>();
    private int current = 0;
    private boolean parsed = false;

    public Parser(String source) {
        this(source, DEFAULT_MAX_DEPTH);
    }

    public Parser(String source, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        this.source = source;
        this.maxDepth = maxDepth;
        this.tokens = new Lexer(source).tokenize();
    }

    public Document parse() {
        if (parsed) {
            throw new IllegalStateException("Parser instances are single-use");
        }
        parsed = true;

        List<Member> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.add(parseMember(Node.NO_PARENT, 0));
        }

        Token eof = peek();
        return new Document(0, source.length(), 1, 0, eof.endLine(), eof.endColumn(), body, nodes);
    }

    // ========================================================================
    // Members
    // ========================================================================

    /**
     * Parse one member of a document, block or dictionary body.
     *
     * @param depth number of containers enclosing the member
     */
    private Member parseMember(int parent, int depth) {
        if (check(TokenType.IDENTIFIER)) {
            if (checkAhead(1, TokenType.EQUAL)) {
                return parseAttribute(parent, depth);
            }
            if (isBlockStart(current)) {
                return depth >= maxDepth ? skipTooDeep(parent) : parseBlock(parent, depth);
            }
        }
        return parseRecovery(parent, depth > 0);
    }

    private Block parseBlock(int parent, int depth) {
        int id = allocate();
        Token name = advance();

        List<Literal> labels = new ArrayList<>();
        while (check(TokenType.STRING)) {
            Token label = advance();
            labels.add(register(new Literal(allocate(), id, label.position(), label.endPosition(),
                createLocation(label, label), LiteralType.STRING, label.lexeme())));
        }

        consume(TokenType.LBRACE);
        List<Member> children = parseBody(id, depth + 1);
        // An unclosed block is closed implicitly at EOF
        match(TokenType.RBRACE);

        Token last = previous();
        return register(new Block(id, parent, name.position(), last.endPosition(),
            createLocation(name, last), name.lexeme(), labels, children));
    }

    private Attribute parseAttribute(int parent, int depth) {
        int id = allocate();
        Token name = advance();
        consume(TokenType.EQUAL);
        Value value = parseValue(id, depth);

        Token last = previous();
        return register(new Attribute(id, parent, name.position(), last.endPosition(),
            createLocation(name, last), name.lexeme(), value));
    }

    private List<Member> parseBody(int parent, int depth) {
        List<Member> children = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.RBRACE)) {
            children.add(parseMember(parent, depth));
        }
        return children;
    }

    // ========================================================================
    // Values
    // ========================================================================

    private Value parseValue(int parent, int depth) {
        return switch (peek().type()) {
            case STRING, NUMBER, TRUE, FALSE -> parseLiteral(parent);
            case HEREDOC_START -> parseHeredoc(parent);
            case LBRACE -> depth >= maxDepth ? skipTooDeep(parent) : parseDictionary(parent, depth);
            case LBRACKET -> depth >= maxDepth ? skipTooDeep(parent) : parseArray(parent, depth);
            default -> parseMissingValue(parent, depth > 0);
        };
    }

    private Dictionary parseDictionary(int parent, int depth) {
        int id = allocate();
        Token open = advance();
        List<Member> children = parseBody(id, depth + 1);
        match(TokenType.RBRACE);

        Token last = previous();
        return register(new Dictionary(id, parent, open.position(), last.endPosition(),
            createLocation(open, last), children));
    }

    private ArrayValue parseArray(int parent, int depth) {
        int id = allocate();
        Token open = advance();

        List<Value> elements = new ArrayList<>();
        // Commas are optional separators. A '}' or a member start means the array was never
        // closed; leave it for the enclosing body.
        while (!isAtEnd() && !check(TokenType.RBRACKET) && !check(TokenType.RBRACE)
            && !isMemberStart(current)) {
            if (match(TokenType.COMMA)) {
                continue;
            }
            if (isValueStart(peek().type())) {
                elements.add(parseValue(id, depth + 1));
            } else {
                elements.add(parseInvalidElement(id));
            }
        }
        match(TokenType.RBRACKET);

        Token last = previous();
        return register(new ArrayValue(id, parent, open.position(), last.endPosition(),
            createLocation(open, last), elements));
    }

    private Literal parseLiteral(int parent) {
        int id = allocate();
        Token token = advance();
        LiteralType literalType = switch (token.type()) {
            case STRING -> LiteralType.STRING;
            case NUMBER -> LiteralType.NUMBER;
            case TRUE, FALSE -> LiteralType.BOOLEAN;
            default -> throw new IllegalStateException("Not a literal token: " + token);
        };
        return register(new Literal(id, parent, token.position(), token.endPosition(),
            createLocation(token, token), literalType, token.lexeme()));
    }

    private Literal parseHeredoc(int parent) {
        int id = allocate();
        Token start = advance();
        Token body = advance();
        Token end = advance();
        if (body.type() != TokenType.HEREDOC_BODY || end.type() != TokenType.HEREDOC_END) {
            throw new IllegalStateException("Heredoc start not followed by body and terminator: " + start);
        }
        LiteralType literalType = start.lexeme().startsWith("<<-")
            ? LiteralType.INDENTED_HEREDOC
            : LiteralType.HEREDOC;
        return register(new Literal(id, parent, start.position(), end.endPosition(),
            createLocation(start, end), literalType, body.literal()));
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    /**
     * Skip an unparseable span. At least one token is consumed; skipping stops at the next member
     * start, at EOF, or (inside a body) at the '}' closing that body. Brace and bracket groups
     * inside the span are skipped whole.
     */
    private Recovery parseRecovery(int parent, boolean inBody) {
        int id = allocate();
        Token first = peek();
        do {
            if (check(TokenType.LBRACE) || check(TokenType.LBRACKET)) {
                skipBalanced();
            } else {
                advance();
            }
        } while (!isAtEnd() && !isMemberStart(current) && !(inBody && check(TokenType.RBRACE)));

        Token last = previous();
        return register(new Recovery(id, parent, first.position(), last.endPosition(),
            createLocation(first, last)));
    }

    /**
     * An attribute with no usable value. When the next token closes the body or starts another
     * member the value is simply missing, so a zero-width recovery is recorded and nothing is
     * consumed.
     */
    private Recovery parseMissingValue(int parent, boolean inBody) {
        if (isAtEnd() || check(TokenType.RBRACE) || isMemberStart(current)) {
            Token next = peek();
            SourceLocation.Position at = new SourceLocation.Position(next.line(), next.column());
            return register(new Recovery(allocate(), parent, next.position(), next.position(),
                new SourceLocation(at, at)));
        }
        return parseRecovery(parent, inBody);
    }

    private Recovery parseInvalidElement(int parent) {
        int id = allocate();
        Token token = advance();
        return register(new Recovery(id, parent, token.position(), token.endPosition(),
            createLocation(token, token)));
    }

    private Recovery skipTooDeep(int parent) {
        int id = allocate();
        Token first = peek();
        if (check(TokenType.IDENTIFIER)) {
            advance();
            while (check(TokenType.STRING)) {
                advance();
            }
        }
        skipBalanced();

        Token last = previous();
        return register(new Recovery(id, parent, first.position(), last.endPosition(),
            createLocation(first, last)));
    }

    // Consume a brace/bracket group starting at the current token, iteratively
    private void skipBalanced() {
        int level = 0;
        do {
            TokenType type = peek().type();
            if (type == TokenType.LBRACE || type == TokenType.LBRACKET) {
                level++;
            } else if (type == TokenType.RBRACE || type == TokenType.RBRACKET) {
                level--;
            }
            advance();
        } while (level > 0 && !isAtEnd());
    }

    // ========================================================================
    // Lookahead
    // ========================================================================

    private boolean isMemberStart(int index) {
        return typeAt(index) == TokenType.IDENTIFIER
            && (typeAt(index + 1) == TokenType.EQUAL || isBlockStart(index));
    }

    // IDENT STRING* '{'
    private boolean isBlockStart(int index) {
        if (typeAt(index) != TokenType.IDENTIFIER) {
            return false;
        }
        int i = index + 1;
        while (typeAt(i) == TokenType.STRING) {
            i++;
        }
        return typeAt(i) == TokenType.LBRACE;
    }

    private static boolean isValueStart(TokenType type) {
        return switch (type) {
            case STRING, NUMBER, TRUE, FALSE, HEREDOC_START, LBRACE, LBRACKET -> true;
            default -> false;
        };
    }

    private TokenType typeAt(int index) {
        return index < tokens.size() ? tokens.get(index).type() : TokenType.EOF;
    }

    // ========================================================================
    // Arena
    // ========================================================================

    private int allocate() {
        nodes.add(null);
        return nodes.size() - 1;
    }

    private <T extends Node> T register(T node) {
        nodes.set(node.id(), node);
        return node;
    }

    // Helper method to create SourceLocation from tokens
    private SourceLocation createLocation(Token start, Token end) {
        SourceLocation.Position startPos = new SourceLocation.Position(start.line(), start.column());
        SourceLocation.Position endPos = new SourceLocation.Position(end.endLine(), end.endColumn());
        return new SourceLocation(startPos, endPos);
    }

    // Helper methods

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        return typeAt(current + offset) == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private void consume(TokenType type) {
        if (!match(type)) {
            throw new IllegalStateException("Expected " + type + " but found " + peek());
        }
    }

    public static Document parse(String source) {
        return new Parser(source).parse();
    }

    public static Document parse(String source, int maxDepth) {
        return new Parser(source, maxDepth).parse();
    }
}
