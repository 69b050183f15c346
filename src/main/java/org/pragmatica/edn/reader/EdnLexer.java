package org.pragmatica.edn.reader;

import org.pragmatica.edn.tree.SourceLocation;
import org.pragmatica.edn.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for EDN / Clojure data-literal text.
 *
 * <p>Unlike a conventional lexer it keeps whitespace, line breaks and comments as tokens, so the
 * token texts concatenated in order reproduce the input exactly. Malformed input yields an
 * {@link EdnToken.Error} token rather than an exception.
 */
public final class EdnLexer {
    private static final String TERMINATING_MACROS = "\";@^`~()[]{}\\";

    private final String input;
    private int pos;
    private int line;
    private int column;

    private EdnLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<EdnToken> tokenize(String input) {
        return new EdnLexer(input).tokenizeAll();
    }

    private List<EdnToken> tokenizeAll() {
        var tokens = new ArrayList<EdnToken>();
        while (!isAtEnd()) {
            tokens.add(nextToken());
        }
        tokens.add(new EdnToken.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private EdnToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == '\n' || (c == '\r' && peekAt(1) == '\n')) {
            return scanNewline(start);
        }
        if (isWhitespace(c)) {
            return scanWhitespace(start);
        }
        if (c == ';') {
            return scanComment(start);
        }
        if (c == '(' || c == '[' || c == '{') {
            advance();
            return new EdnToken.Open(span(start), text(start));
        }
        if (c == ')' || c == ']' || c == '}') {
            advance();
            return new EdnToken.Close(span(start), text(start));
        }
        if (c == '"') {
            return scanString(start);
        }
        if (c == '\\') {
            return scanCharacter(start);
        }
        if (c == ':') {
            return scanKeyword(start);
        }
        if (c == '#') {
            return scanDispatch(start);
        }
        if (c == '\'' || c == '`' || c == '@' || c == '^') {
            advance();
            return new EdnToken.Prefix(span(start), text(start));
        }
        if (c == '~') {
            advance();
            if (!isAtEnd() && peek() == '@') {
                advance();
            }
            return new EdnToken.Prefix(span(start), text(start));
        }
        if (isDigit(c) || ((c == '+' || c == '-') && isDigit(peekAt(1)))) {
            scanTokenChars();
            return new EdnToken.Number(span(start), text(start));
        }
        if (isTokenChar(c)) {
            scanTokenChars();
            return new EdnToken.Symbol(span(start), text(start));
        }
        advance();
        return new EdnToken.Error(span(start), text(start), "Unexpected character: " + c);
    }

    private EdnToken scanNewline(SourceLocation start) {
        if (peek() == '\r') {
            advance();
        }
        advance();
        return new EdnToken.Newline(span(start), text(start));
    }

    private EdnToken scanWhitespace(SourceLocation start) {
        while (!isAtEnd() && isWhitespace(peek()) && !(peek() == '\r' && peekAt(1) == '\n')) {
            advance();
        }
        return new EdnToken.Whitespace(span(start), text(start));
    }

    private EdnToken scanComment(SourceLocation start) {
        while (!isAtEnd() && peek() != '\n' && !(peek() == '\r' && peekAt(1) == '\n')) {
            advance();
        }
        return new EdnToken.Comment(span(start), text(start));
    }

    private EdnToken scanString(SourceLocation start) {
        if (!scanQuoted()) {
            return new EdnToken.Error(span(start), text(start), "Unterminated string literal");
        }
        return new EdnToken.StringLiteral(span(start), text(start));
    }

    private EdnToken scanRegex(SourceLocation start) {
        if (!scanQuoted()) {
            return new EdnToken.Error(span(start), text(start), "Unterminated regex literal");
        }
        return new EdnToken.RegexLiteral(span(start), text(start));
    }

    /**
     * Consume a double-quoted body starting at the opening quote. False if input ends first.
     */
    private boolean scanQuoted() {
        advance();
        // skip opening quote
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            return false;
        }
        advance();
        // skip closing quote
        return true;
    }

    private EdnToken scanCharacter(SourceLocation start) {
        advance();
        // skip backslash
        if (isAtEnd()) {
            return new EdnToken.Error(span(start), text(start), "Unterminated character literal");
        }
        advance();
        scanTokenChars();
        return new EdnToken.CharLiteral(span(start), text(start));
    }

    private EdnToken scanKeyword(SourceLocation start) {
        advance();
        if (!isAtEnd() && peek() == ':') {
            advance();
        }
        int nameStart = pos;
        scanTokenChars();
        if (pos == nameStart) {
            return new EdnToken.Error(span(start), text(start), "Invalid keyword: " + text(start));
        }
        return new EdnToken.Keyword(span(start), text(start));
    }

    private EdnToken scanDispatch(SourceLocation start) {
        advance();
        // skip #
        if (isAtEnd()) {
            return new EdnToken.Error(span(start), text(start), "Unterminated dispatch macro");
        }
        char c = peek();
        return switch (c) {
            case '{', '(' -> {
                advance();
                yield new EdnToken.Open(span(start), text(start));
            }
            case '_', '\'' -> {
                advance();
                yield new EdnToken.Prefix(span(start), text(start));
            }
            case '"' -> scanRegex(start);
            case '!' -> scanComment(start);
            case '#' -> {
                advance();
                scanTokenChars();
                yield new EdnToken.SymbolicValue(span(start), text(start));
            }
            default -> {
                if (Character.isLetter(c)) {
                    scanTokenChars();
                    yield new EdnToken.Tag(span(start), text(start));
                }
                advance();
                yield new EdnToken.Error(span(start), text(start), "Unsupported dispatch macro: #" + c);
            }
        };
    }

    private void scanTokenChars() {
        while (!isAtEnd() && isTokenChar(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int distance) {
        int at = pos + distance;
        return at < input.length() ? input.charAt(at) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private String text(SourceLocation start) {
        return input.substring(start.offset(), pos);
    }

    private static boolean isWhitespace(char c) {
        return c != '\n' && (c == ',' || Character.isWhitespace(c));
    }

    private static boolean isTokenChar(char c) {
        return c != '\n' && c != ',' && !Character.isWhitespace(c) && TERMINATING_MACROS.indexOf(c) < 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
