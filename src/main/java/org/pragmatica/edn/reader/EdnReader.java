package org.pragmatica.edn.reader;

import org.pragmatica.edn.error.ReadError;
import org.pragmatica.edn.tree.CstNode;
import org.pragmatica.edn.tree.NodeKind;
import org.pragmatica.edn.tree.SourceLocation;
import org.pragmatica.edn.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Reader for EDN / Clojure data-literal text.
 * Converts text into a lossless concrete syntax tree rooted at a {@link NodeKind#ROOT} node.
 *
 * <p>The reader is structural: it checks bracket balance and token well-formedness, not the
 * semantics of the data (odd map forms or duplicate keys are left to the decoder).
 */
public final class EdnReader {
    public static final int DEFAULT_MAX_INPUT_SIZE = 10_000_000;
    public static final int DEFAULT_MAX_DEPTH = 1_000;

    private final List<EdnToken> tokens;
    private final int maxDepth;
    private int pos;
    private int depth;

    private EdnReader(List<EdnToken> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
        this.pos = 0;
        this.depth = 0;
    }

    /**
     * Read document text into a concrete syntax tree.
     */
    public static ReadResult read(String text) {
        return read(text, DEFAULT_MAX_INPUT_SIZE);
    }

    /**
     * Read document text into a concrete syntax tree, refusing input longer than {@code maxInputSize} characters.
     */
    public static ReadResult read(String text, int maxInputSize) {
        return read(text, maxInputSize, DEFAULT_MAX_DEPTH);
    }

    /**
     * Read document text into a concrete syntax tree, refusing input longer than {@code maxInputSize}
     * characters or with collections, tagged literals and reader macros nested deeper than {@code maxDepth}.
     */
    public static ReadResult read(String text, int maxInputSize, int maxDepth) {
        if (text.length() > maxInputSize) {
            return new ReadResult.Failure(new ReadError.InputTooLarge(text.length(), maxInputSize));
        }
        try {
            return new ReadResult.Success(new EdnReader(EdnLexer.tokenize(text), maxDepth).readDocument());
        } catch (ReadAbort abort) {
            return new ReadResult.Failure(abort.error);
        }
    }

    private CstNode readDocument() {
        var children = new ArrayList<CstNode>();
        while (!(peek() instanceof EdnToken.Eof)) {
            var token = peek();
            if (isTrivia(token)) {
                children.add(terminal(advance()));
            } else if (token instanceof EdnToken.Close) {
                throw unexpected(token, "a form or end of input");
            } else {
                children.add(readForm());
            }
        }
        var end = peek().span().end();
        return new CstNode.NonTerminal(NodeKind.ROOT, SourceSpan.of(SourceLocation.START, end), children);
    }

    private CstNode readForm() {
        var token = peek();
        if (token instanceof EdnToken.Eof) {
            throw new ReadAbort(new ReadError.UnexpectedEof(token.span().start(), "a form"));
        }
        if (token instanceof EdnToken.Error error) {
            throw new ReadAbort(new ReadError.LexicalError(error.span().start(), error.message()));
        }
        if (token instanceof EdnToken.Close) {
            throw unexpected(token, "a form");
        }
        advance();
        if (token instanceof EdnToken.Open || token instanceof EdnToken.Prefix || token instanceof EdnToken.Tag) {
            if (++depth > maxDepth) {
                throw new ReadAbort(new ReadError.NestingTooDeep(token.span().start(), maxDepth));
            }
            try {
                return readNested(token);
            } finally {
                depth--;
            }
        }
        if (token instanceof EdnToken.Keyword) {
            return new CstNode.Terminal(NodeKind.KEYWORD, token.span(), token.text());
        }
        if (token instanceof EdnToken.Symbol) {
            var kind = isLiteralSymbol(token.text()) ? NodeKind.LITERAL : NodeKind.SYMBOL;
            return new CstNode.Terminal(kind, token.span(), token.text());
        }
        // numbers, strings, regexes, characters, symbolic values
        return new CstNode.Terminal(NodeKind.LITERAL, token.span(), token.text());
    }

    private CstNode readNested(EdnToken token) {
        if (token instanceof EdnToken.Open open) {
            return readCollection(open);
        }
        if (token instanceof EdnToken.Prefix prefix) {
            return readPrefixed(prefix);
        }
        var children = new ArrayList<CstNode>();
        children.add(new CstNode.Terminal(NodeKind.TAG, token.span(), token.text()));
        readTriviaInto(children);
        children.add(readForm());
        return nonTerminal(NodeKind.TAGGED, children);
    }

    private CstNode readCollection(EdnToken.Open open) {
        var children = new ArrayList<CstNode>();
        children.add(new CstNode.Terminal(NodeKind.DELIMITER, open.span(), open.text()));
        var closer = String.valueOf(open.closer());
        while (true) {
            var token = peek();
            if (token instanceof EdnToken.Eof) {
                throw new ReadAbort(new ReadError.UnexpectedEof(token.span().start(), "'" + closer + "'"));
            }
            if (token instanceof EdnToken.Close) {
                if (!token.text().equals(closer)) {
                    throw unexpected(token, "'" + closer + "'");
                }
                children.add(new CstNode.Terminal(NodeKind.DELIMITER, advance().span(), closer));
                return nonTerminal(collectionKind(open.text()), children);
            }
            if (isTrivia(token)) {
                children.add(terminal(advance()));
            } else {
                children.add(readForm());
            }
        }
    }

    private CstNode readPrefixed(EdnToken.Prefix prefix) {
        var children = new ArrayList<CstNode>();
        children.add(new CstNode.Terminal(NodeKind.DELIMITER, prefix.span(), prefix.text()));
        readTriviaInto(children);
        children.add(readForm());
        var kind = switch (prefix.text()) {
            case "#_" -> NodeKind.DISCARD;
            case "^" -> NodeKind.META;
            default -> NodeKind.QUOTED;
        };
        if (kind == NodeKind.META) {
            // metadata first, then the annotated form
            readTriviaInto(children);
            children.add(readForm());
        }
        return nonTerminal(kind, children);
    }

    private void readTriviaInto(List<CstNode> children) {
        while (isTrivia(peek())) {
            children.add(terminal(advance()));
        }
    }

    private static NodeKind collectionKind(String opener) {
        return switch (opener) {
            case "{" -> NodeKind.MAP;
            case "[" -> NodeKind.VECTOR;
            case "#{" -> NodeKind.SET;
            default -> NodeKind.LIST;
        };
    }

    private static CstNode terminal(EdnToken token) {
        NodeKind kind;
        if (token instanceof EdnToken.Newline) {
            kind = NodeKind.NEWLINE;
        } else if (token instanceof EdnToken.Comment) {
            kind = NodeKind.COMMENT;
        } else {
            kind = NodeKind.WHITESPACE;
        }
        return new CstNode.Terminal(kind, token.span(), token.text());
    }

    private static CstNode nonTerminal(NodeKind kind, List<CstNode> children) {
        var span = SourceSpan.of(children.get(0).span().start(),
                                 children.get(children.size() - 1).span().end());
        return new CstNode.NonTerminal(kind, span, children);
    }

    private static boolean isTrivia(EdnToken token) {
        return token instanceof EdnToken.Whitespace
               || token instanceof EdnToken.Newline
               || token instanceof EdnToken.Comment;
    }

    private static boolean isLiteralSymbol(String text) {
        return "nil".equals(text) || "true".equals(text) || "false".equals(text);
    }

    private static ReadAbort unexpected(EdnToken token, String expected) {
        return new ReadAbort(new ReadError.UnexpectedInput(token.span().start(), token.text(), expected));
    }

    private EdnToken peek() {
        return tokens.get(pos);
    }

    private EdnToken advance() {
        var token = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    /**
     * Unwinds the recursive descent on the first error.
     */
    private static final class ReadAbort extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private final transient ReadError error;

        private ReadAbort(ReadError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
