package org.pragmatica.edn.reader;

import org.pragmatica.edn.tree.SourceSpan;

/**
 * Token types for the EDN lexer. Every token keeps its exact source text.
 */
public sealed interface EdnToken {
    SourceSpan span();

    String text();

    // Trivia
    record Whitespace(SourceSpan span, String text) implements EdnToken {}

    record Newline(SourceSpan span, String text) implements EdnToken {}

    record Comment(SourceSpan span, String text) implements EdnToken {}

    // Brackets: ( [ { #{ #(
    record Open(SourceSpan span, String text) implements EdnToken {
        public char closer() {
            return switch (text.charAt(text.length() - 1)) {
                case '(' -> ')';
                case '[' -> ']';
                default -> '}';
            };
        }
    }

    // ) ] }
    record Close(SourceSpan span, String text) implements EdnToken {}

    // Atoms
    record Keyword(SourceSpan span, String text) implements EdnToken {}

    record Symbol(SourceSpan span, String text) implements EdnToken {}

    record Number(SourceSpan span, String text) implements EdnToken {}

    record StringLiteral(SourceSpan span, String text) implements EdnToken {}

    // #"..."
    record RegexLiteral(SourceSpan span, String text) implements EdnToken {}

    // \a \newline A
    record CharLiteral(SourceSpan span, String text) implements EdnToken {}

    // ##Inf ##-Inf ##NaN
    record SymbolicValue(SourceSpan span, String text) implements EdnToken {}

    // #inst
    record Tag(SourceSpan span, String text) implements EdnToken {}

    // ' ` ~ ~@ @ ^ #' #_
    record Prefix(SourceSpan span, String text) implements EdnToken {}

    // Special
    record Eof(SourceSpan span) implements EdnToken {
        @Override
        public String text() {
            return "";
        }
    }

    record Error(SourceSpan span, String text, String message) implements EdnToken {}
}
