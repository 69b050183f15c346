package org.pragmatica.edn.path;

import org.pragmatica.edn.tree.CstNode;
import org.pragmatica.edn.tree.NodeKind;
import org.pragmatica.edn.tree.Nodes;
import org.pragmatica.edn.value.EdnDecoder;
import org.pragmatica.edn.value.EdnValue;

import java.math.BigInteger;

/**
 * One step of a {@link KeyPath}: a map key or a sequence index.
 */
public sealed interface KeySegment {

    /**
     * True iff {@code node} is a map key equal to this segment by decoded textual identity.
     */
    boolean matches(CstNode node);

    /**
     * Keyword key such as {@code :deps}; {@code name} excludes the leading colon.
     */
    record KeywordKey(String name) implements KeySegment {
        public KeywordKey {
            name = name.startsWith(":") ? name.substring(1) : name;
        }

        @Override
        public boolean matches(CstNode node) {
            return Nodes.isKeywordMatch(name, node);
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }

    record SymbolKey(String name) implements KeySegment {
        @Override
        public boolean matches(CstNode node) {
            return Nodes.isSymbolMatch(name, node);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record StringKey(String value) implements KeySegment {
        @Override
        public boolean matches(CstNode node) {
            return node.is(NodeKind.LITERAL)
                   && node.text().startsWith("\"")
                   && EdnDecoder.decode(node)
                                .map(new EdnValue.Str(value)::equals)
                                .orElse(false);
        }

        @Override
        public String toString() {
            return new EdnValue.Str(value).toString();
        }
    }

    /**
     * Zero-based sequence index. As a map key it matches an integer literal of the same value.
     */
    record IndexKey(int index) implements KeySegment {
        public IndexKey {
            if (index < 0) {
                throw new IllegalArgumentException("Index must not be negative: " + index);
            }
        }

        @Override
        public boolean matches(CstNode node) {
            return node.is(NodeKind.LITERAL)
                   && EdnDecoder.decode(node)
                                .map(EdnValue.integer(index)::equals)
                                .orElse(false);
        }

        @Override
        public String toString() {
            return String.valueOf(index);
        }
    }

    static KeySegment keyword(String name) {
        return new KeywordKey(name);
    }

    static KeySegment symbol(String name) {
        return new SymbolKey(name);
    }

    static KeySegment string(String value) {
        return new StringKey(value);
    }

    static KeySegment index(int index) {
        return new IndexKey(index);
    }

    /**
     * Segment for a decoded value: keyword, symbol, string or non-negative integer.
     */
    static KeySegment of(EdnValue value) {
        if (value instanceof EdnValue.Keyword keyword) {
            return new KeywordKey(keyword.name());
        }
        if (value instanceof EdnValue.Symbol symbol) {
            return new SymbolKey(symbol.name());
        }
        if (value instanceof EdnValue.Str str) {
            return new StringKey(str.value());
        }
        if (value instanceof EdnValue.Int integer
            && integer.value().signum() >= 0
            && integer.value().compareTo(BigInteger.valueOf(Integer.MAX_VALUE)) <= 0) {
            return new IndexKey(integer.value().intValue());
        }
        throw new IllegalArgumentException("Not a valid path segment: " + value);
    }
}
