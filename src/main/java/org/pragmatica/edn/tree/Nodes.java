package org.pragmatica.edn.tree;

import java.util.Optional;

/**
 * Classification predicates over concrete syntax tree nodes.
 * Each node matches at most one of map, set, list, vector, symbolic name and keyword token.
 */
public final class Nodes {
    private Nodes() {}

    public static boolean isRoot(CstNode node) {
        return node.is(NodeKind.ROOT);
    }

    public static boolean isMap(CstNode node) {
        return node.is(NodeKind.MAP);
    }

    public static boolean isSet(CstNode node) {
        return node.is(NodeKind.SET);
    }

    public static boolean isList(CstNode node) {
        return node.is(NodeKind.LIST);
    }

    public static boolean isVector(CstNode node) {
        return node.is(NodeKind.VECTOR);
    }

    public static boolean isCollection(CstNode node) {
        return node.kind().isCollection();
    }

    public static boolean isSymbolicName(CstNode node) {
        return node.is(NodeKind.SYMBOL);
    }

    public static boolean isKeywordToken(CstNode node) {
        return node.is(NodeKind.KEYWORD);
    }

    public static boolean isInsignificant(CstNode node) {
        return node.kind().isInsignificant();
    }

    public static boolean isDelimiter(CstNode node) {
        return node.is(NodeKind.DELIMITER);
    }

    /**
     * True iff the node is a keyword token whose name equals {@code name}.
     */
    public static boolean isKeywordMatch(String name, CstNode node) {
        return keywordName(node).map(name::equals)
                                .orElse(false);
    }

    /**
     * True iff the node is a symbol whose text equals {@code name}.
     */
    public static boolean isSymbolMatch(String name, CstNode node) {
        return isSymbolicName(node) && node.text().equals(name);
    }

    /**
     * Name of a keyword token without its leading colons: {@code :a/b} and {@code ::a/b} both yield {@code a/b}.
     */
    public static Optional<String> keywordName(CstNode node) {
        if (!isKeywordToken(node)) {
            return Optional.empty();
        }
        var text = node.text();
        int start = 0;
        while (start < text.length() && text.charAt(start) == ':') {
            start++;
        }
        return Optional.of(text.substring(start));
    }

    /**
     * True iff the node is a plain list whose first significant element is the symbol {@code head},
     * as in {@code (defproject name "1.0" :key value ...)}.
     */
    public static boolean isCallForm(CstNode node, String head) {
        if (!isList(node) || node.children().isEmpty() || !"(".equals(node.children().get(0).text())) {
            return false;
        }
        return node.children()
                   .stream()
                   .skip(1)
                   .filter(child -> !isInsignificant(child))
                   .findFirst()
                   .map(child -> isSymbolMatch(head, child))
                   .orElse(false);
    }
}
