package org.pragmatica.edn.tree;

import java.util.List;

/**
 * Concrete syntax tree node - lossless representation of EDN text.
 * Concatenating the text of all terminals in document order reproduces the source exactly.
 */
public sealed interface CstNode {
    /**
     * Node tag.
     */
    NodeKind kind();

    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * Child nodes, in document order. Empty for terminals.
     */
    List<CstNode> children();

    /**
     * Reconstructed source text of this subtree.
     */
    String text();

    default boolean is(NodeKind kind) {
        return kind() == kind;
    }

    /**
     * Terminal node - a leaf holding raw source text.
     */
    record Terminal(
    NodeKind kind,
    SourceSpan span,
    String text) implements CstNode {
        @Override
        public List<CstNode> children() {
            return List.of();
        }
    }

    /**
     * Non-terminal node - an interior node with children.
     */
    record NonTerminal(
    NodeKind kind,
    SourceSpan span,
    List<CstNode> children) implements CstNode {
        public NonTerminal {
            children = List.copyOf(children);
        }

        @Override
        public String text() {
            var sb = new StringBuilder(span.length());
            appendText(this, sb);
            return sb.toString();
        }

        private static void appendText(CstNode node, StringBuilder sb) {
            if (node instanceof Terminal terminal) {
                sb.append(terminal.text());
                return;
            }
            for (var child : node.children()) {
                appendText(child, sb);
            }
        }
    }
}
