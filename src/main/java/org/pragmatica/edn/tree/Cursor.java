package org.pragmatica.edn.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable position in a concrete syntax tree.
 *
 * <p>A cursor holds the current node, the cursor of its parent and the index of the node among
 * the parent's children. Every movement returns a new cursor; the tree and existing cursors are
 * never modified, so cursors can be freely shared and kept.
 */
public final class Cursor {
    private final CstNode node;
    private final Cursor parent;
    private final int index;

    private Cursor(CstNode node, Cursor parent, int index) {
        this.node = node;
        this.parent = parent;
        this.index = index;
    }

    /**
     * Cursor positioned at the given tree root.
     */
    public static Cursor of(CstNode root) {
        return new Cursor(Objects.requireNonNull(root, "root"), null, -1);
    }

    public CstNode node() {
        return node;
    }

    public NodeKind kind() {
        return node.kind();
    }

    /**
     * Index of the current node among its siblings, or -1 at the top of the tree.
     */
    public int index() {
        return index;
    }

    /**
     * Number of ancestors between this cursor and the top of the tree.
     */
    public int depth() {
        int depth = 0;
        for (var current = parent; current != null; current = current.parent) {
            depth++;
        }
        return depth;
    }

    /**
     * 1-based column where the current node starts.
     */
    public int column() {
        return node.span().start().column();
    }

    public Optional<Cursor> up() {
        return Optional.ofNullable(parent);
    }

    /**
     * Move to the first child.
     */
    public Optional<Cursor> down() {
        return child(0);
    }

    public Optional<Cursor> child(int childIndex) {
        var children = node.children();
        if (childIndex < 0 || childIndex >= children.size()) {
            return Optional.empty();
        }
        return Optional.of(new Cursor(children.get(childIndex), this, childIndex));
    }

    public Optional<Cursor> right() {
        return sibling(index + 1);
    }

    public Optional<Cursor> left() {
        return sibling(index - 1);
    }

    /**
     * Next node in document order (pre-order): first child, else right sibling, else the right
     * sibling of the closest ancestor that has one. Empty once the traversal is exhausted.
     */
    public Optional<Cursor> next() {
        var firstChild = down();
        if (firstChild.isPresent()) {
            return firstChild;
        }
        for (var current = this; current != null; current = current.parent) {
            var sibling = current.right();
            if (sibling.isPresent()) {
                return sibling;
            }
        }
        return Optional.empty();
    }

    /**
     * Topmost cursor of the tree this cursor belongs to.
     */
    public Cursor top() {
        var current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * True iff both cursors point at the same node instance in the same tree.
     */
    public boolean isAt(Cursor other) {
        return other != null && node == other.node && index == other.index && depth() == other.depth();
    }

    private Optional<Cursor> sibling(int siblingIndex) {
        if (parent == null) {
            return Optional.empty();
        }
        return parent.child(siblingIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cursor other)) {
            return false;
        }
        return node == other.node && index == other.index && Objects.equals(parent, other.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(node), index, parent);
    }

    @Override
    public String toString() {
        return "Cursor[" + node.kind() + " at " + node.span().start() + "]";
    }
}
