package org.pragmatica.edn.tree;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Directional walks over a concrete syntax tree.
 */
public final class Navigation {
    private Navigation() {}

    /**
     * Cursors obtained from {@code cursor} by repeatedly applying {@code step}, starting with {@code cursor} itself.
     */
    public static Walk direction(Function<Cursor, Optional<Cursor>> step, Cursor cursor) {
        return Walk.iterate(cursor, step);
    }

    /**
     * First cursor of {@link #direction(Function, Cursor)} satisfying {@code predicate}.
     */
    public static Optional<Cursor> directionFind(Function<Cursor, Optional<Cursor>> step,
                                                 Predicate<Cursor> predicate,
                                                 Cursor cursor) {
        return direction(step, cursor).find(predicate);
    }

    /**
     * Walk upwards to the document root node.
     */
    public static Optional<Cursor> toRoot(Cursor cursor) {
        return directionFind(Cursor::up, c -> Nodes.isRoot(c.node()), cursor);
    }

    /**
     * Pre-order traversal from {@code cursor} to the first node satisfying {@code predicate}.
     */
    public static Optional<Cursor> findFirst(Predicate<CstNode> predicate, Cursor cursor) {
        return directionFind(Cursor::next, c -> predicate.test(c.node()), cursor);
    }

    /**
     * {@code cursor} and its right siblings, without whitespace, newlines, comments and discarded forms.
     */
    public static Walk siblingsRightward(Cursor cursor) {
        return direction(Cursor::right, cursor).filter(c -> !Nodes.isInsignificant(c.node()));
    }

    /**
     * 1-based line of the cursor: the number of newline nodes preceding it in document order, plus one.
     * Line breaks inside string literals are part of the literal and are not counted.
     */
    public static int lineNumber(Cursor cursor) {
        var root = toRoot(cursor).orElseGet(cursor::top);
        int newlines = 0;
        for (var current : direction(Cursor::next, root)) {
            if (current.isAt(cursor)) {
                break;
            }
            if (current.node().is(NodeKind.NEWLINE)) {
                newlines++;
            }
        }
        return newlines + 1;
    }
}
