package org.pragmatica.edn.path;

import org.pragmatica.edn.tree.Cursor;
import org.pragmatica.edn.tree.Navigation;
import org.pragmatica.edn.tree.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves key paths against a concrete syntax tree.
 *
 * <p>Failing to find a segment is a normal outcome reported as an empty result. Supplying a
 * non-index segment for a vector or list is a programming error and throws
 * {@link IllegalArgumentException}. Sets are not navigable: resolving into a set is always empty.
 */
public final class PathResolver {
    private static final Logger LOG = LoggerFactory.getLogger(PathResolver.class);

    public static final String DEFAULT_CALL_FORM_HEAD = "defproject";

    private final String callFormHead;

    private PathResolver(String callFormHead) {
        this.callFormHead = callFormHead;
    }

    public static PathResolver create() {
        return create(DEFAULT_CALL_FORM_HEAD);
    }

    /**
     * Resolver treating lists headed by the symbol {@code callFormHead} as call forms.
     */
    public static PathResolver create(String callFormHead) {
        return new PathResolver(callFormHead);
    }

    public String callFormHead() {
        return callFormHead;
    }

    /**
     * Resolved cursor together with the role of the position it points at.
     */
    public record Resolution(Cursor cursor, PathTarget target) {}

    /**
     * Resolve a path. The last segment resolves to the key token when its parent is a map or a
     * call form, and to the element itself when its parent is a sequence.
     */
    public Optional<Resolution> resolve(KeyPath path, Cursor start) {
        return valueAtPath(path, start).flatMap(parent -> findKey(path.last(), parent)
                                                              .map(cursor -> new Resolution(cursor,
                                                                                            targetOf(parent, path.last()))));
    }

    /**
     * Resolve a path down to the value position of its last segment.
     */
    public Optional<Resolution> resolveValue(KeyPath path, Cursor start) {
        return valueAtPath(path, start).flatMap(parent -> findValue(path.last(), parent))
                                       .map(cursor -> new Resolution(cursor, PathTarget.ELEMENT));
    }

    /**
     * Follow all segments but the last, each to its value position.
     */
    public Optional<Cursor> valueAtPath(KeyPath path, Cursor start) {
        var current = Optional.of(start);
        for (var segment : path.parent()) {
            current = current.flatMap(cursor -> findValue(segment, cursor));
            if (current.isEmpty()) {
                LOG.debug("Path {} does not resolve past segment {}", path, segment);
                break;
            }
        }
        return current;
    }

    /**
     * Position of {@code key} inside the form at {@code cursor}: the key token for maps and call-form
     * options, the element for sequences and indexed call forms.
     */
    public Optional<Cursor> findKey(KeySegment key, Cursor cursor) {
        var form = FormKind.of(cursor.node(), callFormHead);
        var found = switch (form) {
            case MAP -> findKeyInPairs(key, elements(cursor));
            case SEQUENCE -> findIndex(requireIndex(key, cursor), elements(cursor));
            case CALL_FORM -> key instanceof KeySegment.IndexKey index
                              ? findIndex(index, elements(cursor))
                              : findKeyInPairs(key, optionRegion(elements(cursor)));
            case SET -> {
                LOG.debug("Resolving {} into a set at {} is not supported", key, cursor.node().span().start());
                yield Optional.<Cursor>empty();
            }
            case OTHER -> Optional.<Cursor>empty();
        };
        if (found.isEmpty() && LOG.isTraceEnabled()) {
            LOG.trace("No {} in {} at {}", key, form, cursor.node().span().start());
        }
        return found;
    }

    /**
     * Value position of {@code key} inside the form at {@code cursor}.
     */
    public Optional<Cursor> findValue(KeySegment key, Cursor cursor) {
        var target = targetOf(cursor, key);
        return findKey(key, cursor).flatMap(found -> target == PathTarget.KEY
                                                     ? pairedValue(found)
                                                     : Optional.of(found));
    }

    /**
     * Next significant sibling of a key, skipping closing delimiters.
     */
    public static Optional<Cursor> pairedValue(Cursor key) {
        return Navigation.siblingsRightward(key)
                         .skip(1)
                         .filter(c -> !Nodes.isDelimiter(c.node()))
                         .first();
    }

    private PathTarget targetOf(Cursor parent, KeySegment key) {
        return switch (FormKind.of(parent.node(), callFormHead)) {
            case MAP -> PathTarget.KEY;
            case CALL_FORM -> key instanceof KeySegment.IndexKey ? PathTarget.ELEMENT : PathTarget.KEY;
            case SEQUENCE, SET, OTHER -> PathTarget.ELEMENT;
        };
    }

    /**
     * Significant children after the opening delimiter, without the closing one.
     */
    private static List<Cursor> elements(Cursor form) {
        return form.down()
                   .map(first -> Navigation.siblingsRightward(first)
                                           .skip(1)
                                           .filter(c -> !Nodes.isDelimiter(c.node()))
                                           .stream()
                                           .toList())
                   .orElse(List.of());
    }

    /**
     * Elements of a call form from its first keyword token on; the head and positional arguments are skipped.
     */
    private static List<Cursor> optionRegion(List<Cursor> elements) {
        for (int i = 1; i < elements.size(); i++) {
            if (Nodes.isKeywordToken(elements.get(i).node())) {
                return elements.subList(i, elements.size());
            }
        }
        return List.of();
    }

    private static Optional<Cursor> findKeyInPairs(KeySegment key, List<Cursor> elements) {
        for (int i = 0; i + 1 < elements.size(); i += 2) {
            var candidate = elements.get(i);
            if (key.matches(candidate.node())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Optional<Cursor> findIndex(KeySegment.IndexKey key, List<Cursor> elements) {
        return key.index() < elements.size()
               ? Optional.of(elements.get(key.index()))
               : Optional.empty();
    }

    private static KeySegment.IndexKey requireIndex(KeySegment key, Cursor cursor) {
        if (key instanceof KeySegment.IndexKey index) {
            return index;
        }
        throw new IllegalArgumentException("Key into a " + cursor.kind().name().toLowerCase(Locale.ROOT)
                                           + " at " + cursor.node().span().start()
                                           + " must be an index, got " + key);
    }
}
