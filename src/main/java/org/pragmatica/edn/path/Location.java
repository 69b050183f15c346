package org.pragmatica.edn.path;

import org.pragmatica.edn.tree.Cursor;
import org.pragmatica.edn.tree.Navigation;
import org.pragmatica.edn.tree.SourceSpan;
import org.pragmatica.edn.value.EdnValue;

import java.util.Optional;

/**
 * Where a path resolved to in a document.
 *
 * @param file   identifier of the document, usually its path
 * @param line   1-based line of the resolved node
 * @param column 1-based column of the resolved node
 * @param value  decoded value at the position, empty if it could not be decoded
 * @param path   the path that was resolved
 * @param cursor cursor at the resolved node
 * @param target whether the cursor sits on a key or on an element
 */
public record Location(
    String file,
    int line,
    int column,
    Optional<EdnValue> value,
    KeyPath path,
    Cursor cursor,
    PathTarget target
) {
    public static Location of(String file, KeyPath path, PathResolver.Resolution resolution) {
        var cursor = resolution.cursor();
        return new Location(file,
                            Navigation.lineNumber(cursor),
                            cursor.column(),
                            ValueExtractor.extract(cursor, resolution.target()),
                            path,
                            cursor,
                            resolution.target());
    }

    /**
     * Span of the resolved node.
     */
    public SourceSpan span() {
        return cursor.node().span();
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
