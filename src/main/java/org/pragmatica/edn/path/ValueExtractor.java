package org.pragmatica.edn.path;

import org.pragmatica.edn.tree.Cursor;
import org.pragmatica.edn.value.EdnDecoder;
import org.pragmatica.edn.value.EdnValue;

import java.util.Optional;

/**
 * Decodes the value at a resolved position.
 */
public final class ValueExtractor {
    private ValueExtractor() {}

    /**
     * For a {@link PathTarget#KEY} position the paired value is decoded, or the key itself when the
     * key has no value. For an {@link PathTarget#ELEMENT} position the node itself is decoded.
     * A value that cannot be decoded yields empty.
     */
    public static Optional<EdnValue> extract(Cursor cursor, PathTarget target) {
        if (target == PathTarget.KEY) {
            var paired = PathResolver.pairedValue(cursor);
            if (paired.isPresent()) {
                return EdnDecoder.decode(paired.get().node());
            }
        }
        return EdnDecoder.decode(cursor.node());
    }
}
