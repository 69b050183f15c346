package org.pragmatica.edn.report;

import org.pragmatica.edn.path.KeyPath;
import org.pragmatica.edn.path.Location;
import org.pragmatica.edn.path.PathResolver;
import org.pragmatica.edn.path.PathTarget;
import org.pragmatica.edn.tree.Cursor;

import java.util.Optional;

/**
 * Turns validation messages into reports, annotated with source when the offending path could be located.
 */
public final class ViolationReporter {
    private ViolationReporter() {}

    /**
     * Report {@code message} for {@code path}. With a location the report quotes the source around the
     * key (and its value); without one it falls back to {@code path: message}.
     * The header names the location's line and column, which do not count line breaks inside string literals.
     */
    public static String report(String message, KeyPath path, Optional<Location> location) {
        return location.map(found -> diagnostic(message, found).formatAt(source(found.cursor()), found.toString()))
                       .orElseGet(() -> path + ": " + message);
    }

    /**
     * Diagnostic for a located violation: the key is the primary label, its value a secondary one.
     */
    public static Diagnostic diagnostic(String message, Location location) {
        var diagnostic = Diagnostic.error(message, location.span());
        if (location.target() == PathTarget.KEY) {
            var value = PathResolver.pairedValue(location.cursor());
            if (value.isPresent()) {
                diagnostic = diagnostic.withLabel("")
                                       .withSecondaryLabel(value.get().node().span(), "value");
            }
        }
        return diagnostic.withNote("path: " + location.path());
    }

    private static String source(Cursor cursor) {
        return cursor.top()
                     .node()
                     .text();
    }
}
