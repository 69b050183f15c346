package org.pragmatica.edn;

import org.pragmatica.edn.path.PathResolver;
import org.pragmatica.edn.reader.EdnReader;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Locator configuration options.
 *
 * @param callFormHead symbol heading the call form that is used as the initial position, e.g. {@code defproject}
 * @param charset      encoding of documents read from files
 * @param maxInputSize largest document accepted, in characters
 * @param maxDepth     deepest nesting of forms accepted
 */
public record LocatorConfig(
    String callFormHead,
    Charset charset,
    int maxInputSize,
    int maxDepth
) {
    public static final LocatorConfig DEFAULT = new LocatorConfig(
        PathResolver.DEFAULT_CALL_FORM_HEAD,
        StandardCharsets.UTF_8,
        EdnReader.DEFAULT_MAX_INPUT_SIZE,
        EdnReader.DEFAULT_MAX_DEPTH
    );

    public LocatorConfig {
        Objects.requireNonNull(callFormHead, "callFormHead");
        Objects.requireNonNull(charset, "charset");
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive: " + maxInputSize);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }
}
