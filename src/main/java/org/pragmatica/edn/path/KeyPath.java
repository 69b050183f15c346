package org.pragmatica.edn.path;

import org.pragmatica.edn.value.EdnDecoder;
import org.pragmatica.edn.value.EdnValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Non-empty sequence of key segments through decoded data, shallowest first.
 */
public record KeyPath(List<KeySegment> segments) {
    public KeyPath {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Path must contain at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public static KeyPath of(KeySegment... segments) {
        return new KeyPath(Arrays.asList(segments));
    }

    /**
     * Path written as an EDN vector or list, e.g. {@code [:cljsbuild :builds 0 :compiler]}.
     */
    public static KeyPath parse(String edn) {
        var value = EdnDecoder.readValue(edn)
                              .orElseThrow(() -> new IllegalArgumentException("Not a readable path: " + edn));
        List<EdnValue> elements;
        if (value instanceof EdnValue.VectorValue vector) {
            elements = vector.elements();
        } else if (value instanceof EdnValue.ListValue list) {
            elements = list.elements();
        } else {
            throw new IllegalArgumentException("Path must be a vector or a list: " + edn);
        }
        return new KeyPath(elements.stream()
                                   .map(KeySegment::of)
                                   .toList());
    }

    public int size() {
        return segments.size();
    }

    public KeySegment last() {
        return segments.get(segments.size() - 1);
    }

    /**
     * All segments but the last.
     */
    public List<KeySegment> parent() {
        return segments.subList(0, segments.size() - 1);
    }

    @Override
    public String toString() {
        return segments.stream()
                       .map(KeySegment::toString)
                       .collect(Collectors.joining(" ", "[", "]"));
    }
}
