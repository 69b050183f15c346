package org.pragmatica.edn.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decoded EDN value. Collections keep the order in which their elements appear in the source.
 */
public sealed interface EdnValue {

    record Nil() implements EdnValue {
        @Override
        public String toString() {
            return "nil";
        }
    }

    record Bool(boolean value) implements EdnValue {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Int(BigInteger value) implements EdnValue {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * Ratio in lowest terms with a positive denominator greater than one.
     */
    record Ratio(BigInteger numerator, BigInteger denominator) implements EdnValue {
        @Override
        public String toString() {
            return numerator + "/" + denominator;
        }
    }

    record Real(double value) implements EdnValue {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * Arbitrary-precision decimal, written with an {@code M} suffix.
     */
    record Decimal(BigDecimal value) implements EdnValue {
        @Override
        public String toString() {
            return value + "M";
        }
    }

    record Str(String value) implements EdnValue {
        @Override
        public String toString() {
            var sb = new StringBuilder(value.length() + 2).append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    case '\r' -> sb.append("\\r");
                    case '\b' -> sb.append("\\b");
                    case '\f' -> sb.append("\\f");
                    default -> {
                        if (Character.isISOControl(c)) {
                            sb.append(unicodeEscape(c));
                        } else {
                            sb.append(c);
                        }
                    }
                }
            }
            return sb.append('"').toString();
        }
    }

    record Char(char value) implements EdnValue {
        @Override
        public String toString() {
            return switch (value) {
                case '\n' -> "\\newline";
                case ' ' -> "\\space";
                case '\t' -> "\\tab";
                case '\b' -> "\\backspace";
                case '\f' -> "\\formfeed";
                case '\r' -> "\\return";
                default -> Character.isISOControl(value) || Character.isWhitespace(value)
                           ? unicodeEscape(value)
                           : "\\" + value;
            };
        }
    }

    /**
     * Keyword; {@code name} excludes the leading colons and may carry a namespace ({@code ns/name}).
     */
    record Keyword(String name) implements EdnValue {
        @Override
        public String toString() {
            return ":" + name;
        }
    }

    record Symbol(String name) implements EdnValue {
        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Regular expression literal; {@code pattern} is the text between the quotes, unescaped.
     */
    record Regex(String pattern) implements EdnValue {
        @Override
        public String toString() {
            return "#\"" + pattern + '"';
        }
    }

    record ListValue(List<EdnValue> elements) implements EdnValue {
        public ListValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String toString() {
            return join("(", elements, ")");
        }
    }

    record VectorValue(List<EdnValue> elements) implements EdnValue {
        public VectorValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String toString() {
            return join("[", elements, "]");
        }
    }

    record MapValue(Map<EdnValue, EdnValue> entries) implements EdnValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public String toString() {
            var sb = new StringBuilder("{");
            entries.forEach((key, value) -> {
                if (sb.length() > 1) {
                    sb.append(", ");
                }
                sb.append(key).append(' ').append(value);
            });
            return sb.append('}').toString();
        }
    }

    record SetValue(Set<EdnValue> elements) implements EdnValue {
        public SetValue {
            elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
        }

        @Override
        public String toString() {
            return join("#{", elements, "}");
        }
    }

    /**
     * Tagged literal such as {@code #inst "2024-01-01"}; {@code tag} excludes the {@code #}.
     */
    record Tagged(String tag, EdnValue value) implements EdnValue {
        @Override
        public String toString() {
            return "#" + tag + " " + value;
        }
    }

    EdnValue NIL = new Nil();

    static EdnValue integer(long value) {
        return new Int(BigInteger.valueOf(value));
    }

    static EdnValue string(String value) {
        return new Str(value);
    }

    static EdnValue keyword(String name) {
        return new Keyword(name);
    }

    static EdnValue symbol(String name) {
        return new Symbol(name);
    }

    static EdnValue vector(EdnValue... elements) {
        return new VectorValue(Arrays.asList(elements));
    }

    static EdnValue list(EdnValue... elements) {
        return new ListValue(Arrays.asList(elements));
    }

    /**
     * Map from alternating keys and values.
     */
    static EdnValue map(EdnValue... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Map requires an even number of forms, got " + keysAndValues.length);
        }
        var entries = new LinkedHashMap<EdnValue, EdnValue>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return new MapValue(entries);
    }

    private static String unicodeEscape(char c) {
        return String.format("\\u%04x", (int) c);
    }

    private static String join(String open, Iterable<EdnValue> elements, String close) {
        var sb = new StringBuilder(open);
        for (var element : elements) {
            if (sb.length() > open.length()) {
                sb.append(' ');
            }
            sb.append(element);
        }
        return sb.append(close).toString();
    }
}
