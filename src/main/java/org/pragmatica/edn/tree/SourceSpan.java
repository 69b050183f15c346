package org.pragmatica.edn.tree;

/**
 * A range of document text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isMultiline() {
        return end.line() > start.line();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
