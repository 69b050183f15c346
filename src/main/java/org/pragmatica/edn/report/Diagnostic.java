package org.pragmatica.edn.report;

import org.pragmatica.edn.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Source-annotated message pointing at a span of an EDN document.
 *
 * <p>Example output:
 * <pre>
 * error: :optimizations must be one of :none :whitespace :simple :advanced
 *   --> project.clj:7:29
 *    |
 *  7 |                 :compiler {:optimizations :fast}
 *    |                            ^^^^^^^^^^^^^^ ----- value
 *    |
 *    = path: [:cljsbuild :builds 0 :compiler :optimizations]
 * </pre>
 *
 * @param severity Severity level
 * @param message  Primary message
 * @param span     Span the message is about
 * @param labels   Labeled spans; the primary one is underlined with {@code ^}
 * @param notes    Trailing notes
 */
public record Diagnostic(
    Severity severity,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span.
     *
     * @param primary whether the span is underlined with {@code ^} rather than {@code -}
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String labelMessage) {
        return withLabel(Label.primary(span, labelMessage));
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String labelMessage) {
        return withLabel(Label.secondary(labelSpan, labelMessage));
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, labels, newNotes);
    }

    private Diagnostic withLabel(Label label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(label);
        return new Diagnostic(severity, message, span, newLabels, notes);
    }

    /**
     * Render with an excerpt of {@code source}.
     *
     * @param source   full document text the spans refer to
     * @param filename document name for the location line, may be null
     */
    public String format(String source, String filename) {
        return formatAt(source, filename == null ? span.start().toString() : filename + ":" + span.start());
    }

    /**
     * Render with an excerpt of {@code source}, naming the position as {@code position} in the header.
     * The excerpt itself always shows physical source lines.
     */
    public String formatAt(String source, String position) {
        var sb = new StringBuilder();
        var lines = source.split("\r?\n", -1);

        sb.append(severity.display()).append(": ").append(message).append("\n");
        sb.append("  --> ").append(position).append("\n");

        var shown = shownLabels();
        int firstLine = span.start().line();
        int lastLine = span.start().line();
        for (var label : shown) {
            firstLine = Math.min(firstLine, label.span().start().line());
            lastLine = Math.max(lastLine, label.span().start().line());
        }
        int gutter = String.valueOf(lastLine).length();
        var margin = " ".repeat(gutter + 1);

        sb.append(margin).append("|\n");
        for (int lineNum = firstLine; lineNum <= lastLine && lineNum <= lines.length; lineNum++) {
            var content = lines[lineNum - 1];
            sb.append(String.format("%" + gutter + "d", lineNum)).append(" | ").append(content).append("\n");
            var onLine = labelsStartingOn(shown, lineNum);
            if (!onLine.isEmpty()) {
                sb.append(margin).append("| ").append(underline(content, onLine)).append("\n");
            }
        }
        sb.append(margin).append("|\n");
        for (var note : notes) {
            sb.append(margin).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line rendering: {@code file:line:column: severity: message}.
     */
    public String formatSimple(String filename) {
        return String.format("%s:%d:%d: %s: %s",
                             filename == null ? "input" : filename,
                             span.start().line(),
                             span.start().column(),
                             severity.display(),
                             message);
    }

    private List<Label> shownLabels() {
        if (labels.stream().anyMatch(Label::primary)) {
            return labels;
        }
        var all = new ArrayList<Label>();
        all.add(Label.primary(span, ""));
        all.addAll(labels);
        return all;
    }

    private static List<Label> labelsStartingOn(List<Label> labels, int lineNum) {
        return labels.stream()
                     .filter(label -> label.span().start().line() == lineNum)
                     .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                     .toList();
    }

    // Underlines stop at the end of the first line of a multi-line span.
    private static String underline(String content, List<Label> labels) {
        var sb = new StringBuilder();
        int column = 1;
        for (var label : labels) {
            var start = label.span().start();
            var end = label.span().end();
            int startColumn = Math.max(column, start.column());
            int endColumn = label.span().isMultiline() ? content.length() + 1 : end.column();
            sb.append(" ".repeat(startColumn - column));
            int width = Math.max(1, endColumn - startColumn);
            sb.append(String.valueOf(label.primary() ? '^' : '-').repeat(width));
            column = startColumn + width;
            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
                column += label.message().length() + 1;
            }
        }
        return sb.toString();
    }
}
