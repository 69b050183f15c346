package org.pragmatica.edn.report;

import org.junit.jupiter.api.Test;
import org.pragmatica.edn.tree.SourceLocation;
import org.pragmatica.edn.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    private static SourceSpan span(int line, int column, int offset, int length) {
        return SourceSpan.of(SourceLocation.at(line, column, offset), SourceLocation.at(line, column + length, offset + length));
    }

    @Test
    void format_underlinesSpanWithoutExplicitLabels() {
        var source = "{:a 1\n :b 2}";
        var diagnostic = Diagnostic.error("unknown key", span(2, 2, 7, 2));

        assertThat(diagnostic.format(source, "conf.edn")).isEqualTo("""
            error: unknown key
              --> conf.edn:2:2
              |
            2 |  :b 2}
              |  ^^
              |
            """);
    }

    @Test
    void format_rendersLabelsAndNotes() {
        var source = "{:level\n :loud}";
        var diagnostic = Diagnostic.warning("unsupported level", span(1, 2, 1, 6))
                                   .withLabel("key")
                                   .withSecondaryLabel(span(2, 2, 9, 5), "value")
                                   .withNote("expected one of :debug :info");

        assertThat(diagnostic.format(source, null)).isEqualTo("""
            warning: unsupported level
              --> 1:2
              |
            1 | {:level
              |  ^^^^^^ key
            2 |  :loud}
              |  ----- value
              |
              = expected one of :debug :info
            """);
    }

    @Test
    void format_stopsUnderlineAtEndOfFirstLine() {
        var source = "{:doc \"a\nb\"}";
        var span = SourceSpan.of(SourceLocation.at(1, 7, 6), SourceLocation.at(2, 3, 10));

        assertThat(Diagnostic.error("bad doc", span).format(source, "d.edn")).isEqualTo("""
            error: bad doc
              --> d.edn:1:7
              |
            1 | {:doc "a
              |       ^^
              |
            """);
    }

    @Test
    void formatAt_namesGivenPosition() {
        var diagnostic = Diagnostic.error("m", span(1, 2, 1, 2));

        assertThat(diagnostic.formatAt("{:a 1}", "conf.edn:7:9")).startsWith("error: m\n  --> conf.edn:7:9\n");
    }

    @Test
    void format_widensGutterForMultiDigitLines() {
        var source = "x\n".repeat(9) + "{:k 1}";
        var diagnostic = Diagnostic.error("bad", span(10, 2, 19, 2));

        assertThat(diagnostic.format(source, "f.edn")).contains("10 | {:k 1}\n   |  ^^\n");
    }

    @Test
    void formatSimple_rendersSingleLine() {
        var diagnostic = Diagnostic.error("bad value", span(3, 7, 20, 2));

        assertThat(diagnostic.formatSimple("project.clj")).isEqualTo("project.clj:3:7: error: bad value");
        assertThat(diagnostic.formatSimple(null)).isEqualTo("input:3:7: error: bad value");
    }

    @Test
    void withers_leaveOriginalUnchanged() {
        var original = Diagnostic.error("m", span(1, 1, 0, 1));

        var noted = original.withNote("n").withLabel("l");

        assertThat(original.notes()).isEmpty();
        assertThat(original.labels()).isEmpty();
        assertThat(noted.notes()).containsExactly("n");
        assertThat(noted.labels()).singleElement()
                                  .satisfies(label -> assertThat(label.primary()).isTrue());
    }
}
