package org.pragmatica.edn.reader;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.pragmatica.edn.tree.CstNode;
import org.pragmatica.edn.tree.Cursor;
import org.pragmatica.edn.tree.Navigation;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concatenating node texts in document order reproduces the source.
 */
class RoundTripPropertyTest {

    private static final List<String> ATOMS = List.of(
        "nil", "true", "42", "-7", "1.5M", "3/4", "\"text\"", "\"multi\nline\"", "\\a", "\\newline",
        ":key", "::local", ":ns/key", "sym", "ns/sym", "#\"[a-z]+\"", "##Inf");

    private static final List<String> SEPARATORS = List.of(
        " ", ", ", "\n", "\r\n", "\t", " ; comment\n", "  #_ dropped ");

    @Provide
    Arbitrary<String> documents() {
        return form(4);
    }

    private static Arbitrary<String> form(int depth) {
        var atom = Arbitraries.of(ATOMS);
        if (depth == 0) {
            return atom;
        }
        var elements = Combinators.combine(form(depth - 1), Arbitraries.of(SEPARATORS))
                                  .as((element, separator) -> element + separator)
                                  .list()
                                  .ofMaxSize(4)
                                  .map(parts -> String.join("", parts));
        return Arbitraries.oneOf(atom,
                                 elements.map(body -> "[" + body + "]"),
                                 elements.map(body -> "(" + body + ")"),
                                 elements.map(body -> "{" + body + "}"),
                                 elements.map(body -> "#{" + body + "}"),
                                 elements.map(body -> "'(" + body + ")"),
                                 elements.map(body -> "#tag [" + body + "]"),
                                 elements.map(body -> "^:meta [" + body + "]"));
    }

    @Property
    void wellFormedDocuments_roundTrip(@ForAll("documents") String document) {
        var root = EdnReader.read(document).orElseThrow();

        assertThat(root.text()).isEqualTo(document);
        assertThat(terminalsInDocumentOrder(root)).isEqualTo(document);
    }

    @Property
    void anyInput_eitherFailsOrRoundTrips(@ForAll String input) {
        EdnReader.read(input)
                 .root()
                 .ifPresent(root -> assertThat(root.text()).isEqualTo(input));
    }

    @Property
    void tokens_alwaysCoverInput(@ForAll String input) {
        var concatenated = EdnLexer.tokenize(input)
                                   .stream()
                                   .map(EdnToken::text)
                                   .collect(Collectors.joining());

        assertThat(concatenated).isEqualTo(input);
    }

    private static String terminalsInDocumentOrder(CstNode root) {
        return Navigation.direction(Cursor::next, Cursor.of(root))
                         .stream()
                         .map(Cursor::node)
                         .filter(CstNode.Terminal.class::isInstance)
                         .map(CstNode::text)
                         .collect(Collectors.joining());
    }
}
