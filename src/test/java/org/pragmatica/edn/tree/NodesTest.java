package org.pragmatica.edn.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.edn.reader.EdnReader;

import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

class NodesTest {

    private static CstNode firstForm(String text) {
        return EdnReader.read(text)
                        .orElseThrow()
                        .children()
                        .stream()
                        .filter(node -> !Nodes.isInsignificant(node))
                        .findFirst()
                        .orElseThrow();
    }

    private static final List<Predicate<CstNode>> EXCLUSIVE = List.of(
        Nodes::isMap, Nodes::isSet, Nodes::isList, Nodes::isVector, Nodes::isSymbolicName, Nodes::isKeywordToken);

    @Test
    void classification_isMutuallyExclusive() {
        for (var text : List.of("{}", "#{}", "()", "[]", "sym", ":kw", "42", "\"s\"")) {
            var node = firstForm(text);
            long matches = EXCLUSIVE.stream()
                                    .filter(predicate -> predicate.test(node))
                                    .count();
            assertThat(matches).as(text).isLessThanOrEqualTo(1);
        }
    }

    @Test
    void collection_coversMapListAndVectorOnly() {
        assertThat(Nodes.isCollection(firstForm("{}"))).isTrue();
        assertThat(Nodes.isCollection(firstForm("()"))).isTrue();
        assertThat(Nodes.isCollection(firstForm("[]"))).isTrue();
        assertThat(Nodes.isCollection(firstForm("#{}"))).isFalse();
        assertThat(Nodes.isCollection(firstForm("x"))).isFalse();
    }

    @Test
    void literalSymbols_areNotSymbolicNames() {
        assertThat(Nodes.isSymbolicName(firstForm("nil"))).isFalse();
        assertThat(Nodes.isSymbolicName(firstForm("true"))).isFalse();
        assertThat(Nodes.isSymbolicName(firstForm("nilly"))).isTrue();
    }

    @Test
    void insignificant_coversTriviaAndDiscards() {
        var children = EdnReader.read(" ;c\n#_x 1").orElseThrow().children();

        assertThat(children).extracting(CstNode::kind)
                            .containsExactly(NodeKind.WHITESPACE,
                                             NodeKind.COMMENT,
                                             NodeKind.NEWLINE,
                                             NodeKind.DISCARD,
                                             NodeKind.WHITESPACE,
                                             NodeKind.LITERAL);
        assertThat(children).filteredOn(Nodes::isInsignificant).hasSize(5);
    }

    @Test
    void keywordMatch_comparesNameWithoutColons() {
        assertThat(Nodes.isKeywordMatch("deps", firstForm(":deps"))).isTrue();
        assertThat(Nodes.isKeywordMatch("deps", firstForm("::deps"))).isTrue();
        assertThat(Nodes.isKeywordMatch("ns/deps", firstForm(":ns/deps"))).isTrue();
        assertThat(Nodes.isKeywordMatch("deps", firstForm(":ns/deps"))).isFalse();
        assertThat(Nodes.isKeywordMatch("deps", firstForm("deps"))).isFalse();
        assertThat(Nodes.keywordName(firstForm("\"deps\""))).isEmpty();
    }

    @Test
    void callForm_requiresHeadSymbolFirst() {
        assertThat(Nodes.isCallForm(firstForm("(defproject x \"1\")"), "defproject")).isTrue();
        assertThat(Nodes.isCallForm(firstForm("( ; lead\n defproject x)"), "defproject")).isTrue();
        assertThat(Nodes.isCallForm(firstForm("(foo defproject)"), "defproject")).isFalse();
        assertThat(Nodes.isCallForm(firstForm("[defproject x]"), "defproject")).isFalse();
        assertThat(Nodes.isCallForm(firstForm("#(defproject %)"), "defproject")).isFalse();
        assertThat(Nodes.isCallForm(firstForm("()"), "defproject")).isFalse();
    }
}
