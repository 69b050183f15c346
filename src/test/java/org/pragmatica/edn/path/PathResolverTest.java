package org.pragmatica.edn.path;

import org.junit.jupiter.api.Test;
import org.pragmatica.edn.EdnLocator;
import org.pragmatica.edn.reader.EdnReader;
import org.pragmatica.edn.tree.Cursor;
import org.pragmatica.edn.tree.Navigation;
import org.pragmatica.edn.tree.NodeKind;
import org.pragmatica.edn.tree.Nodes;
import org.pragmatica.edn.value.EdnValue;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathResolverTest {

    static final String PROJECT = """
        (defproject proj "1.0"
          :description "demo"
          :deps [[a "1"] [b "2"]]
          :profiles {:dev {:source-paths ["dev"]}})
        """;

    private final EdnLocator locator = EdnLocator.create();
    private final PathResolver resolver = PathResolver.create();

    private Optional<Location> locate(String text, String path) {
        return locator.locate(KeyPath.parse(path), text, "test.edn");
    }

    private static Cursor start(String text) {
        var top = Cursor.of(EdnReader.read(text).orElseThrow());
        return Navigation.findFirst(node -> !Nodes.isRoot(node) && !Nodes.isInsignificant(node), top).orElseThrow();
    }

    // === Maps ===

    @Test
    void mapLookup_findsKeyAndDecodesValue() {
        var location = locate("{:a 1 :b 2}", "[:b]").orElseThrow();

        assertThat(location.line()).isEqualTo(1);
        assertThat(location.column()).isEqualTo(7);
        assertThat(location.value()).contains(EdnValue.integer(2));
        assertThat(location.target()).isEqualTo(PathTarget.KEY);
        assertThat(location.cursor().node().text()).isEqualTo(":b");
        assertThat(location.file()).isEqualTo("test.edn");
        assertThat(location.path()).isEqualTo(KeyPath.parse("[:b]"));
    }

    @Test
    void nestedPath_descendsThroughMapsAndVectors() {
        var location = locate("{:a {:b [10 20 30]}}", "[:a :b 2]").orElseThrow();

        assertThat(location.value()).contains(EdnValue.integer(30));
        assertThat(location.target()).isEqualTo(PathTarget.ELEMENT);
        assertThat(location.column()).isEqualTo(16);
    }

    @Test
    void missingKey_isAbsent() {
        assertThat(locate("{:a 1}", "[:z]")).isEmpty();
        assertThat(locate("{:a {:b 1}}", "[:z :b]")).isEmpty();
    }

    @Test
    void keysAreOnlyMatchedInKeyPositions() {
        assertThat(locate("{:a :b}", "[:b]")).isEmpty();
    }

    @Test
    void keyWithoutValue_isAbsent() {
        assertThat(locate("{:a 1 :b}", "[:b]")).isEmpty();
    }

    @Test
    void triviaBetweenEntries_isSkipped() {
        var text = "{;; leading comment\n :a ,, 1\n #_ :ignored #_ 0\n :b 2}";
        var location = locate(text, "[:b]").orElseThrow();

        assertThat(location.line()).isEqualTo(4);
        assertThat(location.column()).isEqualTo(2);
        assertThat(location.value()).contains(EdnValue.integer(2));
    }

    @Test
    void stringSymbolAndIntegerKeys_matchByDecodedText() {
        var text = "{\"na\\u006de\" 1 sym 2 7 3}";

        assertThat(locate(text, "[\"name\"]").flatMap(Location::value)).contains(EdnValue.integer(1));
        assertThat(locate(text, "[sym]").flatMap(Location::value)).contains(EdnValue.integer(2));
        assertThat(locate(text, "[7]").flatMap(Location::value)).contains(EdnValue.integer(3));
        assertThat(locate(text, "[:sym]")).isEmpty();
    }

    @Test
    void undecodableValue_keepsLocation() {
        var location = locate("{:a 08}", "[:a]").orElseThrow();

        assertThat(location.line()).isEqualTo(1);
        assertThat(location.value()).isEmpty();
    }

    // === Sequences ===

    @Test
    void sequenceIndex_outOfRangeIsAbsent() {
        assertThat(locate("[1 2 3]", "[5]")).isEmpty();
        assertThat(locate("[1 2 3]", "[3]")).isEmpty();
    }

    @Test
    void sequenceIndex_decodesElementItself() {
        assertThat(locate("[1 2 3]", "[0]").flatMap(Location::value)).contains(EdnValue.integer(1));
        assertThat(locate("[1 2 3]", "[2]").flatMap(Location::value)).contains(EdnValue.integer(3));
        assertThat(locate("{:a (1 ;c\n 2)}", "[:a 1]").map(Location::line)).contains(2);
    }

    @Test
    void nonIndexIntoSequence_isContractViolation() {
        assertThatThrownBy(() -> locate("[1 2 3]", "[:x]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be an index");
        assertThatThrownBy(() -> resolver.findKey(KeySegment.string("x"), start("(1 2)")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // === Call forms ===

    @Test
    void callForm_keywordRegionSkipsPositionalArguments() {
        var location = locate(PROJECT, "[:deps]").orElseThrow();

        assertThat(location.line()).isEqualTo(3);
        assertThat(location.column()).isEqualTo(3);
        assertThat(location.target()).isEqualTo(PathTarget.KEY);
        assertThat(location.value()).hasValueSatisfying(value -> assertThat(value).isInstanceOf(EdnValue.VectorValue.class));
    }

    @Test
    void callForm_nestedPaths() {
        assertThat(locate(PROJECT, "[:deps 1 0]").flatMap(Location::value)).contains(EdnValue.symbol("b"));
        assertThat(locate(PROJECT, "[:profiles :dev :source-paths 0]").flatMap(Location::value))
            .contains(EdnValue.string("dev"));
        assertThat(locate(PROJECT, "[:description]").flatMap(Location::value)).contains(EdnValue.string("demo"));
    }

    @Test
    void callForm_indexIncludesHead() {
        var head = locate(PROJECT, "[0]").orElseThrow();

        assertThat(head.value()).contains(EdnValue.symbol("defproject"));
        assertThat(head.target()).isEqualTo(PathTarget.ELEMENT);
        assertThat(locate(PROJECT, "[1]").flatMap(Location::value)).contains(EdnValue.symbol("proj"));
        assertThat(locate(PROJECT, "[2]").flatMap(Location::value)).contains(EdnValue.string("1.0"));
    }

    @Test
    void callForm_positionalArgumentsAreNotKeys() {
        assertThat(locate(PROJECT, "[proj]")).isEmpty();
        assertThat(locate("(defproject proj \"1.0\")", "[:deps]")).isEmpty();
    }

    @Test
    void callForm_isPreferredAsInitialPosition() {
        var text = "(ns build)\n[:not-this]\n(defproject p \"1\" :a 1)";

        var location = locate(text, "[:a]").orElseThrow();
        assertThat(location.line()).isEqualTo(3);
        assertThat(location.value()).contains(EdnValue.integer(1));
    }

    @Test
    void callFormHead_isConfigurable() {
        var custom = EdnLocator.builder().callFormHead("deftask").build();

        var location = custom.locate(KeyPath.parse("[:opt]"), "(deftask build :opt 1)", "build.clj");
        assertThat(location.flatMap(Location::value)).contains(EdnValue.integer(1));
    }

    // === Sets and other nodes ===

    @Test
    void sets_areNotNavigable() {
        assertThat(locate("{:s #{1 2}}", "[:s 0]")).isEmpty();
        assertThat(locate("{:s #{1 2}}", "[:s :x]")).isEmpty();
        assertThat(resolver.findKey(KeySegment.index(0), start("#{1 2}"))).isEmpty();
    }

    @Test
    void setValuedKey_isStillLocatable() {
        var location = locate("{:s #{1 2}}", "[:s]").orElseThrow();

        assertThat(location.value()).hasValueSatisfying(value -> assertThat(value).isInstanceOf(EdnValue.SetValue.class));
    }

    @Test
    void scalarNodes_haveNoKeys() {
        assertThat(locate("{:a 1}", "[:a :b]")).isEmpty();
        assertThat(resolver.findKey(KeySegment.keyword("a"), start(":a"))).isEmpty();
    }

    // === Resolver API ===

    @Test
    void resolveValue_pointsAtValue() {
        var resolution = resolver.resolveValue(KeyPath.parse("[:b]"), start("{:a 1 :b 2}")).orElseThrow();

        assertThat(resolution.cursor().node().text()).isEqualTo("2");
        assertThat(resolution.cursor().column()).isEqualTo(10);
        assertThat(resolution.target()).isEqualTo(PathTarget.ELEMENT);
    }

    @Test
    void findValue_differsFromFindKeyOnlyForPairs() {
        var map = start("{:a [1 2]}");
        var key = resolver.findKey(KeySegment.keyword("a"), map).orElseThrow();
        var value = resolver.findValue(KeySegment.keyword("a"), map).orElseThrow();

        assertThat(key.kind()).isEqualTo(NodeKind.KEYWORD);
        assertThat(value.kind()).isEqualTo(NodeKind.VECTOR);
        assertThat(resolver.findKey(KeySegment.index(1), value)).isEqualTo(resolver.findValue(KeySegment.index(1), value));
    }

    @Test
    void valueAtPath_stopsBeforeLastSegment() {
        var parent = resolver.valueAtPath(KeyPath.parse("[:a :b]"), start("{:a {:b 1}}")).orElseThrow();

        assertThat(parent.kind()).isEqualTo(NodeKind.MAP);
        assertThat(parent.node().text()).isEqualTo("{:b 1}");
    }

    @Test
    void resolution_isDeterministic() {
        var first = locate(PROJECT, "[:deps 0 1]");
        var second = locate(PROJECT, "[:deps 0 1]");

        assertThat(first).isPresent();
        assertThat(first.map(Location::toString)).isEqualTo(second.map(Location::toString));
        assertThat(first.flatMap(Location::value)).isEqualTo(second.flatMap(Location::value))
                                                  .contains(EdnValue.string("1"));
    }
}
