package net.synchro.util.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.synchro.api.parser.ParseTree;
import org.junit.jupiter.api.Test;

class ParseTreeImplTest {

    @Test
    void structuralEquality() {
        ParseTree<String> a = ParseTreeImpl.nonterminal("Sum",
            ParseTreeImpl.terminal("Num", "3"),
            ParseTreeImpl.terminal("+", "+"));
        ParseTree<String> b = ParseTreeImpl.nonterminal("Sum",
            ParseTreeImpl.terminal("Num", "3"),
            ParseTreeImpl.terminal("+", "+"));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(ParseTreeImpl.nonterminal("Sum",
            ParseTreeImpl.terminal("Num", "4"),
            ParseTreeImpl.terminal("+", "+")));
        assertThat(ParseTreeImpl.terminal("Num", "3")).isNotEqualTo(
            ParseTreeImpl.terminal("Digit", "3"));
    }

    @Test
    void accessors() {
        ParseTree<String> leaf = ParseTreeImpl.terminal("Num", "3");
        ParseTree<String> node = ParseTreeImpl.nonterminal("Sum", leaf);

        assertThat(leaf.getKind()).isEqualTo(ParseTree.Kind.TERMINAL);
        assertThat(leaf.getContent()).isEqualTo("3");
        assertThat(leaf.childCount()).isZero();
        assertThat(node.getKind()).isEqualTo(ParseTree.Kind.NONTERMINAL);
        assertThat(node.getTag()).isEqualTo("Sum");
        assertThat(node.getContent()).isNull();
        assertThat(node.childAt(0)).isSameAs(leaf);
        assertThat(node.toString()).isEqualTo("Sum(Num(\"3\"))");
    }

    @Test
    void empty() {
        ParseTree<String> empty = ParseTreeImpl.empty();

        assertThat(empty.getKind()).isEqualTo(ParseTree.Kind.EMPTY);
        assertThat(empty.getTag()).isNull();
        assertThat(empty.getChildren()).isEmpty();
        assertThat(empty).isEqualTo(ParseTreeImpl.<Integer>empty());
    }

    @Test
    void childrenAreImmutable() {
        ParseTree<String> node = ParseTreeImpl.nonterminal("Sum",
            ParseTreeImpl.terminal("Num", "3"));

        assertThatThrownBy(() -> node.getChildren().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

}
