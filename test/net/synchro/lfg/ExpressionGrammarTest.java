package net.synchro.lfg;

import static net.synchro.lfg.ExpressionGrammar.EXPRESSION;
import static net.synchro.lfg.ExpressionGrammar.IDENTIFIER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.synchro.api.parser.ParsingException;
import net.synchro.syntax.ParseOutcome;
import org.junit.jupiter.api.Test;

class ExpressionGrammarTest {

    private static Expression<RelativeIdentifier> ref(RelativeIdentifier id) {
        return Expression.reference(id);
    }

    @Test
    void identifiers() throws Exception {
        assertThat(IDENTIFIER.parseUnique("^")).isSameAs(RelativeIdentifier.UP);
        assertThat(IDENTIFIER.parseUnique("!"))
            .isSameAs(RelativeIdentifier.DOWN);
        assertThat(IDENTIFIER.parseUnique("%f"))
            .isEqualTo(RelativeIdentifier.local("%f"));
        assertThat(IDENTIFIER.parseUnique("X").getKind())
            .isEqualTo(RelativeIdentifier.Kind.LOCAL);
    }

    @Test
    void keywordsAreNotNames() {
        assertThatThrownBy(() -> IDENTIFIER.parseUnique("NOT"))
            .isInstanceOf(ParsingException.class);
        assertThatThrownBy(() -> IDENTIFIER.parseUnique("INc"))
            .isInstanceOf(ParsingException.class);
        assertThat(ExpressionGrammar.LOCAL_NAME.member("INDEX")).isTrue();
        assertThat(ExpressionGrammar.FEATURE.member("OR")).isFalse();
    }

    @Test
    void applications() throws Exception {
        assertThat(EXPRESSION.parseUnique("(^ SUBJ)")).isEqualTo(
            Expression.application(ref(RelativeIdentifier.UP), "SUBJ"));
        assertThat(EXPRESSION.parseUnique("((! OBJ) CASE)")).isEqualTo(
            Expression.application(Expression.application(
                ref(RelativeIdentifier.DOWN), "OBJ"), "CASE"));
        assertThat(EXPRESSION.parse("(^ subj)").getStatus())
            .isEqualTo(ParseOutcome.Status.NO_PARSE);
    }

    @Test
    void values() throws Exception {
        assertThat(EXPRESSION.parseUnique("'sg'"))
            .isEqualTo(Expression.<RelativeIdentifier>value("sg"));
        assertThat(EXPRESSION.parseUnique("%f"))
            .isEqualTo(ref(RelativeIdentifier.local("%f")));
    }

    @Test
    void renderingRoundTrips() throws Exception {
        Expression<RelativeIdentifier> expr = Expression.application(
            Expression.application(ref(RelativeIdentifier.local("%x")),
                                   "ADJ"), "PRED");

        assertThat(EXPRESSION.parseUnique(expr.toString())).isEqualTo(expr);
    }

}
