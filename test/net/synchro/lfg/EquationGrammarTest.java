package net.synchro.lfg;

import static net.synchro.lfg.EquationGrammar.DisjunctionMode.INTENDED;
import static net.synchro.lfg.EquationGrammar.DisjunctionMode.LITERAL;
import static org.assertj.core.api.Assertions.assertThat;

import net.synchro.api.parser.ParsingException;
import net.synchro.syntax.Nonterminal;
import net.synchro.syntax.ParseOutcome;
import net.synchro.util.config.Configuration;
import net.synchro.util.config.DynamicConfiguration;
import org.junit.jupiter.api.Test;

class EquationGrammarTest {

    private static final Nonterminal<Equation<RelativeIdentifier>>
        LITERAL_EQ = EquationGrammar.equation(LITERAL);
    private static final Nonterminal<Equation<RelativeIdentifier>>
        INTENDED_EQ = EquationGrammar.equation(INTENDED);

    private static Expression<RelativeIdentifier> name(String name) {
        return Expression.reference(RelativeIdentifier.local(name));
    }

    private static Equation<RelativeIdentifier> exists(String name) {
        return Equation.of(ConstraintEquation.existence(true, name(name)));
    }

    @Test
    void negatedAssignment() throws Exception {
        Equation<RelativeIdentifier> eq =
            LITERAL_EQ.parseUnique("NOT ( X = Y )");

        assertThat(eq).isEqualTo(Equation.of(
            ConstraintEquation.equality(false, name("X"), name("Y"))));
        assertThat(eq.identifiers()).containsExactlyInAnyOrder(
            RelativeIdentifier.local("X"), RelativeIdentifier.local("Y"));
        assertThat(eq).isEqualTo(LITERAL_EQ.parseUnique("X = Y").negation());
        assertThat(eq.negation()).isEqualTo(Equation.of(
            ConstraintEquation.equality(true, name("X"), name("Y"))));
    }

    @Test
    void groundedConstraint() throws Exception {
        Equation<RelativeIdentifier> eq =
            LITERAL_EQ.parseUnique("(%f SUBJ) =c %g");
        AbsoluteIdentifier f1 = AbsoluteIdentifier.of("f1");
        AbsoluteIdentifier f2 = AbsoluteIdentifier.of("f2");

        assertThat(eq.getConstraint().getKind())
            .isEqualTo(ConstraintEquation.Kind.EQUALS);
        assertThat(eq.getConstraint().isPositive()).isTrue();
        Equation<AbsoluteIdentifier> grounded = Equation.ground(eq, f1, f2);
        assertThat(grounded).isEqualTo(Equation.of(
            ConstraintEquation.equality(true,
                Expression.application(
                    Expression.reference(f2.scoped("%f")), "SUBJ"),
                Expression.reference(f2.scoped("%g")))));
    }

    @Test
    void operators() throws Exception {
        Expression<RelativeIdentifier> upSubj = Expression.application(
            Expression.reference(RelativeIdentifier.UP), "SUBJ");
        Expression<RelativeIdentifier> down = Expression.reference(
            RelativeIdentifier.DOWN);

        assertThat(LITERAL_EQ.parseUnique("(^ SUBJ) = !")).isEqualTo(
            Equation.of(DefiningEquation.assignment(upSubj, down)));
        assertThat(LITERAL_EQ.parseUnique("! IN (^ SUBJ)")).isEqualTo(
            Equation.of(DefiningEquation.containment(down, upSubj)));
        assertThat(LITERAL_EQ.parseUnique("! INc (^ SUBJ)")).isEqualTo(
            Equation.of(ConstraintEquation.containment(true, down, upSubj)));
        assertThat(LITERAL_EQ.parseUnique("(^ SUBJ) =c 'sg'")).isEqualTo(
            Equation.of(ConstraintEquation.equality(true, upSubj,
                Expression.<RelativeIdentifier>value("sg"))));
        assertThat(LITERAL_EQ.parseUnique("(^ SUBJ)")).isEqualTo(
            Equation.of(ConstraintEquation.existence(true, upSubj)));
        assertThat(LITERAL_EQ.parseUnique("NOT (^ SUBJ)")).isEqualTo(
            Equation.of(ConstraintEquation.existence(false, upSubj)));
    }

    @Test
    void conjunction() throws Exception {
        Equation<RelativeIdentifier> expected = Equation.of(
            CompoundEquation.conjunction(exists("X"), exists("Y")));

        assertThat(LITERAL_EQ.parseUnique("X AND Y")).isEqualTo(expected);
        assertThat(INTENDED_EQ.parseUnique("X AND Y")).isEqualTo(expected);
    }

    @Test
    void disjunctionModes() throws Exception {
        assertThat(LITERAL_EQ.parseUnique("X OR Y")).isEqualTo(Equation.of(
            CompoundEquation.conjunction(exists("X"), exists("Y"))));
        assertThat(INTENDED_EQ.parseUnique("X OR Y")).isEqualTo(Equation.of(
            CompoundEquation.disjunction(exists("X"), exists("Y"))));
    }

    @Test
    void oneSymbolPerMode() {
        assertThat(EquationGrammar.equation(LITERAL)).isSameAs(LITERAL_EQ);
        assertThat(INTENDED_EQ).isNotSameAs(LITERAL_EQ);
        assertThat(EquationGrammar.EQUATION).isSameAs(
            EquationGrammar.equation(
                EquationGrammar.configuredMode(Configuration.DEFAULT)));
    }

    @Test
    void configuredMode() {
        DynamicConfiguration cfg = new DynamicConfiguration();
        assertThat(EquationGrammar.configuredMode(cfg)).isEqualTo(LITERAL);
        cfg.put(EquationGrammar.K_DISJUNCTION, "intended");
        assertThat(EquationGrammar.configuredMode(cfg)).isEqualTo(INTENDED);
        cfg.put(EquationGrammar.K_DISJUNCTION, "sometimes");
        assertThat(EquationGrammar.configuredMode(cfg)).isEqualTo(LITERAL);
    }

    @Test
    void grouping() throws Exception {
        Equation<RelativeIdentifier> eq =
            LITERAL_EQ.parseUnique("NOT (X AND Y)");

        assertThat(eq).isEqualTo(Equation.of(CompoundEquation.disjunction(
            exists("X").negation(), exists("Y").negation())));
        assertThat(LITERAL_EQ.parseUnique("((X))")).isEqualTo(exists("X"));
    }

    @Test
    void ambiguityIsReported() throws Exception {
        ParseOutcome<Equation<RelativeIdentifier>> outcome =
            LITERAL_EQ.parse("X AND Y AND Z");

        assertThat(outcome.getStatus())
            .isEqualTo(ParseOutcome.Status.AMBIGUOUS);
        assertThat(outcome.getDistinctValues()).hasSize(2);
        assertThat(LITERAL_EQ.parse("(X AND Y) AND Z").getStatus())
            .isEqualTo(ParseOutcome.Status.UNIQUE);
    }

    @Test
    void malformedInput() throws Exception {
        assertThat(LITERAL_EQ.parse("X =").getStatus())
            .isEqualTo(ParseOutcome.Status.NO_PARSE);
        assertThat(LITERAL_EQ.parse("NOT").getStatus())
            .isEqualTo(ParseOutcome.Status.NO_PARSE);
        try {
            LITERAL_EQ.parseUnique("= X");
            throw new AssertionError("Parsed a malformed equation");
        } catch (ParsingException exc) {
            assertThat(exc.getReason())
                .isEqualTo(ParsingException.Reason.NO_PARSE);
        }
    }

    @Test
    void renderingRoundTrips() throws Exception {
        String[] inputs = {
            "NOT ( X = Y )", "(%f SUBJ) =c %g", "X IN Y AND NOT (^ TENSE)",
            "(! CASE) =c 'nom' AND NOT (! OBJ)", "NOT X INc Y",
            "(NOT X = Y) AND Z", "(NOT (X INc Y)) OR NOT Z",
            "X =c '3sg_1'"
        };
        for (String input : inputs) {
            Equation<RelativeIdentifier> eq = INTENDED_EQ.parseUnique(input);
            assertThat(INTENDED_EQ.parseUnique(eq.toString())).isEqualTo(eq);
        }
    }

    @Test
    void negatedLeftOperandRendersUnambiguously() throws Exception {
        Equation<RelativeIdentifier> eq = Equation.of(
            CompoundEquation.conjunction(
                Equation.of(ConstraintEquation.equality(false, name("X"),
                                                        name("Y"))),
                exists("Z")));

        assertThat(eq.toString()).isEqualTo("((NOT (X =c Y)) AND Z)");
        ParseOutcome<Equation<RelativeIdentifier>> outcome =
            INTENDED_EQ.parse(eq.toString());
        assertThat(outcome.getStatus()).isEqualTo(ParseOutcome.Status.UNIQUE);
        assertThat(outcome.getValues()).containsExactly(eq);
    }

    @Test
    void grammarContents() throws Exception {
        assertThat(LITERAL_EQ.getGrammar().getTokens())
            .containsExactlyInAnyOrder("NOT", "AND", "OR", "=", "IN", "=c",
                                       "INc", "(", ")", "^", "!");
        assertThat(LITERAL_EQ.getClosure()).contains(
            ExpressionGrammar.EXPRESSION, ExpressionGrammar.IDENTIFIER,
            ExpressionGrammar.LOCAL_NAME, ExpressionGrammar.FEATURE,
            ExpressionGrammar.VALUE, EquationGrammar.NOT)
            .doesNotContain(LITERAL_EQ, INTENDED_EQ);
    }

}
