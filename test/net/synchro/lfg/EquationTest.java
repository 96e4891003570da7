package net.synchro.lfg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EquationTest {

    private static final Expression<RelativeIdentifier> X =
        Expression.reference(RelativeIdentifier.local("X"));
    private static final Expression<RelativeIdentifier> Y =
        Expression.reference(RelativeIdentifier.local("Y"));
    private static final Expression<RelativeIdentifier> UP_SUBJ =
        Expression.application(
            Expression.reference(RelativeIdentifier.UP), "SUBJ");
    private static final Expression<RelativeIdentifier> SG =
        Expression.value("sg");

    private static final Equation<RelativeIdentifier> ASSIGN =
        Equation.of(DefiningEquation.assignment(X, Y));
    private static final Equation<RelativeIdentifier> CONTAIN =
        Equation.of(DefiningEquation.containment(X, UP_SUBJ));
    private static final Equation<RelativeIdentifier> EQUALS =
        Equation.of(ConstraintEquation.equality(true, UP_SUBJ, SG));
    private static final Equation<RelativeIdentifier> CONTAINS =
        Equation.of(ConstraintEquation.containment(false, Y, X));
    private static final Equation<RelativeIdentifier> EXISTS =
        Equation.of(ConstraintEquation.existence(true, UP_SUBJ));

    private static List<Equation<RelativeIdentifier>> samples() {
        return Arrays.asList(ASSIGN, CONTAIN, EQUALS, CONTAINS, EXISTS,
            Equation.of(CompoundEquation.conjunction(EQUALS, CONTAINS)),
            Equation.of(CompoundEquation.disjunction(EXISTS,
                Equation.of(CompoundEquation.conjunction(CONTAINS,
                                                         EQUALS)))));
    }

    @Test
    void negationOfConstraintsIsAnInvolution() {
        for (Equation<RelativeIdentifier> eq : samples()) {
            if (eq == ASSIGN || eq == CONTAIN) continue;
            assertThat(eq.negation()).isNotEqualTo(eq);
            assertThat(eq.negation().negation()).isEqualTo(eq);
        }
    }

    @Test
    void negatingDefiningEquationsYieldsConstraints() {
        assertThat(ASSIGN.negation()).isEqualTo(Equation.of(
            ConstraintEquation.equality(false, X, Y)));
        assertThat(CONTAIN.negation()).isEqualTo(Equation.of(
            ConstraintEquation.containment(false, X, UP_SUBJ)));
        /* Negating twice restores the sign, but not the defining kind. */
        assertThat(ASSIGN.negation().negation()).isEqualTo(Equation.of(
            ConstraintEquation.equality(true, X, Y)));
        assertThat(ASSIGN.negation().negation()).isNotEqualTo(ASSIGN);
        assertThat(ASSIGN.negation().negation().negation())
            .isEqualTo(ASSIGN.negation());
    }

    @Test
    void compoundNegationFollowsDeMorgan() {
        Equation<RelativeIdentifier> conj = Equation.of(
            CompoundEquation.conjunction(ASSIGN, EXISTS));

        Equation<RelativeIdentifier> neg = conj.negation();
        assertThat(neg.getKind()).isEqualTo(Equation.Kind.COMPOUND);
        assertThat(neg.getCompound().getKind())
            .isEqualTo(CompoundEquation.Kind.DISJUNCTION);
        assertThat(neg.getCompound().getLeft()).isEqualTo(ASSIGN.negation());
        assertThat(neg.getCompound().getRight())
            .isEqualTo(EXISTS.negation());
        assertThat(neg.negation().getCompound().getKind())
            .isEqualTo(CompoundEquation.Kind.CONJUNCTION);
    }

    @Test
    void identifiersAreCompositional() {
        assertThat(ASSIGN.identifiers()).containsExactly(
            RelativeIdentifier.local("X"), RelativeIdentifier.local("Y"));
        assertThat(EQUALS.identifiers()).containsExactly(
            RelativeIdentifier.UP);
        assertThat(SG.identifiers()).isEmpty();
        for (Equation<RelativeIdentifier> l : samples()) {
            for (Equation<RelativeIdentifier> r : samples()) {
                Equation<RelativeIdentifier> conj = Equation.of(
                    CompoundEquation.conjunction(l, r));
                Equation<RelativeIdentifier> disj = Equation.of(
                    CompoundEquation.disjunction(l, r));
                assertThat(conj.identifiers()).isEqualTo(union(l, r));
                assertThat(disj.identifiers()).isEqualTo(union(l, r));
            }
            assertThat(l.negation().identifiers())
                .isEqualTo(l.identifiers());
        }
    }

    private static Set<RelativeIdentifier> union(
            Equation<RelativeIdentifier> l, Equation<RelativeIdentifier> r) {
        Set<RelativeIdentifier> ret =
            new HashSet<RelativeIdentifier>(l.identifiers());
        ret.addAll(r.identifiers());
        return ret;
    }

    @Test
    void surfaceSyntax() {
        assertThat(ASSIGN.toString()).isEqualTo("X = Y");
        assertThat(CONTAIN.toString()).isEqualTo("X IN (^ SUBJ)");
        assertThat(EQUALS.toString()).isEqualTo("(^ SUBJ) =c 'sg'");
        assertThat(CONTAINS.toString()).isEqualTo("NOT (Y INc X)");
        assertThat(EXISTS.negation().toString()).isEqualTo("NOT ((^ SUBJ))");
        assertThat(Equation.of(CompoundEquation.disjunction(ASSIGN, EXISTS))
                   .toString()).isEqualTo("(X = Y OR (^ SUBJ))");
        assertThat(Equation.of(CompoundEquation.conjunction(CONTAINS, EQUALS))
                   .toString())
            .isEqualTo("((NOT (Y INc X)) AND (^ SUBJ) =c 'sg')");
        assertThat(Equation.of(CompoundEquation.disjunction(EQUALS, CONTAINS))
                   .toString())
            .isEqualTo("((^ SUBJ) =c 'sg' OR (NOT (Y INc X)))");
    }

    @Test
    void unreadableAtomsAreRejected() {
        for (String atom : new String[] { "", "a=b", "a b", "it's", "x(y)",
                                          "^", "IN", "NOT" }) {
            assertThat(Expression.isAtom(atom)).as(atom).isFalse();
            assertThatThrownBy(() -> Expression.value(atom))
                .isInstanceOf(IllegalArgumentException.class);
        }
        assertThat(Expression.isAtom("3sg_1")).isTrue();
        assertThat(Expression.isAtom("INDEX")).isTrue();
    }

    @Test
    void accessorsMatchKind() {
        assertThat(ASSIGN.getKind()).isEqualTo(Equation.Kind.DEFINING);
        assertThat(ASSIGN.getDefining().getKind())
            .isEqualTo(DefiningEquation.Kind.ASSIGNMENT);
        assertThat(ASSIGN.getCompound()).isNull();
        assertThat(ASSIGN.getConstraint()).isNull();
        assertThat(EXISTS.getConstraint().getRight()).isNull();
        assertThat(CONTAINS.getConstraint().isPositive()).isFalse();
        assertThat(UP_SUBJ.getFeature()).isEqualTo("SUBJ");
        assertThat(UP_SUBJ.getBase().getIdentifier())
            .isSameAs(RelativeIdentifier.UP);
        assertThat(SG.getAtom()).isEqualTo("sg");
        assertThat(SG.getFeature()).isNull();
    }

    @Test
    void malformedConstraintsAreRejected() {
        assertThatThrownBy(() -> new ConstraintEquation<RelativeIdentifier>(
                ConstraintEquation.Kind.EXISTS, true, X, Y))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConstraintEquation<RelativeIdentifier>(
                ConstraintEquation.Kind.EQUALS, true, X, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RelativeIdentifier.local(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

}
