package net.synchro.lfg;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class GroundingTest {

    private static final AbsoluteIdentifier F1 = AbsoluteIdentifier.of("f1");
    private static final AbsoluteIdentifier F2 = AbsoluteIdentifier.of("f2");

    @Test
    void identifiers() {
        assertThat(RelativeIdentifier.UP.ground(F1, F2)).isSameAs(F1);
        assertThat(RelativeIdentifier.DOWN.ground(F1, F2)).isSameAs(F2);
        assertThat(RelativeIdentifier.local("%g").ground(F1, F2))
            .isEqualTo(AbsoluteIdentifier.of("f2:%g"));
        Grounding grounding = new Grounding(F1, F2);
        assertThat(grounding.map(RelativeIdentifier.UP)).isEqualTo(F1);
        assertThat(grounding.getUp()).isSameAs(F1);
        assertThat(grounding.getDown()).isSameAs(F2);
        assertThat(F2.scoped("x").getAddress()).isEqualTo("f2:x");
        assertThat(RelativeIdentifier.UP.getName()).isEqualTo("^");
        assertThat(RelativeIdentifier.local("%f"))
            .isEqualTo(RelativeIdentifier.local("%f"))
            .isNotEqualTo(RelativeIdentifier.local("%g"));
    }

    @Test
    void constraintEquation() {
        /* (%f SUBJ) =c %g */
        Equation<RelativeIdentifier> eq = Equation.of(
            ConstraintEquation.equality(true,
                Expression.application(Expression.reference(
                    RelativeIdentifier.local("%f")), "SUBJ"),
                Expression.reference(RelativeIdentifier.local("%g"))));

        Equation<AbsoluteIdentifier> grounded = Equation.ground(eq, F1, F2);

        assertThat(grounded.identifiers()).containsExactly(
            AbsoluteIdentifier.of("f2:%f"), AbsoluteIdentifier.of("f2:%g"));
        assertThat(grounded).isEqualTo(Equation.of(
            ConstraintEquation.equality(true,
                Expression.application(Expression.reference(
                    AbsoluteIdentifier.of("f2:%f")), "SUBJ"),
                Expression.reference(AbsoluteIdentifier.of("f2:%g")))));
        assertThat(grounded.toString()).isEqualTo("(f2:%f SUBJ) =c f2:%g");
    }

    @Test
    void everyLayerGrounds() {
        Expression<RelativeIdentifier> up = Expression.reference(
            RelativeIdentifier.UP);
        Expression<RelativeIdentifier> down = Expression.reference(
            RelativeIdentifier.DOWN);
        DefiningEquation<RelativeIdentifier> def =
            DefiningEquation.assignment(Expression.application(up, "OBJ"),
                                        down);
        ConstraintEquation<RelativeIdentifier> con =
            ConstraintEquation.existence(false, Expression.application(
                down, "TENSE"));
        CompoundEquation<RelativeIdentifier> comp =
            CompoundEquation.disjunction(Equation.of(def), Equation.of(con));

        assertThat(Expression.ground(up, F1, F2))
            .isEqualTo(Expression.reference(F1));
        assertThat(DefiningEquation.ground(def, F1, F2).identifiers())
            .containsExactly(F1, F2);
        assertThat(ConstraintEquation.ground(con, F1, F2).identifiers())
            .containsExactly(F2);
        CompoundEquation<AbsoluteIdentifier> grounded =
            CompoundEquation.ground(comp, F1, F2);
        assertThat(grounded.getKind())
            .isEqualTo(CompoundEquation.Kind.DISJUNCTION);
        assertThat(grounded.identifiers()).containsExactly(F1, F2);
        assertThat(grounded.getRight().getConstraint().isPositive())
            .isFalse();
    }

    @Test
    void valuesAreUnaffected() {
        Expression<RelativeIdentifier> sg = Expression.value("sg");

        assertThat(Expression.ground(sg, F1, F2))
            .isEqualTo(Expression.<AbsoluteIdentifier>value("sg"));
    }

    @Test
    void groundingCommutesWithNegation() {
        Equation<RelativeIdentifier> eq = Equation.of(
            DefiningEquation.containment(
                Expression.reference(RelativeIdentifier.DOWN),
                Expression.application(Expression.reference(
                    RelativeIdentifier.UP), "ADJ")));

        assertThat(Equation.ground(eq.negation(), F1, F2)).isEqualTo(
            Equation.ground(eq, F1, F2).negation());
    }

}
