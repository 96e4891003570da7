package net.synchro.lfg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The disjunction or conjunction of two equations.
 */
public final class CompoundEquation<ID extends Identifier> {

    public enum Kind {
        DISJUNCTION("OR"),
        CONJUNCTION("AND");

        private final String keyword;

        private Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }

        /* De Morgan. */
        public Kind getDual() {
            return (this == DISJUNCTION) ? CONJUNCTION : DISJUNCTION;
        }

    }

    private final Kind kind;
    private final Equation<ID> left;
    private final Equation<ID> right;

    public CompoundEquation(Kind kind, Equation<ID> left,
                            Equation<ID> right) {
        if (kind == null || left == null || right == null)
            throw new NullPointerException(
                "Compound equation components may not be null");
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public String toString() {
        return "(" + operand(left) + " " + kind.getKeyword() + " " +
            operand(right) + ")";
    }

    public boolean equals(Object other) {
        if (! (other instanceof CompoundEquation)) return false;
        CompoundEquation<?> ce = (CompoundEquation<?>) other;
        return (kind == ce.kind && left.equals(ce.left) &&
                right.equals(ce.right));
    }

    public int hashCode() {
        return (kind.hashCode() * 31 + left.hashCode()) * 31 +
            right.hashCode();
    }

    public Kind getKind() {
        return kind;
    }

    public Equation<ID> getLeft() {
        return left;
    }

    public Equation<ID> getRight() {
        return right;
    }

    public CompoundEquation<ID> negation() {
        return new CompoundEquation<ID>(kind.getDual(), left.negation(),
                                        right.negation());
    }

    public Set<ID> identifiers() {
        Set<ID> ret = new LinkedHashSet<ID>();
        collectIdentifiers(ret);
        return Collections.unmodifiableSet(ret);
    }

    void collectIdentifiers(Set<ID> drain) {
        left.collectIdentifiers(drain);
        right.collectIdentifiers(drain);
    }

    public <B extends Identifier> CompoundEquation<B> mapIdentifiers(
            IdentifierMapping<? super ID, ? extends B> mapping) {
        return new CompoundEquation<B>(kind, left.<B>mapIdentifiers(mapping),
                                       right.<B>mapIdentifiers(mapping));
    }

    public static <ID extends Identifier> CompoundEquation<ID> disjunction(
            Equation<ID> left, Equation<ID> right) {
        return new CompoundEquation<ID>(Kind.DISJUNCTION, left, right);
    }

    public static <ID extends Identifier> CompoundEquation<ID> conjunction(
            Equation<ID> left, Equation<ID> right) {
        return new CompoundEquation<ID>(Kind.CONJUNCTION, left, right);
    }

    public static CompoundEquation<AbsoluteIdentifier> ground(
            CompoundEquation<? extends RelativeIdentifier> eq,
            AbsoluteIdentifier up, AbsoluteIdentifier down) {
        return eq.mapIdentifiers(new Grounding(up, down));
    }

    /* A leading NOT would otherwise extend over the whole compound. */
    private static String operand(Equation<?> eq) {
        if (eq.getKind() == Equation.Kind.CONSTRAINT &&
                ! eq.getConstraint().isPositive())
            return "(" + eq + ")";
        return eq.toString();
    }

}
