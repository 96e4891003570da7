package net.synchro.lfg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An equation that contributes information to a feature structure: an
 * assignment ("left = right") or a set containment ("element IN
 * container").
 */
public final class DefiningEquation<ID extends Identifier> {

    public enum Kind {
        ASSIGNMENT("=", ConstraintEquation.Kind.EQUALS),
        CONTAINMENT("IN", ConstraintEquation.Kind.CONTAINS);

        private final String operator;
        private final ConstraintEquation.Kind constraintKind;

        private Kind(String operator, ConstraintEquation.Kind constraintKind) {
            this.operator = operator;
            this.constraintKind = constraintKind;
        }

        public String getOperator() {
            return operator;
        }

        /**
         * The kind of constraint checking the same relation.
         */
        public ConstraintEquation.Kind getConstraintKind() {
            return constraintKind;
        }

    }

    private final Kind kind;
    private final Expression<ID> left;
    private final Expression<ID> right;

    public DefiningEquation(Kind kind, Expression<ID> left,
                            Expression<ID> right) {
        if (kind == null || left == null || right == null)
            throw new NullPointerException(
                "Defining equation components may not be null");
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public String toString() {
        return left + " " + kind.getOperator() + " " + right;
    }

    public boolean equals(Object other) {
        if (! (other instanceof DefiningEquation)) return false;
        DefiningEquation<?> de = (DefiningEquation<?>) other;
        return (kind == de.kind && left.equals(de.left) &&
                right.equals(de.right));
    }

    public int hashCode() {
        return (kind.hashCode() * 31 + left.hashCode()) * 31 +
            right.hashCode();
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The left-hand side; the element of a containment.
     */
    public Expression<ID> getLeft() {
        return left;
    }

    /**
     * The right-hand side; the container of a containment.
     */
    public Expression<ID> getRight() {
        return right;
    }

    /**
     * The negative constraint corresponding to this equation.
     */
    public ConstraintEquation<ID> negation() {
        return new ConstraintEquation<ID>(kind.getConstraintKind(), false,
                                          left, right);
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

    public <B extends Identifier> DefiningEquation<B> mapIdentifiers(
            IdentifierMapping<? super ID, ? extends B> mapping) {
        return new DefiningEquation<B>(kind, left.<B>mapIdentifiers(mapping),
                                       right.<B>mapIdentifiers(mapping));
    }

    public static <ID extends Identifier> DefiningEquation<ID> assignment(
            Expression<ID> left, Expression<ID> right) {
        return new DefiningEquation<ID>(Kind.ASSIGNMENT, left, right);
    }

    public static <ID extends Identifier> DefiningEquation<ID> containment(
            Expression<ID> element, Expression<ID> container) {
        return new DefiningEquation<ID>(Kind.CONTAINMENT, element, container);
    }

    public static DefiningEquation<AbsoluteIdentifier> ground(
            DefiningEquation<? extends RelativeIdentifier> eq,
            AbsoluteIdentifier up, AbsoluteIdentifier down) {
        return eq.mapIdentifiers(new Grounding(up, down));
    }

}
