package net.synchro.lfg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An equation that checks information without contributing any: equality
 * ("left =c right"), set containment ("element INc container"), or the
 * existence of a value (a bare expression).
 * Each constraint carries a sign; negative constraints demand that the
 * relation does not hold.
 */
public final class ConstraintEquation<ID extends Identifier> {

    public enum Kind {
        EQUALS("=c"),
        CONTAINS("INc"),
        /* Unary; there is no right-hand side. */
        EXISTS(null);

        private final String operator;

        private Kind(String operator) {
            this.operator = operator;
        }

        public String getOperator() {
            return operator;
        }

    }

    private final Kind kind;
    private final boolean positive;
    private final Expression<ID> left;
    private final Expression<ID> right;

    public ConstraintEquation(Kind kind, boolean positive,
                              Expression<ID> left, Expression<ID> right) {
        if (kind == null || left == null)
            throw new NullPointerException(
                "Constraint components may not be null");
        if ((kind == Kind.EXISTS) != (right == null))
            throw new IllegalArgumentException("Constraint " + kind +
                ((right == null) ? " needs" : " does not take") +
                " a right-hand side");
        this.kind = kind;
        this.positive = positive;
        this.left = left;
        this.right = right;
    }

    public String toString() {
        String body = (kind == Kind.EXISTS) ? left.toString() :
            left + " " + kind.getOperator() + " " + right;
        return (positive) ? body : "NOT (" + body + ")";
    }

    public boolean equals(Object other) {
        if (! (other instanceof ConstraintEquation)) return false;
        ConstraintEquation<?> ce = (ConstraintEquation<?>) other;
        return (kind == ce.kind && positive == ce.positive &&
                left.equals(ce.left) &&
                ((right == null) ? ce.right == null :
                                   right.equals(ce.right)));
    }

    public int hashCode() {
        return ((kind.hashCode() * 31 + (positive ? 1 : 0)) * 31 +
                left.hashCode()) * 31 + ((right == null) ? 0 :
                                         right.hashCode());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isPositive() {
        return positive;
    }

    /**
     * The left-hand side; the element of a containment; the expression
     * whose existence is checked.
     */
    public Expression<ID> getLeft() {
        return left;
    }

    /**
     * The right-hand side (null for existence constraints).
     */
    public Expression<ID> getRight() {
        return right;
    }

    /**
     * The same constraint with the opposite sign.
     */
    public ConstraintEquation<ID> negation() {
        return new ConstraintEquation<ID>(kind, ! positive, left, right);
    }

    public Set<ID> identifiers() {
        Set<ID> ret = new LinkedHashSet<ID>();
        collectIdentifiers(ret);
        return Collections.unmodifiableSet(ret);
    }

    void collectIdentifiers(Set<ID> drain) {
        left.collectIdentifiers(drain);
        if (right != null) right.collectIdentifiers(drain);
    }

    public <B extends Identifier> ConstraintEquation<B> mapIdentifiers(
            IdentifierMapping<? super ID, ? extends B> mapping) {
        return new ConstraintEquation<B>(kind, positive,
            left.<B>mapIdentifiers(mapping),
            (right == null) ? null : right.<B>mapIdentifiers(mapping));
    }

    public static <ID extends Identifier> ConstraintEquation<ID> equality(
            boolean positive, Expression<ID> left, Expression<ID> right) {
        return new ConstraintEquation<ID>(Kind.EQUALS, positive, left, right);
    }

    public static <ID extends Identifier> ConstraintEquation<ID> containment(
            boolean positive, Expression<ID> element,
            Expression<ID> container) {
        return new ConstraintEquation<ID>(Kind.CONTAINS, positive, element,
                                          container);
    }

    public static <ID extends Identifier> ConstraintEquation<ID> existence(
            boolean positive, Expression<ID> expr) {
        return new ConstraintEquation<ID>(Kind.EXISTS, positive, expr, null);
    }

    public static ConstraintEquation<AbsoluteIdentifier> ground(
            ConstraintEquation<? extends RelativeIdentifier> eq,
            AbsoluteIdentifier up, AbsoluteIdentifier down) {
        return eq.mapIdentifiers(new Grounding(up, down));
    }

}
