package net.synchro.lfg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A functional equation, as attached to nodes of a constituent structure.
 * An equation is a compound of two further equations (CompoundEquation),
 * a defining equation that adds information (DefiningEquation), or a
 * constraint that merely checks it (ConstraintEquation).
 * Instances are immutable and compare structurally.
 */
public final class Equation<ID extends Identifier> {

    public enum Kind { COMPOUND, DEFINING, CONSTRAINT }

    private final Kind kind;
    private final CompoundEquation<ID> compound;
    private final DefiningEquation<ID> defining;
    private final ConstraintEquation<ID> constraint;

    private Equation(Kind kind, CompoundEquation<ID> compound,
                     DefiningEquation<ID> defining,
                     ConstraintEquation<ID> constraint) {
        this.kind = kind;
        this.compound = compound;
        this.defining = defining;
        this.constraint = constraint;
    }

    public String toString() {
        return getContent().toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Equation)) return false;
        Equation<?> eq = (Equation<?>) other;
        return (kind == eq.kind && getContent().equals(eq.getContent()));
    }

    public int hashCode() {
        return kind.hashCode() * 31 + getContent().hashCode();
    }

    private Object getContent() {
        switch (kind) {
            case COMPOUND: return compound;
            case DEFINING: return defining;
            case CONSTRAINT: return constraint;
            default:
                throw new AssertionError("Unknown equation kind " + kind);
        }
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The wrapped compound equation, or null if this is of another kind.
     */
    public CompoundEquation<ID> getCompound() {
        return compound;
    }

    /**
     * The wrapped defining equation, or null if this is of another kind.
     */
    public DefiningEquation<ID> getDefining() {
        return defining;
    }

    /**
     * The wrapped constraint, or null if this is of another kind.
     */
    public ConstraintEquation<ID> getConstraint() {
        return constraint;
    }

    /**
     * The logical negation of this equation.
     * Negation is pushed inwards (compounds follow De Morgan's laws). A
     * defining equation has no negative form of its own; its negation is
     * the negative constraint checking the same relation, so negating a
     * defining equation twice yields a (positive) constraint rather than
     * the equation it started from.
     */
    public Equation<ID> negation() {
        switch (kind) {
            case COMPOUND:
                return of(compound.negation());
            case DEFINING:
                return of(defining.negation());
            case CONSTRAINT:
                return of(constraint.negation());
            default:
                throw new AssertionError("Unknown equation kind " + kind);
        }
    }

    /**
     * All identifiers occurring anywhere in this equation.
     */
    public Set<ID> identifiers() {
        Set<ID> ret = new LinkedHashSet<ID>();
        collectIdentifiers(ret);
        return Collections.unmodifiableSet(ret);
    }

    void collectIdentifiers(Set<ID> drain) {
        switch (kind) {
            case COMPOUND:
                compound.collectIdentifiers(drain);
                break;
            case DEFINING:
                defining.collectIdentifiers(drain);
                break;
            case CONSTRAINT:
                constraint.collectIdentifiers(drain);
                break;
        }
    }

    public <B extends Identifier> Equation<B> mapIdentifiers(
            IdentifierMapping<? super ID, ? extends B> mapping) {
        switch (kind) {
            case COMPOUND:
                return of(compound.<B>mapIdentifiers(mapping));
            case DEFINING:
                return of(defining.<B>mapIdentifiers(mapping));
            case CONSTRAINT:
                return of(constraint.<B>mapIdentifiers(mapping));
            default:
                throw new AssertionError("Unknown equation kind " + kind);
        }
    }

    public static <ID extends Identifier> Equation<ID> of(
            CompoundEquation<ID> compound) {
        if (compound == null)
            throw new NullPointerException("Equation may not be null");
        return new Equation<ID>(Kind.COMPOUND, compound, null, null);
    }
    public static <ID extends Identifier> Equation<ID> of(
            DefiningEquation<ID> defining) {
        if (defining == null)
            throw new NullPointerException("Equation may not be null");
        return new Equation<ID>(Kind.DEFINING, null, defining, null);
    }
    public static <ID extends Identifier> Equation<ID> of(
            ConstraintEquation<ID> constraint) {
        if (constraint == null)
            throw new NullPointerException("Equation may not be null");
        return new Equation<ID>(Kind.CONSTRAINT, null, null, constraint);
    }

    /**
     * Bind the relative identifiers of the given equation to the addresses
     * of the mother node (up) and of the node itself (down).
     */
    public static Equation<AbsoluteIdentifier> ground(
            Equation<? extends RelativeIdentifier> eq,
            AbsoluteIdentifier up, AbsoluteIdentifier down) {
        return eq.mapIdentifiers(new Grounding(up, down));
    }

}
