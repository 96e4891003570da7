package net.synchro.lfg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;
import net.synchro.util.Formats;

/**
 * A term denoting a feature structure or an atomic value.
 * An expression is a reference to an identifier, the application of a
 * feature to another expression (written "(base FEATURE)"), or an atomic
 * value (written "'atom'").
 * Instances are immutable and compare structurally.
 */
public final class Expression<ID extends Identifier> {

    public enum Kind { REFERENCE, APPLICATION, VALUE }

    private static final Pattern ATOM = Pattern.compile("[A-Za-z0-9_]+");

    private final Kind kind;
    private final ID identifier;
    private final Expression<ID> base;
    private final String name;

    private Expression(Kind kind, ID identifier, Expression<ID> base,
                       String name) {
        this.kind = kind;
        this.identifier = identifier;
        this.base = base;
        this.name = name;
    }

    public String toString() {
        switch (kind) {
            case REFERENCE:
                return identifier.getName();
            case APPLICATION:
                return "(" + base + " " + name + ")";
            case VALUE:
                return "'" + name + "'";
            default:
                throw new AssertionError("Unknown expression kind " + kind);
        }
    }

    public boolean equals(Object other) {
        if (! (other instanceof Expression)) return false;
        Expression<?> ex = (Expression<?>) other;
        return (kind == ex.kind && equal(identifier, ex.identifier) &&
                equal(base, ex.base) && equal(name, ex.name));
    }

    public int hashCode() {
        return ((kind.hashCode() * 31 + hash(identifier)) * 31 +
                hash(base)) * 31 + hash(name);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The identifier referenced (only for references).
     */
    public ID getIdentifier() {
        return identifier;
    }

    /**
     * The expression the feature is applied to (only for applications).
     */
    public Expression<ID> getBase() {
        return base;
    }

    /**
     * The feature applied (only for applications).
     */
    public String getFeature() {
        return (kind == Kind.APPLICATION) ? name : null;
    }

    /**
     * The atom (only for values).
     */
    public String getAtom() {
        return (kind == Kind.VALUE) ? name : null;
    }

    /**
     * All identifiers occurring in this expression.
     */
    public Set<ID> identifiers() {
        Set<ID> ret = new LinkedHashSet<ID>();
        collectIdentifiers(ret);
        return Collections.unmodifiableSet(ret);
    }

    void collectIdentifiers(Set<ID> drain) {
        switch (kind) {
            case REFERENCE:
                drain.add(identifier);
                break;
            case APPLICATION:
                base.collectIdentifiers(drain);
                break;
            case VALUE:
                break;
        }
    }

    /**
     * An expression of the same shape with every identifier replaced as
     * the mapping specifies.
     */
    public <B extends Identifier> Expression<B> mapIdentifiers(
            IdentifierMapping<? super ID, ? extends B> mapping) {
        switch (kind) {
            case REFERENCE:
                return Expression.<B>reference(mapping.map(identifier));
            case APPLICATION:
                return Expression.<B>application(
                    base.<B>mapIdentifiers(mapping), name);
            case VALUE:
                return Expression.<B>value(name);
            default:
                throw new AssertionError("Unknown expression kind " + kind);
        }
    }

    public static <ID extends Identifier> Expression<ID> reference(
            ID identifier) {
        if (identifier == null)
            throw new NullPointerException("Identifier may not be null");
        return new Expression<ID>(Kind.REFERENCE, identifier, null, null);
    }

    public static <ID extends Identifier> Expression<ID> application(
            Expression<ID> base, String feature) {
        if (base == null || feature == null)
            throw new NullPointerException(
                "Application components may not be null");
        return new Expression<ID>(Kind.APPLICATION, null, base, feature);
    }

    /**
     * Test whether the given string may serve as an atomic value.
     * Atoms are non-empty runs of letters, digits and underscores that
     * are not one of {@link ExpressionGrammar#KEYWORDS}.
     */
    public static boolean isAtom(String atom) {
        return (ATOM.matcher(atom).matches() &&
                ! ExpressionGrammar.KEYWORDS.contains(atom));
    }

    /**
     * Create an atomic value.
     * Only atoms for which {@link #isAtom(String)} holds are accepted, so
     * that the rendered value can be read back by {@link ExpressionGrammar}.
     * @throws IllegalArgumentException if <code>atom</code> is not a valid
     *                                  atom
     */
    public static <ID extends Identifier> Expression<ID> value(String atom) {
        if (atom == null)
            throw new NullPointerException("Atom may not be null");
        if (! isAtom(atom))
            throw new IllegalArgumentException("Invalid atom " +
                Formats.formatString(atom));
        return new Expression<ID>(Kind.VALUE, null, null, atom);
    }

    /**
     * Resolve all (relative) identifiers of the given expression.
     */
    public static Expression<AbsoluteIdentifier> ground(
            Expression<? extends RelativeIdentifier> expr,
            AbsoluteIdentifier up, AbsoluteIdentifier down) {
        return expr.mapIdentifiers(new Grounding(up, down));
    }

    private static boolean equal(Object a, Object b) {
        return (a == null) ? b == null : a.equals(b);
    }
    private static int hash(Object o) {
        return (o == null) ? 0 : o.hashCode();
    }

}
