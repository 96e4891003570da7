package net.synchro.lfg;

/**
 * A substitution of identifiers, applied to every identifier of an
 * expression or equation.
 */
public interface IdentifierMapping<A extends Identifier, B extends Identifier> {

    B map(A identifier);

}
