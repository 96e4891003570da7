package net.synchro.lfg;

/**
 * Something expressions can refer to.
 * Identifiers are either relative to the node an equation is attached to
 * (RelativeIdentifier) or absolute addresses of feature structures
 * (AbsoluteIdentifier); equations and expressions are parameterized by the
 * kind of identifier they contain.
 */
public interface Identifier {

    /**
     * The surface form of this identifier.
     */
    String getName();

}
