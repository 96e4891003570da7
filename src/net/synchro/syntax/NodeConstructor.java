package net.synchro.syntax;

import java.util.Optional;

/**
 * Builds the value of a nonterminal from the values of a production's
 * constituents.
 * Returning an empty Optional declines the reconstruction; this is a
 * regular outcome (the parse tree then has no interpretation), not an
 * error.
 */
public interface NodeConstructor<A> {

    Optional<A> construct(Constituents children);

}
