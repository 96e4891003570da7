package net.synchro.api.parser;

/**
 * A class of terminal tokens.
 * A lexical rule is defined by a membership predicate over token strings
 * rather than by productions; the parser creates a terminal node tagged
 * with the rule's symbol for every token the rule accepts.
 */
public interface LexicalRule<S> {

    /**
     * The symbol terminal nodes created by this rule are tagged with.
     */
    S getSymbol();

    /**
     * Whether the given token belongs to this class.
     */
    boolean member(String token);

}
