package net.synchro.api.parser;

import java.util.List;

/**
 * A single parse tree node.
 * A node is either a terminal (a leaf carrying a tag and the literal token
 * it was created from), a nonterminal (carrying the head symbol of the
 * production it instantiates and one child per symbol of that production's
 * body), or the empty node (which carries neither).
 * Implementations are immutable and compare structurally; tags are compared
 * using their own equals() method.
 */
public interface ParseTree<S> {

    /**
     * The variants of parse tree nodes.
     */
    enum Kind { TERMINAL, NONTERMINAL, EMPTY }

    /**
     * Which variant this node is.
     */
    Kind getKind();

    /**
     * The symbol this node stems from, or null for the empty node.
     * For terminals, this is the symbol of the lexical rule that accepted
     * the token; for nonterminals, the head of the production.
     */
    S getTag();

    /**
     * The literal token of a terminal node, or null for other nodes.
     */
    String getContent();

    /**
     * An immutable list of this node's children.
     * Terminal and empty nodes have none.
     */
    List<ParseTree<S>> getChildren();

    /**
     * The amount of children of this node.
     */
    int childCount();

    /**
     * The child of this node at the given index.
     */
    ParseTree<S> childAt(int index);

}
