package net.synchro.api.parser;

import java.util.List;
import java.util.Set;

/**
 * A grammar-driven parser.
 * A Parser matches token sequences against a fixed ContextFreeGrammar and
 * returns every parse tree that derives the whole sequence from one of the
 * grammar's start symbols. The search strategy is up to the implementation.
 * Parsers are immutable and may be shared between threads.
 */
public interface Parser<S> {

    /**
     * The grammar this parser has been created for.
     */
    ContextFreeGrammar<S> getGrammar();

    /**
     * Parse the given tokens.
     * The result is empty (and no exception is thrown) if the grammar does
     * not derive the input.
     */
    Set<ParseTree<S>> parse(List<String> tokens);

}
