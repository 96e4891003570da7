package net.synchro.api.parser;

import java.util.Set;

/**
 * Entry-point interface for obtaining tokenizers and parsers.
 */
public interface ParsingEngine {

    /**
     * Create a Tokenizer splitting out the given literal tokens.
     * An InvalidGrammarException is thrown if the tokens cannot be told
     * apart unambiguously.
     */
    Tokenizer createTokenizer(Set<String> tokens)
        throws InvalidGrammarException;

    /**
     * Create a Parser for the given grammar.
     * This validates the grammar and creates internal data structures that
     * are shared among parse calls.
     */
    <S> Parser<S> createParser(ContextFreeGrammar<S> grammar)
        throws InvalidGrammarException;

}
