package net.synchro.api.parser;

import java.util.List;
import java.util.Set;

/**
 * Splits input strings into tokens.
 * Tokenization is deterministic and never fails for a particular input;
 * any problem with the token set is reported when the Tokenizer is
 * created (see ParsingEngine).
 */
public interface Tokenizer {

    /**
     * The literal tokens this Tokenizer splits out of its input.
     */
    Set<String> getTokens();

    /**
     * Split the given string into tokens.
     */
    List<String> tokenize(String input);

}
