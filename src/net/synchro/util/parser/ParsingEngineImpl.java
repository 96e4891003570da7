package net.synchro.util.parser;

import java.util.Set;
import net.synchro.api.parser.ContextFreeGrammar;
import net.synchro.api.parser.InvalidGrammarException;
import net.synchro.api.parser.Parser;
import net.synchro.api.parser.ParsingEngine;
import net.synchro.api.parser.Tokenizer;
import net.synchro.util.config.Configuration;
import net.synchro.util.config.Configurations;

public class ParsingEngineImpl implements ParsingEngine {

    public static final String K_MAX_TREES = "synchro.parser.maxTrees";
    public static final String K_WORD_BOUNDARIES =
        "synchro.tokenizer.wordBoundaries";

    public static final ParsingEngineImpl INSTANCE =
        new ParsingEngineImpl(Configuration.DEFAULT);

    private final int maxTrees;
    private final boolean wordBoundaries;

    public ParsingEngineImpl(int maxTrees, boolean wordBoundaries) {
        if (maxTrees < 0)
            throw new IllegalArgumentException("Negative tree limit");
        this.maxTrees = maxTrees;
        this.wordBoundaries = wordBoundaries;
    }
    public ParsingEngineImpl(Configuration cfg) {
        this(Math.max(0, Configurations.getInt(cfg, K_MAX_TREES, 0)),
             Configurations.getBoolean(cfg, K_WORD_BOUNDARIES, true));
    }

    public int getMaxTrees() {
        return maxTrees;
    }

    public boolean isRespectingWordBoundaries() {
        return wordBoundaries;
    }

    public Tokenizer createTokenizer(Set<String> tokens)
            throws InvalidGrammarException {
        return new MaximalMunchTokenizer(tokens, wordBoundaries);
    }

    public <S> Parser<S> createParser(ContextFreeGrammar<S> grammar)
            throws InvalidGrammarException {
        return new ChartParser<S>(grammar, maxTrees);
    }

}
