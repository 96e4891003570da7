package net.synchro.syntax;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;
import net.synchro.api.parser.ContextFreeGrammar;
import net.synchro.api.parser.InvalidGrammarException;
import net.synchro.api.parser.Parser;
import net.synchro.api.parser.ParsingEngine;
import net.synchro.api.parser.Production;
import net.synchro.api.parser.Tokenizer;

/**
 * Gathers everything needed to parse a symbol into a DerivedGrammar.
 * The grammar comprises the productions of the root and of every
 * nonterminal in its closure, all lexical categories in the closure, and
 * the union of the literal tokens of all those symbols; its only start
 * symbol is the root.
 */
public final class GrammarAssembler {

    private static final Logger LOGGER = Logger.getLogger("GrammarAssembler");

    private GrammarAssembler() {}

    public static <A> DerivedGrammar<A> assemble(GrammarSymbol<A> root,
            ParsingEngine engine) throws InvalidGrammarException {
        Set<GrammarSymbol<?>> symbols = new LinkedHashSet<GrammarSymbol<?>>();
        symbols.add(root);
        symbols.addAll(root.getClosure());
        Set<Production<GrammarSymbol<?>>> productions =
            new LinkedHashSet<Production<GrammarSymbol<?>>>();
        Set<LexicalCategory> categories = new LinkedHashSet<LexicalCategory>();
        Set<String> tokens = new LinkedHashSet<String>();
        for (GrammarSymbol<?> sym : symbols) {
            tokens.addAll(sym.getTokens());
            switch (sym.getKind()) {
                case NONTERMINAL:
                    productions.addAll(((Nonterminal<?>) sym)
                        .getDerivedProductions().keySet());
                    break;
                case LEXICAL_CATEGORY:
                    categories.add((LexicalCategory) sym);
                    break;
                case EMPTY:
                    break;
            }
        }
        Tokenizer tokenizer = engine.createTokenizer(
            Collections.unmodifiableSet(tokens));
        ContextFreeGrammar<GrammarSymbol<?>> grammar =
            new ContextFreeGrammar<GrammarSymbol<?>>(productions, categories,
                Collections.<GrammarSymbol<?>>singleton(root));
        Parser<GrammarSymbol<?>> parser = engine.createParser(grammar);
        LOGGER.config("Assembled grammar for " + root + ": " +
            symbols.size() + " symbol(s), " + productions.size() +
            " production(s), " + categories.size() +
            " lexical categories, " + tokens.size() + " token(s)");
        return new DerivedGrammar<A>(root, root.getClosure(), tokenizer,
                                     parser);
    }

}
