package net.synchro.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.synchro.api.parser.ContextFreeGrammar;
import net.synchro.api.parser.ParseTree;
import net.synchro.api.parser.Parser;
import net.synchro.api.parser.Tokenizer;
import net.synchro.util.parser.Grammars;
import org.json.JSONObject;

/**
 * The tokenizer and parser derived from a root GrammarSymbol.
 * Instances are immutable and may be shared between threads as far as
 * the underlying tokenizer and parser permit.
 */
public class DerivedGrammar<A> {

    private final GrammarSymbol<A> root;
    private final Set<GrammarSymbol<?>> closure;
    private final Tokenizer tokenizer;
    private final Parser<GrammarSymbol<?>> parser;

    public DerivedGrammar(GrammarSymbol<A> root,
                          Set<GrammarSymbol<?>> closure, Tokenizer tokenizer,
                          Parser<GrammarSymbol<?>> parser) {
        this.root = root;
        this.closure = closure;
        this.tokenizer = tokenizer;
        this.parser = parser;
    }

    public String toString() {
        return String.format("%s@%h[root=%s]", getClass().getName(), this,
                             root);
    }

    public GrammarSymbol<A> getRoot() {
        return root;
    }

    public Set<GrammarSymbol<?>> getClosure() {
        return closure;
    }

    public Set<String> getTokens() {
        return tokenizer.getTokens();
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public ContextFreeGrammar<GrammarSymbol<?>> getGrammar() {
        return parser.getGrammar();
    }

    public Parser<GrammarSymbol<?>> getParser() {
        return parser;
    }

    /**
     * Tokenize the input, parse it, and reconstruct a value from every
     * parse tree.
     */
    public ParseOutcome<A> parse(String input) {
        List<String> tokens = tokenizer.tokenize(input);
        Set<ParseTree<GrammarSymbol<?>>> trees = parser.parse(tokens);
        List<A> values = new ArrayList<A>();
        for (ParseTree<GrammarSymbol<?>> t : trees) {
            Optional<A> value = root.fromAST(t);
            if (value.isPresent()) values.add(value.get());
        }
        return new ParseOutcome<A>(input, tokens, trees, values);
    }

    /**
     * A JSON description of the grammar (see Grammars).
     */
    public JSONObject toJSON() {
        return Grammars.describe(getGrammar(), getTokens());
    }

}
