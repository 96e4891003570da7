package net.synchro.syntax;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.synchro.api.parser.InvalidGrammarException;
import net.synchro.api.parser.ParseTree;
import net.synchro.api.parser.ParserException;
import net.synchro.util.parser.ParsingEngineImpl;

/**
 * A symbol of a grammar that doubles as a reconstruction target.
 * A symbol is one of three kinds (see Kind): a Nonterminal, which declares
 * the productions deriving it along with constructors for values of type
 * A; a LexicalCategory, which matches single tokens by a predicate; or the
 * EmptySymbol, which matches nothing.
 * Symbols are compared by identity. They are meant to be created once
 * (typically as constants) and may refer to each other (and themselves)
 * in arbitrary cycles. Everything derived from them (closure, grammar,
 * tokenizer, parser) is computed on first use and cached.
 */
public abstract class GrammarSymbol<A> {

    /**
     * The variants of grammar symbols.
     */
    public enum Kind { NONTERMINAL, LEXICAL_CATEGORY, EMPTY }

    private final String name;
    private final Object lock;
    private volatile Set<GrammarSymbol<?>> closure;
    private volatile DerivedGrammar<A> grammar;

    protected GrammarSymbol(String name) {
        if (name == null)
            throw new NullPointerException("Symbol name may not be null");
        this.name = name;
        this.lock = new Object();
    }

    public String toString() {
        return name;
    }

    /**
     * A human-readable name of this symbol (not necessarily unique).
     */
    public String getName() {
        return name;
    }

    /**
     * Which variant this symbol is.
     */
    public abstract Kind getKind();

    /**
     * The constituent lists this symbol can be derived from, each paired
     * with the constructor of the value to reconstruct.
     * Only nonterminals have any.
     */
    public Map<List<GrammarSymbol<?>>, NodeConstructor<A>>
            getSynchronousProductions() {
        return Collections.emptyMap();
    }

    /**
     * The literal strings this symbol needs the tokenizer to split out.
     */
    public Set<String> getTokens() {
        return Collections.emptySet();
    }

    /**
     * All symbols reachable from this one through production constituents,
     * excluding this symbol itself.
     */
    public final Set<GrammarSymbol<?>> getClosure() {
        Set<GrammarSymbol<?>> ret = closure;
        if (ret == null) {
            synchronized (lock) {
                ret = closure;
                if (ret == null) {
                    ret = SymbolClosure.compute(this);
                    closure = ret;
                }
            }
        }
        return ret;
    }

    /* The closure if it has already been computed, or null. */
    Set<GrammarSymbol<?>> peekClosure() {
        return closure;
    }

    /**
     * The complete grammar rooted at this symbol, using the default
     * parsing engine.
     * An InvalidGrammarException is thrown if the literal tokens of the
     * grammar are ambiguous or the engine rejects the grammar otherwise;
     * failures are not cached.
     */
    public final DerivedGrammar<A> getGrammar()
            throws InvalidGrammarException {
        DerivedGrammar<A> ret = grammar;
        if (ret == null) {
            synchronized (lock) {
                ret = grammar;
                if (ret == null) {
                    ret = GrammarAssembler.assemble(this,
                        ParsingEngineImpl.INSTANCE);
                    grammar = ret;
                }
            }
        }
        return ret;
    }

    /**
     * Reconstruct a value from the given parse tree.
     * See ASTReconstructor for details.
     */
    public final Optional<A> fromAST(ParseTree<GrammarSymbol<?>> tree) {
        return ASTReconstructor.reconstruct(this, tree);
    }

    /**
     * Tokenize and parse the given input and reconstruct values from all
     * resulting parse trees.
     */
    public ParseOutcome<A> parse(String input)
            throws InvalidGrammarException {
        return getGrammar().parse(input);
    }

    /**
     * Parse the given input and return its only interpretation.
     * A ParsingException is thrown if the input has no parse, no
     * reconstructable parse, or multiple distinct values.
     */
    public A parseUnique(String input) throws ParserException {
        return parse(input).getUniqueValue();
    }

}
