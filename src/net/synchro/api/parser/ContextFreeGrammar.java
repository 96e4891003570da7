package net.synchro.api.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A (context-free) grammar, as consumed by a Parser.
 * The grammar consists of productions, lexical rules that classify tokens,
 * and a set of start symbols. It matches those token sequences that are
 * derived by any of its start symbols; a symbol derives a token sequence
 * if a production with that symbol as its head derives it (i.e. the
 * production's body symbols derive adjacent parts of the sequence in
 * order), or if the sequence consists of a single token that a lexical
 * rule for that symbol accepts.
 * Instances are immutable.
 */
public class ContextFreeGrammar<S> {

    private final Set<Production<S>> productions;
    private final Set<LexicalRule<S>> lexicalRules;
    private final Set<S> startSymbols;
    private final Map<S, List<Production<S>>> index;

    public ContextFreeGrammar(Collection<Production<S>> productions,
                              Collection<? extends LexicalRule<S>> lexicalRules,
                              Collection<? extends S> startSymbols) {
        if (productions == null || lexicalRules == null ||
                startSymbols == null)
            throw new NullPointerException(
                "Grammar components may not be null");
        this.productions = Collections.unmodifiableSet(
            new LinkedHashSet<Production<S>>(productions));
        this.lexicalRules = Collections.unmodifiableSet(
            new LinkedHashSet<LexicalRule<S>>(lexicalRules));
        this.startSymbols = Collections.unmodifiableSet(
            new LinkedHashSet<S>(startSymbols));
        this.index = new LinkedHashMap<S, List<Production<S>>>();
        for (Production<S> p : this.productions) {
            List<Production<S>> group = index.get(p.getHead());
            if (group == null) {
                group = new ArrayList<Production<S>>();
                index.put(p.getHead(), group);
            }
            group.add(p);
        }
    }

    public String toString() {
        return String.format("%s@%h[start=%s,productions=%s,lexical=%s]",
            getClass().getName(), this, getStartSymbols(), getProductions(),
            getLexicalRules());
    }

    /**
     * All productions of this grammar.
     */
    public Set<Production<S>> getProductions() {
        return productions;
    }

    /**
     * The productions whose head is the given symbol (possibly none).
     */
    public List<Production<S>> getProductions(S head) {
        List<Production<S>> ret = index.get(head);
        if (ret == null) return Collections.emptyList();
        return Collections.unmodifiableList(ret);
    }

    /**
     * The symbols that appear as heads of productions.
     */
    public Set<S> getHeads() {
        return Collections.unmodifiableSet(index.keySet());
    }

    /**
     * The lexical rules of this grammar.
     */
    public Set<LexicalRule<S>> getLexicalRules() {
        return lexicalRules;
    }

    /**
     * The symbols whose derivations this grammar matches.
     */
    public Set<S> getStartSymbols() {
        return startSymbols;
    }

    /**
     * Whether the given symbol is a start symbol of this grammar.
     */
    public boolean isStartSymbol(S symbol) {
        return startSymbols.contains(symbol);
    }

}
