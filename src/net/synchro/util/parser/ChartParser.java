package net.synchro.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import net.synchro.api.parser.ContextFreeGrammar;
import net.synchro.api.parser.InvalidGrammarException;
import net.synchro.api.parser.LexicalRule;
import net.synchro.api.parser.ParseTree;
import net.synchro.api.parser.Parser;
import net.synchro.api.parser.Production;

/**
 * Bottom-up chart parser returning every parse tree of its input.
 * The chart holds, for each span of tokens and each symbol, all trees
 * deriving that span from that symbol. Spans are filled in order of
 * increasing length; within a span, unary productions are applied until
 * nothing changes, skipping unary chains that would repeat a symbol over
 * the same span (those would make the set of trees infinite).
 * Productions with empty bodies are not supported.
 */
public class ChartParser<S> implements Parser<S> {

    private static final Logger LOGGER = Logger.getLogger("ChartParser");

    protected class Chart {

        private final int size;
        private final List<Map<S, Set<ParseTree<S>>>> cells;
        private boolean truncated;

        public Chart(int size) {
            this.size = size;
            int count = (size + 1) * (size + 1);
            this.cells = new ArrayList<Map<S, Set<ParseTree<S>>>>(count);
            for (int i = 0; i < count; i++) cells.add(null);
        }

        public Map<S, Set<ParseTree<S>>> get(int start, int end) {
            Map<S, Set<ParseTree<S>>> ret = cells.get(start * (size + 1) +
                                                      end);
            if (ret == null) return Collections.emptyMap();
            return ret;
        }

        public Map<S, Set<ParseTree<S>>> create(int start, int end) {
            Map<S, Set<ParseTree<S>>> ret =
                new LinkedHashMap<S, Set<ParseTree<S>>>();
            cells.set(start * (size + 1) + end, ret);
            return ret;
        }

        public boolean add(Map<S, Set<ParseTree<S>>> cell, S symbol,
                           ParseTree<S> tree) {
            Set<ParseTree<S>> group = cell.get(symbol);
            if (group == null) {
                group = new LinkedHashSet<ParseTree<S>>();
                cell.put(symbol, group);
            }
            if (maxTrees > 0 && group.size() >= maxTrees) {
                if (! group.contains(tree)) truncated = true;
                return false;
            }
            return group.add(tree);
        }

        public boolean isTruncated() {
            return truncated;
        }

    }

    private final ContextFreeGrammar<S> grammar;
    private final int maxTrees;
    private final List<Production<S>> unary;
    private final List<Production<S>> branching;

    public ChartParser(ContextFreeGrammar<S> grammar, int maxTrees)
            throws InvalidGrammarException {
        if (grammar == null)
            throw new NullPointerException("Grammar may not be null");
        if (grammar.getStartSymbols().isEmpty())
            throw new InvalidGrammarException("Grammar has no start symbol");
        this.grammar = grammar;
        this.maxTrees = maxTrees;
        this.unary = new ArrayList<Production<S>>();
        this.branching = new ArrayList<Production<S>>();
        for (Production<S> p : grammar.getProductions()) {
            switch (p.getSymbols().size()) {
                case 0:
                    throw new InvalidGrammarException("Production " + p +
                        " has an empty body");
                case 1:
                    unary.add(p);
                    break;
                default:
                    branching.add(p);
                    break;
            }
        }
    }
    public ChartParser(ContextFreeGrammar<S> grammar)
            throws InvalidGrammarException {
        this(grammar, 0);
    }

    public ContextFreeGrammar<S> getGrammar() {
        return grammar;
    }

    /* Zero stands for "unlimited". */
    public int getMaxTrees() {
        return maxTrees;
    }

    public Set<ParseTree<S>> parse(List<String> tokens) {
        int n = tokens.size();
        if (n == 0) return Collections.emptySet();
        Chart chart = new Chart(n);
        for (int length = 1; length <= n; length++) {
            for (int start = 0; start + length <= n; start++) {
                int end = start + length;
                Map<S, Set<ParseTree<S>>> cell = chart.create(start, end);
                if (length == 1) scan(chart, cell, tokens.get(start));
                for (Production<S> p : branching) {
                    if (p.getSymbols().size() > length) continue;
                    combine(chart, cell, p, end, 0, start,
                            new ArrayList<ParseTree<S>>());
                }
                closeUnary(chart, cell);
            }
        }
        Set<ParseTree<S>> ret = new LinkedHashSet<ParseTree<S>>();
        Map<S, Set<ParseTree<S>>> top = chart.get(0, n);
        for (S sym : grammar.getStartSymbols()) {
            Set<ParseTree<S>> trees = top.get(sym);
            if (trees != null) ret.addAll(trees);
        }
        if (chart.isTruncated())
            LOGGER.warning("Chart cells exceeded " + maxTrees + " trees " +
                "while parsing " + n + " tokens; some trees were dropped");
        LOGGER.fine("Parsed " + n + " tokens into " + ret.size() +
                    " tree(s)");
        return Collections.unmodifiableSet(ret);
    }

    protected void scan(Chart chart, Map<S, Set<ParseTree<S>>> cell,
                        String token) {
        for (LexicalRule<S> rule : grammar.getLexicalRules()) {
            if (! rule.member(token)) continue;
            S sym = rule.getSymbol();
            chart.add(cell, sym, ParseTreeImpl.terminal(sym, token));
        }
    }

    /* Every symbol of the body after index must still get at least one
     * token; the last one has to end exactly at end. */
    protected void combine(Chart chart, Map<S, Set<ParseTree<S>>> cell,
                           Production<S> prod, int end, int index, int pos,
                           List<ParseTree<S>> acc) {
        List<S> body = prod.getSymbols();
        int remaining = body.size() - index;
        if (remaining == 0) {
            S head = prod.getHead();
            chart.add(cell, head, ParseTreeImpl.nonterminal(head, acc));
            return;
        }
        S sym = body.get(index);
        int minSplit = (remaining == 1) ? end : pos + 1;
        int maxSplit = end - (remaining - 1);
        for (int split = minSplit; split <= maxSplit; split++) {
            Set<ParseTree<S>> subtrees = chart.get(pos, split).get(sym);
            if (subtrees == null) continue;
            for (ParseTree<S> t : subtrees) {
                acc.add(t);
                combine(chart, cell, prod, end, index + 1, split, acc);
                acc.remove(acc.size() - 1);
            }
        }
    }

    protected void closeUnary(Chart chart, Map<S, Set<ParseTree<S>>> cell) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production<S> p : unary) {
                Set<ParseTree<S>> below = cell.get(p.getSymbols().get(0));
                if (below == null) continue;
                S head = p.getHead();
                for (ParseTree<S> t : new ArrayList<ParseTree<S>>(below)) {
                    if (repeatsSymbol(t, head)) continue;
                    if (chart.add(cell, head,
                                  ParseTreeImpl.nonterminal(head, t)))
                        changed = true;
                }
            }
        }
    }

    /* Whether sym occurs along the chain of single-child nodes starting at
     * tree (all of which span the same tokens). */
    private static <S> boolean repeatsSymbol(ParseTree<S> tree, S sym) {
        for (;;) {
            if (sym.equals(tree.getTag())) return true;
            if (tree.getKind() != ParseTree.Kind.NONTERMINAL ||
                    tree.childCount() != 1)
                return false;
            tree = tree.childAt(0);
        }
    }

}
