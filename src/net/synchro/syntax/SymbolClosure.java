package net.synchro.syntax;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes the set of symbols reachable from a root symbol.
 * The declaration graph may contain cycles; every symbol is expanded at
 * most once, and symbols whose closure is already known are not expanded
 * at all (their closure is taken over wholesale), so the cost is linear in
 * the number of distinct symbols.
 * The result never contains the root itself (even if the root refers to
 * itself) and is ordered by distance from the root.
 */
public final class SymbolClosure {

    private static final Logger LOGGER = Logger.getLogger("SymbolClosure");

    private SymbolClosure() {}

    /**
     * The symbols occurring in any of the given symbol's own productions.
     */
    public static Set<GrammarSymbol<?>> constituentsOf(GrammarSymbol<?> sym) {
        Set<GrammarSymbol<?>> ret = new LinkedHashSet<GrammarSymbol<?>>();
        for (List<GrammarSymbol<?>> body :
             sym.getSynchronousProductions().keySet()) {
            ret.addAll(body);
        }
        return ret;
    }

    public static Set<GrammarSymbol<?>> compute(GrammarSymbol<?> root) {
        Set<GrammarSymbol<?>> ret = new LinkedHashSet<GrammarSymbol<?>>();
        /* Symbols that are expanded already (or covered by a known
         * closure); the root is never part of the result. */
        Set<GrammarSymbol<?>> prohibited =
            new LinkedHashSet<GrammarSymbol<?>>();
        prohibited.add(root);
        Deque<GrammarSymbol<?>> pending = new ArrayDeque<GrammarSymbol<?>>(
            constituentsOf(root));
        while (! pending.isEmpty()) {
            GrammarSymbol<?> sym = pending.removeFirst();
            if (! prohibited.add(sym)) continue;
            ret.add(sym);
            Set<GrammarSymbol<?>> known = sym.peekClosure();
            if (known != null) {
                for (GrammarSymbol<?> s : known) {
                    if (prohibited.add(s)) ret.add(s);
                }
            } else {
                pending.addAll(constituentsOf(sym));
            }
        }
        LOGGER.fine("Closure of " + root + ": " + ret.size() + " symbol(s)");
        return Collections.unmodifiableSet(ret);
    }

}
