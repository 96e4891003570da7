package net.synchro.syntax;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.synchro.api.parser.Production;

/**
 * Turns the declared constituent lists of a Nonterminal into concrete
 * productions headed by that symbol.
 * Since symbols compare by identity, the productions of distinct symbols
 * never collide, even if their declarations look alike.
 */
public final class ProductionDeriver {

    private ProductionDeriver() {}

    public static <A> Production<GrammarSymbol<?>> productionOf(
            Nonterminal<A> head, List<GrammarSymbol<?>> constituents) {
        return new Production<GrammarSymbol<?>>(head, constituents);
    }

    public static <A> Map<Production<GrammarSymbol<?>>,
                          SynchronousProduction<A>> derive(
            Nonterminal<A> symbol) {
        Map<Production<GrammarSymbol<?>>, SynchronousProduction<A>> ret =
            new LinkedHashMap<Production<GrammarSymbol<?>>,
                              SynchronousProduction<A>>();
        for (Map.Entry<List<GrammarSymbol<?>>, NodeConstructor<A>> ent :
             symbol.getSynchronousProductions().entrySet()) {
            Production<GrammarSymbol<?>> prod = productionOf(symbol,
                                                             ent.getKey());
            ret.put(prod, new SynchronousProduction<A>(prod, ent.getValue()));
        }
        return Collections.unmodifiableMap(ret);
    }

}
