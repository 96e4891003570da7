package net.synchro.syntax;

import java.util.List;
import java.util.Map;
import net.synchro.api.parser.Production;

/**
 * A symbol defined by synchronous productions.
 * Subclasses list the productions in declare(); it is invoked once, on
 * first use, so declarations may refer to symbols (including this one)
 * that did not exist yet when this symbol was constructed:
 * <pre>
 * static final Nonterminal&lt;Integer&gt; SUM = new Nonterminal&lt;Integer&gt;("Sum") {
 *     protected void declare(ProductionTable&lt;Integer&gt; table) {
 *         table.production(NUM, PLUS, NUM).yields(...);
 *     }
 * };
 * </pre>
 */
public abstract class Nonterminal<A> extends GrammarSymbol<A> {

    private final Object declarationLock;
    private volatile Map<List<GrammarSymbol<?>>, NodeConstructor<A>> declared;
    private volatile Map<Production<GrammarSymbol<?>>,
                         SynchronousProduction<A>> derived;

    protected Nonterminal(String name) {
        super(name);
        declarationLock = new Object();
    }

    public final Kind getKind() {
        return Kind.NONTERMINAL;
    }

    /**
     * Add this symbol's productions to the given table.
     */
    protected abstract void declare(ProductionTable<A> table);

    public final Map<List<GrammarSymbol<?>>, NodeConstructor<A>>
            getSynchronousProductions() {
        Map<List<GrammarSymbol<?>>, NodeConstructor<A>> ret = declared;
        if (ret == null) {
            synchronized (declarationLock) {
                ret = declared;
                if (ret == null) {
                    ProductionTable<A> table = new ProductionTable<A>(this);
                    declare(table);
                    ret = table.toMap();
                    declared = ret;
                }
            }
        }
        return ret;
    }

    /**
     * The productions of this symbol keyed by their concrete form (this
     * symbol as the head, the constituents as the body).
     */
    public final Map<Production<GrammarSymbol<?>>, SynchronousProduction<A>>
            getDerivedProductions() {
        Map<Production<GrammarSymbol<?>>, SynchronousProduction<A>> ret =
            derived;
        if (ret == null) {
            synchronized (declarationLock) {
                ret = derived;
                if (ret == null) {
                    ret = ProductionDeriver.derive(this);
                    derived = ret;
                }
            }
        }
        return ret;
    }

}
