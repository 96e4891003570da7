package net.synchro.syntax;

import net.synchro.api.parser.Production;

/**
 * A production paired with the constructor of its head's value.
 */
public final class SynchronousProduction<A> {

    private final Production<GrammarSymbol<?>> production;
    private final NodeConstructor<A> constructor;

    public SynchronousProduction(Production<GrammarSymbol<?>> production,
                                 NodeConstructor<A> constructor) {
        if (production == null || constructor == null)
            throw new NullPointerException(
                "SynchronousProduction components may not be null");
        this.production = production;
        this.constructor = constructor;
    }

    public String toString() {
        return String.format("%s@%h[%s]", getClass().getName(), this,
                             production);
    }

    public Production<GrammarSymbol<?>> getProduction() {
        return production;
    }

    public NodeConstructor<A> getConstructor() {
        return constructor;
    }

}
