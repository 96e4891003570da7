package net.synchro.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the synchronous productions of a Nonterminal.
 * Each constituent list may be declared only once per symbol.
 */
public final class ProductionTable<A> {

    public final class Pending {

        private final List<GrammarSymbol<?>> constituents;

        private Pending(List<GrammarSymbol<?>> constituents) {
            this.constituents = constituents;
        }

        /**
         * Register the constructor building this production's value.
         */
        public ProductionTable<A> yields(NodeConstructor<A> constructor) {
            if (constructor == null)
                throw new NullPointerException(
                    "Constructor may not be null");
            if (entries.get(constituents) != null)
                throw new IllegalStateException("Production " + owner +
                    " -> " + constituents + " already has a constructor");
            entries.put(constituents, constructor);
            return ProductionTable.this;
        }

    }

    private final Nonterminal<A> owner;
    private final Map<List<GrammarSymbol<?>>, NodeConstructor<A>> entries;

    ProductionTable(Nonterminal<A> owner) {
        this.owner = owner;
        this.entries =
            new LinkedHashMap<List<GrammarSymbol<?>>, NodeConstructor<A>>();
    }

    public Nonterminal<A> getOwner() {
        return owner;
    }

    /**
     * Declare a production deriving the owner from the given constituents.
     * The returned object must be completed with a constructor.
     */
    public Pending production(GrammarSymbol<?>... constituents) {
        return production(Arrays.asList(constituents));
    }
    public Pending production(List<? extends GrammarSymbol<?>> constituents) {
        for (GrammarSymbol<?> s : constituents) {
            if (s == null)
                throw new IllegalArgumentException("Null constituent in " +
                    "production of " + owner + " (referencing a symbol " +
                    "before its initialization?)");
        }
        List<GrammarSymbol<?>> key = Collections.unmodifiableList(
            new ArrayList<GrammarSymbol<?>>(constituents));
        if (entries.containsKey(key))
            throw new IllegalArgumentException("Duplicate production " +
                owner + " -> " + key);
        entries.put(key, null);
        return new Pending(key);
    }

    Map<List<GrammarSymbol<?>>, NodeConstructor<A>> toMap() {
        for (Map.Entry<List<GrammarSymbol<?>>, NodeConstructor<A>> ent :
             entries.entrySet()) {
            if (ent.getValue() == null)
                throw new IllegalStateException("Production " + owner +
                    " -> " + ent.getKey() + " lacks a constructor");
        }
        return Collections.unmodifiableMap(
            new LinkedHashMap<List<GrammarSymbol<?>>, NodeConstructor<A>>(
                entries));
    }

}
