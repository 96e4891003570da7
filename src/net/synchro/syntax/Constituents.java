package net.synchro.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.synchro.api.parser.ParseTree;

/**
 * The already-reconstructed children of a parse tree node, as handed to a
 * NodeConstructor.
 * Values are retrieved by position along with the symbol expected there;
 * this keeps the retrieval type-safe.
 */
public final class Constituents {

    private final List<ParseTree<GrammarSymbol<?>>> trees;
    private final List<GrammarSymbol<?>> symbols;
    private final List<Object> values;

    Constituents(List<ParseTree<GrammarSymbol<?>>> trees,
                 List<GrammarSymbol<?>> symbols, List<Object> values) {
        if (trees.size() != symbols.size() || trees.size() != values.size())
            throw new IllegalArgumentException(
                "Mismatching constituent list sizes");
        this.trees = Collections.unmodifiableList(
            new ArrayList<ParseTree<GrammarSymbol<?>>>(trees));
        this.symbols = Collections.unmodifiableList(
            new ArrayList<GrammarSymbol<?>>(symbols));
        this.values = Collections.unmodifiableList(
            new ArrayList<Object>(values));
    }

    public String toString() {
        return String.format("%s@%h[symbols=%s,values=%s]",
            getClass().getName(), this, symbols, values);
    }

    public int size() {
        return values.size();
    }

    public GrammarSymbol<?> symbolAt(int index) {
        return symbols.get(index);
    }

    public ParseTree<GrammarSymbol<?>> treeAt(int index) {
        return trees.get(index);
    }

    public Object valueAt(int index) {
        return values.get(index);
    }

    /**
     * The value of the constituent at the given index, which must stem
     * from the given symbol.
     */
    public <T> T get(int index, GrammarSymbol<T> symbol) {
        GrammarSymbol<?> actual = symbols.get(index);
        if (actual != symbol)
            throw new IllegalArgumentException("Constituent " + index +
                " is " + actual + ", not " + symbol);
        @SuppressWarnings("unchecked")
        T ret = (T) values.get(index);
        return ret;
    }

}
