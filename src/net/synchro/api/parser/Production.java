package net.synchro.api.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An (immutable) element of a ContextFreeGrammar.
 * A Production consists of a head symbol and an ordered list of symbols
 * (its body) the head may be rewritten to. Two productions are equal if
 * their heads and bodies are equal.
 */
public final class Production<S> {

    private final S head;
    private final List<S> symbols;

    public Production(S head, List<? extends S> symbols) {
        if (head == null)
            throw new NullPointerException(
                "Production head may not be null");
        if (symbols == null)
            throw new NullPointerException(
                "Production symbols may not be null");
        for (S s : symbols) {
            if (s == null)
                throw new NullPointerException(
                    "Production symbols may not contain null");
        }
        this.head = head;
        this.symbols = Collections.unmodifiableList(
            new ArrayList<S>(symbols));
    }
    @SafeVarargs
    public Production(S head, S... symbols) {
        this(head, Arrays.asList(symbols));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(head).append(" ->");
        for (S s : symbols) sb.append(' ').append(s);
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Production)) return false;
        Production<?> po = (Production<?>) other;
        return (getHead().equals(po.getHead()) &&
                getSymbols().equals(po.getSymbols()));
    }

    public int hashCode() {
        return getHead().hashCode() ^ getSymbols().hashCode();
    }

    /**
     * The symbol this production derives.
     */
    public S getHead() {
        return head;
    }

    /**
     * The body of this production.
     */
    public List<S> getSymbols() {
        return symbols;
    }

}
