package net.synchro.syntax;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import net.synchro.util.Formats;

/**
 * The lexical category of a single literal token.
 * Terminals are interned: of() returns the same instance for equal
 * literals, so that grammars declared independently agree on them.
 */
public final class Terminal extends LexicalCategory {

    private static final ConcurrentMap<String, Terminal> INTERNED =
        new ConcurrentHashMap<String, Terminal>();

    private final String literal;

    private Terminal(String literal) {
        super(Formats.formatString(literal));
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }

    public Set<String> getTokens() {
        return Collections.singleton(literal);
    }

    public boolean member(String token) {
        return literal.equals(token);
    }

    public static Terminal of(String literal) {
        if (literal == null)
            throw new NullPointerException(
                "Terminal literal may not be null");
        Terminal ret = INTERNED.get(literal);
        if (ret != null) return ret;
        Terminal fresh = new Terminal(literal);
        ret = INTERNED.putIfAbsent(literal, fresh);
        return (ret == null) ? fresh : ret;
    }

}
