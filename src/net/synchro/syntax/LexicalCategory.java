package net.synchro.syntax;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;
import net.synchro.api.parser.LexicalRule;

/**
 * A symbol standing for a class of single tokens.
 * A lexical category has no productions; the parser tags every token its
 * member() predicate accepts with the category itself, and such a terminal
 * node reconstructs to the token string.
 */
public abstract class LexicalCategory extends GrammarSymbol<String>
        implements LexicalRule<GrammarSymbol<?>> {

    protected LexicalCategory(String name) {
        super(name);
    }

    public final Kind getKind() {
        return Kind.LEXICAL_CATEGORY;
    }

    public final GrammarSymbol<?> getSymbol() {
        return this;
    }

    public abstract boolean member(String token);

    /**
     * A category of the tokens entirely matched by the given pattern.
     */
    public static LexicalCategory matching(String name, Pattern pattern) {
        return matching(name, pattern, Collections.<String>emptySet());
    }
    /**
     * A category of the tokens entirely matched by the given pattern, save
     * for the excluded ones (such as keywords).
     */
    public static LexicalCategory matching(String name, final Pattern pattern,
                                           Collection<String> excluded) {
        if (pattern == null)
            throw new NullPointerException("Pattern may not be null");
        final Set<String> reserved = Collections.unmodifiableSet(
            new LinkedHashSet<String>(excluded));
        return new LexicalCategory(name) {
            public boolean member(String token) {
                return (pattern.matcher(token).matches() &&
                        ! reserved.contains(token));
            }
        };
    }

}
