package net.synchro.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.synchro.api.parser.InvalidGrammarException;
import net.synchro.api.parser.Tokenizer;
import net.synchro.util.Formats;

/**
 * Tokenizer splitting on whitespace and then splitting literal tokens out of
 * each whitespace-delimited chunk, preferring the longest token at every
 * position. Characters not covered by any literal token are grouped into
 * tokens of their own.
 * If word boundaries are respected, tokens consisting only of word
 * characters (letters, digits, underscores) are only split out where they
 * do not adjoin further word characters, so that "IN" is not taken out of
 * "INDEX".
 */
public class MaximalMunchTokenizer implements Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Comparator<String> LONGEST_FIRST =
        new Comparator<String>() {
            public int compare(String a, String b) {
                if (a.length() != b.length())
                    return b.length() - a.length();
                return a.compareTo(b);
            }
        };

    private final Set<String> tokens;
    private final Map<Character, List<String>> candidates;
    private final boolean wordBoundaries;

    public MaximalMunchTokenizer(Set<String> tokens, boolean wordBoundaries)
            throws InvalidGrammarException {
        if (tokens == null)
            throw new NullPointerException("Token set may not be null");
        validate(tokens, wordBoundaries);
        this.tokens = Collections.unmodifiableSet(
            new LinkedHashSet<String>(tokens));
        this.candidates = new HashMap<Character, List<String>>();
        this.wordBoundaries = wordBoundaries;
        for (String tok : this.tokens) {
            List<String> group = candidates.get(tok.charAt(0));
            if (group == null) {
                group = new ArrayList<String>();
                candidates.put(tok.charAt(0), group);
            }
            group.add(tok);
        }
        for (List<String> group : candidates.values()) {
            Collections.sort(group, LONGEST_FIRST);
        }
    }
    public MaximalMunchTokenizer(Set<String> tokens)
            throws InvalidGrammarException {
        this(tokens, true);
    }

    public String toString() {
        return String.format("%s@%h[tokens=%s]", getClass().getName(), this,
                             Formats.formatStrings(tokens));
    }

    public Set<String> getTokens() {
        return tokens;
    }

    public boolean isRespectingWordBoundaries() {
        return wordBoundaries;
    }

    public List<String> tokenize(String input) {
        List<String> ret = new ArrayList<String>();
        for (String chunk : WHITESPACE.split(input)) {
            if (chunk.isEmpty()) continue;
            splitChunk(chunk, ret);
        }
        return ret;
    }

    protected void splitChunk(String chunk, List<String> drain) {
        StringBuilder pending = new StringBuilder();
        int pos = 0;
        while (pos < chunk.length()) {
            String tok = matchAt(chunk, pos);
            if (tok == null) {
                pending.append(chunk.charAt(pos++));
                continue;
            }
            if (pending.length() > 0) {
                drain.add(pending.toString());
                pending.setLength(0);
            }
            drain.add(tok);
            pos += tok.length();
        }
        if (pending.length() > 0) drain.add(pending.toString());
    }

    protected String matchAt(String chunk, int pos) {
        List<String> group = candidates.get(chunk.charAt(pos));
        if (group == null) return null;
        for (String tok : group) {
            if (! chunk.startsWith(tok, pos)) continue;
            if (wordBoundaries && isWordLike(tok) &&
                    ! atBoundary(chunk, pos, pos + tok.length()))
                continue;
            return tok;
        }
        return null;
    }

    private static boolean isWordChar(char c) {
        return (Character.isLetterOrDigit(c) || c == '_');
    }
    private static boolean isWordLike(String tok) {
        for (int i = 0; i < tok.length(); i++) {
            if (! isWordChar(tok.charAt(i))) return false;
        }
        return true;
    }
    private static boolean atBoundary(String chunk, int start, int end) {
        if (start > 0 && isWordChar(chunk.charAt(start - 1))) return false;
        if (end < chunk.length() && isWordChar(chunk.charAt(end)))
            return false;
        return true;
    }

    /**
     * Check that the given tokens can be split out unambiguously.
     * A token that is a prefix of another is fine (the longer one wins);
     * two tokens where a proper suffix of one is a proper prefix of the
     * other are not, as are empty tokens and tokens containing whitespace.
     * If word boundaries are respected, two word-like tokens never overlap
     * (neither can be split out of the middle of a word), so such pairs
     * are exempt.
     */
    public static void validate(Set<String> tokens, boolean wordBoundaries)
            throws InvalidGrammarException {
        for (String tok : tokens) {
            if (tok == null || tok.isEmpty())
                throw new InvalidGrammarException("Empty token");
            if (WHITESPACE.matcher(tok).find())
                throw new InvalidGrammarException("Token " +
                    Formats.formatString(tok) + " contains whitespace");
        }
        for (String a : tokens) {
            for (String b : tokens) {
                if (a.equals(b)) continue;
                if (wordBoundaries && isWordLike(a) && isWordLike(b))
                    continue;
                int limit = Math.min(a.length(), b.length());
                for (int k = 1; k < limit; k++) {
                    if (a.endsWith(b.substring(0, k)))
                        throw new InvalidGrammarException(
                            "Overlapping tokens " + Formats.formatString(a) +
                            " and " + Formats.formatString(b) +
                            " admit multiple tokenizations");
                }
            }
        }
    }

}
