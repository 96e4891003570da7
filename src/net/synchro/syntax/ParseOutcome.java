package net.synchro.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.synchro.api.parser.ParseTree;
import net.synchro.api.parser.ParsingException;
import net.synchro.util.Formats;

/**
 * The result of parsing an input string with a DerivedGrammar.
 * Holds the tokens, all parse trees, and the values that could be
 * reconstructed from them (trees that did not reconstruct contribute
 * nothing). Distinct parse trees may reconstruct to equal values; an input
 * is only ambiguous if the values differ.
 */
public class ParseOutcome<A> {

    /**
     * How many interpretations an input has.
     */
    public enum Status {
        /* The parser found no tree at all. */
        NO_PARSE,
        /* There were trees, but none reconstructed. */
        NO_INTERPRETATION,
        UNIQUE,
        AMBIGUOUS
    }

    private final String input;
    private final List<String> tokens;
    private final Set<ParseTree<GrammarSymbol<?>>> trees;
    private final List<A> values;
    private final Set<A> distinctValues;

    public ParseOutcome(String input, List<String> tokens,
                        Set<ParseTree<GrammarSymbol<?>>> trees,
                        List<A> values) {
        this.input = input;
        this.tokens = Collections.unmodifiableList(
            new ArrayList<String>(tokens));
        this.trees = Collections.unmodifiableSet(
            new LinkedHashSet<ParseTree<GrammarSymbol<?>>>(trees));
        this.values = Collections.unmodifiableList(new ArrayList<A>(values));
        this.distinctValues = Collections.unmodifiableSet(
            new LinkedHashSet<A>(values));
    }

    public String toString() {
        return String.format("%s@%h[input=%s,status=%s,values=%s]",
            getClass().getName(), this, Formats.formatString(input),
            getStatus(), distinctValues);
    }

    public String getInput() {
        return input;
    }

    public List<String> getTokens() {
        return tokens;
    }

    public Set<ParseTree<GrammarSymbol<?>>> getTrees() {
        return trees;
    }

    /**
     * The values reconstructed from the trees, one per successfully
     * reconstructed tree, in tree order.
     */
    public List<A> getValues() {
        return values;
    }

    public Set<A> getDistinctValues() {
        return distinctValues;
    }

    public Status getStatus() {
        if (trees.isEmpty()) return Status.NO_PARSE;
        switch (distinctValues.size()) {
            case 0: return Status.NO_INTERPRETATION;
            case 1: return Status.UNIQUE;
            default: return Status.AMBIGUOUS;
        }
    }

    public boolean hasValue() {
        return ! values.isEmpty();
    }

    /**
     * The only distinct value of this outcome.
     * A ParsingException (with a reason matching getStatus()) is thrown
     * if there is no such value.
     */
    public A getUniqueValue() throws ParsingException {
        switch (getStatus()) {
            case NO_PARSE:
                throw new ParsingException(ParsingException.Reason.NO_PARSE,
                    "Cannot parse " + Formats.formatString(input) +
                    " (tokens " + Formats.formatStrings(tokens) + ")");
            case NO_INTERPRETATION:
                throw new ParsingException(
                    ParsingException.Reason.NO_INTERPRETATION,
                    "None of the " + trees.size() + " parse(s) of " +
                    Formats.formatString(input) + " can be interpreted");
            case AMBIGUOUS:
                throw new ParsingException(ParsingException.Reason.AMBIGUOUS,
                    Formats.formatString(input) + " has " +
                    distinctValues.size() + " distinct interpretations: " +
                    distinctValues);
            default:
                return distinctValues.iterator().next();
        }
    }

}
