package net.synchro.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.synchro.api.parser.ParseTree;
import net.synchro.api.parser.Production;

/**
 * Recovers typed values from parse trees.
 * For a nonterminal node, the production it instantiates is looked up by
 * its exact head and child tags among the productions of the target symbol
 * (there is no fallback to similar productions); every child is
 * reconstructed by the symbol it is tagged with, and the production's
 * constructor is applied to the children's values. A terminal node
 * reconstructs to its token if it is tagged with the target lexical
 * category and the category accepts the token. Empty nodes and the
 * EmptySymbol never reconstruct.
 * Any failure anywhere in the tree makes the whole reconstruction yield an
 * empty result; reconstruction never throws for malformed trees.
 */
public final class ASTReconstructor {

    private static final Logger LOGGER = Logger.getLogger("ASTReconstructor");

    private ASTReconstructor() {}

    public static <A> Optional<A> reconstruct(GrammarSymbol<A> symbol,
            ParseTree<GrammarSymbol<?>> tree) {
        if (tree == null) return Optional.empty();
        switch (symbol.getKind()) {
            case NONTERMINAL:
                return reconstructNonterminal((Nonterminal<A>) symbol, tree);
            case LEXICAL_CATEGORY:
                @SuppressWarnings("unchecked")
                Optional<A> ret = (Optional<A>) reconstructTerminal(
                    (LexicalCategory) symbol, tree);
                return ret;
            case EMPTY:
                return Optional.empty();
            default:
                throw new AssertionError("Unknown symbol kind " +
                                         symbol.getKind());
        }
    }

    public static <A> Optional<A> reconstructNonterminal(
            Nonterminal<A> symbol, ParseTree<GrammarSymbol<?>> tree) {
        if (tree.getKind() != ParseTree.Kind.NONTERMINAL) {
            mismatch(symbol, tree, "not a nonterminal node");
            return Optional.empty();
        }
        List<ParseTree<GrammarSymbol<?>>> children = tree.getChildren();
        List<GrammarSymbol<?>> tags = new ArrayList<GrammarSymbol<?>>();
        for (ParseTree<GrammarSymbol<?>> ch : children) {
            if (ch.getTag() == null) {
                mismatch(symbol, tree, "empty constituent");
                return Optional.empty();
            }
            tags.add(ch.getTag());
        }
        Production<GrammarSymbol<?>> key =
            new Production<GrammarSymbol<?>>(tree.getTag(), tags);
        SynchronousProduction<A> prod =
            symbol.getDerivedProductions().get(key);
        if (prod == null) {
            mismatch(symbol, tree, "undeclared production " + key);
            return Optional.empty();
        }
        List<Object> values = new ArrayList<Object>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Optional<?> value = reconstruct(tags.get(i), children.get(i));
            if (! value.isPresent()) {
                mismatch(symbol, tree, "constituent " + i + " (" +
                         tags.get(i) + ") has no value");
                return Optional.empty();
            }
            values.add(value.get());
        }
        Optional<A> ret = prod.getConstructor().construct(
            new Constituents(children, tags, values));
        if (ret == null || ! ret.isPresent()) {
            mismatch(symbol, tree, "constructor declined");
            return Optional.empty();
        }
        return ret;
    }

    public static Optional<String> reconstructTerminal(
            LexicalCategory category, ParseTree<GrammarSymbol<?>> tree) {
        if (tree.getKind() != ParseTree.Kind.TERMINAL ||
                tree.getTag() != category ||
                ! category.member(tree.getContent()))
            return Optional.empty();
        return Optional.of(tree.getContent());
    }

    private static void mismatch(GrammarSymbol<?> symbol,
                                 ParseTree<GrammarSymbol<?>> tree,
                                 String detail) {
        if (LOGGER.isLoggable(Level.FINE))
            LOGGER.fine("Cannot reconstruct " + symbol + " from " + tree +
                        ": " + detail);
    }

}
