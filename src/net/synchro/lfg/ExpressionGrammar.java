package net.synchro.lfg;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import net.synchro.syntax.Constituents;
import net.synchro.syntax.LexicalCategory;
import net.synchro.syntax.NodeConstructor;
import net.synchro.syntax.Nonterminal;
import net.synchro.syntax.ProductionTable;
import net.synchro.syntax.Terminal;

/**
 * Grammar symbols for the surface syntax of relative identifiers and
 * expressions.
 * <pre>
 * Identifier := "^" | "!" | LocalName
 * Expression := Identifier | "(" Expression Feature ")" | Value
 * </pre>
 * Local names are identifier-like words (optionally prefixed with a
 * percent sign), features are upper-case words, and values are quoted
 * with single quotes; none of them may be a keyword.
 */
public final class ExpressionGrammar {

    public static final List<String> KEYWORDS = Collections.unmodifiableList(
        Arrays.asList("NOT", "AND", "OR", "IN", "INc"));

    public static final Terminal UP = Terminal.of("^");
    public static final Terminal DOWN = Terminal.of("!");
    public static final Terminal OPEN = Terminal.of("(");
    public static final Terminal CLOSE = Terminal.of(")");

    public static final LexicalCategory LOCAL_NAME = LexicalCategory.matching(
        "LocalName", Pattern.compile("%?[A-Za-z][A-Za-z0-9_]*"), KEYWORDS);
    public static final LexicalCategory FEATURE = LexicalCategory.matching(
        "Feature", Pattern.compile("[A-Z][A-Z0-9_]*"), KEYWORDS);
    public static final LexicalCategory VALUE = LexicalCategory.matching(
        "Value", Pattern.compile("'[A-Za-z0-9_]+'"));

    public static final Nonterminal<RelativeIdentifier> IDENTIFIER =
        new Nonterminal<RelativeIdentifier>("Identifier") {
            protected void declare(ProductionTable<RelativeIdentifier> t) {
                t.production(UP).yields(
                    new NodeConstructor<RelativeIdentifier>() {
                        public Optional<RelativeIdentifier> construct(
                                Constituents c) {
                            return Optional.of(RelativeIdentifier.UP);
                        }
                    });
                t.production(DOWN).yields(
                    new NodeConstructor<RelativeIdentifier>() {
                        public Optional<RelativeIdentifier> construct(
                                Constituents c) {
                            return Optional.of(RelativeIdentifier.DOWN);
                        }
                    });
                t.production(LOCAL_NAME).yields(
                    new NodeConstructor<RelativeIdentifier>() {
                        public Optional<RelativeIdentifier> construct(
                                Constituents c) {
                            return Optional.of(RelativeIdentifier.local(
                                c.get(0, LOCAL_NAME)));
                        }
                    });
            }
        };

    public static final Nonterminal<Expression<RelativeIdentifier>>
        EXPRESSION = new Nonterminal<Expression<RelativeIdentifier>>(
                "Expression") {
            protected void declare(
                    ProductionTable<Expression<RelativeIdentifier>> t) {
                final Nonterminal<Expression<RelativeIdentifier>> self = this;
                t.production(IDENTIFIER).yields(
                    new NodeConstructor<Expression<RelativeIdentifier>>() {
                        public Optional<Expression<RelativeIdentifier>>
                                construct(Constituents c) {
                            return Optional.of(Expression.reference(
                                c.get(0, IDENTIFIER)));
                        }
                    });
                t.production(OPEN, this, FEATURE, CLOSE).yields(
                    new NodeConstructor<Expression<RelativeIdentifier>>() {
                        public Optional<Expression<RelativeIdentifier>>
                                construct(Constituents c) {
                            return Optional.of(Expression.application(
                                c.get(1, self), c.get(2, FEATURE)));
                        }
                    });
                t.production(VALUE).yields(
                    new NodeConstructor<Expression<RelativeIdentifier>>() {
                        public Optional<Expression<RelativeIdentifier>>
                                construct(Constituents c) {
                            String quoted = c.get(0, VALUE);
                            return Optional.of(
                                Expression.<RelativeIdentifier>value(
                                    quoted.substring(1,
                                                     quoted.length() - 1)));
                        }
                    });
            }
        };

    private ExpressionGrammar() {}

}
