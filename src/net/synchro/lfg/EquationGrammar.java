package net.synchro.lfg;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import net.synchro.syntax.Constituents;
import net.synchro.syntax.NodeConstructor;
import net.synchro.syntax.Nonterminal;
import net.synchro.syntax.ProductionTable;
import net.synchro.syntax.Terminal;
import net.synchro.util.config.Configuration;
import net.synchro.util.config.Configurations;

import static net.synchro.lfg.ExpressionGrammar.CLOSE;
import static net.synchro.lfg.ExpressionGrammar.EXPRESSION;
import static net.synchro.lfg.ExpressionGrammar.OPEN;

/**
 * Grammar symbols for the surface syntax of equations.
 * <pre>
 * Equation := "NOT" Equation
 *           | Equation "AND" Equation | Equation "OR" Equation
 *           | Expression "=" Expression | Expression "IN" Expression
 *           | Expression "=c" Expression | Expression "INc" Expression
 *           | Expression
 *           | "(" Equation ")"
 * </pre>
 * "NOT" negates the equation following it (see Equation.negation()); a
 * bare expression is a positive existence constraint.
 * The grammar has traditionally read "OR" as a conjunction; whether it does
 * so or yields a disjunction is determined by the DisjunctionMode. The
 * mode of EQUATION is taken from the "synchro.lfg.disjunction"
 * configuration key.
 */
public final class EquationGrammar {

    /**
     * How "A OR B" is interpreted.
     */
    public enum DisjunctionMode {
        /* As a conjunction, like AND. */
        LITERAL,
        /* As a disjunction. */
        INTENDED
    }

    public static final String K_DISJUNCTION = "synchro.lfg.disjunction";

    private static final Logger LOGGER = Logger.getLogger("EquationGrammar");

    public static final Terminal NOT = Terminal.of("NOT");
    public static final Terminal AND = Terminal.of("AND");
    public static final Terminal OR = Terminal.of("OR");
    public static final Terminal ASSIGN = Terminal.of("=");
    public static final Terminal IN = Terminal.of("IN");
    public static final Terminal EQUALS_C = Terminal.of("=c");
    public static final Terminal IN_C = Terminal.of("INc");

    private static final Map<DisjunctionMode,
        Nonterminal<Equation<RelativeIdentifier>>> BY_MODE;

    static {
        Map<DisjunctionMode, Nonterminal<Equation<RelativeIdentifier>>> m =
            new EnumMap<DisjunctionMode,
                        Nonterminal<Equation<RelativeIdentifier>>>(
                DisjunctionMode.class);
        for (DisjunctionMode mode : DisjunctionMode.values()) {
            m.put(mode, createEquation(mode));
        }
        BY_MODE = Collections.unmodifiableMap(m);
    }

    /**
     * The equation symbol using the configured disjunction mode.
     */
    public static final Nonterminal<Equation<RelativeIdentifier>> EQUATION =
        equation(configuredMode(Configuration.DEFAULT));

    private EquationGrammar() {}

    /**
     * The equation symbol for the given disjunction mode.
     * There is exactly one symbol per mode.
     */
    public static Nonterminal<Equation<RelativeIdentifier>> equation(
            DisjunctionMode mode) {
        if (mode == null)
            throw new NullPointerException("Mode may not be null");
        return BY_MODE.get(mode);
    }

    public static DisjunctionMode configuredMode(Configuration cfg) {
        DisjunctionMode ret = Configurations.getEnum(cfg, K_DISJUNCTION,
            DisjunctionMode.class, DisjunctionMode.LITERAL);
        LOGGER.config("Disjunction mode: " + ret);
        return ret;
    }

    private static Nonterminal<Equation<RelativeIdentifier>> createEquation(
            final DisjunctionMode mode) {
        String name = (mode == DisjunctionMode.LITERAL) ? "Equation" :
            "Equation[" + mode + "]";
        return new Nonterminal<Equation<RelativeIdentifier>>(name) {
            protected void declare(
                    ProductionTable<Equation<RelativeIdentifier>> t) {
                final Nonterminal<Equation<RelativeIdentifier>> self = this;
                t.production(NOT, self).yields(
                    new NodeConstructor<Equation<RelativeIdentifier>>() {
                        public Optional<Equation<RelativeIdentifier>>
                                construct(Constituents c) {
                            return Optional.of(c.get(1, self).negation());
                        }
                    });
                t.production(self, AND, self).yields(
                    compound(self, CompoundEquation.Kind.CONJUNCTION));
                t.production(self, OR, self).yields(
                    compound(self, (mode == DisjunctionMode.INTENDED) ?
                        CompoundEquation.Kind.DISJUNCTION :
                        CompoundEquation.Kind.CONJUNCTION));
                t.production(EXPRESSION, ASSIGN, EXPRESSION).yields(
                    defining(DefiningEquation.Kind.ASSIGNMENT));
                t.production(EXPRESSION, IN, EXPRESSION).yields(
                    defining(DefiningEquation.Kind.CONTAINMENT));
                t.production(EXPRESSION, EQUALS_C, EXPRESSION).yields(
                    constraint(ConstraintEquation.Kind.EQUALS));
                t.production(EXPRESSION, IN_C, EXPRESSION).yields(
                    constraint(ConstraintEquation.Kind.CONTAINS));
                t.production(EXPRESSION).yields(
                    constraint(ConstraintEquation.Kind.EXISTS));
                t.production(OPEN, self, CLOSE).yields(
                    new NodeConstructor<Equation<RelativeIdentifier>>() {
                        public Optional<Equation<RelativeIdentifier>>
                                construct(Constituents c) {
                            return Optional.of(c.get(1, self));
                        }
                    });
            }
        };
    }

    private static NodeConstructor<Equation<RelativeIdentifier>> compound(
            final Nonterminal<Equation<RelativeIdentifier>> self,
            final CompoundEquation.Kind kind) {
        return new NodeConstructor<Equation<RelativeIdentifier>>() {
            public Optional<Equation<RelativeIdentifier>> construct(
                    Constituents c) {
                return Optional.of(Equation.of(
                    new CompoundEquation<RelativeIdentifier>(kind,
                        c.get(0, self), c.get(2, self))));
            }
        };
    }

    private static NodeConstructor<Equation<RelativeIdentifier>> defining(
            final DefiningEquation.Kind kind) {
        return new NodeConstructor<Equation<RelativeIdentifier>>() {
            public Optional<Equation<RelativeIdentifier>> construct(
                    Constituents c) {
                return Optional.of(Equation.of(
                    new DefiningEquation<RelativeIdentifier>(kind,
                        c.get(0, EXPRESSION), c.get(2, EXPRESSION))));
            }
        };
    }

    private static NodeConstructor<Equation<RelativeIdentifier>> constraint(
            final ConstraintEquation.Kind kind) {
        return new NodeConstructor<Equation<RelativeIdentifier>>() {
            public Optional<Equation<RelativeIdentifier>> construct(
                    Constituents c) {
                Expression<RelativeIdentifier> right = (kind ==
                    ConstraintEquation.Kind.EXISTS) ? null :
                    c.get(2, EXPRESSION);
                return Optional.of(Equation.of(
                    new ConstraintEquation<RelativeIdentifier>(kind, true,
                        c.get(0, EXPRESSION), right)));
            }
        };
    }

}
