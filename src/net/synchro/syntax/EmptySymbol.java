package net.synchro.syntax;

/**
 * The symbol matching nothing.
 * It serves as an explicit "no value" marker: nothing ever reconstructs
 * from it, so any production mentioning it never yields a value.
 */
public final class EmptySymbol extends GrammarSymbol<Void> {

    public static final EmptySymbol INSTANCE = new EmptySymbol();

    private EmptySymbol() {
        super("<empty>");
    }

    public Kind getKind() {
        return Kind.EMPTY;
    }

}
