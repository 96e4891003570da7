package net.synchro.lfg;

/**
 * An identifier whose referent depends on where the equation using it is
 * attached: the mother node (^), the node itself (!), or a name local to
 * the node (such as %f).
 */
public final class RelativeIdentifier implements Identifier {

    public enum Kind { UP, DOWN, LOCAL }

    public static final RelativeIdentifier UP =
        new RelativeIdentifier(Kind.UP, "^");
    public static final RelativeIdentifier DOWN =
        new RelativeIdentifier(Kind.DOWN, "!");

    private final Kind kind;
    private final String name;

    private RelativeIdentifier(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public String toString() {
        return name;
    }

    public boolean equals(Object other) {
        if (! (other instanceof RelativeIdentifier)) return false;
        RelativeIdentifier ri = (RelativeIdentifier) other;
        return (kind == ri.kind && name.equals(ri.name));
    }

    public int hashCode() {
        return kind.hashCode() * 31 + name.hashCode();
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /**
     * Resolve this identifier given the addresses of the mother node and
     * of the node itself.
     * Local names are scoped to the node itself.
     */
    public AbsoluteIdentifier ground(AbsoluteIdentifier up,
                                     AbsoluteIdentifier down) {
        switch (kind) {
            case UP:
                return up;
            case DOWN:
                return down;
            case LOCAL:
                return down.scoped(name);
            default:
                throw new AssertionError("Unknown identifier kind " + kind);
        }
    }

    public static RelativeIdentifier local(String name) {
        if (name == null)
            throw new NullPointerException("Name may not be null");
        if (name.isEmpty())
            throw new IllegalArgumentException("Name may not be empty");
        return new RelativeIdentifier(Kind.LOCAL, name);
    }

}
