package net.synchro.lfg;

/**
 * Resolves relative identifiers against the addresses of a mother node
 * (up) and of the node an equation is attached to (down).
 */
public final class Grounding
        implements IdentifierMapping<RelativeIdentifier, AbsoluteIdentifier> {

    private final AbsoluteIdentifier up;
    private final AbsoluteIdentifier down;

    public Grounding(AbsoluteIdentifier up, AbsoluteIdentifier down) {
        if (up == null || down == null)
            throw new NullPointerException(
                "Grounding addresses may not be null");
        this.up = up;
        this.down = down;
    }

    public String toString() {
        return String.format("%s@%h[up=%s,down=%s]", getClass().getName(),
                             this, up, down);
    }

    public AbsoluteIdentifier getUp() {
        return up;
    }

    public AbsoluteIdentifier getDown() {
        return down;
    }

    public AbsoluteIdentifier map(RelativeIdentifier identifier) {
        return identifier.ground(up, down);
    }

}
