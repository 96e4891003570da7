package net.synchro.lfg;

/**
 * The address of a concrete feature structure.
 */
public final class AbsoluteIdentifier implements Identifier {

    public static final char SCOPE_SEPARATOR = ':';

    private final String address;

    private AbsoluteIdentifier(String address) {
        this.address = address;
    }

    public String toString() {
        return address;
    }

    public boolean equals(Object other) {
        return (other instanceof AbsoluteIdentifier &&
                address.equals(((AbsoluteIdentifier) other).address));
    }

    public int hashCode() {
        return address.hashCode();
    }

    public String getName() {
        return address;
    }

    public String getAddress() {
        return address;
    }

    /**
     * The address of the given name local to this structure.
     */
    public AbsoluteIdentifier scoped(String name) {
        return of(address + SCOPE_SEPARATOR + name);
    }

    public static AbsoluteIdentifier of(String address) {
        if (address == null)
            throw new NullPointerException("Address may not be null");
        if (address.isEmpty())
            throw new IllegalArgumentException("Address may not be empty");
        return new AbsoluteIdentifier(address);
    }

}
