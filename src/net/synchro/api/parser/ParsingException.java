package net.synchro.api.parser;

/**
 * Thrown if an input does not have exactly one interpretation when one is
 * demanded.
 * The Reason tells apart inputs that do not parse at all, inputs whose
 * parse trees do not correspond to any well-formed value, and inputs with
 * more than one distinct value.
 */
public class ParsingException extends ParserException {

    public enum Reason {
        /* The grammar does not derive the input. */
        NO_PARSE("no valid parse"),
        /* There are parse trees, but none of them can be reconstructed. */
        NO_INTERPRETATION("no valid interpretation"),
        /* Multiple distinct values could be reconstructed. */
        AMBIGUOUS("ambiguous interpretation");

        private final String description;

        private Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }

    }

    private final Reason reason;

    public ParsingException(Reason reason, String message) {
        super(reason.getDescription() + ": " + message);
        this.reason = reason;
    }
    public ParsingException(Reason reason, String message, Throwable cause) {
        super(reason.getDescription() + ": " + message, cause);
        this.reason = reason;
    }

    /**
     * Why the input was rejected.
     */
    public Reason getReason() {
        return reason;
    }

}
