package net.synchro.api.parser;

/**
 * Thrown if a grammar or a token set is unfit for parsing.
 * This is a configuration error: it is detected while a tokenizer or a
 * parser is created, before any input is looked at.
 */
public class InvalidGrammarException extends ParserException {

    public InvalidGrammarException() {
        super();
    }
    public InvalidGrammarException(String message) {
        super(message);
    }
    public InvalidGrammarException(Throwable cause) {
        super(cause);
    }
    public InvalidGrammarException(String message, Throwable cause) {
        super(message, cause);
    }

}
