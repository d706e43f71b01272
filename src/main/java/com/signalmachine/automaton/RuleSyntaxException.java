package com.signalmachine.automaton;

/**
 * Malformed rule text. Parsing stops at the first error.
 */
public class RuleSyntaxException extends IllegalArgumentException {

    private final int lineNumber;

    public RuleSyntaxException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public RuleSyntaxException(int lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line of the rule text where parsing failed.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
