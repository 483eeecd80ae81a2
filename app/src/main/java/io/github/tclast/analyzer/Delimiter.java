package io.github.tclast.analyzer;

/** Opening delimiters the tokenizer tracks. */
public enum Delimiter {
    BRACE("close-brace"),
    QUOTE("close-quote"),
    BRACKET("close-bracket"),
    PAREN("close-paren");

    private final String closeName;

    Delimiter(String closeName) {
        this.closeName = closeName;
    }

    /** Human-readable name of the missing closer, as used in error messages. */
    public String closeName() {
        return closeName;
    }
}
