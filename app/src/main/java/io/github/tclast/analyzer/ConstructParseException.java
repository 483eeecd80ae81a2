package io.github.tclast.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown by a construct parser when a known command has malformed arguments. The builder turns it into a
 * {@code syntax} error node in place of the command.
 */
public class ConstructParseException extends Exception {
    private final String command;
    private final @Nullable String suggestion;

    public ConstructParseException(String message, String command) {
        this(message, command, null);
    }

    public ConstructParseException(String message, String command, @Nullable String suggestion) {
        super(message);
        this.command = command;
        this.suggestion = suggestion;
    }

    /** Name of the command whose arguments were rejected. */
    public String getCommand() {
        return command;
    }

    public @Nullable String getSuggestion() {
        return suggestion;
    }
}
