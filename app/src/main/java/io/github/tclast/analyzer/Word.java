package io.github.tclast.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * One word of a command, exactly as written. {@code start}/{@code end} are offsets into the scanned text.
 * {@code unclosed} is set for a best-effort word that ran to the end of the input with a delimiter still open.
 */
public record Word(String text, int start, int end, @Nullable Delimiter unclosed) {

    public boolean isTerminated() {
        return unclosed == null;
    }

    public boolean isBraced() {
        return !text.isEmpty() && text.charAt(0) == '{';
    }

    public boolean isQuoted() {
        return !text.isEmpty() && text.charAt(0) == '"';
    }
}
