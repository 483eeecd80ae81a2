package io.github.tclast.analyzer;

/** Helpers for the outer delimiters of a literal word. */
public final class Delimiters {

    private Delimiters() {}

    /** Removes one pair of surrounding braces or quotes, if the word has them; anything else is returned as is. */
    public static String stripOuter(String word) {
        if (isBraced(word) || isQuoted(word)) {
            return word.substring(1, word.length() - 1);
        }
        return word;
    }

    public static boolean isBraced(String word) {
        return word.length() >= 2 && word.charAt(0) == '{' && word.charAt(word.length() - 1) == '}';
    }

    public static boolean isQuoted(String word) {
        return word.length() >= 2 && word.charAt(0) == '"' && word.charAt(word.length() - 1) == '"';
    }
}
