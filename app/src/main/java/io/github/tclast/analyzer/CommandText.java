package io.github.tclast.analyzer;

import java.util.List;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** One command found by {@link TclTokenizer#splitCommands}; offsets are absolute in the scanned text. */
public record CommandText(List<Word> words, int start, int end) {

    public CommandText {
        if (words.isEmpty()) {
            throw new IllegalArgumentException("A command has at least one word");
        }
        words = List.copyOf(words);
    }

    /** The literal first word. */
    public String name() {
        return words.get(0).text();
    }

    public int size() {
        return words.size();
    }

    public Word word(int index) {
        return words.get(index);
    }

    /** Literal text of word {@code index}, or {@code ""} when there is no such word. */
    public String text(int index) {
        return index >= 0 && index < words.size() ? words.get(index).text() : "";
    }

    /** Literal texts of the words from {@code from} on. */
    public List<String> texts(int from) {
        if (from >= words.size()) {
            return List.of();
        }
        return words.subList(from, words.size()).stream().map(Word::text).collect(Collectors.toList());
    }

    /** The delimiter left open at end of input, if the last word is a best-effort word. */
    public @Nullable Delimiter unclosed() {
        return words.get(words.size() - 1).unclosed();
    }
}
