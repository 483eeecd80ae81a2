package io.github.tclast.analyzer;

import io.github.tclast.util.ParserConfig;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Splits Tcl text into commands and words without evaluating anything. Every word keeps its literal source text,
 * delimiters included: {@code "hello"} stays quoted, {@code {42}} stays braced, {@code [expr 1]} keeps its brackets.
 *
 * <p>The scan is a single left-to-right pass per word with an explicit stack of open delimiters:
 *
 * <ul>
 *   <li>inside braces only braces count, and a backslash hides the next character;
 *   <li>inside quotes a {@code [} opens a command substitution, so a quote inside it does not end the word;
 *   <li>inside brackets, brackets nest and a brace or quote at the start of an inner word opens a group;
 *   <li>a bare word keeps {@code $name}, {@code ${name}}, {@code $name(key)} and embedded {@code [...]} together.
 * </ul>
 *
 * <p>Unmatched delimiters are not errors here: the word runs to the end of the input and reports what was left open
 * (see {@link Word#unclosed()}). The same happens when the delimiter stack would grow past the configured depth.
 * Every method is total: no input makes it throw.
 */
public final class TclTokenizer {
    private static final Logger logger = LogManager.getLogger(TclTokenizer.class);

    private final int maxDelimiterDepth;

    public TclTokenizer() {
        this(ParserConfig.DEFAULT_MAX_DELIMITER_DEPTH);
    }

    public TclTokenizer(int maxDelimiterDepth) {
        if (maxDelimiterDepth < 1) {
            throw new IllegalArgumentException("maxDelimiterDepth must be positive: " + maxDelimiterDepth);
        }
        this.maxDelimiterDepth = maxDelimiterDepth;
    }

    /** Commands and comments of one scanned range, each in source order. */
    public record ScanResult(List<CommandText> commands, List<CommentText> comments) {}

    /** Literal words of every command in {@code source}, command separators and comments dropped. */
    public List<String> tokenize(String source) {
        return words(source).stream().map(Word::text).toList();
    }

    public int countTokens(String source) {
        return words(source).size();
    }

    /** The literal word at {@code index}, or {@code ""} when there is none. */
    public String getToken(String source, int index) {
        var words = words(source);
        return index >= 0 && index < words.size() ? words.get(index).text() : "";
    }

    public List<Word> words(String source) {
        var result = new ArrayList<Word>();
        for (var command : splitCommands(source).commands()) {
            result.addAll(command.words());
        }
        return result;
    }

    public ScanResult splitCommands(String source) {
        return splitCommands(source, 0, source.length());
    }

    /**
     * Splits {@code text[from, to)} into commands. An unescaped newline or {@code ;} outside any open delimiter ends a
     * command; a {@code #} where a command would start begins a comment that runs to the end of its line.
     */
    public ScanResult splitCommands(String text, int from, int to) {
        var commands = new ArrayList<CommandText>();
        var comments = new ArrayList<CommentText>();
        int pos = from;
        while (pos < to) {
            pos = skipCommandSeparators(text, pos, to);
            if (pos >= to) {
                break;
            }
            if (text.charAt(pos) == '#') {
                int end = commentEnd(text, pos, to);
                comments.add(new CommentText(text.substring(pos + 1, end), pos, end));
                pos = end;
                continue;
            }

            var words = new ArrayList<Word>();
            while (true) {
                pos = skipWordSeparators(text, pos, to);
                if (pos >= to) {
                    break;
                }
                char c = text.charAt(pos);
                if (c == '\n' || c == ';') {
                    break;
                }
                var word = scanWord(text, pos, to, false);
                words.add(word);
                pos = word.end();
                if (!word.isTerminated()) {
                    break;
                }
            }
            if (!words.isEmpty()) {
                commands.add(new CommandText(
                        words, words.get(0).start(), words.get(words.size() - 1).end()));
            }
        }
        return new ScanResult(commands, comments);
    }

    /** Elements of a Tcl list such as a parameter list or a switch body, as literal words. */
    public List<String> listElements(String list) {
        return listWords(list, 0, list.length()).stream().map(Word::text).toList();
    }

    /**
     * Splits {@code text[from, to)} as a Tcl list: any whitespace, newlines included, separates elements, and
     * {@code ;} and {@code #} have no special meaning.
     */
    public List<Word> listWords(String text, int from, int to) {
        var words = new ArrayList<Word>();
        int pos = from;
        while (true) {
            while (pos < to) {
                char c = text.charAt(pos);
                if (isSpace(c) || c == '\n') {
                    pos++;
                } else if (c == '\\' && pos + 1 < to && text.charAt(pos + 1) == '\n') {
                    pos += 2;
                } else {
                    break;
                }
            }
            if (pos >= to) {
                return words;
            }
            var word = scanWord(text, pos, to, true);
            words.add(word);
            pos = word.end();
            if (!word.isTerminated()) {
                return words;
            }
        }
    }

    /** Scans one word starting at a non-separator character. Always consumes at least one character. */
    Word scanWord(String text, int start, int limit, boolean listMode) {
        Deque<Delimiter> open = new ArrayDeque<>();
        int pos = start;
        char first = text.charAt(pos);
        boolean bare = first != '{' && first != '"';
        if (!bare) {
            open.push(first == '{' ? Delimiter.BRACE : Delimiter.QUOTE);
            pos++;
        }

        while (pos < limit) {
            char c = text.charAt(pos);

            if (open.isEmpty()) {
                if (!bare || isSpace(c) || c == '\n' || (c == ';' && !listMode)) {
                    break;
                }
                if (c == '\\') {
                    if (pos > start && pos + 1 < limit && text.charAt(pos + 1) == '\n') {
                        break;
                    }
                    pos = Math.min(pos + 2, limit);
                } else if (c == '[') {
                    if (!push(open, Delimiter.BRACKET)) {
                        return overflow(text, start, limit, open, pos);
                    }
                    pos++;
                } else if (c == '$') {
                    int next = variableEnd(text, pos + 1, limit);
                    if (next < 0) {
                        // ${name with no closing brace
                        return new Word(text.substring(start, limit), start, limit, Delimiter.BRACE);
                    }
                    if (next < limit && text.charAt(next) == '(' && next > pos + 1) {
                        if (!push(open, Delimiter.PAREN)) {
                            return overflow(text, start, limit, open, pos);
                        }
                        next++;
                    }
                    pos = next;
                } else {
                    pos++;
                }
                continue;
            }

            if (c == '\\') {
                pos = Math.min(pos + 2, limit);
                continue;
            }

            Delimiter top = open.peek();
            Delimiter opened = null;
            if (top == Delimiter.BRACE) {
                if (c == '{') {
                    opened = Delimiter.BRACE;
                } else if (c == '}') {
                    open.pop();
                }
            } else if (top == Delimiter.QUOTE) {
                if (c == '"') {
                    open.pop();
                } else if (c == '[') {
                    opened = Delimiter.BRACKET;
                }
            } else if (top == Delimiter.BRACKET) {
                if (c == '[') {
                    opened = Delimiter.BRACKET;
                } else if (c == ']') {
                    open.pop();
                } else if (c == '{' && atInnerWordStart(text, pos)) {
                    opened = Delimiter.BRACE;
                } else if (c == '"' && atInnerWordStart(text, pos)) {
                    opened = Delimiter.QUOTE;
                }
            } else {
                if (c == '(') {
                    opened = Delimiter.PAREN;
                } else if (c == ')') {
                    open.pop();
                } else if (c == '[') {
                    opened = Delimiter.BRACKET;
                }
            }
            if (opened != null && !push(open, opened)) {
                return overflow(text, start, limit, open, pos);
            }
            pos++;
        }

        Delimiter unclosed = open.isEmpty() ? null : open.peekLast();
        return new Word(text.substring(start, pos), start, pos, unclosed);
    }

    private boolean push(Deque<Delimiter> open, Delimiter delimiter) {
        if (open.size() >= maxDelimiterDepth) {
            return false;
        }
        open.push(delimiter);
        return true;
    }

    private Word overflow(String text, int start, int limit, Deque<Delimiter> open, int at) {
        logger.debug(
                "Delimiter nesting deeper than {} at offset {}; taking the rest of the input literally",
                maxDelimiterDepth,
                at);
        Delimiter outermost = open.isEmpty() ? Delimiter.BRACKET : open.peekLast();
        return new Word(text.substring(start, limit), start, limit, outermost);
    }

    /**
     * Returns the offset just past a variable name that starts at {@code pos} (right after the {@code $}), or -1 for a
     * {@code ${...}} form with no closing brace. A lone {@code $} yields {@code pos}.
     */
    private static int variableEnd(String text, int pos, int limit) {
        if (pos < limit && text.charAt(pos) == '{') {
            int close = text.indexOf('}', pos + 1);
            return close < 0 || close >= limit ? -1 : close + 1;
        }
        int end = pos;
        while (end < limit) {
            char c = text.charAt(end);
            if (Character.isLetterOrDigit(c) || c == '_' || c == ':') {
                end++;
            } else {
                break;
            }
        }
        return end;
    }

    private static boolean atInnerWordStart(String text, int pos) {
        char prev = text.charAt(pos - 1);
        return isSpace(prev) || prev == '\n' || prev == ';' || prev == '[';
    }

    private static int skipCommandSeparators(String text, int pos, int to) {
        while (pos < to) {
            char c = text.charAt(pos);
            if (isSpace(c) || c == '\n' || c == ';') {
                pos++;
            } else if (c == '\\' && pos + 1 < to && text.charAt(pos + 1) == '\n') {
                pos += 2;
            } else {
                break;
            }
        }
        return pos;
    }

    private static int skipWordSeparators(String text, int pos, int to) {
        while (pos < to) {
            char c = text.charAt(pos);
            if (isSpace(c)) {
                pos++;
            } else if (c == '\\' && pos + 1 < to && text.charAt(pos + 1) == '\n') {
                pos += 2;
            } else {
                break;
            }
        }
        return pos;
    }

    private static int commentEnd(String text, int pos, int to) {
        int i = pos;
        while (i < to) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\n') {
                break;
            }
            i++;
        }
        return Math.min(i, to);
    }

    static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }
}
