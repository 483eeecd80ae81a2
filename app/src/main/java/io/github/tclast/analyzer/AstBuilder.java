package io.github.tclast.analyzer;

import io.github.tclast.analyzer.ast.Body;
import io.github.tclast.analyzer.ast.CommandNode;
import io.github.tclast.analyzer.ast.CommentNode;
import io.github.tclast.analyzer.ast.ErrorNode;
import io.github.tclast.analyzer.ast.Statement;
import io.github.tclast.analyzer.parsers.ConstructParsers;
import io.github.tclast.analyzer.parsers.ParseContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * State of a single build: the source, its position tracker, and the comments and errors collected so far. Nested
 * bodies are walked over absolute offsets of the same source, so every range is absolute.
 *
 * <p>Not thread-safe; {@link TclAnalyzer} creates one per call.
 */
final class AstBuilder implements ParseContext {
    private static final Logger logger = LogManager.getLogger(AstBuilder.class);

    private final String source;
    private final PositionTracker tracker;
    private final TclTokenizer tokenizer;
    private final ConstructParsers parsers;
    private final int maxBodyDepth;

    private final List<CommentNode> comments = new ArrayList<>();
    private final List<ErrorNode> errors = new ArrayList<>();

    AstBuilder(String source, TclTokenizer tokenizer, ConstructParsers parsers, int maxBodyDepth) {
        this.source = source;
        this.tracker = new PositionTracker(source);
        this.tokenizer = tokenizer;
        this.parsers = parsers;
        this.maxBodyDepth = maxBodyDepth;
    }

    List<Statement> buildTopLevel() {
        return walk(0, source.length(), 0, true);
    }

    /** Comments from every walked level, in document order. */
    List<CommentNode> comments() {
        var sorted = new ArrayList<>(comments);
        sorted.sort(Comparator.comparing((CommentNode c) -> c.range().start()));
        return sorted;
    }

    List<ErrorNode> errors() {
        return errors;
    }

    Range rangeOf(int start, int end) {
        return tracker.rangeOf(start, end);
    }

    /** Records an error for the root's list and returns it for placement among the statements. */
    ErrorNode error(String message, ErrorNode.Kind kind, @Nullable String suggestion, Range range, int depth) {
        var node = new ErrorNode(message, kind, suggestion, range, depth);
        errors.add(node);
        return node;
    }

    /**
     * Parses the commands of {@code source[from, to)} at {@code depth}. An unterminated last command gets an
     * {@code incomplete} error after it, placed at the end of the input where the closer is missing, unless the
     * enclosing body was itself unterminated and will be reported by its own level.
     */
    List<Statement> walk(int from, int to, int depth, boolean reportIncomplete) {
        var scan = tokenizer.splitCommands(source, from, to);
        for (var comment : scan.comments()) {
            comments.add(new CommentNode(comment.text(), tracker.rangeOf(comment.start(), comment.end()), depth));
        }

        var statements = new ArrayList<Statement>(scan.commands().size());
        for (var command : scan.commands()) {
            statements.add(parseCommand(command, depth));
            var unclosed = command.unclosed();
            if (unclosed != null && reportIncomplete) {
                statements.add(error(
                        "Syntax error: missing " + unclosed.closeName(),
                        ErrorNode.Kind.INCOMPLETE,
                        "Check for missing closing " + describe(unclosed),
                        tracker.rangeOf(command.end(), command.end()),
                        depth));
            }
        }
        return statements;
    }

    private Statement parseCommand(CommandText command, int depth) {
        var name = commandName(command.name());
        var parser = parsers.lookup(name);
        if (parser == null) {
            return new CommandNode(command.name(), command.texts(1), rangeOf(command), depth);
        }
        // a failed parser discards the bodies it walked; their errors and comments go with them
        int errorMark = errors.size();
        int commentMark = comments.size();
        try {
            return parser.parse(command, this, depth);
        } catch (ConstructParseException e) {
            rollBack(errorMark, commentMark);
            return error(e.getMessage(), ErrorNode.Kind.SYNTAX, e.getSuggestion(), rangeOf(command), depth);
        } catch (RuntimeException e) {
            logger.warn("Unexpected failure parsing '{}' at offset {}", name, command.start(), e);
            rollBack(errorMark, commentMark);
            return error(
                    "Internal error while parsing " + name + ": " + e.getClass().getSimpleName(),
                    ErrorNode.Kind.INTERNAL,
                    null,
                    rangeOf(command),
                    depth);
        }
    }

    private void rollBack(int errorMark, int commentMark) {
        errors.subList(errorMark, errors.size()).clear();
        comments.subList(commentMark, comments.size()).clear();
    }

    /** Dispatch key: the first word without outer braces or quotes and without a leading {@code ::}. */
    static String commandName(String word) {
        var name = Delimiters.stripOuter(word);
        return name.startsWith("::") ? name.substring(2) : name;
    }

    @Override
    public Range rangeOf(CommandText command) {
        return tracker.rangeOf(command.start(), command.end());
    }

    @Override
    public Range rangeOf(Word word) {
        return tracker.rangeOf(word.start(), word.end());
    }

    @Override
    public Body parseBody(Word word, int depth) {
        if (depth > maxBodyDepth) {
            logger.debug("Body at offset {} is nested deeper than {}; not descending", word.start(), maxBodyDepth);
            return new Body(List.of(error(
                    "Nesting too deep: more than " + maxBodyDepth + " levels",
                    ErrorNode.Kind.DEPTH_EXCEEDED,
                    "Reduce the nesting of this script",
                    rangeOf(word),
                    depth)));
        }
        int from = word.start();
        int to = word.end();
        if (word.isBraced() || word.isQuoted()) {
            from++;
            if (word.isTerminated()) {
                to--;
            }
        }
        return new Body(walk(from, to, depth, word.isTerminated()));
    }

    @Override
    public List<Word> listWords(Word word) {
        int from = word.start();
        int to = word.end();
        if (word.isBraced() || word.isQuoted()) {
            from++;
            if (word.isTerminated()) {
                to--;
            }
        }
        return tokenizer.listWords(source, from, to);
    }

    @Override
    public TclTokenizer tokenizer() {
        return tokenizer;
    }

    private static String describe(Delimiter delimiter) {
        return switch (delimiter) {
            case BRACE -> "brace }";
            case QUOTE -> "quote \"";
            case BRACKET -> "bracket ]";
            case PAREN -> "parenthesis )";
        };
    }
}
