package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.Delimiters;
import io.github.tclast.analyzer.Word;
import io.github.tclast.analyzer.ast.Body;
import io.github.tclast.analyzer.ast.CatchNode;
import io.github.tclast.analyzer.ast.ForNode;
import io.github.tclast.analyzer.ast.ForeachNode;
import io.github.tclast.analyzer.ast.IfNode;
import io.github.tclast.analyzer.ast.Statement;
import io.github.tclast.analyzer.ast.SwitchNode;
import io.github.tclast.analyzer.ast.WhileNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code if}, {@code for}, {@code while}, {@code foreach}, {@code switch} and {@code catch}. Conditions, iterables and
 * switch patterns are kept as literal text; only script arguments are parsed.
 */
public final class ControlFlowParsers {
    private static final Set<String> SWITCH_OPTIONS_WITH_ARG = Set.of("-matchvar", "-indexvar");

    private ControlFlowParsers() {}

    /** {@code if cond ?then? body ?elseif cond ?then? body ...? ?else? ?body?}. */
    public static Statement parseIf(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        int size = command.size();
        if (size < 3) {
            throw new ConstructParseException("Invalid if syntax", "if", "Use: if {condition} {body}");
        }
        var condition = command.text(1);
        int i = skipThen(command, 2);
        if (i >= size) {
            throw new ConstructParseException("Invalid if syntax: missing body", "if", "Add a body after the condition");
        }
        var thenBody = context.parseBody(command.word(i++), depth + 1);

        var branches = new ArrayList<IfNode.ElseIfBranch>();
        Body elseBody = null;
        while (i < size) {
            var keyword = command.text(i);
            if (keyword.equals("elseif")) {
                if (i + 1 >= size) {
                    throw new ConstructParseException(
                            "Invalid if syntax: elseif without condition", "if", "Use: elseif {condition} {body}");
                }
                var branchCondition = command.text(i + 1);
                i = skipThen(command, i + 2);
                if (i >= size) {
                    throw new ConstructParseException(
                            "Invalid if syntax: elseif without body", "if", "Use: elseif {condition} {body}");
                }
                branches.add(new IfNode.ElseIfBranch(branchCondition, context.parseBody(command.word(i++), depth + 1)));
            } else if (keyword.equals("else")) {
                if (i + 2 != size) {
                    throw new ConstructParseException(
                            "Invalid if syntax: else takes exactly one body", "if", "Use: else {body}");
                }
                elseBody = context.parseBody(command.word(i + 1), depth + 1);
                i = size;
            } else if (i + 1 == size) {
                // a trailing body without the else keyword
                elseBody = context.parseBody(command.word(i), depth + 1);
                i = size;
            } else {
                throw new ConstructParseException(
                        "Invalid if syntax: unexpected word " + keyword, "if", "Expected elseif or else");
            }
        }
        return new IfNode(condition, thenBody, branches, elseBody, context.rangeOf(command), depth);
    }

    public static Statement parseFor(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() != 5) {
            throw new ConstructParseException(
                    "Invalid for syntax", "for", "Use: for {init} {condition} {increment} {body}");
        }
        var body = context.parseBody(command.word(4), depth + 1);
        return new ForNode(
                command.text(1), command.text(2), command.text(3), body, context.rangeOf(command), depth);
    }

    public static Statement parseWhile(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() != 3) {
            throw new ConstructParseException("Invalid while syntax", "while", "Use: while {condition} {body}");
        }
        var body = context.parseBody(command.word(2), depth + 1);
        return new WhileNode(command.text(1), body, context.rangeOf(command), depth);
    }

    /** {@code foreach varList list ?varList list ...? body}; the first pair is also exposed on its own. */
    public static Statement parseForeach(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        int size = command.size();
        if (size < 4 || size % 2 != 0) {
            throw new ConstructParseException(
                    "Invalid foreach syntax", "foreach", "Use: foreach varName list ?varName list ...? {body}");
        }
        var iterations = new ArrayList<ForeachNode.Iteration>();
        for (int i = 1; i < size - 1; i += 2) {
            iterations.add(new ForeachNode.Iteration(command.text(i), command.text(i + 1)));
        }
        var body = context.parseBody(command.word(size - 1), depth + 1);
        return new ForeachNode(
                command.text(1), command.text(2), iterations, body, context.rangeOf(command), depth);
    }

    /**
     * {@code switch ?options? string {pattern body ...}} or {@code switch ?options? string pattern body ...}. A body
     * of {@code -} falls through to the next case.
     */
    public static Statement parseSwitch(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        int size = command.size();
        var options = new ArrayList<String>();
        int i = 1;
        while (i < size - 2 && command.text(i).startsWith("-")) {
            var option = command.text(i++);
            options.add(option);
            if (option.equals("--")) {
                break;
            }
            if (SWITCH_OPTIONS_WITH_ARG.contains(option)) {
                options.add(command.text(i++));
            }
        }
        if (i + 1 >= size) {
            throw new ConstructParseException(
                    "Invalid switch syntax", "switch", "Use: switch ?options? string {pattern body ...}");
        }
        var expression = command.text(i++);

        List<Word> caseWords = i == size - 1 ? context.listWords(command.word(i)) : command.words().subList(i, size);
        if (caseWords.size() % 2 != 0) {
            throw new ConstructParseException(
                    "Invalid switch syntax: patterns and bodies must come in pairs",
                    "switch",
                    "Give every pattern a body, or - to fall through");
        }
        var cases = new ArrayList<SwitchNode.Case>();
        for (int c = 0; c < caseWords.size(); c += 2) {
            var pattern = caseWords.get(c).text();
            var bodyWord = caseWords.get(c + 1);
            if (bodyWord.text().equals("-")) {
                cases.add(new SwitchNode.Case(pattern, Body.EMPTY, true));
            } else {
                cases.add(new SwitchNode.Case(pattern, context.parseBody(bodyWord, depth + 1), false));
            }
        }
        return new SwitchNode(expression, options, cases, context.rangeOf(command), depth);
    }

    /** {@code catch script ?resultVar? ?optionsVar?}. */
    public static Statement parseCatch(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2 || command.size() > 4) {
            throw new ConstructParseException(
                    "Invalid catch syntax", "catch", "Use: catch {script} ?resultVar? ?optionsVar?");
        }
        var body = context.parseBody(command.word(1), depth + 1);
        var resultVar = command.size() > 2 ? Delimiters.stripOuter(command.text(2)) : null;
        var optionsVar = command.size() > 3 ? Delimiters.stripOuter(command.text(3)) : null;
        return new CatchNode(body, resultVar, optionsVar, context.rangeOf(command), depth);
    }

    private static int skipThen(CommandText command, int index) {
        return command.text(index).equals("then") ? index + 1 : index;
    }
}
