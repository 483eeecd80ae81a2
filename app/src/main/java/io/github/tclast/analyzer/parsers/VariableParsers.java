package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.Delimiters;
import io.github.tclast.analyzer.VariableNameRef;
import io.github.tclast.analyzer.ast.ArrayNode;
import io.github.tclast.analyzer.ast.GlobalNode;
import io.github.tclast.analyzer.ast.SetNode;
import io.github.tclast.analyzer.ast.Statement;
import io.github.tclast.analyzer.ast.UpvarNode;
import io.github.tclast.analyzer.ast.VariableNode;
import java.util.ArrayList;
import java.util.regex.Pattern;

/** {@code set}, {@code variable}, {@code global}, {@code upvar} and {@code array}. */
public final class VariableParsers {
    private static final Pattern LEVEL = Pattern.compile("#?\\d+");

    private VariableParsers() {}

    public static Statement parseSet(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2 || command.size() > 3) {
            throw new ConstructParseException(
                    "Invalid set syntax", "set", "Use: set varName ?value?");
        }
        var varName = command.text(1);
        return new SetNode(varName, target(varName), command.text(2), context.rangeOf(command), depth);
    }

    /** The first name/value pair is the node's own; further pairs land in {@code additional}. */
    public static Statement parseVariable(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2) {
            throw new ConstructParseException(
                    "Invalid variable syntax", "variable", "Use: variable name ?value? ?name value ...?");
        }
        var name = command.text(1);
        var additional = new ArrayList<VariableNode.Declaration>();
        for (int i = 3; i < command.size(); i += 2) {
            var extra = command.text(i);
            additional.add(new VariableNode.Declaration(extra, target(extra), command.text(i + 1)));
        }
        return new VariableNode(
                name, target(name), command.text(2), additional, context.rangeOf(command), depth);
    }

    public static Statement parseGlobal(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2) {
            throw new ConstructParseException("Invalid global syntax", "global", "Use: global varName ?varName ...?");
        }
        var vars = command.texts(1);
        var refs = vars.stream().map(VariableParsers::target).toList();
        return new GlobalNode(vars, refs, context.rangeOf(command), depth);
    }

    /** The level is optional and defaults to {@code 1} unless the first argument is {@code N} or {@code #N}. */
    public static Statement parseUpvar(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        int first = 1;
        var level = "1";
        if (command.size() > 1 && LEVEL.matcher(Delimiters.stripOuter(command.text(1))).matches()) {
            level = Delimiters.stripOuter(command.text(1));
            first = 2;
        }
        int remaining = command.size() - first;
        if (remaining < 2 || remaining % 2 != 0) {
            throw new ConstructParseException(
                    "Invalid upvar syntax", "upvar", "Use: upvar ?level? otherVar localVar ?otherVar localVar ...?");
        }
        var links = new ArrayList<UpvarNode.Link>();
        for (int i = first; i < command.size(); i += 2) {
            links.add(new UpvarNode.Link(
                    Delimiters.stripOuter(command.text(i)), Delimiters.stripOuter(command.text(i + 1))));
        }
        var head = links.get(0);
        return new UpvarNode(level, head.otherVar(), head.localVar(), links, context.rangeOf(command), depth);
    }

    public static Statement parseArray(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 3) {
            throw new ConstructParseException("Invalid array syntax", "array", "Use: array option arrayName ?arg ...?");
        }
        return new ArrayNode(
                Delimiters.stripOuter(command.text(1)),
                Delimiters.stripOuter(command.text(2)),
                command.texts(3),
                context.rangeOf(command),
                depth);
    }

    private static VariableNameRef target(String word) {
        return VariableNameRef.parse(Delimiters.stripOuter(word));
    }
}
