package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.Delimiters;
import io.github.tclast.analyzer.ast.Body;
import io.github.tclast.analyzer.ast.NamespaceNode;
import io.github.tclast.analyzer.ast.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code namespace eval}, {@code import} and {@code export} get their own node shapes; any other subcommand is kept
 * with its literal arguments.
 */
public final class NamespaceParser {

    private NamespaceParser() {}

    public static Statement parse(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2) {
            throw new ConstructParseException(
                    "Invalid namespace syntax: missing subcommand", "namespace", "Use: namespace subcommand ?arg ...?");
        }
        var subcommand = Delimiters.stripOuter(command.text(1));
        if (subcommand.equals("eval")) {
            return parseEval(command, context, depth);
        }
        // import and export patterns, or the arguments of any other subcommand
        return new NamespaceNode(subcommand, "", null, command.texts(2), context.rangeOf(command), depth);
    }

    /** Several script arguments are concatenated by Tcl; their statements are joined in order here. */
    private static Statement parseEval(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 4) {
            throw new ConstructParseException(
                    "Invalid namespace eval syntax", "namespace", "Use: namespace eval name {body}");
        }
        var name = Delimiters.stripOuter(command.text(2));
        Body body;
        if (command.size() == 4) {
            body = context.parseBody(command.word(3), depth + 1);
        } else {
            var children = new ArrayList<Statement>();
            for (var word : command.words().subList(3, command.size())) {
                children.addAll(context.parseBody(word, depth + 1).children());
            }
            body = new Body(children);
        }
        return new NamespaceNode("eval", name, body, List.of(), context.rangeOf(command), depth);
    }
}
