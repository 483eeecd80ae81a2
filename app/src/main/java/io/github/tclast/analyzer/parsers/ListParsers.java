package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.ast.LappendNode;
import io.github.tclast.analyzer.ast.ListNode;
import io.github.tclast.analyzer.ast.Statement;

public final class ListParsers {

    private ListParsers() {}

    /** {@code list ?arg ...?}; an empty list is valid. */
    public static Statement parseList(CommandText command, ParseContext context, int depth) {
        return new ListNode(command.texts(1), context.rangeOf(command), depth);
    }

    /** {@code lappend varName ?value ...?}; {@code value} is the first appended word, or empty. */
    public static Statement parseLappend(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2) {
            throw new ConstructParseException(
                    "Invalid lappend syntax", "lappend", "Use: lappend varName ?value ...?");
        }
        return new LappendNode(
                command.text(1), command.text(2), command.texts(2), context.rangeOf(command), depth);
    }
}
