package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.ast.ExprNode;
import io.github.tclast.analyzer.ast.Statement;

/** {@code expr arg ?arg ...?}; the arguments are joined with single spaces and never evaluated. */
public final class ExpressionParser {

    private ExpressionParser() {}

    public static Statement parse(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2) {
            throw new ConstructParseException("Invalid expr syntax: missing expression", "expr", "Use: expr {expression}");
        }
        return new ExprNode(String.join(" ", command.texts(1)), context.rangeOf(command), depth);
    }
}
