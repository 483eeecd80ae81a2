package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.ast.Statement;

/** Turns one command whose name it is registered for into a node. */
@FunctionalInterface
public interface ConstructParser {

    /**
     * @param command the command, first word included
     * @param context access to ranges and recursive body parsing
     * @param depth nesting depth of the resulting node
     * @throws ConstructParseException when the arguments do not fit the construct
     */
    Statement parse(CommandText command, ParseContext context, int depth) throws ConstructParseException;
}
