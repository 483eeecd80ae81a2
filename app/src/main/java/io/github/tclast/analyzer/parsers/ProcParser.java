package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.Delimiters;
import io.github.tclast.analyzer.TclTokenizer;
import io.github.tclast.analyzer.ast.ProcNode;
import io.github.tclast.analyzer.ast.ProcNode.Param;
import io.github.tclast.analyzer.ast.Statement;
import java.util.ArrayList;
import java.util.List;

/** {@code proc name args body}. */
public final class ProcParser {

    private ProcParser() {}

    public static Statement parse(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() != 4) {
            throw new ConstructParseException(
                    "Invalid proc syntax: expected 3 arguments, got " + (command.size() - 1),
                    "proc",
                    "Use: proc name {args} {body}");
        }
        var name = Delimiters.stripOuter(command.text(1));
        var params = parseParams(command.text(2), context.tokenizer());
        var body = context.parseBody(command.word(3), depth + 1);
        return new ProcNode(name, params, body, context.rangeOf(command), depth);
    }

    /**
     * Each element is a bare name or a {@code {name default}} pair. Only a final parameter named {@code args} collects
     * the remaining arguments.
     */
    static List<Param> parseParams(String list, TclTokenizer tokenizer) {
        var elements = tokenizer.listElements(Delimiters.stripOuter(list));
        var params = new ArrayList<Param>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            var element = elements.get(i);
            String name;
            String defaultValue = null;
            if (Delimiters.isBraced(element) || Delimiters.isQuoted(element)) {
                var parts = tokenizer.listElements(Delimiters.stripOuter(element));
                name = parts.isEmpty() ? "" : Delimiters.stripOuter(parts.get(0));
                if (parts.size() > 1) {
                    defaultValue = Delimiters.stripOuter(parts.get(1));
                }
            } else {
                name = element;
            }
            boolean varargs = i == elements.size() - 1 && name.equals("args") && defaultValue == null;
            params.add(new Param(name, defaultValue, varargs));
        }
        return params;
    }
}
