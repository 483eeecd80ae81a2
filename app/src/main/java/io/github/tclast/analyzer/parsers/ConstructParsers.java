package io.github.tclast.analyzer.parsers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Command name to parser table. Names not registered here become plain command nodes. */
public final class ConstructParsers {
    private final Map<String, ConstructParser> parsers = new LinkedHashMap<>();

    /** Parsers for every construct the analyzer understands. */
    public static ConstructParsers standard() {
        return new ConstructParsers()
                .register("proc", ProcParser::parse)
                .register("set", VariableParsers::parseSet)
                .register("variable", VariableParsers::parseVariable)
                .register("global", VariableParsers::parseGlobal)
                .register("upvar", VariableParsers::parseUpvar)
                .register("array", VariableParsers::parseArray)
                .register("if", ControlFlowParsers::parseIf)
                .register("for", ControlFlowParsers::parseFor)
                .register("while", ControlFlowParsers::parseWhile)
                .register("foreach", ControlFlowParsers::parseForeach)
                .register("switch", ControlFlowParsers::parseSwitch)
                .register("catch", ControlFlowParsers::parseCatch)
                .register("expr", ExpressionParser::parse)
                .register("namespace", NamespaceParser::parse)
                .register("package", PackageParsers::parsePackage)
                .register("source", PackageParsers::parseSource)
                .register("list", ListParsers::parseList)
                .register("lappend", ListParsers::parseLappend);
    }

    /** Adds or replaces the parser for {@code name}. */
    public ConstructParsers register(String name, ConstructParser parser) {
        parsers.put(name, parser);
        return this;
    }

    public @Nullable ConstructParser lookup(String name) {
        return parsers.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(parsers.keySet());
    }
}
