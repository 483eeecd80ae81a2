package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.ConstructParseException;
import io.github.tclast.analyzer.Delimiters;
import io.github.tclast.analyzer.ast.PackageNode;
import io.github.tclast.analyzer.ast.SourceNode;
import io.github.tclast.analyzer.ast.Statement;

/** {@code package} and {@code source}. */
public final class PackageParsers {

    private PackageParsers() {}

    /** {@code package require ?-exact? name ?version?}, {@code package provide name ?version?} and the rest. */
    public static Statement parsePackage(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2) {
            throw new ConstructParseException(
                    "Invalid package command", "package", "Use: package require name ?version?");
        }
        var subcommand = Delimiters.stripOuter(command.text(1));
        int nameIndex = 2;
        if (subcommand.equals("require") && command.text(2).equals("-exact")) {
            nameIndex = 3;
        }
        return new PackageNode(
                subcommand,
                Delimiters.stripOuter(command.text(nameIndex)),
                Delimiters.stripOuter(command.text(nameIndex + 1)),
                context.rangeOf(command),
                depth);
    }

    /** The file is the last word, so {@code source -encoding utf-8 file.tcl} works too. */
    public static Statement parseSource(CommandText command, ParseContext context, int depth)
            throws ConstructParseException {
        if (command.size() < 2) {
            throw new ConstructParseException("Invalid source command", "source", "Use: source fileName");
        }
        var file = Delimiters.stripOuter(command.text(command.size() - 1));
        return new SourceNode(file, context.rangeOf(command), depth);
    }
}
