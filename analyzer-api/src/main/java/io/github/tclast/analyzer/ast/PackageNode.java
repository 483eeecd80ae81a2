package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;

/** {@code package require|provide name ?version?}. Versions stay strings, {@code 8.10} is not {@code 8.1}. */
public record PackageNode(String subcommand, String packageName, String version, Range range, int depth)
        implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPackage(this);
    }

    @Override
    public NodeType type() {
        return switch (subcommand) {
            case "require" -> NodeType.PACKAGE_REQUIRE;
            case "provide" -> NodeType.PACKAGE_PROVIDE;
            default -> NodeType.PACKAGE;
        };
    }
}
