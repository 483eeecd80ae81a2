package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code namespace} command. Only {@code namespace eval} carries a {@code body}; for {@code import} and
 * {@code export} the patterns are in {@code args}, and any other subcommand keeps its literal arguments there too.
 */
public record NamespaceNode(
        String subcommand, String name, @Nullable Body body, List<String> args, Range range, int depth)
        implements Statement {

    public NamespaceNode {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNamespace(this);
    }

    @Override
    public NodeType type() {
        return switch (subcommand) {
            case "eval" -> body != null ? NodeType.NAMESPACE_EVAL : NodeType.NAMESPACE;
            case "import" -> NodeType.NAMESPACE_IMPORT;
            case "export" -> NodeType.NAMESPACE_EXPORT;
            default -> NodeType.NAMESPACE;
        };
    }
}
