package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

/** Any command without a dedicated parser. {@code args} are the literal words after the name. */
public record CommandNode(String name, List<String> args, Range range, int depth) implements Statement {

    public CommandNode {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCommand(this);
    }

    @Override
    public NodeType type() {
        return NodeType.COMMAND;
    }
}
