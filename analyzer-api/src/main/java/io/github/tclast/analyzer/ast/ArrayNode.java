package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

/** {@code array operation arrayName ?arg ...?}. */
public record ArrayNode(String operation, String arrayName, List<String> args, Range range, int depth)
        implements Statement {

    public ArrayNode {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public NodeType type() {
        return NodeType.ARRAY;
    }
}
