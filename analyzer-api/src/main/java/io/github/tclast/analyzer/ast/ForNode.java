package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;

/** {@code for init condition increment body}; only {@code body} is parsed. */
public record ForNode(String init, String condition, String increment, Body body, Range range, int depth)
        implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public NodeType type() {
        return NodeType.FOR;
    }
}
