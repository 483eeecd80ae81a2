package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;

/** A {@code #} comment; {@code text} is everything after the {@code #}. */
public record CommentNode(String text, Range range, int depth) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitComment(this);
    }

    @Override
    public NodeType type() {
        return NodeType.COMMENT;
    }
}
