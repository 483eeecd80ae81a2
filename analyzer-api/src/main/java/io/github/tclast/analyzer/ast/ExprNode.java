package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;

/** {@code expr ...}; the expression text is an unparsed leaf. */
public record ExprNode(String expression, Range range, int depth) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExpr(this);
    }

    @Override
    public NodeType type() {
        return NodeType.EXPR;
    }
}
