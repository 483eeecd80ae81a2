package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;

public record WhileNode(String condition, Body body, Range range, int depth) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public NodeType type() {
        return NodeType.WHILE;
    }
}
