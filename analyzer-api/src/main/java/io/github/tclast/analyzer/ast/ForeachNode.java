package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

/**
 * {@code foreach varList list ?varList list ...? body}. {@code varName} and {@code list} repeat the first pair.
 */
public record ForeachNode(String varName, String list, List<Iteration> iterations, Body body, Range range, int depth)
        implements Statement {

    public ForeachNode {
        iterations = List.copyOf(iterations);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitForeach(this);
    }

    @Override
    public NodeType type() {
        return NodeType.FOREACH;
    }

    public record Iteration(String varName, String list) {}
}
