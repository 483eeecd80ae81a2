package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

public record ListNode(List<String> elements, Range range, int depth) implements Statement {

    public ListNode {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public NodeType type() {
        return NodeType.LIST;
    }
}
