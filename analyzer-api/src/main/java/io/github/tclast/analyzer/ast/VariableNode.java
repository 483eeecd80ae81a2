package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import io.github.tclast.analyzer.VariableNameRef;
import java.util.List;

/** {@code variable name ?value? ?name value ...?}; pairs after the first are kept in {@code additional}. */
public record VariableNode(
        String name, VariableNameRef target, String value, List<Declaration> additional, Range range, int depth)
        implements Statement {

    public VariableNode {
        additional = List.copyOf(additional);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public NodeType type() {
        return NodeType.VARIABLE;
    }

    public record Declaration(String name, VariableNameRef target, String value) {}
}
