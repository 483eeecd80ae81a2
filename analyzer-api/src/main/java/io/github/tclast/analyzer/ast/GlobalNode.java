package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import io.github.tclast.analyzer.VariableNameRef;
import java.util.List;

public record GlobalNode(List<String> vars, List<VariableNameRef> refs, Range range, int depth) implements Statement {

    public GlobalNode {
        vars = List.copyOf(vars);
        refs = List.copyOf(refs);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGlobal(this);
    }

    @Override
    public NodeType type() {
        return NodeType.GLOBAL;
    }
}
