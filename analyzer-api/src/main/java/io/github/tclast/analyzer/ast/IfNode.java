package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** {@code if cond ?then? body ?elseif cond ?then? body ...? ?else body?}. Conditions are kept verbatim. */
public record IfNode(
        String condition,
        Body thenBody,
        List<ElseIfBranch> elseIfBranches,
        @Nullable Body elseBody,
        Range range,
        int depth)
        implements Statement {

    public IfNode {
        elseIfBranches = List.copyOf(elseIfBranches);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public NodeType type() {
        return NodeType.IF;
    }

    public record ElseIfBranch(String condition, Body body) {}
}
