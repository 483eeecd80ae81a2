package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import org.jetbrains.annotations.Nullable;

/** {@code catch script ?resultVar? ?optionsVar?}. */
public record CatchNode(Body body, @Nullable String resultVar, @Nullable String optionsVar, Range range, int depth)
        implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCatch(this);
    }

    @Override
    public NodeType type() {
        return NodeType.CATCH;
    }
}
