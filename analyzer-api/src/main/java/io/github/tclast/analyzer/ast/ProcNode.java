package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** {@code proc name params body}. */
public record ProcNode(String name, List<Param> params, Body body, Range range, int depth) implements Statement {

    public ProcNode {
        params = List.copyOf(params);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProc(this);
    }

    @Override
    public NodeType type() {
        return NodeType.PROC;
    }

    /**
     * One formal parameter. {@code defaultValue} is null when the parameter has none; {@code varargs} marks a trailing
     * {@code args} parameter.
     */
    public record Param(String name, @Nullable String defaultValue, boolean varargs) {}
}
