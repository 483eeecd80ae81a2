package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

/** {@code lappend varName ?value ...?}; {@code value} is the first appended word, {@code values} all of them. */
public record LappendNode(String varName, String value, List<String> values, Range range, int depth)
        implements Statement {

    public LappendNode {
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLappend(this);
    }

    @Override
    public NodeType type() {
        return NodeType.LAPPEND;
    }
}
