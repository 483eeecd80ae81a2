package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

/** {@code switch ?options? string {pattern body ...}} or with the pattern/body pairs given inline. */
public record SwitchNode(String expression, List<String> options, List<Case> cases, Range range, int depth)
        implements Statement {

    public SwitchNode {
        options = List.copyOf(options);
        cases = List.copyOf(cases);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }

    @Override
    public NodeType type() {
        return NodeType.SWITCH;
    }

    /** A {@code -} body falls through to the next case; its {@code body} is empty. */
    public record Case(String pattern, Body body, boolean fallthrough) {}
}
