package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import io.github.tclast.analyzer.VariableNameRef;

/**
 * {@code set varName ?value?}. {@code varName} is the literal target word; {@code target} is its classification.
 * {@code value} is the literal value word, empty for a read.
 */
public record SetNode(String varName, VariableNameRef target, String value, Range range, int depth)
        implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSet(this);
    }

    @Override
    public NodeType type() {
        return NodeType.SET;
    }
}
