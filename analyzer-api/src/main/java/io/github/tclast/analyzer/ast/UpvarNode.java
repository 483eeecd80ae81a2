package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

/**
 * {@code upvar ?level? otherVar localVar ?otherVar localVar ...?}. {@code otherVar}/{@code localVar} repeat the first
 * link; {@code links} holds all of them.
 */
public record UpvarNode(String level, String otherVar, String localVar, List<Link> links, Range range, int depth)
        implements Statement {

    public UpvarNode {
        links = List.copyOf(links);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUpvar(this);
    }

    @Override
    public NodeType type() {
        return NodeType.UPVAR;
    }

    public record Link(String otherVar, String localVar) {}
}
