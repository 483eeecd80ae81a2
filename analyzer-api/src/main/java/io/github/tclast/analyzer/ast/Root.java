package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import java.util.List;

/**
 * Result of one build. {@code hadError} is always {@code !errors.isEmpty()}; every error is also present, in place,
 * somewhere under {@code children}.
 */
public record Root(
        String filepath,
        List<CommentNode> comments,
        List<Statement> children,
        boolean hadError,
        List<ErrorNode> errors,
        Range range)
        implements AstNode {

    public Root {
        comments = List.copyOf(comments);
        children = List.copyOf(children);
        errors = List.copyOf(errors);
        if (hadError == errors.isEmpty()) {
            throw new IllegalArgumentException("hadError=" + hadError + " but " + errors.size() + " errors recorded");
        }
    }

    public static Root of(
            String filepath, List<CommentNode> comments, List<Statement> children, List<ErrorNode> errors, Range range) {
        return new Root(filepath, comments, children, !errors.isEmpty(), errors, range);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRoot(this);
    }

    @Override
    public NodeType type() {
        return NodeType.ROOT;
    }
}
