package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;

/** Any node of the tree: the {@link Root} or a {@link Statement} below it. */
public sealed interface AstNode permits Root, Statement {

    NodeType type();

    Range range();

    <R> R accept(AstVisitor<R> visitor);
}
