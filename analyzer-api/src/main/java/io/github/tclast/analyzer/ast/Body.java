package io.github.tclast.analyzer.ast;

import java.util.List;

/** The parsed content of a braced script argument. */
public record Body(List<Statement> children) {

    public static final Body EMPTY = new Body(List.of());

    public Body {
        children = List.copyOf(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}
