package io.github.tclast.analyzer.ast;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Range;
import org.jetbrains.annotations.Nullable;

/** A command, or the end of a script, that could not be parsed. */
public record ErrorNode(String message, Kind kind, @Nullable String suggestion, Range range, int depth)
        implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitError(this);
    }

    @Override
    public NodeType type() {
        return NodeType.ERROR;
    }

    public enum Kind {
        /** A known command with malformed arguments. */
        SYNTAX("syntax"),
        /** An unterminated brace, quote or bracket running to the end of the input. */
        INCOMPLETE("incomplete"),
        /** A body nested deeper than the configured guard; its content was not parsed. */
        DEPTH_EXCEEDED("depth_exceeded"),
        /** An unexpected failure while parsing one command. */
        INTERNAL("internal");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }
}
