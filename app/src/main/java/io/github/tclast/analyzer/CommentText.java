package io.github.tclast.analyzer;

/** A {@code #} comment found in command position. {@code text} excludes the {@code #}. */
public record CommentText(String text, int start, int end) {}
