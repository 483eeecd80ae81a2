package io.github.tclast.analyzer.parsers;

import static org.junit.jupiter.api.Assertions.*;

import io.github.tclast.analyzer.TclAnalyzer;
import io.github.tclast.analyzer.ast.ErrorNode;
import io.github.tclast.analyzer.ast.Statement;
import io.github.tclast.util.ParserConfig;

/** Builds one-command scripts and unwraps the resulting node. */
final class ParserTestSupport {
    private static final TclAnalyzer ANALYZER = new TclAnalyzer(ParserConfig.defaults());

    private ParserTestSupport() {}

    static <T extends Statement> T parseOnly(String source, Class<T> type) {
        var root = ANALYZER.build(source, "test.tcl");
        assertFalse(root.hadError(), () -> "unexpected errors: " + root.errors());
        assertEquals(1, root.children().size());
        return assertInstanceOf(type, root.children().get(0));
    }

    static ErrorNode parseError(String source) {
        var root = ANALYZER.build(source, "test.tcl");
        var error = assertInstanceOf(ErrorNode.class, root.children().get(0));
        assertEquals(ErrorNode.Kind.SYNTAX, error.kind());
        assertTrue(root.errors().contains(error));
        return error;
    }
}
