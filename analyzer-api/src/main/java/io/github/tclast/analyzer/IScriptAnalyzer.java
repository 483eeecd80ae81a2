package io.github.tclast.analyzer;

import io.github.tclast.analyzer.ast.AstNode;
import io.github.tclast.analyzer.ast.Root;

/**
 * The two entry points of the parser core. Editor integrations, symbol indexers and schema validators call only
 * these and treat the JSON produced by {@link #toJson(AstNode)} as a stable schema.
 *
 * <p>Implementations are stateless between calls: every {@link #build} creates a fresh tree, and concurrent calls on
 * independent inputs need no locking.
 */
public interface IScriptAnalyzer {

    /**
     * Parses {@code source} into a tree. Never throws for any input; malformed commands become error nodes and are
     * listed in {@link Root#errors()}.
     *
     * @param source the script text
     * @param filepath the path recorded on the root, used only for reporting
     */
    Root build(String source, String filepath);

    /** Renders a node, typically a {@link Root}, as JSON text. Never throws for nodes produced by {@link #build}. */
    String toJson(AstNode node);

    default Root build(String source) {
        return build(source, "<string>");
    }
}
