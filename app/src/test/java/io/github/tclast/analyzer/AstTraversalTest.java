package io.github.tclast.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.github.tclast.analyzer.ast.AstNode;
import io.github.tclast.analyzer.ast.CommandNode;
import io.github.tclast.analyzer.ast.ProcNode;
import io.github.tclast.util.ParserConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

class AstTraversalTest {

    private static final String SCRIPT = """
            proc a {} {
                if {$x} {
                    puts one
                } else {
                    puts two
                }
            }
            proc b {} { switch $y { k { puts three } } }
            set z 1
            """;

    private final TclAnalyzer analyzer = new TclAnalyzer(ParserConfig.defaults());

    @Test
    void preOrderVisitsEveryNodeInDocumentOrder() {
        var types = AstTraversal.preOrder(analyzer.build(SCRIPT)).stream()
                .map(node -> node.type().wireName())
                .toList();
        assertEquals(
                List.of("root", "proc", "if", "command", "command", "proc", "switch", "command", "set"), types);
    }

    @Test
    void findsFirstAndAllMatches() {
        var root = analyzer.build(SCRIPT);

        var firstProc = AstTraversal.findNodeRecursive(root, node -> node instanceof ProcNode);
        assertEquals("a", ((ProcNode) firstProc).name());
        assertNull(AstTraversal.findNodeRecursive(root, node -> node.type() == NodeType.WHILE));

        var puts = AstTraversal.findAllNodesRecursive(root, node -> node instanceof CommandNode);
        assertEquals(
                List.of(List.of("one"), List.of("two"), List.of("three")),
                puts.stream().map(node -> ((CommandNode) node).args()).toList());
    }

    @Test
    void onlyBodyOwningKindsHaveChildren() {
        for (AstNode node : AstTraversal.preOrder(analyzer.build(SCRIPT))) {
            if (node.type() != NodeType.ROOT && !NodeType.WITH_BODIES.contains(node.type())) {
                assertTrue(AstTraversal.childrenOf(node).isEmpty(), node.type() + " should be a leaf");
            }
        }
    }
}
