package io.github.tclast.analyzer.parsers;

import static io.github.tclast.analyzer.parsers.ParserTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.tclast.analyzer.Position;
import io.github.tclast.analyzer.ast.CatchNode;
import io.github.tclast.analyzer.ast.CommandNode;
import io.github.tclast.analyzer.ast.ForNode;
import io.github.tclast.analyzer.ast.ForeachNode;
import io.github.tclast.analyzer.ast.IfNode;
import io.github.tclast.analyzer.ast.SwitchNode;
import io.github.tclast.analyzer.ast.WhileNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class ControlFlowParsersTest {

    @Test
    void ifWithThenElseifAndElse() {
        var node = parseOnly("if {$a} then {x} elseif {$b} {y; z} else {w}", IfNode.class);
        assertEquals("{$a}", node.condition());
        assertEquals(1, node.thenBody().children().size());
        assertEquals(1, node.elseIfBranches().size());
        assertEquals("{$b}", node.elseIfBranches().get(0).condition());
        assertEquals(2, node.elseIfBranches().get(0).body().children().size());
        assertNotNull(node.elseBody());
        assertEquals("w", ((CommandNode) node.elseBody().children().get(0)).name());
    }

    @Test
    void ifWithoutElse() {
        var node = parseOnly("if {$a > 0} {puts pos}", IfNode.class);
        assertTrue(node.elseIfBranches().isEmpty());
        assertNull(node.elseBody());
    }

    @Test
    void trailingBodyIsImplicitElse() {
        var node = parseOnly("if 1 {a} {b}", IfNode.class);
        assertNotNull(node.elseBody());
        assertEquals("b", ((CommandNode) node.elseBody().children().get(0)).name());
    }

    @Test
    void malformedIfIsError() {
        parseError("if 1");
        parseError("if 1 {a} bogus extra");
        parseError("if 1 {a} else");
        parseError("if 1 {a} elseif {b}");
    }

    @Test
    void forKeepsClausesVerbatim() {
        var node = parseOnly("for {set i 0} {$i < 3} {incr i} {puts $i}", ForNode.class);
        assertEquals("{set i 0}", node.init());
        assertEquals("{$i < 3}", node.condition());
        assertEquals("{incr i}", node.increment());
        assertEquals(1, node.body().children().size());
        parseError("for {set i 0} {$i < 3} {puts $i}");
    }

    @Test
    void whileTakesConditionAndBody() {
        var node = parseOnly("while {$running} {\n  step\n  check\n}", WhileNode.class);
        assertEquals("{$running}", node.condition());
        assertEquals(2, node.body().children().size());
        assertEquals(new Position(3, 3), node.body().children().get(1).range().start());
        parseError("while 1");
    }

    @Test
    void foreachWithSeveralLists() {
        var node = parseOnly("foreach a {1 2} b {3 4} {puts $a$b}", ForeachNode.class);
        assertEquals("a", node.varName());
        assertEquals("{1 2}", node.list());
        assertEquals(
                List.of(new ForeachNode.Iteration("a", "{1 2}"), new ForeachNode.Iteration("b", "{3 4}")),
                node.iterations());
        parseError("foreach a {1}");
        parseError("foreach a {1} b {}");
    }

    @Test
    void switchBlockWithFallthrough() {
        var source = """
                switch -exact -- $x {
                    a -
                    b { puts ab }
                    default { puts other }
                }""";
        var node = parseOnly(source, SwitchNode.class);
        assertEquals(List.of("-exact", "--"), node.options());
        assertEquals("$x", node.expression());
        assertEquals(3, node.cases().size());

        var a = node.cases().get(0);
        assertEquals("a", a.pattern());
        assertTrue(a.fallthrough());
        assertTrue(a.body().isEmpty());

        var b = node.cases().get(1);
        assertFalse(b.fallthrough());
        assertEquals(1, b.body().children().size());
        var puts = b.body().children().get(0);
        assertEquals(1, puts.depth());
        assertEquals(new Position(3, 9), puts.range().start());

        assertEquals("default", node.cases().get(2).pattern());
    }

    @Test
    void switchInlinePairs() {
        var node = parseOnly("switch $x a {puts 1} b {puts 2}", SwitchNode.class);
        assertTrue(node.options().isEmpty());
        assertEquals(List.of("a", "b"), node.cases().stream().map(SwitchNode.Case::pattern).toList());
    }

    @Test
    void switchOptionsWithArguments() {
        var node = parseOnly("switch -matchvar m -regexp $s {{^a} {puts $m}}", SwitchNode.class);
        assertEquals(List.of("-matchvar", "m", "-regexp"), node.options());
        assertEquals("$s", node.expression());
        assertEquals("{^a}", node.cases().get(0).pattern());
    }

    @Test
    void switchWithOddPairsIsError() {
        parseError("switch $x {a {puts 1} b}");
        parseError("switch $x");
    }

    @Test
    void catchWithVariables() {
        var node = parseOnly("catch {risky} result opts", CatchNode.class);
        assertEquals(1, node.body().children().size());
        assertEquals("result", node.resultVar());
        assertEquals("opts", node.optionsVar());

        var bare = parseOnly("catch {risky}", CatchNode.class);
        assertNull(bare.resultVar());
        parseError("catch {a} r o extra");
    }
}
