package io.github.tclast.analyzer.parsers;

import static io.github.tclast.analyzer.parsers.ParserTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.ast.ExprNode;
import io.github.tclast.analyzer.ast.LappendNode;
import io.github.tclast.analyzer.ast.ListNode;
import io.github.tclast.analyzer.ast.NamespaceNode;
import io.github.tclast.analyzer.ast.PackageNode;
import io.github.tclast.analyzer.ast.ProcNode;
import io.github.tclast.analyzer.ast.SourceNode;
import java.util.List;
import org.junit.jupiter.api.Test;

/** expr, namespace, package, source, list and lappend. */
class OtherParsersTest {

    @Test
    void exprJoinsArgumentsVerbatim() {
        assertEquals("{$a + 1}", parseOnly("expr {$a + 1}", ExprNode.class).expression());
        assertEquals("$a + 1", parseOnly("expr $a   + 1", ExprNode.class).expression());
        parseError("expr");
    }

    @Test
    void namespaceEvalParsesBody() {
        var node = parseOnly("namespace eval ::foo {\n  proc bar {} {}\n}", NamespaceNode.class);
        assertEquals(NodeType.NAMESPACE_EVAL, node.type());
        assertEquals("::foo", node.name());
        assertNotNull(node.body());
        var proc = assertInstanceOf(ProcNode.class, node.body().children().get(0));
        assertEquals(1, proc.depth());
    }

    @Test
    void namespaceEvalJoinsSeveralScripts() {
        var node = parseOnly("namespace eval a {set x 1} {set y 2}", NamespaceNode.class);
        assertNotNull(node.body());
        assertEquals(2, node.body().children().size());
        parseError("namespace eval a");
        parseError("namespace");
    }

    @Test
    void namespaceImportExportAndOthers() {
        var imports = parseOnly("namespace import ::a::* ::b::c", NamespaceNode.class);
        assertEquals(NodeType.NAMESPACE_IMPORT, imports.type());
        assertEquals(List.of("::a::*", "::b::c"), imports.args());

        var exports = parseOnly("namespace export -clear x", NamespaceNode.class);
        assertEquals(NodeType.NAMESPACE_EXPORT, exports.type());
        assertEquals(List.of("-clear", "x"), exports.args());

        var current = parseOnly("namespace current", NamespaceNode.class);
        assertEquals(NodeType.NAMESPACE, current.type());
        assertEquals("current", current.subcommand());
        assertTrue(current.args().isEmpty());
    }

    @Test
    void packageRequireAndProvide() {
        var require = parseOnly("package require Tcl 8.6", PackageNode.class);
        assertEquals(NodeType.PACKAGE_REQUIRE, require.type());
        assertEquals("Tcl", require.packageName());
        assertEquals("8.6", require.version());

        var exact = parseOnly("package require -exact Tk 8.6.1", PackageNode.class);
        assertEquals("Tk", exact.packageName());
        assertEquals("8.6.1", exact.version());

        var provide = parseOnly("package provide mypkg {1.0}", PackageNode.class);
        assertEquals(NodeType.PACKAGE_PROVIDE, provide.type());
        assertEquals("1.0", provide.version());

        assertEquals(NodeType.PACKAGE, parseOnly("package forget x", PackageNode.class).type());
        parseError("package");
    }

    @Test
    void sourceUsesLastWord() {
        assertEquals("lib/util.tcl", parseOnly("source \"lib/util.tcl\"", SourceNode.class).filepath());
        assertEquals("a.tcl", parseOnly("source -encoding utf-8 a.tcl", SourceNode.class).filepath());
        parseError("source");
    }

    @Test
    void listAndLappend() {
        assertTrue(parseOnly("list", ListNode.class).elements().isEmpty());
        assertEquals(List.of("a", "{b c}"), parseOnly("list a {b c}", ListNode.class).elements());

        var lappend = parseOnly("lappend items x \"y z\"", LappendNode.class);
        assertEquals("items", lappend.varName());
        assertEquals("x", lappend.value());
        assertEquals(List.of("x", "\"y z\""), lappend.values());

        assertEquals("", parseOnly("lappend items", LappendNode.class).value());
        parseError("lappend");
    }
}
