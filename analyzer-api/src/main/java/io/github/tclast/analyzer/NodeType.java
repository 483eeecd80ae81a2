package io.github.tclast.analyzer;

import java.util.EnumSet;
import java.util.Set;

/** Node kinds and the {@code type} tag each one carries on the wire. */
public enum NodeType {
    ROOT("root"),
    PROC("proc"),
    SET("set"),
    VARIABLE("variable"),
    GLOBAL("global"),
    UPVAR("upvar"),
    ARRAY("array"),
    NAMESPACE("namespace"),
    NAMESPACE_EVAL("namespace_eval"),
    NAMESPACE_IMPORT("namespace_import"),
    NAMESPACE_EXPORT("namespace_export"),
    IF("if"),
    FOR("for"),
    WHILE("while"),
    FOREACH("foreach"),
    SWITCH("switch"),
    CATCH("catch"),
    PACKAGE("package"),
    PACKAGE_REQUIRE("package_require"),
    PACKAGE_PROVIDE("package_provide"),
    SOURCE("source"),
    LIST("list"),
    LAPPEND("lappend"),
    EXPR("expr"),
    COMMAND("command"),
    COMMENT("comment"),
    ERROR("error");

    /** Kinds whose nodes own nested bodies that the builder parses recursively. */
    public static final Set<NodeType> WITH_BODIES =
            EnumSet.of(PROC, NAMESPACE_EVAL, IF, FOR, WHILE, FOREACH, SWITCH, CATCH);

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
