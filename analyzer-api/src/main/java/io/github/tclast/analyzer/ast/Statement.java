package io.github.tclast.analyzer.ast;

/**
 * A node produced from one command, comment or error. {@code depth} is the body nesting level the node was found at,
 * 0 for top-level commands.
 */
public sealed interface Statement extends AstNode
        permits ProcNode,
                SetNode,
                VariableNode,
                GlobalNode,
                UpvarNode,
                ArrayNode,
                NamespaceNode,
                IfNode,
                ForNode,
                WhileNode,
                ForeachNode,
                SwitchNode,
                CatchNode,
                PackageNode,
                SourceNode,
                ListNode,
                LappendNode,
                ExprNode,
                CommandNode,
                CommentNode,
                ErrorNode {

    int depth();
}
