package io.github.tclast.analyzer.ast;

/** Double dispatch over the closed set of node kinds. */
public interface AstVisitor<R> {

    R visitRoot(Root node);

    R visitProc(ProcNode node);

    R visitSet(SetNode node);

    R visitVariable(VariableNode node);

    R visitGlobal(GlobalNode node);

    R visitUpvar(UpvarNode node);

    R visitArray(ArrayNode node);

    R visitNamespace(NamespaceNode node);

    R visitIf(IfNode node);

    R visitFor(ForNode node);

    R visitWhile(WhileNode node);

    R visitForeach(ForeachNode node);

    R visitSwitch(SwitchNode node);

    R visitCatch(CatchNode node);

    R visitPackage(PackageNode node);

    R visitSource(SourceNode node);

    R visitList(ListNode node);

    R visitLappend(LappendNode node);

    R visitExpr(ExprNode node);

    R visitCommand(CommandNode node);

    R visitComment(CommentNode node);

    R visitError(ErrorNode node);
}
