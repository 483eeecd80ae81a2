package io.github.tclast.analyzer;

import io.github.tclast.analyzer.ast.ArrayNode;
import io.github.tclast.analyzer.ast.AstNode;
import io.github.tclast.analyzer.ast.AstVisitor;
import io.github.tclast.analyzer.ast.Body;
import io.github.tclast.analyzer.ast.CatchNode;
import io.github.tclast.analyzer.ast.CommandNode;
import io.github.tclast.analyzer.ast.CommentNode;
import io.github.tclast.analyzer.ast.ErrorNode;
import io.github.tclast.analyzer.ast.ExprNode;
import io.github.tclast.analyzer.ast.ForNode;
import io.github.tclast.analyzer.ast.ForeachNode;
import io.github.tclast.analyzer.ast.GlobalNode;
import io.github.tclast.analyzer.ast.IfNode;
import io.github.tclast.analyzer.ast.LappendNode;
import io.github.tclast.analyzer.ast.ListNode;
import io.github.tclast.analyzer.ast.NamespaceNode;
import io.github.tclast.analyzer.ast.PackageNode;
import io.github.tclast.analyzer.ast.ProcNode;
import io.github.tclast.analyzer.ast.Root;
import io.github.tclast.analyzer.ast.SetNode;
import io.github.tclast.analyzer.ast.SourceNode;
import io.github.tclast.analyzer.ast.Statement;
import io.github.tclast.analyzer.ast.SwitchNode;
import io.github.tclast.analyzer.ast.UpvarNode;
import io.github.tclast.analyzer.ast.VariableNode;
import io.github.tclast.analyzer.ast.WhileNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/** Common walks over a built tree. Comments on the root are not part of the child structure. */
public class AstTraversal {

    private AstTraversal() {}

    /** Statements nested directly in {@code node}: root children, then every body in source order. */
    public static List<Statement> childrenOf(AstNode node) {
        return node.accept(CHILDREN);
    }

    /** All nodes in document order, {@code root} first. */
    public static List<AstNode> preOrder(AstNode root) {
        var result = new ArrayList<AstNode>();
        var stack = new ArrayDeque<AstNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            result.add(node);
            var children = childrenOf(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /** Finds the first node, in document order, matching the predicate. */
    public static @Nullable AstNode findNodeRecursive(AstNode root, Predicate<AstNode> predicate) {
        if (predicate.test(root)) {
            return root;
        }
        for (var child : childrenOf(root)) {
            var result = findNodeRecursive(child, predicate);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /** Finds all nodes matching the predicate, in document order. */
    public static List<AstNode> findAllNodesRecursive(AstNode root, Predicate<AstNode> predicate) {
        return preOrder(root).stream().filter(predicate).toList();
    }

    private static final AstVisitor<List<Statement>> CHILDREN = new AstVisitor<>() {
        @Override
        public List<Statement> visitRoot(Root node) {
            return node.children();
        }

        @Override
        public List<Statement> visitProc(ProcNode node) {
            return node.body().children();
        }

        @Override
        public List<Statement> visitSet(SetNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitVariable(VariableNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitGlobal(GlobalNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitUpvar(UpvarNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitArray(ArrayNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitNamespace(NamespaceNode node) {
            return node.body() != null ? node.body().children() : List.of();
        }

        @Override
        public List<Statement> visitIf(IfNode node) {
            var bodies = new ArrayList<Body>();
            bodies.add(node.thenBody());
            node.elseIfBranches().forEach(branch -> bodies.add(branch.body()));
            if (node.elseBody() != null) {
                bodies.add(node.elseBody());
            }
            return flatten(bodies);
        }

        @Override
        public List<Statement> visitFor(ForNode node) {
            return node.body().children();
        }

        @Override
        public List<Statement> visitWhile(WhileNode node) {
            return node.body().children();
        }

        @Override
        public List<Statement> visitForeach(ForeachNode node) {
            return node.body().children();
        }

        @Override
        public List<Statement> visitSwitch(SwitchNode node) {
            return flatten(node.cases().stream().map(SwitchNode.Case::body).toList());
        }

        @Override
        public List<Statement> visitCatch(CatchNode node) {
            return node.body().children();
        }

        @Override
        public List<Statement> visitPackage(PackageNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitSource(SourceNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitList(ListNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitLappend(LappendNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitExpr(ExprNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitCommand(CommandNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitComment(CommentNode node) {
            return List.of();
        }

        @Override
        public List<Statement> visitError(ErrorNode node) {
            return List.of();
        }
    };

    private static List<Statement> flatten(List<Body> bodies) {
        var result = new ArrayList<Statement>();
        bodies.forEach(body -> result.addAll(body.children()));
        return result;
    }
}
