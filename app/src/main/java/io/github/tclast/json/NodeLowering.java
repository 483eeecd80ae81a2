package io.github.tclast.json;

import io.github.tclast.analyzer.NodeType;
import io.github.tclast.analyzer.Position;
import io.github.tclast.analyzer.Range;
import io.github.tclast.analyzer.VariableNameRef;
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
import io.github.tclast.json.TreeValue.Fields;
import io.github.tclast.json.TreeValue.Seq;
import java.util.List;
import java.util.function.Function;

/** Turns nodes into {@link TreeValue}s using the wire field names documented on {@link WireSchema}. */
public final class NodeLowering implements AstVisitor<Seq> {

    public static Seq lower(AstNode node) {
        return node.accept(new NodeLowering());
    }

    @Override
    public Seq visitRoot(Root node) {
        return TreeValue.fields()
                .put("type", node.type().wireName())
                .put("filepath", node.filepath())
                .put("comments", list(node.comments(), this::visitComment))
                .put("children", statements(node.children()))
                .put("had_error", node.hadError())
                .put("errors", list(node.errors(), this::visitError))
                .put("range", range(node.range()))
                .build();
    }

    @Override
    public Seq visitProc(ProcNode node) {
        var params = list(node.params(), param -> {
            var fields = TreeValue.fields().put("name", param.name());
            if (param.defaultValue() != null) {
                fields.put("default", param.defaultValue());
            }
            return fields.put("is_varargs", param.varargs()).build();
        });
        return end(start(node).put("name", node.name()).put("params", params).put("body", body(node.body())), node);
    }

    @Override
    public Seq visitSet(SetNode node) {
        return end(
                start(node)
                        .put("var_name", node.varName())
                        .put("var_ref", varRef(node.target()))
                        .put("value", node.value()),
                node);
    }

    @Override
    public Seq visitVariable(VariableNode node) {
        var additional = list(node.additional(), decl -> TreeValue.fields()
                .put("name", decl.name())
                .put("var_ref", varRef(decl.target()))
                .put("value", decl.value())
                .build());
        return end(
                start(node)
                        .put("name", node.name())
                        .put("var_ref", varRef(node.target()))
                        .put("value", node.value())
                        .put("additional", additional),
                node);
    }

    @Override
    public Seq visitGlobal(GlobalNode node) {
        return end(
                start(node)
                        .put("vars", TreeValue.strings(node.vars()))
                        .put("refs", list(node.refs(), NodeLowering::varRef)),
                node);
    }

    @Override
    public Seq visitUpvar(UpvarNode node) {
        var pairs = list(node.links(), link -> TreeValue.fields()
                .put("other_var", link.otherVar())
                .put("local_var", link.localVar())
                .build());
        return end(
                start(node)
                        .put("level", node.level())
                        .put("other_var", node.otherVar())
                        .put("local_var", node.localVar())
                        .put("pairs", pairs),
                node);
    }

    @Override
    public Seq visitArray(ArrayNode node) {
        return end(
                start(node)
                        .put("operation", node.operation())
                        .put("array_name", node.arrayName())
                        .put("args", TreeValue.strings(node.args())),
                node);
    }

    @Override
    public Seq visitNamespace(NamespaceNode node) {
        var fields = start(node);
        var type = node.type();
        if (type == NodeType.NAMESPACE_EVAL && node.body() != null) {
            fields.put("name", node.name()).put("body", body(node.body()));
        } else if (type == NodeType.NAMESPACE_IMPORT) {
            fields.put("patterns", TreeValue.strings(node.args()));
        } else if (type == NodeType.NAMESPACE_EXPORT) {
            fields.put("exports", TreeValue.strings(node.args()));
        } else {
            fields.put("subcommand", node.subcommand()).put("args", TreeValue.strings(node.args()));
        }
        return end(fields, node);
    }

    @Override
    public Seq visitIf(IfNode node) {
        var fields = start(node)
                .put("condition", node.condition())
                .put("then_body", body(node.thenBody()))
                .put("elseif", list(node.elseIfBranches(), branch -> TreeValue.fields()
                        .put("condition", branch.condition())
                        .put("body", body(branch.body()))
                        .build()));
        if (node.elseBody() != null) {
            fields.put("else_body", body(node.elseBody()));
        }
        return end(fields, node);
    }

    @Override
    public Seq visitFor(ForNode node) {
        return end(
                start(node)
                        .put("init", node.init())
                        .put("condition", node.condition())
                        .put("increment", node.increment())
                        .put("body", body(node.body())),
                node);
    }

    @Override
    public Seq visitWhile(WhileNode node) {
        return end(start(node).put("condition", node.condition()).put("body", body(node.body())), node);
    }

    @Override
    public Seq visitForeach(ForeachNode node) {
        var pairs = list(node.iterations(), it -> TreeValue.fields()
                .put("var_name", it.varName())
                .put("list", it.list())
                .build());
        return end(
                start(node)
                        .put("var_name", node.varName())
                        .put("list", node.list())
                        .put("pairs", pairs)
                        .put("body", body(node.body())),
                node);
    }

    @Override
    public Seq visitSwitch(SwitchNode node) {
        var cases = list(node.cases(), c -> TreeValue.fields()
                .put("pattern", c.pattern())
                .put("body", body(c.body()))
                .put("fallthrough", c.fallthrough())
                .build());
        return end(
                start(node)
                        .put("expression", node.expression())
                        .put("options", TreeValue.strings(node.options()))
                        .put("cases", cases),
                node);
    }

    @Override
    public Seq visitCatch(CatchNode node) {
        var fields = start(node).put("body", body(node.body()));
        if (node.resultVar() != null) {
            fields.put("result_var", node.resultVar());
        }
        if (node.optionsVar() != null) {
            fields.put("options_var", node.optionsVar());
        }
        return end(fields, node);
    }

    @Override
    public Seq visitPackage(PackageNode node) {
        var fields = start(node);
        if (node.type() == NodeType.PACKAGE) {
            fields.put("subcommand", node.subcommand());
        }
        return end(fields.put("package_name", node.packageName()).put("version", node.version()), node);
    }

    @Override
    public Seq visitSource(SourceNode node) {
        return end(start(node).put("filepath", node.filepath()), node);
    }

    @Override
    public Seq visitList(ListNode node) {
        return end(start(node).put("elements", TreeValue.strings(node.elements())), node);
    }

    @Override
    public Seq visitLappend(LappendNode node) {
        return end(
                start(node)
                        .put("var_name", node.varName())
                        .put("value", node.value())
                        .put("args", TreeValue.strings(node.values())),
                node);
    }

    @Override
    public Seq visitExpr(ExprNode node) {
        return end(start(node).put("expression", node.expression()), node);
    }

    @Override
    public Seq visitCommand(CommandNode node) {
        return end(start(node).put("name", node.name()).put("args", TreeValue.strings(node.args())), node);
    }

    @Override
    public Seq visitComment(CommentNode node) {
        return end(start(node).put("text", node.text()), node);
    }

    @Override
    public Seq visitError(ErrorNode node) {
        var fields = start(node).put("message", node.message()).put("error_type", node.kind().wireName());
        if (node.suggestion() != null) {
            fields.put("suggestion", node.suggestion());
        }
        return end(fields, node);
    }

    private static Fields start(Statement node) {
        return TreeValue.fields().put("type", node.type().wireName());
    }

    private static Seq end(Fields fields, Statement node) {
        return fields.put("range", range(node.range())).put("depth", node.depth()).build();
    }

    private Seq body(Body body) {
        return TreeValue.fields().put("children", statements(body.children())).build();
    }

    private Seq statements(List<? extends Statement> statements) {
        return list(statements, statement -> statement.accept(this));
    }

    private static <T> Seq list(List<T> items, Function<? super T, ? extends TreeValue> lowering) {
        return new Seq(items.stream().<TreeValue>map(lowering).toList());
    }

    static Seq range(Range range) {
        return TreeValue.fields()
                .put("start", position(range.start()))
                .put("end_pos", position(range.end()))
                .build();
    }

    private static Seq position(Position position) {
        return TreeValue.fields()
                .put("line", position.line())
                .put("column", position.column())
                .build();
    }

    static Seq varRef(VariableNameRef ref) {
        if (ref instanceof VariableNameRef.ArrayAccess access) {
            return TreeValue.fields()
                    .put("kind", "array")
                    .put("name", access.name())
                    .put("key", access.key())
                    .build();
        }
        return TreeValue.fields().put("kind", "plain").put("name", ref.name()).build();
    }
}
