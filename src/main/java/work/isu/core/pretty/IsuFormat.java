package work.isu.core.pretty;

import java.util.List;
import java.util.stream.Collectors;
import work.isu.core.model.Declaration;
import work.isu.core.model.Expr;
import work.isu.core.model.ExprVisitor;

/**
 * Canonical spelling of literals, expressions and inline lists.
 */
public final class IsuFormat {
    private static final ExprVisitor<String> RENDER = new ExprVisitor<>() {
        @Override
        public String visitConst(Expr.Const node) {
            return "(const " + literal(node) + ")";
        }

        @Override
        public String visitVar(Expr.Var node) {
            return "(var " + node.name() + ")";
        }

        @Override
        public String visitBinary(Expr.Binary node) {
            return "(" + node.op().tag() + " " + node.left().accept(this) + " " + node.right().accept(this) + ")";
        }

        @Override
        public String visitIndex(Expr.Index node) {
            return "(index " + node.target().accept(this) + " " + node.index().accept(this) + ")";
        }

        @Override
        public String visitCall(Expr.Call node) {
            var builder = new StringBuilder("(call ").append(node.function().name());
            for (Expr arg : node.args()) {
                builder.append(' ').append(arg.accept(this));
            }
            return builder.append(')').toString();
        }
    };

    private IsuFormat() {}

    public static String expr(Expr expr) {
        return expr.accept(RENDER);
    }

    public static String literal(Expr.Const literal) {
        switch (literal.type()) {
            case STRING:
                return quote((String) literal.value());
            case LIST:
                return "[]";
            case MAP:
                return "{}";
            default:
                return String.valueOf(literal.value());
        }
    }

    public static String quote(String value) {
        var builder = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\t' -> builder.append("\\t");
                default -> builder.append(ch);
            }
        }
        return builder.append('"').toString();
    }

    /** {@code [a, b]} */
    public static String nameList(List<String> names) {
        return "[" + String.join(", ", names) + "]";
    }

    /** {@code [a: int, b: list]} */
    public static String declarationList(List<Declaration> declarations) {
        return declarations.stream()
            .map(d -> d.name() + ": " + d.type().keyword())
            .collect(Collectors.joining(", ", "[", "]"));
    }

    /** {@code name: type} or {@code name: type = literal}, without the list dash. */
    public static String declaration(Declaration declaration) {
        var text = declaration.name() + ": " + declaration.type().keyword();
        return declaration.initializer().map(init -> text + " = " + literal(init)).orElse(text);
    }
}
