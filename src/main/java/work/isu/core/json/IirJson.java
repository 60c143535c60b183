package work.isu.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.isu.core.model.BinaryOp;
import work.isu.core.model.Declaration;
import work.isu.core.model.Expr;
import work.isu.core.model.ExprVisitor;
import work.isu.core.model.Func;
import work.isu.core.model.Io;
import work.isu.core.model.Meta;
import work.isu.core.model.Program;
import work.isu.core.model.StdFunction;
import work.isu.core.model.Step;
import work.isu.core.model.StepId;
import work.isu.core.model.StepKind;
import work.isu.core.model.StepVisitor;
import work.isu.core.model.ValueType;

/**
 * Key-ordered JSON form of canonical IIR. Identical programs always serialize to identical bytes.
 */
public final class IirJson {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final ObjectWriter PRETTY = JSON.writerWithDefaultPrettyPrinter();

    private IirJson() {}

    public static String write(Program program) {
        try {
            return PRETTY.writeValueAsString(toMap(program));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize IIR: " + ex.getMessage(), ex);
        }
    }

    public static Program read(String json) {
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid IIR JSON: " + ex.getOriginalMessage(), ex);
        }
        return program(root);
    }

    public static Map<String, Object> toMap(Program program) {
        var map = new LinkedHashMap<String, Object>();
        program.meta().ifPresent(meta -> {
            var metaMap = new LinkedHashMap<String, Object>();
            metaMap.put("auto_id", meta.autoId());
            metaMap.put("flags", meta.flags());
            map.put("meta", metaMap);
        });
        var func = new LinkedHashMap<String, Object>();
        func.put("name", program.func().name());
        func.put("params", program.func().params());
        func.put("returns", program.func().returnType().keyword());
        map.put("func", func);
        var io = new LinkedHashMap<String, Object>();
        io.put("inputs", declarations(program.io().inputs()));
        io.put("outputs", declarations(program.io().outputs()));
        map.put("io", io);
        map.put("state", declarations(program.state()));
        map.put("local", declarations(program.local()));
        map.put("steps", step(program.steps()));
        return map;
    }

    private static List<Object> declarations(List<Declaration> declarations) {
        var list = new ArrayList<Object>();
        for (Declaration declaration : declarations) {
            var map = new LinkedHashMap<String, Object>();
            map.put("name", declaration.name());
            map.put("type", declaration.type().keyword());
            declaration.initializer().ifPresent(init -> map.put("init", expr(init)));
            list.add(map);
        }
        return list;
    }

    private static List<Object> steps(List<Step> steps) {
        var list = new ArrayList<Object>(steps.size());
        for (Step step : steps) {
            list.add(step(step));
        }
        return list;
    }

    private static Map<String, Object> step(Step step) {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", step.kind().keyword());
        if (step.id() != null) {
            map.put("id", step.id().toString());
        }
        step.accept(new StepVisitor<Void>() {
            @Override
            public Void visitSeq(Step.Seq s) {
                map.put("body", steps(s.body()));
                return null;
            }

            @Override
            public Void visitAssign(Step.Assign s) {
                map.put("target", s.target());
                map.put("expr", expr(s.expr()));
                return null;
            }

            @Override
            public Void visitIf(Step.If s) {
                map.put("cond", expr(s.cond()));
                map.put("then", steps(s.thenBranch()));
                map.put("else", steps(s.elseBranch()));
                return null;
            }

            @Override
            public Void visitLoop(Step.Loop s) {
                map.put("iter", s.iter());
                map.put("from", expr(s.from()));
                map.put("to", expr(s.to()));
                map.put("body", steps(s.body()));
                return null;
            }

            @Override
            public Void visitReturn(Step.Return s) {
                map.put("expr", expr(s.expr()));
                return null;
            }
        });
        return map;
    }

    private static Map<String, Object> expr(Expr expr) {
        return expr.accept(new ExprVisitor<Map<String, Object>>() {
            @Override
            public Map<String, Object> visitConst(Expr.Const node) {
                var map = tagged("const");
                map.put("type", node.type().keyword());
                map.put("value", node.value());
                return map;
            }

            @Override
            public Map<String, Object> visitVar(Expr.Var node) {
                var map = tagged("var");
                map.put("name", node.name());
                return map;
            }

            @Override
            public Map<String, Object> visitBinary(Expr.Binary node) {
                var map = tagged(node.op().tag());
                map.put("left", node.left().accept(this));
                map.put("right", node.right().accept(this));
                return map;
            }

            @Override
            public Map<String, Object> visitIndex(Expr.Index node) {
                var map = tagged("index");
                map.put("target", node.target().accept(this));
                map.put("index", node.index().accept(this));
                return map;
            }

            @Override
            public Map<String, Object> visitCall(Expr.Call node) {
                var map = tagged("call");
                map.put("function", node.function().name());
                var args = new ArrayList<Object>();
                for (Expr arg : node.args()) {
                    args.add(arg.accept(this));
                }
                map.put("args", args);
                return map;
            }
        });
    }

    private static LinkedHashMap<String, Object> tagged(String tag) {
        var map = new LinkedHashMap<String, Object>();
        map.put("tag", tag);
        return map;
    }

    private static Program program(JsonNode root) {
        Optional<Meta> meta = Optional.empty();
        if (root.has("meta")) {
            var node = root.get("meta");
            var flags = new LinkedHashMap<String, String>();
            node.path("flags").fields().forEachRemaining(e -> flags.put(e.getKey(), e.getValue().asText()));
            meta = Optional.of(new Meta(node.path("auto_id").asBoolean(false), flags));
        }
        var funcNode = required(root, "func");
        var params = new ArrayList<String>();
        for (JsonNode param : funcNode.path("params")) {
            params.add(param.asText());
        }
        var func = new Func(text(funcNode, "name"), params, type(text(funcNode, "returns")));
        var ioNode = required(root, "io");
        var io = new Io(declarations(ioNode.path("inputs")), declarations(ioNode.path("outputs")));
        var steps = step(required(root, "steps"));
        if (!(steps instanceof Step.Seq seq) || !seq.isRoot()) {
            throw new IllegalArgumentException("IIR steps must be a SEQ without id");
        }
        return new Program(meta, func, io, declarations(root.path("state")), declarations(root.path("local")), seq);
    }

    private static List<Declaration> declarations(JsonNode array) {
        var list = new ArrayList<Declaration>();
        for (JsonNode node : array) {
            Optional<Expr.Const> init = Optional.empty();
            if (node.has("init")) {
                if (!(expr(node.get("init")) instanceof Expr.Const literal)) {
                    throw new IllegalArgumentException("Initializer of " + text(node, "name") + " must be a const");
                }
                init = Optional.of(literal);
            }
            list.add(new Declaration(text(node, "name"), type(text(node, "type")), init));
        }
        return list;
    }

    private static List<Step> stepList(JsonNode array) {
        var list = new ArrayList<Step>();
        for (JsonNode node : array) {
            list.add(step(node));
        }
        return list;
    }

    private static Step step(JsonNode node) {
        var kind = StepKind.fromKeyword(text(node, "kind"))
            .orElseThrow(() -> new IllegalArgumentException("Unknown step kind: " + node.get("kind")));
        StepId id = node.has("id") ? StepId.parse(node.get("id").asText()) : null;
        switch (kind) {
            case SEQ:
                return new Step.Seq(id, stepList(required(node, "body")));
            case ASSIGN:
                return new Step.Assign(id, text(node, "target"), expr(required(node, "expr")));
            case IF:
                return new Step.If(id, expr(required(node, "cond")), stepList(required(node, "then")), stepList(required(node, "else")));
            case LOOP:
                return new Step.Loop(
                    id,
                    text(node, "iter"),
                    expr(required(node, "from")),
                    expr(required(node, "to")),
                    stepList(required(node, "body"))
                );
            default:
                return new Step.Return(id, expr(required(node, "expr")));
        }
    }

    private static Expr expr(JsonNode node) {
        String tag = text(node, "tag");
        switch (tag) {
            case "const":
                return literal(type(text(node, "type")), required(node, "value"));
            case "var":
                return new Expr.Var(text(node, "name"));
            case "index":
                return new Expr.Index(expr(required(node, "target")), expr(required(node, "index")));
            case "call": {
                var function = StdFunction.fromName(text(node, "function"))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown function: " + node.get("function")));
                var args = new ArrayList<Expr>();
                for (JsonNode arg : required(node, "args")) {
                    args.add(expr(arg));
                }
                return new Expr.Call(function, args);
            }
            default: {
                var op = BinaryOp.fromTag(tag).orElseThrow(() -> new IllegalArgumentException("Unknown expression tag: " + tag));
                return new Expr.Binary(op, expr(required(node, "left")), expr(required(node, "right")));
            }
        }
    }

    private static Expr.Const literal(ValueType type, JsonNode value) {
        switch (type) {
            case INT:
                return Expr.Const.ofInt(value.asLong());
            case BOOL:
                return Expr.Const.ofBool(value.asBoolean());
            case STRING:
                return Expr.Const.ofString(value.asText());
            case LIST:
                return Expr.Const.emptyList();
            case MAP:
                return Expr.Const.emptyMap();
            default:
                throw new IllegalArgumentException("Literal cannot have type " + type.keyword());
        }
    }

    private static ValueType type(String keyword) {
        return ValueType.fromKeyword(keyword).orElseThrow(() -> new IllegalArgumentException("Unknown type: " + keyword));
    }

    private static JsonNode required(JsonNode node, String field) {
        var child = node.get(field);
        if (child == null || child.isNull()) {
            throw new IllegalArgumentException("Missing IIR field '" + field + "'");
        }
        return child;
    }

    private static String text(JsonNode node, String field) {
        return required(node, field).asText();
    }
}
