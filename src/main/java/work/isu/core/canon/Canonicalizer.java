package work.isu.core.canon;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.diag.SourcePos;
import work.isu.core.diag.StaticError;
import work.isu.core.diag.StaticErrorKind;
import work.isu.core.model.Declaration;
import work.isu.core.model.Expr;
import work.isu.core.model.Func;
import work.isu.core.model.Io;
import work.isu.core.model.Meta;
import work.isu.core.model.Program;
import work.isu.core.model.Step;
import work.isu.core.model.StepId;
import work.isu.core.model.StepKind;
import work.isu.core.model.ValueType;
import work.isu.core.parse.RawDecl;
import work.isu.core.parse.RawEntry;
import work.isu.core.parse.RawField;
import work.isu.core.parse.RawProgram;
import work.isu.core.parse.RawSection;
import work.isu.core.parse.RawStep;
import work.isu.core.parse.RawValue;
import work.isu.core.parse.SExprReader;
import work.isu.core.parse.StepField;

/**
 * Turns a raw parse tree into canonical IIR in one deterministic pass. Structural problems raise
 * {@link IsuParseException}; step ID conflicts raise {@link IsuStaticException}. Both abort at the
 * first problem found.
 */
public final class Canonicalizer {
    private static final Map<StepKind, List<StepField>> FIELDS = new EnumMap<>(StepKind.class);

    static {
        FIELDS.put(StepKind.SEQ, List.of(StepField.BODY));
        FIELDS.put(StepKind.ASSIGN, List.of(StepField.TARGET, StepField.EXPR));
        FIELDS.put(StepKind.IF, List.of(StepField.COND, StepField.THEN, StepField.ELSE));
        FIELDS.put(StepKind.LOOP, List.of(StepField.ITER, StepField.FROM, StepField.TO, StepField.BODY));
        FIELDS.put(StepKind.RETURN, List.of(StepField.EXPR));
    }

    private final boolean positional;
    private final Set<StepId> seen = new HashSet<>();

    private Canonicalizer(boolean positional) {
        this.positional = positional;
    }

    public static Program canonicalize(RawProgram raw) {
        var meta = raw.meta().map(Canonicalizer::meta);
        boolean autoId = meta.map(Meta::autoId).orElse(false);
        var io = io(raw.io());
        var func = func(raw.func(), io);
        var state = declarations(raw.state(), true);
        var local = declarations(raw.local(), false);
        var canonicalizer = new Canonicalizer(autoId);
        var rootFields = canonicalizer.fields(raw.steps());
        var body = canonicalizer.block(rootFields.get(StepField.BODY), IdScope.topLevel());
        return new Program(meta, func, io, state, local, Step.Seq.root(body));
    }

    /**
     * Canonicalizes a standalone step spliced in at {@code target}. The fragment root takes the
     * target ID; nested IDs are positional under it and explicit ones must agree.
     */
    public static Step canonicalizeFragment(RawStep raw, StepId target) {
        var canonicalizer = new Canonicalizer(true);
        return canonicalizer.step(raw, target);
    }

    private List<Step> block(RawField field, IdScope scope) {
        var block = (RawValue.Block) field.value();
        var steps = new ArrayList<Step>(block.steps().size());
        for (RawStep raw : block.steps()) {
            steps.add(step(raw, scope.next()));
        }
        return steps;
    }

    private Step step(RawStep raw, StepId positionalId) {
        var id = resolveId(raw, positionalId);
        var fields = fields(raw);
        switch (raw.kind()) {
            case SEQ:
                return new Step.Seq(id, block(fields.get(StepField.BODY), IdScope.under(id)));
            case ASSIGN:
                return new Step.Assign(id, name(fields.get(StepField.TARGET)), expr(fields.get(StepField.EXPR)));
            case IF: {
                var scope = IdScope.under(id);
                var thenBranch = block(fields.get(StepField.THEN), scope);
                var elseBranch = block(fields.get(StepField.ELSE), scope);
                return new Step.If(id, expr(fields.get(StepField.COND)), thenBranch, elseBranch);
            }
            case LOOP:
                return new Step.Loop(
                    id,
                    name(fields.get(StepField.ITER)),
                    expr(fields.get(StepField.FROM)),
                    expr(fields.get(StepField.TO)),
                    block(fields.get(StepField.BODY), IdScope.under(id))
                );
            case RETURN:
                return new Step.Return(id, expr(fields.get(StepField.EXPR)));
            default:
                throw new IllegalStateException("Unhandled step kind " + raw.kind());
        }
    }

    private StepId resolveId(RawStep raw, StepId positionalId) {
        if (positional) {
            if (raw.id().isPresent() && !raw.id().get().equals(positionalId)) {
                throw new IsuStaticException(StaticError.at(
                    StaticErrorKind.STEP_ID_MISMATCH,
                    raw.id().get(),
                    "step " + raw.id().get() + " sits at position " + positionalId
                ));
            }
            return positionalId;
        }
        var id = raw.id().orElseThrow(() -> new IsuParseException(raw.pos(), "step ID required when AUTO_ID is false"));
        if (!seen.add(id)) {
            throw new IsuStaticException(StaticError.at(
                StaticErrorKind.DUPLICATE_STEP_ID,
                id,
                "step ID " + id + " is used more than once"
            ));
        }
        return id;
    }

    /** Checks that {@code raw} has exactly the fields its kind requires, each once. */
    private Map<StepField, RawField> fields(RawStep raw) {
        var allowed = FIELDS.get(raw.kind());
        var fields = new EnumMap<StepField, RawField>(StepField.class);
        for (RawField field : raw.fields()) {
            if (!allowed.contains(field.field())) {
                throw new IsuParseException(field.pos(), "field " + field.field() + " is not allowed in " + raw.kind().keyword());
            }
            if (fields.putIfAbsent(field.field(), field) != null) {
                throw new IsuParseException(field.pos(), "duplicate field " + field.field() + " in " + raw.kind().keyword());
            }
        }
        for (StepField required : allowed) {
            if (!fields.containsKey(required)) {
                throw new IsuParseException(raw.pos(), raw.kind().keyword() + " is missing required field " + required);
            }
        }
        return fields;
    }

    private static String name(RawField field) {
        return ((RawValue.Name) field.value()).name();
    }

    private static Expr expr(RawField field) {
        return ((RawValue.Expression) field.value()).expr();
    }

    private static Meta meta(RawSection<RawEntry> section) {
        boolean autoId = false;
        var flags = new LinkedHashMap<String, String>();
        var keys = new HashSet<String>();
        for (RawEntry entry : uniqueKeys(section, keys)) {
            String key = entry.key().toUpperCase(Locale.ROOT);
            if (key.equals("AUTO_ID")) {
                autoId = flag(entry);
            } else {
                flags.put(key, entry.value());
            }
        }
        return new Meta(autoId, flags);
    }

    private static boolean flag(RawEntry entry) {
        if (entry.value().equalsIgnoreCase("true")) {
            return true;
        }
        if (entry.value().equalsIgnoreCase("false")) {
            return false;
        }
        throw new IsuParseException(entry.valuePos(), "AUTO_ID must be true or false");
    }

    private static Func func(RawSection<RawEntry> section, Io io) {
        String name = null;
        Optional<List<String>> params = Optional.empty();
        ValueType returns = ValueType.ANY;
        for (RawEntry entry : uniqueKeys(section, new HashSet<>())) {
            switch (entry.key().toUpperCase(Locale.ROOT)) {
                case "NAME":
                    if (!SExprReader.isIdentifier(entry.value())) {
                        throw new IsuParseException(entry.valuePos(), "invalid function name '" + entry.value() + "'");
                    }
                    name = entry.value();
                    break;
                case "PARAMS": {
                    var names = new ArrayList<String>();
                    for (InlineList.Item item : InlineList.split(entry.value(), entry.valuePos(), "PARAMS")) {
                        if (!SExprReader.isIdentifier(item.text())) {
                            throw new IsuParseException(item.pos(), "invalid parameter name '" + item.text() + "'");
                        }
                        names.add(item.text());
                    }
                    params = Optional.of(names);
                    break;
                }
                case "RETURNS":
                    returns = type(entry.value(), entry.valuePos());
                    break;
                default:
                    throw new IsuParseException(entry.pos(), "unknown FUNC key '" + entry.key() + "'");
            }
        }
        if (name == null) {
            throw new IsuParseException(section.pos(), "FUNC is missing NAME");
        }
        var paramNames = params.orElseGet(() -> io.inputs().stream().map(Declaration::name).toList());
        return new Func(name, paramNames, returns);
    }

    private static Io io(RawSection<RawEntry> section) {
        List<Declaration> inputs = List.of();
        List<Declaration> outputs = List.of();
        for (RawEntry entry : uniqueKeys(section, new HashSet<>())) {
            switch (entry.key().toUpperCase(Locale.ROOT)) {
                case "INPUT":
                    inputs = typedList(entry, "INPUT");
                    break;
                case "OUTPUT":
                    outputs = typedList(entry, "OUTPUT");
                    break;
                default:
                    throw new IsuParseException(entry.pos(), "unknown IO key '" + entry.key() + "'");
            }
        }
        return new Io(inputs, outputs);
    }

    private static List<Declaration> typedList(RawEntry entry, String what) {
        var declarations = new ArrayList<Declaration>();
        for (InlineList.Item item : InlineList.split(entry.value(), entry.valuePos(), what)) {
            int colon = item.text().indexOf(':');
            if (colon < 0) {
                throw new IsuParseException(item.pos(), "expected 'name: type' in " + what + " but got '" + item.text() + "'");
            }
            String name = item.text().substring(0, colon).trim();
            if (!SExprReader.isIdentifier(name)) {
                throw new IsuParseException(item.pos(), "invalid variable name '" + name + "'");
            }
            var type = type(item.text().substring(colon + 1).trim(), item.pos().shift(colon + 1));
            declarations.add(Declaration.of(name, type));
        }
        return declarations;
    }

    private static List<Declaration> declarations(RawSection<RawDecl> section, boolean initializersAllowed) {
        var declarations = new ArrayList<Declaration>();
        for (RawDecl raw : section.items()) {
            var type = type(raw.type(), raw.typePos());
            Optional<Expr.Const> initializer = Optional.empty();
            if (raw.initializer().isPresent()) {
                if (!initializersAllowed) {
                    throw new IsuParseException(raw.pos(), section.name() + " declarations cannot have initializers");
                }
                initializer = Optional.of(SExprReader.parseLiteral(raw.initializer().get(), raw.typePos()));
            }
            declarations.add(new Declaration(raw.name(), type, initializer));
        }
        return declarations;
    }

    private static ValueType type(String keyword, SourcePos pos) {
        return ValueType.fromKeyword(keyword)
            .orElseThrow(() -> new IsuParseException(pos, "unknown type '" + keyword + "'"));
    }

    private static List<RawEntry> uniqueKeys(RawSection<RawEntry> section, Set<String> keys) {
        for (RawEntry entry : section.items()) {
            if (!keys.add(entry.key().toUpperCase(Locale.ROOT))) {
                throw new IsuParseException(entry.pos(), "duplicate " + section.name() + " key '" + entry.key() + "'");
            }
        }
        return section.items();
    }
}
