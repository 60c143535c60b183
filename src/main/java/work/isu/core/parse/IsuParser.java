package work.isu.core.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.SourcePos;
import work.isu.core.model.StepId;
import work.isu.core.model.StepKind;

/**
 * Builds a permissive {@link RawProgram} from Isu text. Structure is decided by line-leading
 * keywords and explicit block delimiters only; indentation is ignored. Fields may appear in any
 * order here, the canonicalizer enforces which ones a step kind needs.
 */
public final class IsuParser {
    static final List<String> SECTIONS = List.of("META", "FUNC", "IO", "STATE", "LOCAL", "STEPS");
    private static final String AUTO_ID = "AUTO_ID";

    private final List<LexedLine> lines;
    private boolean idsOptional;
    private int index = 0;

    private IsuParser(List<LexedLine> lines, boolean idsOptional) {
        this.lines = lines;
        this.idsOptional = idsOptional;
    }

    public static RawProgram parse(String text) {
        var lines = IsuLexer.lex(text);
        if (lines.isEmpty()) {
            throw new IsuParseException(new SourcePos(1, 1), "empty program: expected FUNC section");
        }
        return new IsuParser(lines, false).readProgram();
    }

    /** Parses a standalone step, as used for patch fragments. Step IDs are always optional here. */
    public static RawStep parseFragment(String text) {
        var lines = IsuLexer.lex(text);
        if (lines.isEmpty()) {
            throw new IsuParseException(new SourcePos(1, 1), "empty fragment: expected one step");
        }
        var parser = new IsuParser(lines, true);
        var step = parser.readStep(false);
        if (parser.index < lines.size()) {
            throw new IsuParseException(lines.get(parser.index).pos(), "a fragment must contain exactly one step");
        }
        return step;
    }

    public static PatchDirective parsePatch(String text) {
        var lines = IsuLexer.lex(text);
        if (lines.isEmpty()) {
            throw new IsuParseException(new SourcePos(1, 1), "empty patch: expected PATCH block");
        }
        return new IsuParser(lines, true).readPatch();
    }

    private RawProgram readProgram() {
        Optional<RawSection<RawEntry>> meta = Optional.empty();
        if (isSectionHeader(current(), "META")) {
            meta = Optional.of(readMapping("META"));
            idsOptional = readAutoId(meta.get());
        }
        var func = readMapping("FUNC");
        var io = readMapping("IO");
        var state = readDeclarations("STATE");
        var local = readDeclarations("LOCAL");
        var header = expectSection("STEPS");
        if (!header.tail().isEmpty()) {
            throw new IsuParseException(header.tailPos(), "STEPS header takes no inline value");
        }
        index++;
        if (index >= lines.size()) {
            throw new IsuParseException(header.pos(), "STEPS is empty: expected 'SEQ: BEGIN'");
        }
        var root = readStep(true);
        if (root.kind() != StepKind.SEQ) {
            throw new IsuParseException(root.pos(), "STEPS must start with 'SEQ: BEGIN'");
        }
        if (index < lines.size()) {
            throw new IsuParseException(lines.get(index).pos(), "unexpected content after the root SEQ block");
        }
        return new RawProgram(meta, func, io, state, local, root);
    }

    private PatchDirective readPatch() {
        var header = current();
        boolean headerOk = header.hasColon()
            ? header.head().equalsIgnoreCase("PATCH") && header.tail().isEmpty()
            : header.is("PATCH");
        if (!headerOk) {
            throw new IsuParseException(header.pos(), "expected 'PATCH:' header");
        }
        index++;
        if (index >= lines.size()) {
            throw new IsuParseException(header.pos(), "PATCH block needs a REPLACE directive");
        }
        var directive = current();
        String[] words = directive.head().trim().split("\\s+");
        if (!directive.hasColon() || words.length == 0 || !words[0].equalsIgnoreCase("REPLACE")) {
            throw new IsuParseException(directive.pos(), "expected 'REPLACE <StepID>:' directive");
        }
        if (words.length != 2) {
            throw new IsuParseException(directive.pos(), "REPLACE takes exactly one step ID");
        }
        if (!directive.tail().isEmpty()) {
            throw new IsuParseException(directive.tailPos(), "unexpected text after 'REPLACE " + words[1] + ":'");
        }
        var target = StepId.tryParse(words[1])
            .orElseThrow(() -> new IsuParseException(directive.pos(), "malformed step ID '" + words[1] + "'"));
        index++;
        if (index >= lines.size()) {
            throw new IsuParseException(directive.pos(), "REPLACE " + target + " has no replacement step");
        }
        var replacement = readStep(false);
        if (index < lines.size()) {
            var extra = current();
            String reason = extra.hasColon() && extra.head().toUpperCase(Locale.ROOT).startsWith("REPLACE")
                ? "PATCH accepts exactly one REPLACE directive"
                : "PATCH accepts exactly one replacement step";
            throw new IsuParseException(extra.pos(), reason);
        }
        return new PatchDirective(target, directive.pos(), replacement);
    }

    private RawSection<RawEntry> readMapping(String name) {
        var header = expectSection(name);
        if (!header.tail().isEmpty()) {
            throw new IsuParseException(header.tailPos(), name + " header takes no inline value");
        }
        index++;
        var entries = new ArrayList<RawEntry>();
        while (index < lines.size() && !isAnySectionHeader(current())) {
            var line = current();
            if (!line.hasColon() || line.head().isEmpty()) {
                throw new IsuParseException(line.pos(), "expected 'KEY: value' in " + name + " but got '" + line.text() + "'");
            }
            entries.add(new RawEntry(line.head(), line.tail(), line.pos(), line.tailPos()));
            index++;
        }
        return new RawSection<>(name, header.pos(), entries);
    }

    private RawSection<RawDecl> readDeclarations(String name) {
        var header = expectSection(name);
        index++;
        var decls = new ArrayList<RawDecl>();
        boolean inlineEmpty = false;
        if (!header.tail().isEmpty()) {
            if (!header.tail().replace(" ", "").equals("[]")) {
                throw new IsuParseException(header.tailPos(), name + " header only accepts '[]' inline");
            }
            inlineEmpty = true;
        }
        boolean sawEmptyMarker = inlineEmpty;
        while (index < lines.size() && !isAnySectionHeader(current())) {
            var line = current();
            if (line.text().replace(" ", "").equals("[]")) {
                if (sawEmptyMarker || !decls.isEmpty()) {
                    throw new IsuParseException(line.pos(), "'[]' cannot be combined with other " + name + " entries");
                }
                sawEmptyMarker = true;
                index++;
                continue;
            }
            if (sawEmptyMarker) {
                throw new IsuParseException(line.pos(), name + " was declared empty with '[]'");
            }
            decls.add(readDeclaration(line));
            index++;
        }
        return new RawSection<>(name, header.pos(), decls);
    }

    private RawDecl readDeclaration(LexedLine line) {
        String text = line.text();
        int offset = 0;
        if (text.startsWith("-")) {
            offset = 1;
            while (offset < text.length() && Character.isWhitespace(text.charAt(offset))) {
                offset++;
            }
        }
        String body = text.substring(offset);
        int colon = body.indexOf(':');
        if (colon < 0) {
            throw new IsuParseException(line.pos(), "expected '- name: type' but got '" + text + "'");
        }
        String name = body.substring(0, colon).trim();
        SourcePos namePos = line.pos().shift(offset);
        if (!SExprReader.isIdentifier(name)) {
            throw new IsuParseException(namePos, "invalid variable name '" + name + "'");
        }
        String rest = body.substring(colon + 1);
        int equals = rest.indexOf('=');
        String type = (equals < 0 ? rest : rest.substring(0, equals)).trim();
        int typeOffset = offset + colon + 1 + leadingSpaces(rest);
        Optional<String> initializer = equals < 0 ? Optional.empty() : Optional.of(rest.substring(equals + 1).trim());
        if (type.isEmpty()) {
            throw new IsuParseException(line.pos().shift(typeOffset), "missing type for '" + name + "'");
        }
        if (initializer.isPresent() && initializer.get().isEmpty()) {
            throw new IsuParseException(line.pos().shift(offset + colon + 1 + equals), "missing initializer for '" + name + "'");
        }
        return new RawDecl(name, type, initializer, namePos, line.pos().shift(typeOffset));
    }

    /**
     * Reads one step header and its field lines. {@code root} marks the program's {@code SEQ},
     * which never carries an ID.
     */
    private RawStep readStep(boolean root) {
        var line = current();
        Optional<StepId> id = Optional.empty();
        StepKind kind;
        String inlineBody = null;
        if (!line.hasColon()) {
            kind = stepKind(line.text(), line.pos());
        } else if (StepId.isValid(line.head())) {
            id = Optional.of(StepId.tryParse(line.head())
                .orElseThrow(() -> new IsuParseException(line.pos(), "malformed step ID '" + line.head() + "'")));
            if (line.tail().isEmpty()) {
                throw new IsuParseException(line.tailPos(), "step " + line.head() + " is missing its kind");
            }
            kind = stepKind(line.tail(), line.tailPos());
        } else if (looksLikeStepId(line.head())) {
            throw new IsuParseException(line.pos(), "malformed step ID '" + line.head() + "'");
        } else {
            kind = stepKind(line.head(), line.pos());
            if (!line.tail().isEmpty()) {
                if (kind == StepKind.SEQ && isBlockOpener(line.tail())) {
                    inlineBody = line.tail();
                } else {
                    throw new IsuParseException(line.tailPos(), "unexpected '" + line.tail() + "' after " + kind.keyword());
                }
            }
        }
        if (root && id.isPresent()) {
            throw new IsuParseException(line.pos(), "the root SEQ does not take a step ID");
        }
        if (!root && id.isEmpty() && !idsOptional) {
            throw new IsuParseException(line.pos(), "step ID required for " + kind.keyword() + " when AUTO_ID is false");
        }
        index++;
        var fields = new ArrayList<RawField>();
        if (inlineBody != null) {
            fields.add(new RawField(StepField.BODY, line.tailPos(), readBlock(inlineBody, line.tailPos(), line)));
        } else if (kind == StepKind.SEQ && id.isEmpty() && line.hasColon() && opensBlockOnNextLine()) {
            fields.add(new RawField(StepField.BODY, line.tailPos(), readBlock("", line.tailPos(), line)));
        }
        while (index < lines.size() && isFieldLine(current())) {
            fields.add(readField());
        }
        return new RawStep(kind, id, line.pos(), fields);
    }

    private RawField readField() {
        var line = current();
        var field = StepField.fromKeyword(line.head()).orElseThrow();
        index++;
        RawValue value;
        switch (field.shape()) {
            case NAME:
                if (!SExprReader.isIdentifier(line.tail())) {
                    throw new IsuParseException(line.tailPos(), field + " expects a variable name but got '" + line.tail() + "'");
                }
                value = new RawValue.Name(line.tail(), line.tailPos());
                break;
            case EXPRESSION:
                if (line.tail().isEmpty()) {
                    throw new IsuParseException(line.tailPos(), field + " is missing its expression");
                }
                value = new RawValue.Expression(SExprReader.parse(line.tail(), line.tailPos()), line.tailPos());
                break;
            default:
                value = readBlock(line.tail(), line.tailPos(), line);
                break;
        }
        return new RawField(field, line.pos(), value);
    }

    private RawValue.Block readBlock(String inlineOpener, SourcePos openerPos, LexedLine owner) {
        String opener = inlineOpener;
        SourcePos openPos = openerPos;
        if (opener.isEmpty()) {
            if (opensBlockOnNextLine()) {
                opener = current().text();
                openPos = current().pos();
                index++;
            } else {
                throw new IsuParseException(openerPos, owner.head().toUpperCase(Locale.ROOT) + " expects BEGIN or '{' to open its block");
            }
        }
        String compact = opener.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        switch (compact) {
            case "{}":
                return new RawValue.Block(BlockStyle.BRACES, openPos, List.of());
            case "BEGINEND":
                return new RawValue.Block(BlockStyle.BEGIN_END, openPos, List.of());
            case "{":
                return readBlockBody(BlockStyle.BRACES, openPos);
            case "BEGIN":
                return readBlockBody(BlockStyle.BEGIN_END, openPos);
            default:
                throw new IsuParseException(openPos, "expected BEGIN or '{' but got '" + opener + "'");
        }
    }

    private RawValue.Block readBlockBody(BlockStyle style, SourcePos openPos) {
        var steps = new ArrayList<RawStep>();
        while (true) {
            if (index >= lines.size()) {
                throw new IsuParseException(openPos, "block opened with " + style.opener() + " is never closed");
            }
            var line = current();
            var closer = closerStyle(line);
            if (closer.isPresent()) {
                if (closer.get() != style) {
                    throw new IsuParseException(
                        line.pos(),
                        "block opened with " + style.opener() + " at " + openPos + " is closed by '" + closer.get().closer() + "'"
                    );
                }
                index++;
                return new RawValue.Block(style, openPos, steps);
            }
            steps.add(readStep(false));
        }
    }

    private StepKind stepKind(String word, SourcePos pos) {
        return StepKind.fromKeyword(word).orElseThrow(() -> unknownLine(word, pos));
    }

    private IsuParseException unknownLine(String word, SourcePos pos) {
        if (StepField.fromKeyword(word).isPresent()) {
            return new IsuParseException(pos, "field " + word.toUpperCase(Locale.ROOT) + " appears outside of a step");
        }
        if (word.equalsIgnoreCase("END") || word.equals("}")) {
            return new IsuParseException(pos, "'" + word + "' without a matching block opener");
        }
        if (isBlockOpener(word)) {
            return new IsuParseException(pos, "block opener '" + word + "' is only allowed after THEN, ELSE or BODY");
        }
        return new IsuParseException(pos, "unknown step kind '" + word + "'");
    }

    private LexedLine expectSection(String name) {
        if (index >= lines.size()) {
            var last = lines.get(lines.size() - 1);
            throw new IsuParseException(new SourcePos(last.number() + 1, 1), "missing " + name + " section");
        }
        var line = current();
        if (isSectionHeader(line, name)) {
            return line;
        }
        if (isAnySectionHeader(line)) {
            throw new IsuParseException(
                line.pos(),
                "section " + line.head().toUpperCase(Locale.ROOT) + " is out of order: expected " + name
            );
        }
        throw new IsuParseException(line.pos(), "expected " + name + " section but got '" + line.text() + "'");
    }

    private boolean readAutoId(RawSection<RawEntry> meta) {
        boolean autoId = false;
        for (RawEntry entry : meta.items()) {
            if (!entry.key().equalsIgnoreCase(AUTO_ID)) {
                continue;
            }
            autoId = parseFlag(entry, IsuParseException::new);
        }
        return autoId;
    }

    static boolean parseFlag(RawEntry entry, BiFunction<SourcePos, String, IsuParseException> error) {
        if (entry.value().equalsIgnoreCase("true")) {
            return true;
        }
        if (entry.value().equalsIgnoreCase("false")) {
            return false;
        }
        throw error.apply(entry.valuePos(), entry.key().toUpperCase(Locale.ROOT) + " must be true or false");
    }

    private LexedLine current() {
        return lines.get(index);
    }

    private boolean opensBlockOnNextLine() {
        return index < lines.size() && !current().hasColon() && isBlockOpener(current().text());
    }

    private static boolean isFieldLine(LexedLine line) {
        return line.hasColon() && StepField.fromKeyword(line.head()).isPresent();
    }

    private static boolean isSectionHeader(LexedLine line, String name) {
        return line.hasColon() && line.head().equalsIgnoreCase(name);
    }

    private static boolean isAnySectionHeader(LexedLine line) {
        return line.hasColon() && SECTIONS.contains(line.head().toUpperCase(Locale.ROOT));
    }

    private static Optional<BlockStyle> closerStyle(LexedLine line) {
        if (line.hasColon()) {
            return Optional.empty();
        }
        if (line.text().equalsIgnoreCase("END")) {
            return Optional.of(BlockStyle.BEGIN_END);
        }
        if (line.text().equals("}")) {
            return Optional.of(BlockStyle.BRACES);
        }
        return Optional.empty();
    }

    private static boolean isBlockOpener(String text) {
        String compact = text.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        return compact.equals("BEGIN") || compact.equals("{") || compact.equals("{}") || compact.equals("BEGINEND");
    }

    private static boolean looksLikeStepId(String head) {
        return head.length() > 1 && (head.charAt(0) == 'S' || head.charAt(0) == 's') && Character.isDigit(head.charAt(1));
    }

    private static int leadingSpaces(String text) {
        int count = 0;
        while (count < text.length() && Character.isWhitespace(text.charAt(count))) {
            count++;
        }
        return count;
    }
}
