package work.isu.core.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.isu.core.diag.SourcePos;
import work.isu.core.model.Declaration;
import work.isu.core.model.Expr;
import work.isu.core.model.Program;
import work.isu.core.model.Step;
import work.isu.core.model.StepKind;
import work.isu.core.model.StepVisitor;
import work.isu.core.pretty.IsuFormat;

/**
 * Rebuilds a raw tree from canonical IIR, so canonical programs can be fed back through the
 * canonicalizer without a text round trip.
 */
final class RawLowering {
    private static final SourcePos AT = SourcePos.SYNTHETIC;

    private RawLowering() {}

    static RawProgram lower(Program program) {
        var meta = program.meta().map(m -> {
            var entries = new ArrayList<RawEntry>();
            entries.add(entry("AUTO_ID", String.valueOf(m.autoId())));
            for (Map.Entry<String, String> flag : m.flags().entrySet()) {
                entries.add(entry(flag.getKey(), flag.getValue()));
            }
            return new RawSection<>("META", AT, entries);
        });
        var func = new RawSection<>("FUNC", AT, List.of(
            entry("NAME", program.func().name()),
            entry("PARAMS", IsuFormat.nameList(program.func().params())),
            entry("RETURNS", program.func().returnType().keyword())
        ));
        var io = new RawSection<>("IO", AT, List.of(
            entry("INPUT", IsuFormat.declarationList(program.io().inputs())),
            entry("OUTPUT", IsuFormat.declarationList(program.io().outputs()))
        ));
        var root = new RawStep(StepKind.SEQ, Optional.empty(), AT, List.of(block(StepField.BODY, program.steps().body())));
        return new RawProgram(meta, func, io, declarations("STATE", program.state()), declarations("LOCAL", program.local()), root);
    }

    static RawStep lower(Step step) {
        return step.accept(new StepVisitor<RawStep>() {
            @Override
            public RawStep visitSeq(Step.Seq s) {
                return raw(s, block(StepField.BODY, s.body()));
            }

            @Override
            public RawStep visitAssign(Step.Assign s) {
                return raw(s, name(StepField.TARGET, s.target()), expr(StepField.EXPR, s.expr()));
            }

            @Override
            public RawStep visitIf(Step.If s) {
                return raw(s, expr(StepField.COND, s.cond()), block(StepField.THEN, s.thenBranch()), block(StepField.ELSE, s.elseBranch()));
            }

            @Override
            public RawStep visitLoop(Step.Loop s) {
                return raw(
                    s,
                    name(StepField.ITER, s.iter()),
                    expr(StepField.FROM, s.from()),
                    expr(StepField.TO, s.to()),
                    block(StepField.BODY, s.body())
                );
            }

            @Override
            public RawStep visitReturn(Step.Return s) {
                return raw(s, expr(StepField.EXPR, s.expr()));
            }
        });
    }

    private static RawStep raw(Step step, RawField... fields) {
        return new RawStep(step.kind(), Optional.ofNullable(step.id()), AT, List.of(fields));
    }

    private static RawField name(StepField field, String name) {
        return new RawField(field, AT, new RawValue.Name(name, AT));
    }

    private static RawField expr(StepField field, Expr expr) {
        return new RawField(field, AT, new RawValue.Expression(expr, AT));
    }

    private static RawField block(StepField field, List<Step> steps) {
        var lowered = new ArrayList<RawStep>(steps.size());
        for (Step step : steps) {
            lowered.add(lower(step));
        }
        return new RawField(field, AT, new RawValue.Block(BlockStyle.BEGIN_END, AT, lowered));
    }

    private static RawSection<RawDecl> declarations(String name, List<Declaration> declarations) {
        var raw = new ArrayList<RawDecl>();
        for (Declaration declaration : declarations) {
            var initializer = declaration.initializer().map(IsuFormat::literal);
            raw.add(new RawDecl(declaration.name(), declaration.type().keyword(), initializer, AT, AT));
        }
        return new RawSection<>(name, AT, raw);
    }

    private static RawEntry entry(String key, String value) {
        return new RawEntry(key, value, AT, AT);
    }
}
