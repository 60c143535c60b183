package work.isu.core.pretty;

import java.util.List;
import java.util.Map;
import work.isu.core.model.Declaration;
import work.isu.core.model.Program;
import work.isu.core.model.Step;
import work.isu.core.model.StepVisitor;

/**
 * Renders canonical IIR as canonical Isu text: two-space indentation, {@code BEGIN}/{@code END}
 * blocks, explicit step IDs and every optional {@code FUNC} key spelled out.
 */
public final class PrettyPrinter {
    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();

    private PrettyPrinter() {}

    public static String print(Program program) {
        var printer = new PrettyPrinter();
        printer.program(program);
        return printer.out.toString();
    }

    private void program(Program program) {
        program.meta().ifPresent(meta -> {
            line(0, "META:");
            line(1, "AUTO_ID: " + meta.autoId());
            for (Map.Entry<String, String> flag : meta.flags().entrySet()) {
                line(1, flag.getKey() + ": " + flag.getValue());
            }
        });
        line(0, "FUNC:");
        line(1, "NAME: " + program.func().name());
        line(1, "PARAMS: " + IsuFormat.nameList(program.func().params()));
        line(1, "RETURNS: " + program.func().returnType().keyword());
        line(0, "IO:");
        line(1, "INPUT: " + IsuFormat.declarationList(program.io().inputs()));
        line(1, "OUTPUT: " + IsuFormat.declarationList(program.io().outputs()));
        declarations("STATE", program.state());
        declarations("LOCAL", program.local());
        line(0, "STEPS:");
        line(1, "SEQ: BEGIN");
        block(program.steps().body(), 2);
        line(1, "END");
    }

    private void declarations(String section, List<Declaration> declarations) {
        if (declarations.isEmpty()) {
            line(0, section + ": []");
            return;
        }
        line(0, section + ":");
        for (Declaration declaration : declarations) {
            line(1, "- " + IsuFormat.declaration(declaration));
        }
    }

    private void block(List<Step> steps, int depth) {
        for (Step step : steps) {
            step.accept(new StepWriter(depth));
        }
    }

    private void blockField(String field, List<Step> steps, int depth) {
        line(depth, field + ": BEGIN");
        block(steps, depth + 1);
        line(depth, "END");
    }

    private void line(int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }

    private final class StepWriter implements StepVisitor<Void> {
        private final int depth;

        StepWriter(int depth) {
            this.depth = depth;
        }

        private void header(Step step) {
            line(depth, step.id() + ": " + step.kind().keyword());
        }

        @Override
        public Void visitSeq(Step.Seq step) {
            header(step);
            blockField("BODY", step.body(), depth + 1);
            return null;
        }

        @Override
        public Void visitAssign(Step.Assign step) {
            header(step);
            line(depth + 1, "TARGET: " + step.target());
            line(depth + 1, "EXPR: " + IsuFormat.expr(step.expr()));
            return null;
        }

        @Override
        public Void visitIf(Step.If step) {
            header(step);
            line(depth + 1, "COND: " + IsuFormat.expr(step.cond()));
            blockField("THEN", step.thenBranch(), depth + 1);
            blockField("ELSE", step.elseBranch(), depth + 1);
            return null;
        }

        @Override
        public Void visitLoop(Step.Loop step) {
            header(step);
            line(depth + 1, "ITER: " + step.iter());
            line(depth + 1, "FROM: " + IsuFormat.expr(step.from()));
            line(depth + 1, "TO: " + IsuFormat.expr(step.to()));
            blockField("BODY", step.body(), depth + 1);
            return null;
        }

        @Override
        public Void visitReturn(Step.Return step) {
            header(step);
            line(depth + 1, "EXPR: " + IsuFormat.expr(step.expr()));
            return null;
        }
    }
}
