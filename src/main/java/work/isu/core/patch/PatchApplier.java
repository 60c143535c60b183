package work.isu.core.patch;

import java.util.List;
import work.isu.core.canon.Canonicalizer;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.diag.StaticError;
import work.isu.core.diag.StaticErrorKind;
import work.isu.core.model.Program;
import work.isu.core.model.StepId;
import work.isu.core.model.StepTree;
import work.isu.core.parse.IsuParser;
import work.isu.core.parse.RawStep;
import work.isu.core.pretty.PrettyPrinter;
import work.isu.core.validate.Validator;

/**
 * Replaces one step's subtree with a freshly parsed fragment. All-or-nothing: on any failure an
 * exception is thrown and the caller's program is untouched, since programs are immutable.
 */
public final class PatchApplier {
    private PatchApplier() {}

    /**
     * @throws IsuStaticException if the target is unknown, the fragment's IDs disagree with the
     *     splice point, or the patched program fails validation (all errors included)
     * @throws IsuParseException if the fragment does not parse
     */
    public static PatchOutcome apply(Program program, StepId target, String fragmentText) {
        requireTarget(program, target);
        return splice(program, target, IsuParser.parseFragment(fragmentText));
    }

    /** Parses a {@code PATCH} / {@code REPLACE} block and applies it. */
    public static PatchOutcome applyCommand(Program program, String patchText) {
        var directive = IsuParser.parsePatch(patchText);
        requireTarget(program, directive.target());
        return splice(program, directive.target(), directive.replacement());
    }

    private static void requireTarget(Program program, StepId target) {
        if (program.findStep(target).isEmpty()) {
            throw new IsuStaticException(StaticError.at(
                StaticErrorKind.UNRESOLVED_STEP_REF,
                target,
                "patch target " + target + " does not exist"
            ));
        }
    }

    private static PatchOutcome splice(Program program, StepId target, RawStep fragment) {
        var replacement = Canonicalizer.canonicalizeFragment(fragment, target);
        var root = StepTree.replace(program.steps(), target, replacement)
            .orElseThrow(() -> new IllegalStateException("Target vanished during splice: " + target));
        var patched = program.withSteps(root);
        List<StaticError> errors = Validator.validate(patched);
        if (!errors.isEmpty()) {
            throw new IsuStaticException(errors);
        }
        return new PatchOutcome(patched, PrettyPrinter.print(patched));
    }
}
