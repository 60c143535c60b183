package work.isu.core.runtime;

import java.util.List;
import work.isu.core.diag.IsuRuntimeException;
import work.isu.core.diag.RuntimeFaultKind;
import work.isu.core.model.StdFunction;
import work.isu.core.model.StepId;

/**
 * Where a standard function is being called from; used to tag faults.
 */
public record CallSite(StepId stepId, StdFunction function, List<Object> args) {
    public CallSite {
        args = List.copyOf(args);
    }

    public IsuRuntimeException fault(RuntimeFaultKind kind, String message) {
        return new IsuRuntimeException(kind, stepId, function.name(), args, message);
    }
}
