package work.isu.core.runtime;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import work.isu.core.diag.IsuRuntimeException;
import work.isu.core.diag.RuntimeFaultKind;
import work.isu.core.model.StepId;

/**
 * Per-call execution settings: the function registry, cooperative cancellation, an optional
 * deadline and an optional budget on total loop iterations. Checked at step entry and per loop
 * iteration.
 */
public final class ExecutionContext {
    private final FunctionRegistry registry;
    private final CancellationToken cancellationToken;
    private final long deadlineNanos;
    private final long maxIterations;
    private long iterations = 0;

    public ExecutionContext() {
        this(FunctionRegistry.standard(), new CancellationToken(), null, 0);
    }

    /**
     * @param timeout wall-clock limit for the call, {@code null} for none
     * @param maxIterations total loop iterations allowed, {@code 0} for unlimited
     */
    public ExecutionContext(FunctionRegistry registry, CancellationToken token, Duration timeout, long maxIterations) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cancellationToken = token == null ? new CancellationToken() : token;
        this.deadlineNanos = timeout == null ? 0 : System.nanoTime() + Math.max(timeout.toNanos(), 1);
        this.maxIterations = Math.max(maxIterations, 0);
    }

    public FunctionRegistry registry() {
        return registry;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    public void ensureNotCancelled(StepId stepId) {
        if (cancellationToken.isCancelled()) {
            throw cancelled(stepId, "execution cancelled");
        }
        if (deadlineNanos != 0 && System.nanoTime() - deadlineNanos > 0) {
            throw cancelled(stepId, "execution timed out");
        }
    }

    void countIteration(StepId stepId) {
        iterations++;
        if (maxIterations > 0 && iterations > maxIterations) {
            throw cancelled(stepId, "loop iteration budget of " + maxIterations + " exhausted");
        }
    }

    public long iterations() {
        return iterations;
    }

    private static IsuRuntimeException cancelled(StepId stepId, String message) {
        return new IsuRuntimeException(RuntimeFaultKind.CANCELLED, stepId, "step", List.of(), message);
    }

    public static final class CancellationToken {
        private volatile boolean cancelled = false;

        public void cancel() {
            this.cancelled = true;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }
}
