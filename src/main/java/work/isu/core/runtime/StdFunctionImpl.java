package work.isu.core.runtime;

/**
 * Implementation bound to one {@link work.isu.core.model.StdFunction} entry.
 */
@FunctionalInterface
public interface StdFunctionImpl {
    Object invoke(CallSite site);
}
