package work.isu.core.diag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import work.isu.core.model.StepId;

/**
 * Runtime fault raised by the interpreter, tagged with the step being evaluated,
 * the operator or function involved and the offending operand values.
 */
public final class IsuRuntimeException extends IsuException {
    private final RuntimeFaultKind kind;
    private final StepId stepId;
    private final String operator;
    private final List<Object> operands;

    public IsuRuntimeException(RuntimeFaultKind kind, StepId stepId, String operator, List<?> operands, String message) {
        super(kind.code(), format(stepId, operator, operands, message));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.stepId = stepId;
        this.operator = operator;
        this.operands = operands == null ? List.of() : List.copyOf(new ArrayList<Object>(operands));
    }

    public RuntimeFaultKind kind() {
        return kind;
    }

    public StepId stepId() {
        return stepId;
    }

    public String operator() {
        return operator;
    }

    public List<Object> operands() {
        return operands;
    }

    @Override
    protected Map<String, Object> details() {
        var map = new LinkedHashMap<String, Object>();
        map.put("step", stepId == null ? null : stepId.toString());
        map.put("operator", operator);
        map.put("operands", operands);
        return map;
    }

    private static String format(StepId stepId, String operator, List<?> operands, String message) {
        String where = stepId == null ? "<entry>" : stepId.toString();
        String args = operands == null ? "" : operands.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return String.format("%s at %s (%s %s)", message, where, operator, args).trim();
    }
}
