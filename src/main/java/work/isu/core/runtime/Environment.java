package work.isu.core.runtime;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.isu.core.diag.IsuRuntimeException;
import work.isu.core.diag.RuntimeFaultKind;
import work.isu.core.model.Declaration;
import work.isu.core.model.StepId;
import work.isu.core.model.ValueType;

/**
 * The single flat variable scope of one interpretation. Declared types are enforced on write.
 */
final class Environment {
    private final Map<String, ValueType> types = new HashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();

    void declare(Declaration declaration, Object value) {
        types.putIfAbsent(declaration.name(), declaration.type());
        values.putIfAbsent(declaration.name(), value);
    }

    Object get(String name, StepId stepId) {
        var value = values.get(name);
        if (value == null) {
            throw new IsuRuntimeException(RuntimeFaultKind.UNBOUND_VARIABLE, stepId, "var", List.of(name), "variable '" + name + "' is not bound");
        }
        return value;
    }

    void set(String name, Object value, StepId stepId, String operator) {
        var type = types.get(name);
        if (type == null) {
            throw new IsuRuntimeException(RuntimeFaultKind.UNBOUND_VARIABLE, stepId, operator, List.of(name), "variable '" + name + "' is not declared");
        }
        if (!Values.conforms(value, type)) {
            throw new IsuRuntimeException(
                RuntimeFaultKind.TYPE_ERROR,
                stepId,
                operator,
                List.of(name, value),
                "'" + name + "' is " + type.keyword() + " but got " + Values.typeOf(value).keyword()
            );
        }
        values.put(name, value);
    }

    Map<String, Object> snapshot(List<Declaration> declarations) {
        var snapshot = new LinkedHashMap<String, Object>();
        for (Declaration declaration : declarations) {
            snapshot.put(declaration.name(), values.get(declaration.name()));
        }
        return snapshot;
    }
}
