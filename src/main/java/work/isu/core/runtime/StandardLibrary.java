package work.isu.core.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import work.isu.core.diag.RuntimeFaultKind;
import work.isu.core.model.StdFunction;

/**
 * Implementations of the fixed standard-function registry. Every function returns a new value;
 * arguments are never mutated.
 */
public final class StandardLibrary {
    private StandardLibrary() {}

    public static FunctionRegistry register(FunctionRegistry registry) {
        registry.register(StdFunction.LEN, StandardLibrary::len);
        registry.register(StdFunction.PUSH, StandardLibrary::push);
        registry.register(StdFunction.POP, StandardLibrary::pop);
        registry.register(StdFunction.SLICE, StandardLibrary::slice);
        registry.register(StdFunction.HAS, site -> map(site, 0).containsKey(string(site, 1)));
        registry.register(StdFunction.GET, StandardLibrary::get);
        registry.register(StdFunction.SET, site -> Values.put(map(site, 0), string(site, 1), site.args().get(2)));
        registry.register(StdFunction.SPLIT, StandardLibrary::split);
        registry.register(StdFunction.JOIN, StandardLibrary::join);
        registry.register(StdFunction.LOWER, site -> string(site, 0).toLowerCase(Locale.ROOT));
        registry.register(StdFunction.ABS, StandardLibrary::abs);
        registry.register(StdFunction.MIN, site -> extreme(site, true));
        registry.register(StdFunction.MAX, site -> extreme(site, false));
        return registry;
    }

    private static Object len(CallSite site) {
        Object value = site.args().get(0);
        if (value instanceof List<?> list) {
            return (long) list.size();
        }
        if (value instanceof String text) {
            return (long) text.length();
        }
        if (value instanceof Map<?, ?> map) {
            return (long) map.size();
        }
        throw site.fault(RuntimeFaultKind.TYPE_ERROR, "LEN expects a list, string or map");
    }

    private static Object push(CallSite site) {
        return Values.append(list(site, 0), site.args().get(1));
    }

    private static Object pop(CallSite site) {
        var list = list(site, 0);
        if (list.isEmpty()) {
            throw site.fault(RuntimeFaultKind.INDEX_OUT_OF_RANGE, "POP on an empty list");
        }
        return Collections.unmodifiableList(new ArrayList<Object>(list.subList(0, list.size() - 1)));
    }

    private static Object slice(CallSite site) {
        Object value = site.args().get(0);
        long start = integer(site, 1);
        long end = integer(site, 2);
        int length;
        if (value instanceof List<?> list) {
            length = list.size();
        } else if (value instanceof String text) {
            length = text.length();
        } else {
            throw site.fault(RuntimeFaultKind.TYPE_ERROR, "SLICE expects a list or string");
        }
        if (start < 0 || end < start || end > length) {
            throw site.fault(RuntimeFaultKind.INDEX_OUT_OF_RANGE, "slice bounds outside [0, " + length + "]");
        }
        if (value instanceof String text) {
            return text.substring((int) start, (int) end);
        }
        return Collections.unmodifiableList(new ArrayList<Object>(((List<?>) value).subList((int) start, (int) end)));
    }

    private static Object get(CallSite site) {
        var map = map(site, 0);
        var key = string(site, 1);
        if (!map.containsKey(key)) {
            throw site.fault(RuntimeFaultKind.MISSING_KEY, "key '" + key + "' is not present");
        }
        return map.get(key);
    }

    private static Object split(CallSite site) {
        var text = string(site, 0);
        var separator = string(site, 1);
        if (separator.isEmpty()) {
            throw site.fault(RuntimeFaultKind.TYPE_ERROR, "SPLIT separator must not be empty");
        }
        return List.<Object>of(text.split(Pattern.quote(separator), -1));
    }

    private static Object join(CallSite site) {
        var parts = new ArrayList<String>();
        for (Object item : list(site, 0)) {
            if (!(item instanceof String text)) {
                throw site.fault(RuntimeFaultKind.TYPE_ERROR, "JOIN expects a list of strings");
            }
            parts.add(text);
        }
        return String.join(string(site, 1), parts);
    }

    private static Object abs(CallSite site) {
        long value = integer(site, 0);
        if (value == Long.MIN_VALUE) {
            throw site.fault(RuntimeFaultKind.ARITHMETIC_OVERFLOW, "ABS overflows int");
        }
        return Math.abs(value);
    }

    private static Object extreme(CallSite site, boolean min) {
        long result = integer(site, 0);
        for (int i = 1; i < site.args().size(); i++) {
            long next = integer(site, i);
            result = min ? Math.min(result, next) : Math.max(result, next);
        }
        return result;
    }

    private static List<?> list(CallSite site, int index) {
        if (site.args().get(index) instanceof List<?> list) {
            return list;
        }
        throw argumentFault(site, index, "list");
    }

    private static Map<?, ?> map(CallSite site, int index) {
        if (site.args().get(index) instanceof Map<?, ?> map) {
            return map;
        }
        throw argumentFault(site, index, "map");
    }

    private static String string(CallSite site, int index) {
        if (site.args().get(index) instanceof String text) {
            return text;
        }
        throw argumentFault(site, index, "string");
    }

    private static long integer(CallSite site, int index) {
        if (site.args().get(index) instanceof Long value) {
            return value;
        }
        throw argumentFault(site, index, "int");
    }

    private static RuntimeException argumentFault(CallSite site, int index, String expected) {
        return site.fault(
            RuntimeFaultKind.TYPE_ERROR,
            site.function().name() + " argument " + (index + 1) + " must be " + expected
        );
    }
}
