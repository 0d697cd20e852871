package io.gridsync.core.normalize;

import io.gridsync.core.model.JsonNodes;
import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.OptionValue;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structural comparison of option bags.
 *
 * <p>
 * Values are compared by their persistable JSON form: object key order is ignored and numbers
 * compare by value, so {@code 30} equals {@code 30.0}. Function-bearing values compare by their
 * data and inputs, never by function identity.
 */
public final class OptionDelta {

    private OptionDelta() {}

    /**
     * Returns the option names whose value differs between {@code current} and {@code baseline},
     * including names present in only one of them. Result order: {@code current}'s names first,
     * then names only in {@code baseline}.
     */
    public static Set<String> between(OptionBag current, OptionBag baseline) {
        Set<String> delta = new LinkedHashSet<>();
        current.forEach((name, value) -> {
            if (!sameValue(value, baseline.get(name))) {
                delta.add(name);
            }
        });
        for (String name : baseline.names()) {
            if (!current.contains(name)) {
                delta.add(name);
            }
        }
        return delta;
    }

    /** Structural equality of two option values; {@code null} equals only {@code null}. */
    public static boolean sameValue(OptionValue a, OptionValue b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof OptionValue.FunctionRef || b instanceof OptionValue.FunctionRef) {
            return a.equals(b);
        }
        return JsonNodes.structurallyEqual(a.toJson(), b.toJson());
    }
}
