package org.pyoptimizer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A located, classified instance of an inefficiency pattern.
 *
 * @param kind     the pattern
 * @param anchor   where it was found
 * @param evidence kind-specific details, keys from {@link Evidence}, in insertion order
 */
public record Finding(FindingKind kind, Anchor anchor, Map<String, Object> evidence) {

    public Finding {
        evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public Object get(String key) {
        return evidence.get(key);
    }

    public String getString(String key) {
        Object value = evidence.get(key);
        return value == null ? null : value.toString();
    }

    public int line() {
        return anchor.span().startLine();
    }

    @Override
    public String toString() {
        return kind + " at line " + line() + " " + evidence;
    }
}
