package org.pyoptimizer.model;

/**
 * The rewrite families, declared in priority order: when two candidate patches
 * overlap, the one whose rule comes first wins.
 */
public enum RuleKind {
    FLATTEN("flatten"),
    VECTORIZE("vectorize"),
    CACHE("cache");

    private final String optionName;

    RuleKind(String optionName) {
        this.optionName = optionName;
    }

    /**
     * The name used in configuration files and on the command line.
     */
    public String optionName() {
        return optionName;
    }

    public static RuleKind fromOptionName(String name) {
        for (RuleKind kind : values()) {
            if (kind.optionName.equalsIgnoreCase(name.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown rule '" + name + "'");
    }
}
