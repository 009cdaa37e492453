package org.pyoptimizer.model;

/**
 * Modules a rewritten script may need; the engine adds the import statement when
 * the script does not already bind the name.
 */
public enum RequiredImport {
    ITERTOOLS("itertools", null),
    NUMPY("numpy", "np"),
    FUNCTOOLS("functools", null);

    private final String module;
    private final String alias;

    RequiredImport(String module, String alias) {
        this.module = module;
        this.alias = alias;
    }

    public String module() {
        return module;
    }

    /**
     * The "as" name, or null.
     */
    public String alias() {
        return alias;
    }

    /**
     * The name the import binds.
     */
    public String boundName() {
        return alias != null ? alias : module;
    }

    public String statement() {
        return alias != null ? "import " + module + " as " + alias : "import " + module;
    }
}
