package org.pyoptimizer.astnode;

/**
 * {@code name [as asName]} in an import statement. {@code name} may be dotted
 * ({@code os.path}) or "*" for a star import.
 */
public record ImportAlias(String name, String asName) {

    /**
     * The name this alias binds in the importing scope.
     */
    public String boundName() {
        if (asName != null) {
            return asName;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
