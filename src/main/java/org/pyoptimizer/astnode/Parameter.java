package org.pyoptimizer.astnode;

/**
 * One entry of a parameter list.
 *
 * @param kind         what kind of parameter this is
 * @param name         the parameter name, null for the bare {@code *} and {@code /} markers
 * @param annotation   the annotation expression or null
 * @param defaultValue the default expression or null
 */
public record Parameter(Kind kind, String name, Node annotation, Node defaultValue) {

    public enum Kind {
        POSITIONAL,
        /**
         * The {@code /} marker ending positional-only parameters.
         */
        POSITIONAL_ONLY_MARKER,
        /**
         * {@code *args}, or the bare {@code *} when the name is null.
         */
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD
    }
}
