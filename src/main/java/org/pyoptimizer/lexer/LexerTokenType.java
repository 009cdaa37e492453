package org.pyoptimizer.lexer;

/**
 * Token categories produced by the {@link Lexer}.
 * <p>
 * INDENT, DEDENT and NEWLINE are synthesized from the physical layout of the source;
 * they carry the block structure that Python expresses through indentation.
 */
public enum LexerTokenType {
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
