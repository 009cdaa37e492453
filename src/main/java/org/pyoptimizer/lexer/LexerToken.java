package org.pyoptimizer.lexer;

/**
 * The LexerToken class represents a lexical token of a Python script.
 *
 * <p>Besides the type and the text of the token it keeps the position of its first
 * character and the position just after its last character, so the parser can give
 * every node a source span.</p>
 */
public class LexerToken {
    /**
     * The type of the token.
     */
    public final LexerTokenType type;

    /**
     * The text of the token, exactly as written in the source (string prefixes and
     * quotes included).
     */
    public final String text;

    /**
     * 1-based line of the first character.
     */
    public final int line;

    /**
     * 0-based column of the first character.
     */
    public final int column;

    public final int endLine;
    public final int endColumn;

    public LexerToken(LexerTokenType type, String text, int line, int column, int endLine, int endColumn) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public boolean is(LexerTokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOperator(String text) {
        return is(LexerTokenType.OPERATOR, text);
    }

    public boolean isKeyword(String keyword) {
        return is(LexerTokenType.NAME, keyword);
    }

    /**
     * Returns a string representation of the token.
     * The string representation includes the type, text and position of the token.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + ", line=" + line + ", column=" + column + '}';
    }
}
