package org.pyoptimizer.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import org.pyoptimizer.exception.ErrorMessageUtil;
import org.pyoptimizer.exception.ParseError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The Lexer class converts Python source text into a sequence of tokens.
 * <p>
 * Besides the usual names, numbers, strings and operators it synthesizes the layout
 * tokens that carry Python's block structure:
 * <ul>
 *   <li>NEWLINE at the end of every logical line that produced tokens,</li>
 *   <li>INDENT when a logical line is indented deeper than the enclosing block,</li>
 *   <li>DEDENT for every block closed by a shallower line (and at end of input).</li>
 * </ul>
 * Comments and blank lines produce no tokens. Physical newlines inside brackets and
 * after a backslash continuation are joined into the current logical line.
 * <p>
 * NOTE:
 * String literals are kept verbatim (prefix and quotes included) and are not decoded;
 * f-strings are opaque to the lexer, so replacement fields are never analyzed.
 */
public class Lexer {
    // Array to mark operator characters
    public static boolean[] isOperator;

    // Longest first, so that a prefix never shadows a longer operator
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", ">>", "<<", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "="
    };

    private static final int TAB_SIZE = 8;

    static {
        isOperator = new boolean[128];
        for (char c : "!%&()*+,-./:;<=>@[]^{|}~".toCharArray()) {
            isOperator[c] = true;
        }
    }

    private final String input;
    private final int length;
    private final ErrorMessageUtil errorUtil;
    private final List<LexerToken> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();

    private int position;
    private int line = 1;
    private int lineStart;
    private int parenDepth;
    private boolean atLineStart = true;
    private boolean lineHasTokens;

    public Lexer(String fileName, String input) {
        this.input = input.startsWith("\uFEFF") ? input.substring(1) : input;
        this.length = this.input.length();
        this.errorUtil = new ErrorMessageUtil(fileName, this.input);
        this.indentStack.push(0);
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    private static boolean isStringPrefix(String prefix) {
        return switch (prefix.toLowerCase()) {
            case "r", "u", "b", "f", "br", "rb", "fr", "rf" -> true;
            default -> false;
        };
    }

    /**
     * Tokenizes the whole input. The returned list always ends with a single EOF token.
     *
     * @return the token list
     * @throws ParseError on characters or layouts that are not valid Python
     */
    public List<LexerToken> tokenize() {
        while (true) {
            if (atLineStart && parenDepth == 0) {
                if (!processIndentation()) {
                    break;
                }
            }
            skipInlineWhitespace();
            if (position >= length) {
                break;
            }
            char current = input.charAt(position);
            if (current == '#') {
                skipComment();
            } else if (current == '\\') {
                consumeContinuation();
            } else if (current == '\n' || current == '\r') {
                consumeNewline();
            } else {
                tokens.add(nextToken());
                lineHasTokens = true;
            }
        }
        if (parenDepth > 0) {
            throw error(line, position - lineStart, "unexpected EOF while inside brackets");
        }
        int column = position - lineStart;
        if (lineHasTokens) {
            tokens.add(new LexerToken(LexerTokenType.NEWLINE, "", line, column, line, column));
        }
        while (indentStack.size() > 1) {
            indentStack.pop();
            tokens.add(new LexerToken(LexerTokenType.DEDENT, "", line, column, line, column));
        }
        tokens.add(new LexerToken(LexerTokenType.EOF, "", line, column, line, column));
        return tokens;
    }

    /**
     * Measures the indentation of the next non-blank line and emits INDENT/DEDENT tokens.
     *
     * @return false when only blank lines remain
     */
    private boolean processIndentation() {
        while (true) {
            int col = 0;
            int p = position;
            while (p < length) {
                char c = input.charAt(p);
                if (c == ' ') {
                    col++;
                } else if (c == '\t') {
                    col = (col / TAB_SIZE + 1) * TAB_SIZE;
                } else if (c == '\f') {
                    col = 0;
                } else {
                    break;
                }
                p++;
            }
            if (p >= length) {
                position = p;
                return false;
            }
            char c = input.charAt(p);
            if (c == '#' || c == '\n' || c == '\r') {
                // Blank or comment-only line: no layout tokens
                position = p;
                skipComment();
                if (position < length) {
                    consumeLineBreak();
                }
                continue;
            }
            position = p;
            int column = position - lineStart;
            int top = indentStack.peek();
            if (col > top) {
                indentStack.push(col);
                tokens.add(new LexerToken(LexerTokenType.INDENT, "", line, 0, line, column));
            } else {
                while (col < indentStack.peek()) {
                    indentStack.pop();
                    tokens.add(new LexerToken(LexerTokenType.DEDENT, "", line, column, line, column));
                }
                if (col != indentStack.peek()) {
                    throw error(line, column, "unindent does not match any outer indentation level");
                }
            }
            atLineStart = false;
            return true;
        }
    }

    private void skipInlineWhitespace() {
        while (position < length) {
            char c = input.charAt(position);
            if (c == ' ' || c == '\t' || c == '\f') {
                position++;
            } else {
                break;
            }
        }
    }

    private void skipComment() {
        while (position < length && input.charAt(position) != '\n' && input.charAt(position) != '\r') {
            position++;
        }
    }

    private void consumeLineBreak() {
        if (input.charAt(position) == '\r' && position + 1 < length && input.charAt(position + 1) == '\n') {
            position++;
        }
        position++;
        line++;
        lineStart = position;
    }

    private void consumeNewline() {
        int column = position - lineStart;
        if (parenDepth == 0 && lineHasTokens) {
            tokens.add(new LexerToken(LexerTokenType.NEWLINE, "\n", line, column, line, column + 1));
        }
        consumeLineBreak();
        if (parenDepth == 0) {
            atLineStart = true;
            lineHasTokens = false;
        }
    }

    private void consumeContinuation() {
        int p = position + 1;
        if (p < length && (input.charAt(p) == '\n' || input.charAt(p) == '\r')) {
            position = p;
            consumeLineBreak();
            return;
        }
        throw error(line, position - lineStart, "unexpected character after line continuation character");
    }

    private LexerToken nextToken() {
        char current = input.charAt(position);
        int codePoint = input.codePointAt(position);

        if (current == '"' || current == '\'') {
            return consumeString(position);
        }
        if (isIdentifierStart(codePoint)) {
            int prefixEnd = position;
            while (prefixEnd < length && prefixEnd - position < 2 && Character.isLetter(input.charAt(prefixEnd))) {
                prefixEnd++;
            }
            for (int end = position + 1; end <= prefixEnd; end++) {
                if (end < length && (input.charAt(end) == '"' || input.charAt(end) == '\'')
                        && isStringPrefix(input.substring(position, end))) {
                    return consumeString(end);
                }
            }
            return consumeIdentifier();
        }
        if (Character.isDigit(current)
                || (current == '.' && position + 1 < length && Character.isDigit(input.charAt(position + 1)))) {
            return consumeNumber();
        }
        if (current < 128 && isOperator[current]) {
            return consumeOperator();
        }
        throw error(line, position - lineStart, "invalid character '" + new String(Character.toChars(codePoint)) + "'");
    }

    private LexerToken consumeIdentifier() {
        int start = position;
        int column = position - lineStart;
        position += Character.charCount(input.codePointAt(position));
        while (position < length) {
            int cp = input.codePointAt(position);
            if (!isIdentifierPart(cp)) {
                break;
            }
            position += Character.charCount(cp);
        }
        return new LexerToken(LexerTokenType.NAME, input.substring(start, position), line, column, line, position - lineStart);
    }

    private LexerToken consumeNumber() {
        int start = position;
        int column = position - lineStart;
        if (input.charAt(position) == '0' && position + 1 < length
                && "xXoObB".indexOf(input.charAt(position + 1)) >= 0) {
            position += 2;
            while (position < length && (Character.isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '_')) {
                position++;
            }
        } else {
            consumeDigits();
            if (position < length && input.charAt(position) == '.') {
                position++;
                consumeDigits();
            }
            if (position < length && (input.charAt(position) == 'e' || input.charAt(position) == 'E')) {
                int mark = position;
                position++;
                if (position < length && (input.charAt(position) == '+' || input.charAt(position) == '-')) {
                    position++;
                }
                if (position < length && Character.isDigit(input.charAt(position))) {
                    consumeDigits();
                } else {
                    position = mark;
                }
            }
            if (position < length && (input.charAt(position) == 'j' || input.charAt(position) == 'J')) {
                position++;
            }
        }
        if (position < length && isIdentifierStart(input.codePointAt(position))) {
            throw error(line, column, "invalid decimal literal");
        }
        return new LexerToken(LexerTokenType.NUMBER, input.substring(start, position), line, column, line, position - lineStart);
    }

    private void consumeDigits() {
        while (position < length && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }
    }

    /**
     * Reads a string literal. {@code quoteIndex} points at the opening quote, the
     * characters between the current position and the quote are the prefix.
     */
    private LexerToken consumeString(int quoteIndex) {
        int start = position;
        int startLine = line;
        int column = position - lineStart;
        char quote = input.charAt(quoteIndex);
        boolean triple = quoteIndex + 2 < length
                && input.charAt(quoteIndex + 1) == quote && input.charAt(quoteIndex + 2) == quote;
        position = quoteIndex + (triple ? 3 : 1);
        while (true) {
            if (position >= length) {
                throw error(startLine, column, triple ? "unterminated triple-quoted string literal" : "unterminated string literal");
            }
            char c = input.charAt(position);
            if (c == '\\') {
                position++;
                if (position < length && (input.charAt(position) == '\n' || input.charAt(position) == '\r')) {
                    consumeLineBreak();
                } else {
                    position++;
                }
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw error(startLine, column, "unterminated string literal");
                }
                consumeLineBreak();
            } else if (c == quote) {
                if (!triple) {
                    position++;
                    break;
                }
                if (position + 2 < length && input.charAt(position + 1) == quote && input.charAt(position + 2) == quote) {
                    position += 3;
                    break;
                }
                position++;
            } else {
                position++;
            }
        }
        return new LexerToken(LexerTokenType.STRING, input.substring(start, position), startLine, column, line, position - lineStart);
    }

    private LexerToken consumeOperator() {
        int column = position - lineStart;
        for (String op : OPERATORS) {
            if (input.startsWith(op, position)) {
                position += op.length();
                trackBrackets(op, column);
                return new LexerToken(LexerTokenType.OPERATOR, op, line, column, line, column + op.length());
            }
        }
        throw error(line, column, "invalid syntax");
    }

    private void trackBrackets(String op, int column) {
        switch (op) {
            case "(", "[", "{" -> parenDepth++;
            case ")", "]", "}" -> {
                if (parenDepth == 0) {
                    throw error(line, column, "unmatched '" + op + "'");
                }
                parenDepth--;
            }
            default -> {
            }
        }
    }

    private ParseError error(int errorLine, int column, String message) {
        return new ParseError(errorLine, column, message, errorUtil);
    }
}
