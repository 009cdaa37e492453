package org.pyoptimizer.parser;

import org.pyoptimizer.lexer.LexerToken;
import org.pyoptimizer.lexer.LexerTokenType;

import java.util.Set;

/**
 * The TokenUtils class provides utility methods for peeking at and consuming lexer
 * tokens during parsing.
 */
public class TokenUtils {

    /**
     * Reserved words; they can never be used as plain names.
     */
    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    /**
     * Peeks at the current token without consuming it.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The current LexerToken; the final EOF token once the end is reached.
     */
    public static LexerToken peek(Parser parser) {
        return peek(parser, 0);
    }

    /**
     * Peeks ahead of the current token without consuming anything.
     */
    public static LexerToken peek(Parser parser, int offset) {
        int index = Math.min(parser.tokenIndex + offset, parser.tokens.size() - 1);
        return parser.tokens.get(index);
    }

    /**
     * Consumes the current token.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The consumed LexerToken; EOF is never consumed past.
     */
    public static LexerToken consume(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type != LexerTokenType.EOF) {
            parser.tokenIndex++;
        }
        return token;
    }

    /**
     * Consumes the current token and checks its type.
     *
     * @throws org.pyoptimizer.exception.ParseError if the token type does not match
     */
    public static LexerToken consume(Parser parser, LexerTokenType type) {
        LexerToken token = peek(parser);
        if (token.type != type) {
            throw parser.error(token, "expected " + describe(type) + " but found " + describe(token));
        }
        return consume(parser);
    }

    /**
     * Consumes the current token and checks its type and text.
     *
     * @throws org.pyoptimizer.exception.ParseError if the token does not match
     */
    public static LexerToken consume(Parser parser, LexerTokenType type, String text) {
        LexerToken token = peek(parser);
        if (!token.is(type, text)) {
            throw parser.error(token, "expected '" + text + "' but found " + describe(token));
        }
        return consume(parser);
    }

    /**
     * Consumes the current token if it is the given operator.
     */
    public static boolean consumeOperatorIf(Parser parser, String text) {
        if (peek(parser).isOperator(text)) {
            parser.tokenIndex++;
            return true;
        }
        return false;
    }

    /**
     * Consumes the current token if it is the given keyword.
     */
    public static boolean consumeKeywordIf(Parser parser, String keyword) {
        if (peek(parser).isKeyword(keyword)) {
            parser.tokenIndex++;
            return true;
        }
        return false;
    }

    public static boolean isKeyword(LexerToken token) {
        return token.type == LexerTokenType.NAME && KEYWORDS.contains(token.text);
    }

    /**
     * A NAME token usable as an identifier.
     */
    public static boolean isIdentifier(LexerToken token) {
        return token.type == LexerTokenType.NAME && !KEYWORDS.contains(token.text);
    }

    public static String consumeIdentifier(Parser parser) {
        LexerToken token = peek(parser);
        if (!isIdentifier(token)) {
            throw parser.error(token, "expected a name but found " + describe(token));
        }
        parser.tokenIndex++;
        return token.text;
    }

    /**
     * True when the token can begin an expression.
     */
    public static boolean startsExpression(LexerToken token) {
        return switch (token.type) {
            case NUMBER, STRING -> true;
            case NAME -> !isKeyword(token) || switch (token.text) {
                case "None", "True", "False", "not", "lambda", "await", "yield" -> true;
                default -> false;
            };
            case OPERATOR -> switch (token.text) {
                case "(", "[", "{", "-", "+", "~", "*", "**", "..." -> true;
                default -> false;
            };
            default -> false;
        };
    }

    public static String describe(LexerToken token) {
        return switch (token.type) {
            case EOF -> "end of file";
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            default -> "'" + token.text + "'";
        };
    }

    private static String describe(LexerTokenType type) {
        return switch (type) {
            case NAME -> "a name";
            case NEWLINE -> "end of line";
            case INDENT -> "an indented block";
            default -> type.name().toLowerCase();
        };
    }
}
