package org.pyoptimizer.parser;

import org.pyoptimizer.astnode.*;
import org.pyoptimizer.lexer.LexerToken;
import org.pyoptimizer.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyoptimizer.parser.ExpressionParser.*;
import static org.pyoptimizer.parser.TokenUtils.*;

/**
 * Parsing of Python statements. Compound statements own their blocks; a line of
 * simple statements separated by ';' yields several nodes.
 */
public class StatementParser {

    private StatementParser() {
    }

    /**
     * Parses one logical line, or one compound statement with all of its clauses.
     *
     * @return the statements, in source order
     */
    public static List<Node> parseStatement(Parser parser) {
        LexerToken token = peek(parser);
        if (token.isOperator("@")) {
            return List.of(parseDecorated(parser));
        }
        if (token.type == LexerTokenType.NAME) {
            switch (token.text) {
                case "if":
                    return List.of(parseIfStatement(parser, false));
                case "while":
                    return List.of(parseWhileStatement(parser));
                case "for":
                    return List.of(parseForStatement(parser, parser.tokenIndex, false));
                case "try":
                    return List.of(parseTryStatement(parser));
                case "with":
                    return List.of(parseWithStatement(parser, parser.tokenIndex, false));
                case "def":
                    return List.of(parseFunctionDef(parser, parser.tokenIndex, new ArrayList<>(), false));
                case "class":
                    return List.of(parseClassDef(parser, parser.tokenIndex, new ArrayList<>()));
                case "async":
                    return List.of(parseAsyncStatement(parser, parser.tokenIndex, new ArrayList<>()));
                default:
                    break;
            }
        }
        return parseSimpleStatementLine(parser);
    }

    private static Node parseAsyncStatement(Parser parser, int start, List<Node> decorators) {
        consume(parser, LexerTokenType.NAME, "async");
        LexerToken token = peek(parser);
        if (token.isKeyword("def")) {
            return parseFunctionDef(parser, start, decorators, true);
        }
        if (!decorators.isEmpty()) {
            throw parser.error(token, "expected 'def' after decorators");
        }
        if (token.isKeyword("for")) {
            return parseForStatement(parser, start, true);
        }
        if (token.isKeyword("with")) {
            return parseWithStatement(parser, start, true);
        }
        throw parser.error(token, "invalid syntax after 'async'");
    }

    /**
     * Parses the block after a compound statement header, starting at the ':'.
     * Either an indented suite or simple statements on the same line.
     */
    public static BlockNode parseBlock(Parser parser) {
        consume(parser, LexerTokenType.OPERATOR, ":");
        int start = parser.tokenIndex;
        List<Node> statements = new ArrayList<>();
        if (peek(parser).type != LexerTokenType.NEWLINE) {
            statements.addAll(parseSimpleStatementLine(parser));
            return parser.finish(new BlockNode(statements), start);
        }
        consume(parser, LexerTokenType.NEWLINE);
        consume(parser, LexerTokenType.INDENT);
        while (peek(parser).type != LexerTokenType.DEDENT && peek(parser).type != LexerTokenType.EOF) {
            statements.addAll(parseStatement(parser));
        }
        BlockNode block = parser.finish(new BlockNode(statements), start);
        consume(parser, LexerTokenType.DEDENT);
        return block;
    }

    // ---------- compound statements ----------

    public static Node parseIfStatement(Parser parser, boolean isElif) {
        int start = parser.tokenIndex;
        consume(parser);
        Node condition = parseNamedExpression(parser);
        BlockNode thenBlock = parseBlock(parser);
        BlockNode elseBlock = null;
        LexerToken token = peek(parser);
        if (token.isKeyword("elif")) {
            int elifStart = parser.tokenIndex;
            Node elif = parseIfStatement(parser, true);
            List<Node> elements = new ArrayList<>();
            elements.add(elif);
            elseBlock = parser.finish(new BlockNode(elements), elifStart);
        } else if (token.isKeyword("else")) {
            consume(parser);
            elseBlock = parseBlock(parser);
        }
        return parser.finish(new IfNode(condition, thenBlock, elseBlock, isElif), start);
    }

    public static Node parseWhileStatement(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.NAME, "while");
        Node condition = parseNamedExpression(parser);
        BlockNode body = parseBlock(parser);
        BlockNode elseBlock = parseOptionalElse(parser);
        return parser.finish(new WhileNode(condition, body, elseBlock), start);
    }

    public static Node parseForStatement(Parser parser, int start, boolean isAsync) {
        consume(parser, LexerTokenType.NAME, "for");
        Node target = parseTargetList(parser);
        consume(parser, LexerTokenType.NAME, "in");
        Node iterable = parseExpressionList(parser, true);
        BlockNode body = parseBlock(parser);
        BlockNode elseBlock = parseOptionalElse(parser);
        return parser.finish(new ForNode(target, iterable, body, elseBlock, isAsync), start);
    }

    private static BlockNode parseOptionalElse(Parser parser) {
        if (consumeKeywordIf(parser, "else")) {
            return parseBlock(parser);
        }
        return null;
    }

    public static Node parseTryStatement(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.NAME, "try");
        BlockNode body = parseBlock(parser);
        List<ExceptHandler> handlers = new ArrayList<>();
        while (peek(parser).isKeyword("except")) {
            consume(parser);
            boolean isGroup = consumeOperatorIf(parser, "*");
            Node type = null;
            String name = null;
            if (!peek(parser).isOperator(":")) {
                type = parseTest(parser);
                if (consumeKeywordIf(parser, "as")) {
                    name = consumeIdentifier(parser);
                }
            }
            handlers.add(new ExceptHandler(type, name, parseBlock(parser), isGroup));
        }
        BlockNode elseBlock = null;
        if (!handlers.isEmpty()) {
            elseBlock = parseOptionalElse(parser);
        }
        BlockNode finallyBlock = null;
        if (consumeKeywordIf(parser, "finally")) {
            finallyBlock = parseBlock(parser);
        }
        if (handlers.isEmpty() && finallyBlock == null) {
            throw parser.error(peek(parser), "expected 'except' or 'finally' block");
        }
        return parser.finish(new TryNode(body, handlers, elseBlock, finallyBlock), start);
    }

    public static Node parseWithStatement(Parser parser, int start, boolean isAsync) {
        consume(parser, LexerTokenType.NAME, "with");
        List<WithItem> items = new ArrayList<>();
        boolean parenthesized = peek(parser).isOperator("(") && isParenthesizedWithItems(parser);
        if (parenthesized) {
            consume(parser);
        }
        while (true) {
            Node context = parseTest(parser);
            Node target = null;
            if (consumeKeywordIf(parser, "as")) {
                target = parseTarget(parser);
            }
            items.add(new WithItem(context, target));
            if (!consumeOperatorIf(parser, ",")) {
                break;
            }
            if (parenthesized && peek(parser).isOperator(")")) {
                break;
            }
        }
        if (parenthesized) {
            consume(parser, LexerTokenType.OPERATOR, ")");
        }
        BlockNode body = parseBlock(parser);
        return parser.finish(new WithNode(items, body, isAsync), start);
    }

    private static Node parseTarget(Parser parser) {
        if (peek(parser).isOperator("(") || peek(parser).isOperator("[")) {
            return parseAtom(parser);
        }
        return parseTargetList(parser);
    }

    /**
     * {@code with (a as b, c as d):} as opposed to {@code with (a, b) as c:} or
     * {@code with (yield x):}. The opening parenthesis groups items when the matching
     * closing one is directly followed by the block colon and an {@code as} or a comma
     * appears at depth one.
     */
    private static boolean isParenthesizedWithItems(Parser parser) {
        int depth = 0;
        boolean separatorAtTop = false;
        for (int i = parser.tokenIndex; i < parser.tokens.size(); i++) {
            LexerToken token = parser.tokens.get(i);
            if (token.type == LexerTokenType.OPERATOR) {
                switch (token.text) {
                    case "(", "[", "{" -> depth++;
                    case ")", "]", "}" -> {
                        depth--;
                        if (depth == 0) {
                            return separatorAtTop && parser.tokens.get(i + 1).isOperator(":");
                        }
                    }
                    case "," -> separatorAtTop |= depth == 1;
                    default -> {
                    }
                }
            } else if (token.isKeyword("as") && depth == 1) {
                separatorAtTop = true;
            } else if (token.type == LexerTokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    private static Node parseDecorated(Parser parser) {
        int start = parser.tokenIndex;
        List<Node> decorators = new ArrayList<>();
        while (consumeOperatorIf(parser, "@")) {
            decorators.add(parseNamedExpression(parser));
            consume(parser, LexerTokenType.NEWLINE);
        }
        LexerToken token = peek(parser);
        if (token.isKeyword("def")) {
            return parseFunctionDef(parser, start, decorators, false);
        }
        if (token.isKeyword("class")) {
            return parseClassDef(parser, start, decorators);
        }
        if (token.isKeyword("async")) {
            return parseAsyncStatement(parser, start, decorators);
        }
        throw parser.error(token, "expected 'def' or 'class' after decorators");
    }

    public static Node parseFunctionDef(Parser parser, int start, List<Node> decorators, boolean isAsync) {
        consume(parser, LexerTokenType.NAME, "def");
        String name = consumeIdentifier(parser);
        consume(parser, LexerTokenType.OPERATOR, "(");
        ParameterList parameters = parseParameters(parser, ")", true);
        consume(parser, LexerTokenType.OPERATOR, ")");
        Node returns = null;
        if (consumeOperatorIf(parser, "->")) {
            returns = parseTest(parser);
        }
        LexerToken colon = peek(parser);
        SourceSpan headerSpan = parser.spanFrom(start).withEnd(colon.endLine, colon.endColumn);
        BlockNode body = parseBlock(parser);
        FunctionDefNode node = parser.finish(new FunctionDefNode(name, parameters, returns, body, decorators, isAsync), start);
        node.headerSpan = headerSpan;
        return node;
    }

    public static Node parseClassDef(Parser parser, int start, List<Node> decorators) {
        consume(parser, LexerTokenType.NAME, "class");
        String name = consumeIdentifier(parser);
        List<Node> bases = new ArrayList<>();
        if (consumeOperatorIf(parser, "(")) {
            bases = parseArguments(parser);
            consume(parser, LexerTokenType.OPERATOR, ")");
        }
        BlockNode body = parseBlock(parser);
        return parser.finish(new ClassDefNode(name, bases, body, decorators), start);
    }

    /**
     * Parses parameters up to (not including) the terminator: ")" for a def, ":"
     * for a lambda.
     */
    public static ParameterList parseParameters(Parser parser, String terminator, boolean allowAnnotations) {
        List<Parameter> parameters = new ArrayList<>();
        boolean keywordOnly = false;
        while (!peek(parser).isOperator(terminator)) {
            LexerToken token = peek(parser);
            if (consumeOperatorIf(parser, "/")) {
                parameters.add(new Parameter(Parameter.Kind.POSITIONAL_ONLY_MARKER, null, null, null));
            } else if (consumeOperatorIf(parser, "**")) {
                String name = consumeIdentifier(parser);
                parameters.add(new Parameter(Parameter.Kind.VAR_KEYWORD, name, parseAnnotation(parser, allowAnnotations), null));
            } else if (consumeOperatorIf(parser, "*")) {
                keywordOnly = true;
                if (isIdentifier(peek(parser))) {
                    String name = consumeIdentifier(parser);
                    parameters.add(new Parameter(Parameter.Kind.VAR_POSITIONAL, name, parseAnnotation(parser, allowAnnotations), null));
                } else {
                    parameters.add(new Parameter(Parameter.Kind.VAR_POSITIONAL, null, null, null));
                }
            } else if (isIdentifier(token)) {
                String name = consumeIdentifier(parser);
                Node annotation = parseAnnotation(parser, allowAnnotations);
                Node defaultValue = null;
                if (consumeOperatorIf(parser, "=")) {
                    defaultValue = parseTest(parser);
                }
                Parameter.Kind kind = keywordOnly ? Parameter.Kind.KEYWORD_ONLY : Parameter.Kind.POSITIONAL;
                parameters.add(new Parameter(kind, name, annotation, defaultValue));
            } else {
                throw parser.error(token, "invalid syntax in parameter list, unexpected " + describe(token));
            }
            if (!consumeOperatorIf(parser, ",")) {
                break;
            }
        }
        return new ParameterList(parameters);
    }

    private static Node parseAnnotation(Parser parser, boolean allowAnnotations) {
        if (allowAnnotations && consumeOperatorIf(parser, ":")) {
            return parseTest(parser);
        }
        return null;
    }

    // ---------- simple statements ----------

    /**
     * Simple statements separated by ';' up to and including the NEWLINE.
     */
    private static List<Node> parseSimpleStatementLine(Parser parser) {
        List<Node> statements = new ArrayList<>();
        statements.add(parseSimpleStatement(parser));
        while (consumeOperatorIf(parser, ";")) {
            if (peek(parser).type == LexerTokenType.NEWLINE) {
                break;
            }
            statements.add(parseSimpleStatement(parser));
        }
        LexerToken token = peek(parser);
        if (token.type != LexerTokenType.NEWLINE && token.type != LexerTokenType.EOF) {
            throw parser.error(token, "invalid syntax, unexpected " + describe(token));
        }
        consume(parser);
        return statements;
    }

    private static Node parseSimpleStatement(Parser parser) {
        int start = parser.tokenIndex;
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.NAME) {
            switch (token.text) {
                case "pass", "break", "continue" -> {
                    consume(parser);
                    return parser.finish(new ControlStatementNode(token.text), start);
                }
                case "return" -> {
                    consume(parser);
                    Node value = startsExpression(peek(parser)) ? parseExpressionList(parser, true) : null;
                    return parser.finish(new ReturnNode(value), start);
                }
                case "raise" -> {
                    consume(parser);
                    Node exception = null;
                    Node cause = null;
                    if (startsExpression(peek(parser))) {
                        exception = parseTest(parser);
                        if (consumeKeywordIf(parser, "from")) {
                            cause = parseTest(parser);
                        }
                    }
                    return parser.finish(new RaiseNode(exception, cause), start);
                }
                case "global", "nonlocal" -> {
                    consume(parser);
                    List<String> names = new ArrayList<>();
                    do {
                        names.add(consumeIdentifier(parser));
                    } while (consumeOperatorIf(parser, ","));
                    return parser.finish(new GlobalNode(token.text, names), start);
                }
                case "del" -> {
                    consume(parser);
                    List<Node> targets = parseTargetElements(parser);
                    return parser.finish(new DeleteNode(targets), start);
                }
                case "assert" -> {
                    consume(parser);
                    Node test = parseTest(parser);
                    Node message = consumeOperatorIf(parser, ",") ? parseTest(parser) : null;
                    return parser.finish(new AssertNode(test, message), start);
                }
                case "import" -> {
                    return parseImport(parser);
                }
                case "from" -> {
                    return parseImportFrom(parser);
                }
                default -> {
                }
            }
        }
        return parseExpressionStatement(parser);
    }

    private static Node parseExpressionStatement(Parser parser) {
        int start = parser.tokenIndex;
        Node first = parseExpressionOrYield(parser);
        LexerToken token = peek(parser);
        if (token.isOperator("=")) {
            List<Node> targets = new ArrayList<>();
            Node value = first;
            while (consumeOperatorIf(parser, "=")) {
                checkTarget(parser, value, token);
                targets.add(value);
                value = parseExpressionOrYield(parser);
            }
            return parser.finish(new AssignNode(targets, value), start);
        }
        if (token.type == LexerTokenType.OPERATOR && token.text.length() >= 2 && token.text.endsWith("=")
                && !token.text.equals("==") && !token.text.equals("<=") && !token.text.equals(">=")
                && !token.text.equals("!=")) {
            consume(parser);
            checkTarget(parser, first, token);
            Node value = parseExpressionOrYield(parser);
            String operator = token.text.substring(0, token.text.length() - 1);
            return parser.finish(new AugAssignNode(first, operator, value), start);
        }
        if (token.isOperator(":")) {
            consume(parser);
            Node annotation = parseTest(parser);
            Node value = null;
            if (consumeOperatorIf(parser, "=")) {
                value = parseExpressionOrYield(parser);
            }
            return parser.finish(new AnnAssignNode(first, annotation, value), start);
        }
        return parser.finish(new ExpressionStatementNode(first), start);
    }

    private static Node parseExpressionOrYield(Parser parser) {
        if (peek(parser).isKeyword("yield")) {
            return parseYield(parser);
        }
        return parseExpressionList(parser, true);
    }

    private static void checkTarget(Parser parser, Node target, LexerToken operator) {
        if (target instanceof IdentifierNode || target instanceof AttributeNode || target instanceof SubscriptNode) {
            return;
        }
        if (target instanceof StarredNode starred) {
            checkTarget(parser, starred.value, operator);
            return;
        }
        if (!operator.isOperator("=")) {
            throw parser.error(operator, "illegal expression for augmented assignment");
        }
        if (target instanceof TupleNode tuple) {
            tuple.elements.forEach(element -> checkTarget(parser, element, operator));
        } else if (target instanceof ListLiteralNode list) {
            list.elements.forEach(element -> checkTarget(parser, element, operator));
        } else {
            throw parser.error(operator, "cannot assign to expression");
        }
    }

    private static String parseDottedName(Parser parser) {
        StringBuilder name = new StringBuilder(consume(parser, LexerTokenType.NAME).text);
        while (consumeOperatorIf(parser, ".")) {
            name.append('.').append(consume(parser, LexerTokenType.NAME).text);
        }
        return name.toString();
    }

    private static Node parseImport(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.NAME, "import");
        List<ImportAlias> names = new ArrayList<>();
        do {
            String name = parseDottedName(parser);
            String asName = consumeKeywordIf(parser, "as") ? consumeIdentifier(parser) : null;
            names.add(new ImportAlias(name, asName));
        } while (consumeOperatorIf(parser, ","));
        return parser.finish(new ImportNode(names), start);
    }

    private static Node parseImportFrom(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.NAME, "from");
        int level = 0;
        while (true) {
            if (consumeOperatorIf(parser, ".")) {
                level++;
            } else if (consumeOperatorIf(parser, "...")) {
                level += 3;
            } else {
                break;
            }
        }
        String module = null;
        if (!peek(parser).isKeyword("import")) {
            module = parseDottedName(parser);
        } else if (level == 0) {
            throw parser.error(peek(parser), "expected a module name");
        }
        consume(parser, LexerTokenType.NAME, "import");
        List<ImportAlias> names = new ArrayList<>();
        if (consumeOperatorIf(parser, "*")) {
            names.add(new ImportAlias("*", null));
        } else {
            boolean parenthesized = consumeOperatorIf(parser, "(");
            do {
                if (parenthesized && peek(parser).isOperator(")")) {
                    break;
                }
                String name = consumeIdentifier(parser);
                String asName = consumeKeywordIf(parser, "as") ? consumeIdentifier(parser) : null;
                names.add(new ImportAlias(name, asName));
            } while (consumeOperatorIf(parser, ","));
            if (parenthesized) {
                consume(parser, LexerTokenType.OPERATOR, ")");
            }
        }
        return parser.finish(new ImportFromNode(module, level, names), start);
    }
}
