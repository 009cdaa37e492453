package org.pyoptimizer.parser;

import org.pyoptimizer.astnode.*;
import org.pyoptimizer.lexer.LexerToken;
import org.pyoptimizer.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyoptimizer.parser.TokenUtils.*;

/**
 * Recursive-descent parsing of Python expressions, one method per precedence level,
 * from the loosest ({@link #parseExpressionList}) to the tightest ({@link #parseAtom}).
 */
public class ExpressionParser {

    private ExpressionParser() {
    }

    /**
     * Parses a comma separated expression list, as found on either side of an
     * assignment, after {@code return}, or in an expression statement. More than one
     * element (or a trailing comma) yields a bare {@link TupleNode}.
     */
    public static Node parseExpressionList(Parser parser, boolean allowStarred) {
        int start = parser.tokenIndex;
        Node first = parseListElement(parser, allowStarred);
        if (!peek(parser).isOperator(",")) {
            return first;
        }
        List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (consumeOperatorIf(parser, ",")) {
            if (!startsExpression(peek(parser))) {
                break;
            }
            elements.add(parseListElement(parser, allowStarred));
        }
        return parser.finish(new TupleNode(elements), start);
    }

    private static Node parseListElement(Parser parser, boolean allowStarred) {
        if (allowStarred && peek(parser).isOperator("*")) {
            return parseStarred(parser);
        }
        return parseNamedExpression(parser);
    }

    private static Node parseStarred(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.OPERATOR, "*");
        Node value = parseBitOr(parser);
        return parser.finish(new StarredNode("*", value), start);
    }

    /**
     * Targets of {@code for} loops and comprehension clauses. They are parsed at the
     * bitwise-or level so that the following {@code in} is not taken as a comparison.
     */
    public static Node parseTargetList(Parser parser) {
        int start = parser.tokenIndex;
        Node first = parseTarget(parser);
        if (!peek(parser).isOperator(",")) {
            return first;
        }
        List<Node> elements = new ArrayList<>();
        elements.add(first);
        elements.addAll(parseMoreTargets(parser));
        return parser.finish(new TupleNode(elements), start);
    }

    /**
     * Comma separated targets as a plain list, as in {@code del a, b[0]}.
     */
    public static List<Node> parseTargetElements(Parser parser) {
        List<Node> elements = new ArrayList<>();
        elements.add(parseTarget(parser));
        elements.addAll(parseMoreTargets(parser));
        return elements;
    }

    private static List<Node> parseMoreTargets(Parser parser) {
        List<Node> elements = new ArrayList<>();
        while (consumeOperatorIf(parser, ",")) {
            if (peek(parser).isKeyword("in") || !startsExpression(peek(parser))) {
                break;
            }
            elements.add(parseTarget(parser));
        }
        return elements;
    }

    private static Node parseTarget(Parser parser) {
        if (peek(parser).isOperator("*")) {
            return parseStarred(parser);
        }
        return parseBitOr(parser);
    }

    /**
     * namedexpr_test: {@code test [':=' test]}
     */
    public static Node parseNamedExpression(Parser parser) {
        int start = parser.tokenIndex;
        Node expression = parseTest(parser);
        if (peek(parser).isOperator(":=")) {
            LexerToken operator = consume(parser);
            if (!(expression instanceof IdentifierNode target)) {
                throw parser.error(operator, "cannot use assignment expressions with this target");
            }
            Node value = parseTest(parser);
            return parser.finish(new NamedExpressionNode(target, value), start);
        }
        return expression;
    }

    /**
     * test: {@code or_test ['if' or_test 'else' test] | lambdef}
     */
    public static Node parseTest(Parser parser) {
        if (peek(parser).isKeyword("lambda")) {
            return parseLambda(parser, true);
        }
        int start = parser.tokenIndex;
        Node expression = parseOrTest(parser);
        if (peek(parser).isKeyword("if")) {
            consume(parser);
            Node condition = parseOrTest(parser);
            consume(parser, LexerTokenType.NAME, "else");
            Node falseExpr = parseTest(parser);
            return parser.finish(new TernaryOperatorNode(condition, expression, falseExpr), start);
        }
        return expression;
    }

    /**
     * The restricted test of comprehension filters, where a conditional expression
     * would be ambiguous.
     */
    private static Node parseTestNoCondition(Parser parser) {
        if (peek(parser).isKeyword("lambda")) {
            return parseLambda(parser, false);
        }
        return parseOrTest(parser);
    }

    private static Node parseLambda(Parser parser, boolean allowConditional) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.NAME, "lambda");
        ParameterList parameters = StatementParser.parseParameters(parser, ":", false);
        consume(parser, LexerTokenType.OPERATOR, ":");
        Node body = allowConditional ? parseTest(parser) : parseTestNoCondition(parser);
        return parser.finish(new LambdaNode(parameters, body), start);
    }

    public static Node parseOrTest(Parser parser) {
        int start = parser.tokenIndex;
        Node left = parseAndTest(parser);
        while (peek(parser).isKeyword("or")) {
            consume(parser);
            Node right = parseAndTest(parser);
            left = parser.finish(new BinaryOperatorNode("or", left, right), start);
        }
        return left;
    }

    private static Node parseAndTest(Parser parser) {
        int start = parser.tokenIndex;
        Node left = parseNotTest(parser);
        while (peek(parser).isKeyword("and")) {
            consume(parser);
            Node right = parseNotTest(parser);
            left = parser.finish(new BinaryOperatorNode("and", left, right), start);
        }
        return left;
    }

    private static Node parseNotTest(Parser parser) {
        if (peek(parser).isKeyword("not")) {
            int start = parser.tokenIndex;
            consume(parser);
            Node operand = parseNotTest(parser);
            return parser.finish(new OperatorNode("not", operand), start);
        }
        return parseComparison(parser);
    }

    private static String comparisonOperator(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.OPERATOR) {
            return switch (token.text) {
                case "<", ">", "==", ">=", "<=", "!=" -> token.text;
                default -> null;
            };
        }
        if (token.isKeyword("in")) {
            return "in";
        }
        if (token.isKeyword("not") && peek(parser, 1).isKeyword("in")) {
            return "not in";
        }
        if (token.isKeyword("is")) {
            return peek(parser, 1).isKeyword("not") ? "is not" : "is";
        }
        return null;
    }

    private static Node parseComparison(Parser parser) {
        int start = parser.tokenIndex;
        Node left = parseBitOr(parser);
        List<String> operators = new ArrayList<>();
        List<Node> comparators = new ArrayList<>();
        String operator;
        while ((operator = comparisonOperator(parser)) != null) {
            parser.tokenIndex += operator.contains(" ") ? 2 : 1;
            operators.add(operator);
            comparators.add(parseBitOr(parser));
        }
        if (operators.isEmpty()) {
            return left;
        }
        return parser.finish(new CompareNode(left, operators, comparators), start);
    }

    private static Node parseBitOr(Parser parser) {
        return parseBinary(parser, 0);
    }

    private static final String[][] BINARY_LEVELS = {
            {"|"},
            {"^"},
            {"&"},
            {"<<", ">>"},
            {"+", "-"},
            {"*", "/", "//", "%", "@"},
    };

    private static String binaryOperatorAt(Parser parser, int level) {
        LexerToken token = peek(parser);
        if (token.type != LexerTokenType.OPERATOR) {
            return null;
        }
        for (String operator : BINARY_LEVELS[level]) {
            if (operator.equals(token.text)) {
                return operator;
            }
        }
        return null;
    }

    /**
     * Left-associative binary operators, one table row per precedence level.
     */
    private static Node parseBinary(Parser parser, int level) {
        if (level == BINARY_LEVELS.length) {
            return parseFactor(parser);
        }
        int start = parser.tokenIndex;
        Node left = parseBinary(parser, level + 1);
        String operator;
        while ((operator = binaryOperatorAt(parser, level)) != null) {
            consume(parser);
            Node right = parseBinary(parser, level + 1);
            left = parser.finish(new BinaryOperatorNode(operator, left, right), start);
        }
        return left;
    }

    private static Node parseFactor(Parser parser) {
        LexerToken token = peek(parser);
        if (token.isOperator("-") || token.isOperator("+") || token.isOperator("~")) {
            int start = parser.tokenIndex;
            consume(parser);
            Node operand = parseFactor(parser);
            return parser.finish(new OperatorNode(token.text, operand), start);
        }
        return parsePower(parser);
    }

    private static Node parsePower(Parser parser) {
        int start = parser.tokenIndex;
        Node base = parseAwait(parser);
        if (peek(parser).isOperator("**")) {
            consume(parser);
            Node exponent = parseFactor(parser);
            return parser.finish(new BinaryOperatorNode("**", base, exponent), start);
        }
        return base;
    }

    private static Node parseAwait(Parser parser) {
        if (peek(parser).isKeyword("await")) {
            int start = parser.tokenIndex;
            consume(parser);
            Node operand = parsePrimary(parser);
            return parser.finish(new OperatorNode("await", operand), start);
        }
        return parsePrimary(parser);
    }

    /**
     * An atom followed by any number of calls, subscripts and attribute accesses.
     */
    private static Node parsePrimary(Parser parser) {
        int start = parser.tokenIndex;
        Node node = parseAtom(parser);
        while (true) {
            LexerToken token = peek(parser);
            if (token.isOperator("(")) {
                consume(parser);
                List<Node> arguments = parseArguments(parser);
                consume(parser, LexerTokenType.OPERATOR, ")");
                node = parser.finish(new CallNode(node, arguments), start);
            } else if (token.isOperator("[")) {
                consume(parser);
                Node index = parseSubscriptList(parser);
                consume(parser, LexerTokenType.OPERATOR, "]");
                node = parser.finish(new SubscriptNode(node, index), start);
            } else if (token.isOperator(".")) {
                consume(parser);
                String attribute = consume(parser, LexerTokenType.NAME).text;
                node = parser.finish(new AttributeNode(node, attribute), start);
            } else {
                return node;
            }
        }
    }

    /**
     * Call arguments up to (not including) the closing parenthesis.
     */
    public static List<Node> parseArguments(Parser parser) {
        List<Node> arguments = new ArrayList<>();
        while (!peek(parser).isOperator(")")) {
            int start = parser.tokenIndex;
            LexerToken token = peek(parser);
            if (token.isOperator("*") || token.isOperator("**")) {
                consume(parser);
                Node value = parseTest(parser);
                arguments.add(parser.finish(new StarredNode(token.text, value), start));
            } else if (isIdentifier(token) && peek(parser, 1).isOperator("=")) {
                consume(parser);
                consume(parser);
                Node value = parseTest(parser);
                arguments.add(parser.finish(new KeywordArgumentNode(token.text, value), start));
            } else {
                Node value = parseNamedExpression(parser);
                if (peek(parser).isKeyword("for") || (peek(parser).isKeyword("async") && peek(parser, 1).isKeyword("for"))) {
                    List<ComprehensionClause> clauses = parseComprehensionClauses(parser);
                    value = parser.finish(new ComprehensionNode(ComprehensionNode.Kind.GENERATOR, value, null, clauses), start);
                }
                arguments.add(value);
            }
            if (!consumeOperatorIf(parser, ",")) {
                break;
            }
        }
        return arguments;
    }

    private static Node parseSubscriptList(Parser parser) {
        int start = parser.tokenIndex;
        Node first = parseSubscript(parser);
        if (!peek(parser).isOperator(",")) {
            return first;
        }
        List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (consumeOperatorIf(parser, ",")) {
            if (peek(parser).isOperator("]")) {
                break;
            }
            elements.add(parseSubscript(parser));
        }
        return parser.finish(new TupleNode(elements), start);
    }

    private static Node parseSubscript(Parser parser) {
        int start = parser.tokenIndex;
        if (peek(parser).isOperator("*")) {
            return parseStarred(parser);
        }
        Node lower = null;
        if (!peek(parser).isOperator(":")) {
            lower = parseNamedExpression(parser);
            if (!peek(parser).isOperator(":")) {
                return lower;
            }
        }
        consume(parser, LexerTokenType.OPERATOR, ":");
        Node upper = null;
        if (startsExpression(peek(parser))) {
            upper = parseTest(parser);
        }
        Node step = null;
        boolean hasStepColon = false;
        if (consumeOperatorIf(parser, ":")) {
            hasStepColon = true;
            if (startsExpression(peek(parser))) {
                step = parseTest(parser);
            }
        }
        return parser.finish(new SliceNode(lower, upper, step, hasStepColon), start);
    }

    private static List<ComprehensionClause> parseComprehensionClauses(Parser parser) {
        List<ComprehensionClause> clauses = new ArrayList<>();
        while (true) {
            boolean isAsync = false;
            if (peek(parser).isKeyword("async") && peek(parser, 1).isKeyword("for")) {
                consume(parser);
                isAsync = true;
            } else if (!peek(parser).isKeyword("for")) {
                break;
            }
            consume(parser, LexerTokenType.NAME, "for");
            Node target = parseTargetList(parser);
            consume(parser, LexerTokenType.NAME, "in");
            Node iterable = parseOrTest(parser);
            List<Node> conditions = new ArrayList<>();
            while (consumeKeywordIf(parser, "if")) {
                conditions.add(parseTestNoCondition(parser));
            }
            clauses.add(new ComprehensionClause(target, iterable, conditions, isAsync));
        }
        return clauses;
    }

    private static boolean atComprehension(Parser parser) {
        return peek(parser).isKeyword("for") || (peek(parser).isKeyword("async") && peek(parser, 1).isKeyword("for"));
    }

    /**
     * {@code yield [from test | expression list]}
     */
    public static Node parseYield(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.NAME, "yield");
        if (consumeKeywordIf(parser, "from")) {
            Node value = parseTest(parser);
            return parser.finish(new YieldNode(value, true), start);
        }
        Node value = null;
        if (startsExpression(peek(parser))) {
            value = parseExpressionList(parser, true);
        }
        return parser.finish(new YieldNode(value, false), start);
    }

    public static Node parseAtom(Parser parser) {
        int start = parser.tokenIndex;
        LexerToken token = peek(parser);
        switch (token.type) {
            case NUMBER -> {
                consume(parser);
                return parser.finish(new NumberNode(token.text), start);
            }
            case STRING -> {
                List<String> pieces = new ArrayList<>();
                while (peek(parser).type == LexerTokenType.STRING) {
                    pieces.add(consume(parser).text);
                }
                return parser.finish(new StringNode(pieces), start);
            }
            case NAME -> {
                if (token.text.equals("None") || token.text.equals("True") || token.text.equals("False")) {
                    consume(parser);
                    return parser.finish(new ConstantNode(token.text), start);
                }
                if (isKeyword(token)) {
                    throw parser.error(token, "invalid syntax, unexpected " + describe(token));
                }
                consume(parser);
                return parser.finish(new IdentifierNode(token.text), start);
            }
            case OPERATOR -> {
                switch (token.text) {
                    case "(" -> {
                        return parseParenthesized(parser);
                    }
                    case "[" -> {
                        return parseListDisplay(parser);
                    }
                    case "{" -> {
                        return parseBraceDisplay(parser);
                    }
                    case "..." -> {
                        consume(parser);
                        return parser.finish(new ConstantNode("..."), start);
                    }
                    default -> {
                    }
                }
            }
            default -> {
            }
        }
        throw parser.error(token, "invalid syntax, unexpected " + describe(token));
    }

    private static Node parseParenthesized(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.OPERATOR, "(");
        if (consumeOperatorIf(parser, ")")) {
            return parser.finish(new TupleNode(new ArrayList<>()), start);
        }
        if (peek(parser).isKeyword("yield")) {
            Node yield = parseYield(parser);
            consume(parser, LexerTokenType.OPERATOR, ")");
            return yield;
        }
        Node first = parseListElement(parser, true);
        if (atComprehension(parser)) {
            List<ComprehensionClause> clauses = parseComprehensionClauses(parser);
            consume(parser, LexerTokenType.OPERATOR, ")");
            return parser.finish(new ComprehensionNode(ComprehensionNode.Kind.GENERATOR, first, null, clauses), start);
        }
        if (consumeOperatorIf(parser, ")")) {
            // Grouping only: keep the inner node, with its own span
            return first;
        }
        List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (consumeOperatorIf(parser, ",")) {
            if (peek(parser).isOperator(")")) {
                break;
            }
            elements.add(parseListElement(parser, true));
        }
        consume(parser, LexerTokenType.OPERATOR, ")");
        return parser.finish(new TupleNode(elements), start);
    }

    private static Node parseListDisplay(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.OPERATOR, "[");
        List<Node> elements = new ArrayList<>();
        if (!peek(parser).isOperator("]")) {
            Node first = parseListElement(parser, true);
            if (atComprehension(parser)) {
                List<ComprehensionClause> clauses = parseComprehensionClauses(parser);
                consume(parser, LexerTokenType.OPERATOR, "]");
                return parser.finish(new ComprehensionNode(ComprehensionNode.Kind.LIST, first, null, clauses), start);
            }
            elements.add(first);
            while (consumeOperatorIf(parser, ",")) {
                if (peek(parser).isOperator("]")) {
                    break;
                }
                elements.add(parseListElement(parser, true));
            }
        }
        consume(parser, LexerTokenType.OPERATOR, "]");
        return parser.finish(new ListLiteralNode(elements), start);
    }

    private static Node parseBraceDisplay(Parser parser) {
        int start = parser.tokenIndex;
        consume(parser, LexerTokenType.OPERATOR, "{");
        if (consumeOperatorIf(parser, "}")) {
            return parser.finish(new DictLiteralNode(new ArrayList<>(), new ArrayList<>()), start);
        }
        if (peek(parser).isOperator("**") || !isSetDisplay(parser)) {
            return parseDictDisplay(parser, start);
        }
        Node first = parseListElement(parser, true);
        if (atComprehension(parser)) {
            List<ComprehensionClause> clauses = parseComprehensionClauses(parser);
            consume(parser, LexerTokenType.OPERATOR, "}");
            return parser.finish(new ComprehensionNode(ComprehensionNode.Kind.SET, first, null, clauses), start);
        }
        List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (consumeOperatorIf(parser, ",")) {
            if (peek(parser).isOperator("}")) {
                break;
            }
            elements.add(parseListElement(parser, true));
        }
        consume(parser, LexerTokenType.OPERATOR, "}");
        return parser.finish(new SetLiteralNode(elements), start);
    }

    /**
     * Looks ahead at bracket depth zero for the ':' that separates a dict key from its value.
     */
    private static boolean isSetDisplay(Parser parser) {
        int depth = 0;
        for (int i = parser.tokenIndex; i < parser.tokens.size(); i++) {
            LexerToken token = parser.tokens.get(i);
            if (token.type == LexerTokenType.EOF) {
                return true;
            }
            if (token.type != LexerTokenType.OPERATOR) {
                if (depth == 0 && token.isKeyword("lambda")) {
                    return !lambdaIsDictKey(parser, i);
                }
                continue;
            }
            switch (token.text) {
                case "(", "[", "{" -> depth++;
                case ")", "]" -> depth--;
                case "}" -> {
                    if (depth == 0) {
                        return true;
                    }
                    depth--;
                }
                case ":" -> {
                    if (depth == 0) {
                        return false;
                    }
                }
                case "," -> {
                    if (depth == 0) {
                        return true;
                    }
                }
                default -> {
                }
            }
        }
        return true;
    }

    /**
     * A lambda at the start of a brace element: {@code {lambda: 1}} is a set, while
     * {@code {lambda: 1: 2}} is not valid. The element is a dict key only when a second
     * top-level ':' follows the lambda's own colon.
     */
    private static boolean lambdaIsDictKey(Parser parser, int lambdaIndex) {
        int depth = 0;
        int colons = 0;
        for (int i = lambdaIndex; i < parser.tokens.size(); i++) {
            LexerToken token = parser.tokens.get(i);
            if (token.type != LexerTokenType.OPERATOR) {
                if (token.type == LexerTokenType.EOF) {
                    break;
                }
                continue;
            }
            switch (token.text) {
                case "(", "[", "{" -> depth++;
                case ")", "]" -> depth--;
                case "}" -> {
                    if (depth == 0) {
                        return colons > 1;
                    }
                    depth--;
                }
                case ":" -> {
                    if (depth == 0) {
                        colons++;
                    }
                }
                case "," -> {
                    if (depth == 0) {
                        return colons > 1;
                    }
                }
                default -> {
                }
            }
        }
        return colons > 1;
    }

    private static Node parseDictDisplay(Parser parser, int start) {
        List<Node> keys = new ArrayList<>();
        List<Node> values = new ArrayList<>();
        boolean first = true;
        while (!peek(parser).isOperator("}")) {
            if (consumeOperatorIf(parser, "**")) {
                keys.add(null);
                values.add(parseBitOr(parser));
            } else {
                Node key = parseTest(parser);
                consume(parser, LexerTokenType.OPERATOR, ":");
                Node value = parseTest(parser);
                if (first && atComprehension(parser)) {
                    List<ComprehensionClause> clauses = parseComprehensionClauses(parser);
                    consume(parser, LexerTokenType.OPERATOR, "}");
                    return parser.finish(new ComprehensionNode(ComprehensionNode.Kind.DICT, key, value, clauses), start);
                }
                keys.add(key);
                values.add(value);
            }
            first = false;
            if (!consumeOperatorIf(parser, ",")) {
                break;
            }
        }
        consume(parser, LexerTokenType.OPERATOR, "}");
        return parser.finish(new DictLiteralNode(keys, values), start);
    }
}
