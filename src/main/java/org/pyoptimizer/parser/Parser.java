package org.pyoptimizer.parser;

import org.pyoptimizer.astnode.AbstractNode;
import org.pyoptimizer.astnode.BlockNode;
import org.pyoptimizer.astnode.ModuleNode;
import org.pyoptimizer.astnode.Node;
import org.pyoptimizer.astnode.SourceSpan;
import org.pyoptimizer.astnode.SyntaxTree;
import org.pyoptimizer.exception.ErrorMessageUtil;
import org.pyoptimizer.exception.ParseError;
import org.pyoptimizer.lexer.Lexer;
import org.pyoptimizer.lexer.LexerToken;
import org.pyoptimizer.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyoptimizer.parser.TokenUtils.peek;

/**
 * The Parser class turns the token list of one script into a syntax tree.
 * <p>
 * It is a recursive-descent parser: statements are handled by {@link StatementParser},
 * expressions by {@link ExpressionParser}. Every node gets an id from the parser's
 * counter and a span running from its first token to the last token consumed for it.
 */
public class Parser {

    public final String fileName;
    public final ErrorMessageUtil errorUtil;
    // List of tokens to be parsed.
    public final List<LexerToken> tokens;
    // Current index in the token list.
    public int tokenIndex = 0;
    private int lastId = 0;

    public Parser(String fileName, String source) {
        this.fileName = fileName;
        this.errorUtil = new ErrorMessageUtil(fileName, source);
        this.tokens = new Lexer(fileName, source).tokenize();
    }

    /**
     * Parses the whole script.
     *
     * @return the syntax tree
     * @throws ParseError if the script is not valid Python
     */
    public SyntaxTree parse() {
        int start = tokenIndex;
        List<Node> statements = new ArrayList<>();
        while (true) {
            LexerToken token = peek(this);
            if (token.type == LexerTokenType.EOF) {
                break;
            }
            if (token.type == LexerTokenType.NEWLINE) {
                tokenIndex++;
                continue;
            }
            if (token.type == LexerTokenType.INDENT) {
                throw error(token, "unexpected indent");
            }
            statements.addAll(StatementParser.parseStatement(this));
        }
        BlockNode body = finish(new BlockNode(statements), start);
        ModuleNode module = finish(new ModuleNode(body), start);
        return new SyntaxTree(fileName, module, lastId);
    }

    /**
     * Assigns the next id to a freshly built node and sets its span from the token at
     * {@code startIndex} to the last significant token consumed so far.
     */
    public <T extends AbstractNode> T finish(T node, int startIndex) {
        node.id = ++lastId;
        node.span = spanFrom(startIndex);
        return node;
    }

    public SourceSpan spanFrom(int startIndex) {
        LexerToken first = firstSignificant(startIndex);
        LexerToken last = lastSignificant();
        if (first == null || last == null) {
            return SourceSpan.UNKNOWN;
        }
        return new SourceSpan(first.line, first.column, last.endLine, last.endColumn);
    }

    private static boolean isLayout(LexerToken token) {
        return token.type == LexerTokenType.NEWLINE || token.type == LexerTokenType.INDENT
                || token.type == LexerTokenType.DEDENT || token.type == LexerTokenType.EOF;
    }

    private LexerToken firstSignificant(int startIndex) {
        for (int i = startIndex; i < tokenIndex && i < tokens.size(); i++) {
            if (!isLayout(tokens.get(i))) {
                return tokens.get(i);
            }
        }
        return null;
    }

    private LexerToken lastSignificant() {
        for (int i = tokenIndex - 1; i >= 0; i--) {
            if (!isLayout(tokens.get(i))) {
                return tokens.get(i);
            }
        }
        return null;
    }

    public ParseError error(LexerToken token, String message) {
        return new ParseError(token.line, token.column, message, errorUtil);
    }
}
