package org.pyoptimizer.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pyoptimizer.exception.ParseError;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<LexerToken> tokenize(String input) {
        return new Lexer("test.py", input).tokenize();
    }

    private static String types(List<LexerToken> tokens) {
        return tokens.stream().map(token -> token.type.name()).collect(Collectors.joining(" "));
    }

    @Test
    public void testSimpleAssignment() {
        List<LexerToken> tokens = tokenize("x = 42\n");
        assertEquals("NAME OPERATOR NUMBER NEWLINE EOF", types(tokens));
        assertEquals("x", tokens.get(0).text);
        assertEquals("=", tokens.get(1).text);
        assertEquals("42", tokens.get(2).text);
        assertEquals(1, tokens.get(2).line);
        assertEquals(4, tokens.get(2).column);
        assertEquals(6, tokens.get(2).endColumn);
    }

    @Test
    public void testIndentationProducesIndentAndDedent() {
        List<LexerToken> tokens = tokenize("if a:\n    b = 1\nc = 2\n");
        assertEquals("NAME NAME OPERATOR NEWLINE INDENT NAME OPERATOR NUMBER NEWLINE DEDENT NAME OPERATOR NUMBER NEWLINE EOF",
                types(tokens));
    }

    @Test
    public void testDedentsClosedAtEndOfInput() {
        List<LexerToken> tokens = tokenize("for i in x:\n    for j in y:\n        pass");
        long dedents = tokens.stream().filter(token -> token.type == LexerTokenType.DEDENT).count();
        assertEquals(2, dedents, "Every open block should be closed at EOF");
        assertEquals(LexerTokenType.EOF, tokens.get(tokens.size() - 1).type);
    }

    @Test
    public void testBlankAndCommentLinesDoNotAffectLayout() {
        List<LexerToken> tokens = tokenize("if a:\n\n    # comment\n    b\n");
        assertEquals("NAME NAME OPERATOR NEWLINE INDENT NAME NEWLINE DEDENT EOF", types(tokens));
    }

    @Test
    public void testNewlinesInsideBracketsAreIgnored() {
        List<LexerToken> tokens = tokenize("x = (1,\n     2)\n");
        assertEquals("NAME OPERATOR OPERATOR NUMBER OPERATOR NUMBER OPERATOR NEWLINE EOF", types(tokens));
    }

    @Test
    public void testLineContinuation() {
        List<LexerToken> tokens = tokenize("x = 1 + \\\n    2\n");
        assertEquals("NAME OPERATOR NUMBER OPERATOR NUMBER NEWLINE EOF", types(tokens));
        assertEquals(2, tokens.get(4).line);
    }

    @Test
    public void testLongestOperatorWins() {
        List<LexerToken> tokens = tokenize("a //= b ** 2 != c\n");
        assertEquals("//=", tokens.get(1).text);
        assertEquals("**", tokens.get(3).text);
        assertEquals("!=", tokens.get(5).text);
    }

    @Test
    public void testStringPrefixesAndQuotesAreKeptVerbatim() {
        List<LexerToken> tokens = tokenize("s = rb'a\\'b' + f\"{x}\"\n");
        assertEquals(LexerTokenType.STRING, tokens.get(2).type);
        assertEquals("rb'a\\'b'", tokens.get(2).text);
        assertEquals("f\"{x}\"", tokens.get(4).text);
    }

    @Test
    public void testTripleQuotedStringSpansLines() {
        List<LexerToken> tokens = tokenize("doc = \"\"\"first\nsecond\"\"\"\nx = 1\n");
        LexerToken string = tokens.get(2);
        assertEquals(LexerTokenType.STRING, string.type);
        assertEquals(1, string.line);
        assertEquals(2, string.endLine);
        assertEquals(3, tokens.get(4).line, "Token after the string should be on the line after it");
    }

    @Test
    public void testNumberForms() {
        List<LexerToken> tokens = tokenize("a = [0x1F, 1_000, 3.5e-2, 2j, .5]\n");
        List<String> numbers = tokens.stream()
                .filter(token -> token.type == LexerTokenType.NUMBER)
                .map(token -> token.text)
                .collect(Collectors.toList());
        assertEquals(List.of("0x1F", "1_000", "3.5e-2", "2j", ".5"), numbers);
    }

    @Test
    public void testUnicodeIdentifier() {
        List<LexerToken> tokens = tokenize("größe = 1\n");
        assertEquals(LexerTokenType.NAME, tokens.get(0).type);
        assertEquals("größe", tokens.get(0).text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x = $\n",
            "x = (1, 2\n",
            "x = 1)\n",
            "s = 'open\n",
            "if a:\n        b\n    c\n",
            "x = 1abc\n"
    })
    public void testInvalidInputRaisesParseError(String input) {
        ParseError error = assertThrows(ParseError.class, () -> tokenize(input));
        assertTrue(error.getMessage().contains("test.py"), "Message should name the file: " + error.getMessage());
    }
}
