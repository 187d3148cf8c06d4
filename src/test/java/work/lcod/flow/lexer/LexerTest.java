package work.lcod.flow.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.flow.support.FlowTestSupport;

class LexerTest {
    @Test
    void emitsIndentAndDedentForNestedBlocks() {
        var tokens = Lexer.tokenize(FlowTestSupport.source(
            "workflow:",
            "    step Greet:",
            "        log \"hi\""
        ));

        assertEquals(List.of(
            TokenKind.KEYWORD, TokenKind.COLON, TokenKind.NEWLINE,
            TokenKind.INDENT, TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.NEWLINE,
            TokenKind.INDENT, TokenKind.KEYWORD, TokenKind.STRING, TokenKind.NEWLINE,
            TokenKind.DEDENT, TokenKind.DEDENT, TokenKind.EOF
        ), kinds(tokens));
    }

    @Test
    void skipsBlankLinesAndComments() {
        var tokens = Lexer.tokenize(FlowTestSupport.source(
            "workflow:",
            "",
            "    # a note",
            "    log 1  # trailing"
        ));

        assertEquals(List.of(
            TokenKind.KEYWORD, TokenKind.COLON, TokenKind.NEWLINE, TokenKind.INDENT,
            TokenKind.KEYWORD, TokenKind.NUMBER, TokenKind.NEWLINE, TokenKind.DEDENT, TokenKind.EOF
        ), kinds(tokens));
    }

    @Test
    void compoundKeywordsBecomeSingleTokens() {
        var tokens = Lexer.tokenize("if items is not empty:\n");
        assertEquals(TokenKind.KEYWORD_COMPOUND, tokens.get(2).kind());
        assertEquals("is not empty", tokens.get(2).text());

        var loop = Lexer.tokenize("for each item in items:\n");
        assertEquals(TokenKind.KEYWORD_COMPOUND, loop.get(0).kind());
        assertEquals("for each", loop.get(0).text());
        assertEquals(TokenKind.IDENTIFIER, loop.get(1).kind());
    }

    @Test
    void compoundKeywordsMatchCaseInsensitively() {
        var tokens = Lexer.tokenize("FOR EACH x in list:\n");
        assertTrue(tokens.get(0).is(TokenKind.KEYWORD_COMPOUND, "for each"));
    }

    @Test
    void compoundKeywordNeedsAWordBoundary() {
        var tokens = Lexer.tokenize("if x is emptyish:\n");
        assertTrue(tokens.get(2).is(TokenKind.KEYWORD, "is"));
        assertTrue(tokens.get(3).is(TokenKind.IDENTIFIER, "emptyish"));
    }

    @Test
    void splitsInterpolatedStrings() {
        var tokens = Lexer.tokenize("log \"Hi {user.name}!\"\n");
        assertEquals(List.of(
            TokenKind.KEYWORD, TokenKind.STRING_PART, TokenKind.INTERP_START, TokenKind.IDENTIFIER, TokenKind.DOT,
            TokenKind.IDENTIFIER, TokenKind.INTERP_END, TokenKind.STRING_PART, TokenKind.NEWLINE, TokenKind.EOF
        ), kinds(tokens));
        assertEquals("Hi ", tokens.get(1).text());
        assertEquals("!", tokens.get(7).text());
    }

    @Test
    void handlesEscapesAndDoubledBraces() {
        var tokens = Lexer.tokenize("log \"say \\\"hi\\\" {{literal}}\"\n");
        assertEquals(TokenKind.STRING, tokens.get(1).kind());
        assertEquals("say \"hi\" {literal}", tokens.get(1).text());
    }

    @Test
    void recognizesNumbersBooleansAndDots() {
        var tokens = Lexer.tokenize("set x to 3.25 plus order.total and true\n");
        assertTrue(tokens.get(3).is(TokenKind.NUMBER, "3.25"));
        assertTrue(tokens.get(4).is(TokenKind.KEYWORD, "plus"));
        assertTrue(tokens.get(5).is(TokenKind.IDENTIFIER, "order"));
        assertTrue(tokens.get(6).is(TokenKind.DOT));
        assertTrue(tokens.get(7).is(TokenKind.IDENTIFIER, "total"));
        assertTrue(tokens.get(9).is(TokenKind.BOOLEAN, "true"));
    }

    @Test
    void tracksLinesAndColumns() {
        var tokens = Lexer.tokenize("workflow:\n    set x to 1\n");
        Token set = tokens.stream().filter(token -> token.isKeyword("set")).findFirst().orElseThrow();
        assertEquals(2, set.line());
        assertEquals(5, set.column());
    }

    @Test
    void rejectsIndentationThatIsNotFourSpaces() {
        var error = assertThrows(LexerException.class, () -> Lexer.tokenize("workflow:\n   set x to 1\n"));
        assertEquals("Unexpected indentation. I expected 4 spaces but found 3.", error.getMessage());
        assertEquals(2, error.diagnostic().line());
    }

    @Test
    void rejectsDedentToUnknownLevel() {
        var error = assertThrows(LexerException.class, () -> Lexer.tokenize(FlowTestSupport.source(
            "workflow:",
            "    step A:",
            "        log 1",
            "      log 2"
        )));
        assertEquals("Indentation doesn't match any outer block. Found 6 spaces.", error.getMessage());
    }

    @Test
    void rejectsTabs() {
        var source = FlowTestSupport.read(FlowTestSupport.flowFile("tabs.flow"));
        var error = assertThrows(LexerException.class, () -> Lexer.tokenize(source, "tabs.flow"));
        assertEquals("Tabs are not allowed in Flow. Please use spaces (4 per indent level).", error.getMessage());
        assertEquals("tabs.flow", error.diagnostic().file());
        assertTrue(error.diagnostic().suggestion().isPresent());
    }

    @Test
    void rejectsStringsSpanningLines() {
        var error = assertThrows(LexerException.class, () -> Lexer.tokenize("log \"open\nclose\"\n"));
        assertEquals("This string is missing its closing quote.", error.getMessage());
    }

    @Test
    void rejectsEmptyInterpolation() {
        var error = assertThrows(LexerException.class, () -> Lexer.tokenize("log \"{}\"\n"));
        assertEquals("Empty interpolation expression.", error.getMessage());
        assertEquals(1, error.diagnostic().line());
        assertEquals(7, error.diagnostic().column());
    }

    @Test
    void rejectsUnclosedInterpolation() {
        var error = assertThrows(LexerException.class, () -> Lexer.tokenize("log \"{name\"\n"));
        assertEquals("Missing closing } in string interpolation.", error.getMessage());
        assertEquals(1, error.diagnostic().line());
        assertEquals(11, error.diagnostic().column());
    }

    @Test
    void rejectsUnknownCharacters() {
        var error = assertThrows(LexerException.class, () -> Lexer.tokenize("set x to 1 + 2\n"));
        assertEquals("Unexpected character \"+\".", error.getMessage());
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).collect(Collectors.toList());
    }
}
