package org.dxworks.sieveframe.sieve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SieveLexerTest {

    @Test
    void numberWithQuantifierIsOneToken() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("100K");

        assertEquals(1, tokens.size());
        assertEquals(TokenType.NUMBER, tokens.get(0).type);
        assertEquals("100K", tokens.get(0).text);
    }

    @Test
    void stringListTokens() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("[\"a\", \"b\"]");

        assertEquals(5, tokens.size());
        assertEquals(TokenType.LEFT_BRACKET, tokens.get(0).type);
        assertEquals(TokenType.QUOTED_STRING, tokens.get(1).type);
        assertEquals("a", tokens.get(1).text);
        assertEquals(TokenType.COMMA, tokens.get(2).type);
        assertEquals("b", tokens.get(3).text);
        assertEquals(TokenType.RIGHT_BRACKET, tokens.get(4).type);
    }

    @Test
    void offsetsPointIntoSource() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("keep;\n  stop;");

        assertEquals(4, tokens.size());
        assertEquals(0, tokens.get(0).offset);
        assertEquals(4, tokens.get(1).offset);
        assertEquals(8, tokens.get(2).offset);
        assertEquals(4, tokens.get(2).length);
    }

    @Test
    void lineCommentIsTrimmed() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("#   Filter: Spam  \nkeep;");

        assertEquals(TokenType.COMMENT, tokens.get(0).type);
        assertEquals("Filter: Spam", tokens.get(0).text);
        assertTrue(tokens.get(1).isIdentifier("KEEP"));
    }

    @Test
    void blockComment() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("/* note\n more */ stop;");

        assertEquals(TokenType.BLOCK_COMMENT, tokens.get(0).type);
        assertEquals("note\n more", tokens.get(0).text);
        assertEquals(3, tokens.size());
    }

    @Test
    void tagsAreLowercased() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize(":Contains :DOMAIN");

        assertEquals(":contains", tokens.get(0).text);
        assertEquals(":domain", tokens.get(1).text);
        assertTrue(tokens.get(0).is(TokenType.TAG));
    }

    @Test
    void escapedQuoteInsideString() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("\"say \\\"hi\\\" \\\\ now\"");

        assertEquals(1, tokens.size());
        assertEquals("say \"hi\" \\ now", tokens.get(0).text);
    }

    @Test
    void multiLineString() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("reject text:\nNot here.\n..\n.\n;");

        assertEquals(3, tokens.size());
        assertEquals(TokenType.MULTI_LINE_STRING, tokens.get(1).type);
        assertEquals("Not here.\n..\n", tokens.get(1).text);
        assertEquals(TokenType.SEMICOLON, tokens.get(2).type);
    }

    @Test
    void multiLineStringWithCrLf() throws SieveParseException {
        List<Token> tokens = SieveLexer.tokenize("text:\r\nline\r\n.\r\n");

        assertEquals(1, tokens.size());
        assertEquals("line\r\n", tokens.get(0).text);
    }

    @Test
    void unterminatedString() {
        SieveParseException e = assertThrows(SieveParseException.class,
                () -> SieveLexer.tokenize("fileinto \"Junk"));

        assertEquals(ErrorKind.UNTERMINATED_STRING, e.getKind());
        assertEquals(9, e.getOffset());
    }

    @Test
    void unterminatedBlockComment() {
        SieveParseException e = assertThrows(SieveParseException.class,
                () -> SieveLexer.tokenize("keep; /* never closed"));

        assertEquals(ErrorKind.UNTERMINATED_COMMENT, e.getKind());
    }

    @Test
    void unterminatedMultiLine() {
        SieveParseException e = assertThrows(SieveParseException.class,
                () -> SieveLexer.tokenize("reject text:\nno terminator\n"));

        assertEquals(ErrorKind.UNTERMINATED_MULTILINE, e.getKind());
    }

    @Test
    void unexpectedCharacter() {
        SieveParseException e = assertThrows(SieveParseException.class,
                () -> SieveLexer.tokenize("keep @"));

        assertEquals(ErrorKind.UNEXPECTED_CHARACTER, e.getKind());
        assertEquals(5, e.getOffset());
        assertTrue(e.getMessage().contains("'@'"));
    }
}
