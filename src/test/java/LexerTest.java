import org.junit.jupiter.api.Test;

import com.otto.script.error.LexException;
import com.otto.script.parser.Lexer;
import com.otto.script.parser.Token;
import com.otto.script.parser.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    @Test
    void peekToken_doesNotConsume() {
        Lexer lexer = new Lexer("param size 50");
        Token p1 = lexer.peekToken();
        Token p2 = lexer.peekToken();
        Token p3 = lexer.peekToken();
        Token next = lexer.nextToken();

        assertEquals(TokenType.PARAM, p1.type);
        assertEquals(p1.type, p2.type);
        assertEquals(p1.type, p3.type);
        assertEquals(p1.type, next.type);
        assertEquals(p1.line, next.line);
        assertEquals(p1.column, next.column);

        Token name = lexer.nextToken();
        assertEquals(TokenType.IDENTIFIER, name.type);
        assertEquals("size", name.lexeme);
        Token number = lexer.nextToken();
        assertEquals(TokenType.NUMBER, number.type);
        assertEquals(50.0, (Double) number.literal, 1e-9);
        assertEquals(TokenType.EOF, lexer.nextToken().type);
        assertEquals(TokenType.EOF, lexer.nextToken().type);
    }

    @Test
    void keywords_areCaseInsensitive_identifiersKeepSpelling() {
        List<Token> tokens = lex("PARAM Shape myBox");
        assertEquals(TokenType.PARAM, tokens.get(0).type);
        assertEquals(TokenType.SHAPE, tokens.get(1).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).type);
        assertEquals("myBox", tokens.get(2).lexeme);
    }

    @Test
    void stylingAliases_mapToCanonicalTokens() {
        List<Token> tokens = lex("background border thickness alpha fillColor");
        assertEquals(TokenType.FILLCOLOR, tokens.get(0).type);
        assertEquals(TokenType.STROKECOLOR, tokens.get(1).type);
        assertEquals(TokenType.STROKEWIDTH, tokens.get(2).type);
        assertEquals(TokenType.OPACITY, tokens.get(3).type);
        assertEquals(TokenType.FILLCOLOR, tokens.get(4).type);
    }

    @Test
    void colorNames_areColorTokens() {
        List<Token> tokens = lex("red Blue grey");
        assertEquals(TokenType.COLORNAME, tokens.get(0).type);
        assertEquals("red", tokens.get(0).literal);
        assertEquals(TokenType.COLORNAME, tokens.get(1).type);
        assertEquals("blue", tokens.get(1).literal);
        assertEquals(TokenType.COLORNAME, tokens.get(2).type);
    }

    @Test
    void hexColors_acceptedLengths() {
        List<Token> tokens = lex("#fff #ffff #a1B2c3 #a1b2c3d4");
        for (int i = 0; i < 4; i++) {
            assertEquals(TokenType.HEXCOLOR, tokens.get(i).type);
        }
        assertEquals("#a1B2c3", tokens.get(2).literal);
    }

    @Test
    void hexColor_wrongLength_isLexError() {
        LexException ex = assertThrows(LexException.class, () -> lex("shape circle c { color: #12345 }"));
        assertTrue(ex.getMessage().contains("Invalid hex color format"), ex.getMessage());
        assertEquals(1, ex.getLine());
        assertEquals(25, ex.getColumn());
    }

    @Test
    void strings_supportEscapes() {
        List<Token> tokens = lex("\"a\\nb\\t\\\"c\\\\\"");
        assertEquals(TokenType.STRING, tokens.get(0).type);
        assertEquals("a\nb\t\"c\\", tokens.get(0).literal);
    }

    @Test
    void unterminatedString_isLexError() {
        LexException ex = assertThrows(LexException.class, () -> lex("param s \"open"));
        assertTrue(ex.getMessage().contains("Unterminated string"));
        assertEquals(1, ex.getLine());
        assertEquals(9, ex.getColumn());
    }

    @Test
    void comments_areSkipped_andPositionsTracked() {
        List<Token> tokens = lex("// heading\n  shape");
        assertEquals(TokenType.SHAPE, tokens.get(0).type);
        assertEquals(2, tokens.get(0).line);
        assertEquals(3, tokens.get(0).column);
        assertEquals(TokenType.EOF, tokens.get(1).type);
    }

    @Test
    void operators() {
        List<Token> tokens = lex("== != <= >= < > ? : / *");
        TokenType[] expected = {
                TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.LESS, TokenType.GREATER, TokenType.QUESTION, TokenType.COLON, TokenType.SLASH, TokenType.STAR
        };
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], tokens.get(i).type, "token " + i);
        }
    }

    @Test
    void unknownCharacter_isLexErrorWithPosition() {
        LexException ex = assertThrows(LexException.class, () -> lex("x ` y"));
        assertEquals("Lexer error at line 1, col 3: Unexpected character: `", ex.getMessage());

        assertThrows(LexException.class, () -> lex("not !x"));
    }

    @Test
    void numbers_withFraction() {
        List<Token> tokens = lex("3.25 7");
        assertEquals(3.25, (Double) tokens.get(0).literal, 1e-12);
        assertEquals(7.0, (Double) tokens.get(1).literal, 1e-12);
    }

    @Test
    void isValidColor_formats() {
        assertTrue(Lexer.isValidColor("#abc"));
        assertTrue(Lexer.isValidColor("rgb(10, 20, 30)"));
        assertTrue(Lexer.isValidColor("rgba(10,20,30,0.5)"));
        assertTrue(Lexer.isValidColor("hsl(120, 50%, 50%)"));
        assertTrue(Lexer.isValidColor("Gold"));
        assertFalse(Lexer.isValidColor("#abcde"));
        assertFalse(Lexer.isValidColor("notacolor"));
    }
}
