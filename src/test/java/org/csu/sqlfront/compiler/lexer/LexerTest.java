package org.csu.sqlfront.compiler.lexer;

import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.diagnostic.Phase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private List<Token> tokenize(String sql) {
        System.out.println("Input SQL: " + sql); // [日志] 打印输入的SQL
        LexResult result = new Lexer(sql).tokenize();
        System.out.println("Generated Tokens: " + result.tokens());
        return result.tokens();
    }

    private void assertTypes(List<Token> tokens, TokenType... expectedTypes) {
        assertEquals(expectedTypes.length, tokens.size(), "Token数量不匹配");
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type(), "Token类型不匹配 at index " + i);
        }
    }

    @Test
    public void testSimpleSelectStatement() {
        List<Token> tokens = tokenize("SELECT id, name FROM student;");

        assertTypes(tokens,
                TokenType.SELECT, TokenType.IDENTIFIER, TokenType.COMMA, TokenType.IDENTIFIER,
                TokenType.FROM, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF);
        assertEquals("id", tokens.get(1).lexeme());
        assertEquals("student", tokens.get(5).lexeme());

        // 列号从 1 开始
        assertEquals(1, tokens.get(0).column());
        assertEquals(8, tokens.get(1).column());
        assertEquals(10, tokens.get(2).column());
        assertEquals(22, tokens.get(5).column());
        assertEquals(29, tokens.get(6).column());
    }

    @Test
    public void testKeywordsAreCaseInsensitive() {
        List<Token> tokens = tokenize("select * FrOm Students;");

        assertTypes(tokens,
                TokenType.SELECT, TokenType.ASTERISK, TokenType.FROM, TokenType.IDENTIFIER,
                TokenType.SEMICOLON, TokenType.EOF);
        // 原样保留写法
        assertEquals("FrOm", tokens.get(2).lexeme());
        assertEquals("Students", tokens.get(3).lexeme());
    }

    @Test
    public void testLiteralsKeepTheirExactText() {
        List<Token> tokens = tokenize("INSERT INTO t VALUES (1, 85.5, 'Ali Baba');");

        Token integer = tokens.get(5);
        Token decimal = tokens.get(7);
        Token string = tokens.get(9);
        assertEquals(TokenType.INTEGER_CONST, integer.type());
        assertEquals("1", integer.lexeme());
        assertEquals(TokenType.DECIMAL_CONST, decimal.type());
        assertEquals("85.5", decimal.lexeme());
        assertEquals(TokenType.STRING_CONST, string.type());
        assertEquals("'Ali Baba'", string.lexeme());
    }

    @Test
    public void testTrailingDotIsNotPartOfNumber() {
        LexResult result = new Lexer("3.").tokenize();

        assertTypes(result.tokens(), TokenType.INTEGER_CONST, TokenType.ILLEGAL, TokenType.EOF);
        assertEquals("3", result.tokens().get(0).lexeme());
        assertEquals(1, result.diagnostics().size());
        assertEquals("Invalid character '.'", result.diagnostics().get(0).message());
    }

    @Test
    public void testComparisonOperators() {
        List<Token> tokens = tokenize("= != <> < <= > >=");

        assertTypes(tokens,
                TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.NOT_EQUAL, TokenType.LESS,
                TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.EOF);
        int[] expectedColumns = {1, 3, 6, 9, 11, 14, 16};
        for (int i = 0; i < expectedColumns.length; i++) {
            assertEquals(expectedColumns[i], tokens.get(i).column(), "列号不匹配 at index " + i);
        }
        assertEquals("<>", tokens.get(2).lexeme());
    }

    @Test
    public void testLineAndColumnTracking() {
        List<Token> tokens = tokenize("SELECT *\nFROM t;");

        Token from = tokens.get(2);
        assertEquals(TokenType.FROM, from.type());
        assertEquals(2, from.line());
        assertEquals(1, from.column());
        assertEquals(2, tokens.get(3).line());
        assertEquals(6, tokens.get(3).column());
    }

    @Test
    public void testCommentsAreSkipped() {
        List<Token> tokens = tokenize("-- line comment\nSELECT ## block\n comment ## id FROM t;");

        assertTypes(tokens,
                TokenType.SELECT, TokenType.IDENTIFIER, TokenType.FROM, TokenType.IDENTIFIER,
                TokenType.SEMICOLON, TokenType.EOF);
        assertEquals(2, tokens.get(0).line());
        assertEquals(3, tokens.get(1).line());
        assertEquals(13, tokens.get(1).column());
    }

    @Test
    public void testIllegalCharacterKeepsScanning() {
        LexResult result = new Lexer("SELECT @ FROM t;").tokenize();
        System.out.println("Diagnostics: " + result.diagnostics());

        assertTypes(result.tokens(),
                TokenType.SELECT, TokenType.ILLEGAL, TokenType.FROM, TokenType.IDENTIFIER,
                TokenType.SEMICOLON, TokenType.EOF);
        assertTrue(result.hasErrors());

        Diagnostic diagnostic = result.diagnostics().get(0);
        assertEquals(Phase.LEXICAL, diagnostic.phase());
        assertEquals("Invalid character '@'", diagnostic.message());
        assertEquals(1, diagnostic.line());
        assertEquals(8, diagnostic.column());

        List<Token> filtered = result.tokensWithoutIllegal();
        assertEquals(result.tokens().size() - 1, filtered.size());
        assertTrue(filtered.stream().noneMatch(t -> t.type() == TokenType.ILLEGAL));
    }

    @Test
    public void testUnclosedString() {
        LexResult result = new Lexer("SELECT 'abc").tokenize();

        assertTypes(result.tokens(), TokenType.SELECT, TokenType.ILLEGAL, TokenType.EOF);
        assertEquals("'abc", result.tokens().get(1).lexeme());
        assertEquals(1, result.diagnostics().size());
        assertEquals("Unclosed string literal", result.diagnostics().get(0).message());
        assertEquals(8, result.diagnostics().get(0).column());
    }

    @Test
    public void testUnterminatedBlockComment() {
        LexResult result = new Lexer("SELECT ## never closed").tokenize();

        assertTypes(result.tokens(), TokenType.SELECT, TokenType.EOF);
        assertEquals(1, result.diagnostics().size());
        assertEquals("Unterminated block comment", result.diagnostics().get(0).message());
        assertEquals(1, result.diagnostics().get(0).line());
        assertEquals(8, result.diagnostics().get(0).column());
    }

    @Test
    public void testEmptyInputProducesOnlyEof() {
        LexResult result = new Lexer("").tokenize();

        assertTypes(result.tokens(), TokenType.EOF);
        assertEquals(1, result.tokens().get(0).line());
        assertEquals(1, result.tokens().get(0).column());
        assertFalse(result.hasErrors());
    }

    @Test
    public void testStandardTokenizerDelegatesToLexer() {
        String sql = "GRANT SELECT ON t TO alice;";
        LexResult viaTokenizer = Tokenizer.standard().tokenize(sql);
        LexResult viaLexer = new Lexer(sql).tokenize();

        assertEquals(viaLexer, viaTokenizer);
    }
}
