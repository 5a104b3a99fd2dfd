package org.csu.sqlfront.compiler;

import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.diagnostic.Phase;
import org.csu.sqlfront.common.diagnostic.Severity;
import org.csu.sqlfront.compiler.lexer.LexResult;
import org.csu.sqlfront.compiler.lexer.LexicalErrorPolicy;
import org.csu.sqlfront.compiler.lexer.Token;
import org.csu.sqlfront.compiler.lexer.TokenType;
import org.csu.sqlfront.compiler.lexer.Tokenizer;
import org.csu.sqlfront.config.CompilerConfig;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 端到端测试: 源文本 -> 词法 -> 语法 -> 语义
 */
public class SqlCompilerTest {

    private static final String LEXICAL_ERROR_SCRIPT = "CREATE TABLE t (id INT);\nSELECT id @ FROM t;";
    private static final String SYNTAX_ERROR_SCRIPT = "CREATE TABLE t (id INT);\nDELETE t;";

    private CompilationResult compile(CompilerConfig config, String sql) {
        System.out.println("Input SQL: " + sql);
        CompilationResult result = new SqlCompiler(config).compile(sql);
        result.diagnostics().forEach(d -> System.out.println("  " + d));
        return result;
    }

    @Test
    void testCompileValidScript() {
        CompilationResult result = compile(CompilerConfig.defaults(),
                "CREATE TABLE students (id INT, name TEXT);\n"
                        + "CREATE USER alice IDENTIFIED BY 'pw';\n"
                        + "GRANT UPDATE ON students TO alice;\n"
                        + "UPDATE students SET name = 'Bob' WHERE id = 3;");

        assertFalse(result.hasErrors());
        assertTrue(result.diagnostics().isEmpty());
        assertTrue(result.isAnalyzed());
        assertEquals(4, result.statements().size());
        assertEquals(4, result.validatedStatements().size());
        assertTrue(result.schemaTable().contains("students"));
        assertTrue(result.userTable().contains("alice"));
        assertEquals(TokenType.EOF, result.tokens().get(result.tokens().size() - 1).type());
    }

    @Test
    void testSkipPolicyDropsIllegalTokens() {
        CompilationResult result = compile(CompilerConfig.defaults(), LEXICAL_ERROR_SCRIPT);

        assertTrue(result.hasErrors());
        assertEquals(1, result.diagnostics(Phase.LEXICAL).size());
        assertTrue(result.diagnostics(Phase.SYNTAX).isEmpty(), "the illegal token is removed before parsing");
        assertTrue(result.isAnalyzed());
        assertTrue(result.analysis().isSuccessful());
        assertEquals(2, result.validatedStatements().size());
        // 原始 Token 序列仍然包含非法 Token
        assertTrue(result.tokens().stream().anyMatch(t -> t.type() == TokenType.ILLEGAL));
    }

    @Test
    void testAbortPolicyStopsAfterLexing() {
        CompilationResult result = compile(new CompilerConfig(LexicalErrorPolicy.ABORT, false), LEXICAL_ERROR_SCRIPT);

        assertTrue(result.hasErrors());
        assertEquals(1, result.diagnostics().size());
        assertEquals(Phase.LEXICAL, result.diagnostics().get(0).phase());
        assertTrue(result.statements().isEmpty());
        assertFalse(result.isAnalyzed());
        assertTrue(result.schemaTable().isEmpty());
    }

    @Test
    void testAbortPolicyIgnoredWithoutLexicalErrors() {
        CompilationResult result = compile(new CompilerConfig(LexicalErrorPolicy.ABORT, false), "CREATE TABLE t (id INT);");
        assertFalse(result.hasErrors());
        assertTrue(result.isAnalyzed());
    }

    @Test
    void testDiagnosticsAreOrderedByPhase() {
        CompilationResult result = compile(CompilerConfig.defaults(), "SELECT @ * FROM t;\nSELECT FROM t;");

        List<Phase> phases = result.diagnostics().stream()
                .map(Diagnostic::phase)
                .collect(Collectors.toList());
        assertEquals(List.of(Phase.LEXICAL, Phase.SYNTAX, Phase.SEMANTIC), phases);
        assertEquals("[Line 1, Col 17] Semantic Error: Table 't' not found.", result.diagnostics().get(2).format());
    }

    @Test
    void testSemanticAnalysisRunsDespiteSyntaxErrorsByDefault() {
        CompilationResult result = compile(CompilerConfig.defaults(), SYNTAX_ERROR_SCRIPT);

        assertEquals(1, result.diagnostics(Phase.SYNTAX).size());
        assertTrue(result.isAnalyzed());
        assertTrue(result.schemaTable().contains("t"));
    }

    @Test
    void testSkipAnalysisOnSyntaxErrors() {
        CompilationResult result = compile(new CompilerConfig(LexicalErrorPolicy.SKIP, true), SYNTAX_ERROR_SCRIPT);

        assertEquals(1, result.diagnostics(Phase.SYNTAX).size());
        assertEquals(1, result.statements().size());
        assertFalse(result.isAnalyzed());
        assertTrue(result.validatedStatements().isEmpty());
        assertFalse(result.schemaTable().contains("t"));
    }

    @Test
    void testWarningsAreNotErrors() {
        CompilationResult result = compile(CompilerConfig.defaults(),
                "CREATE TABLE t (id INT);\n"
                        + "CREATE USER u IDENTIFIED BY 'p';\n"
                        + "GRANT DELETE ON t TO u;\n"
                        + "GRANT DELETE ON t TO u;");

        assertFalse(result.hasErrors());
        assertEquals(1, result.diagnostics().size());
        assertEquals(Severity.WARNING, result.diagnostics().get(0).severity());
    }

    @Test
    void testHostileNestingIsReportedNotThrown() {
        String nested = "(".repeat(20000) + "id = 1" + ")".repeat(20000);
        CompilationResult result = new SqlCompiler(CompilerConfig.defaults())
                .compile("CREATE TABLE t (id INT);\nSELECT * FROM t WHERE " + nested + ";\nDELETE FROM t;");

        assertTrue(result.hasErrors());
        List<Diagnostic> syntax = result.diagnostics(Phase.SYNTAX);
        assertEquals(1, syntax.size());
        assertEquals(2, syntax.get(0).line());
        assertTrue(syntax.get(0).message().startsWith("Condition nested too deeply"));
        assertEquals(2, result.validatedStatements().size());
    }

    @Test
    void testEachCompilationStartsWithEmptyTables() {
        SqlCompiler compiler = new SqlCompiler(CompilerConfig.defaults());
        assertFalse(compiler.compile("CREATE TABLE t (id INT);").hasErrors());
        assertFalse(compiler.compile("CREATE TABLE t (id INT);").hasErrors());
    }

    @Test
    void testCustomTokenizer() {
        // 用 Mock 替换词法分析器，验证 Parser 只依赖 Token 序列
        Tokenizer tokenizer = Mockito.mock(Tokenizer.class);
        String source = "ignored by the mock";
        when(tokenizer.tokenize(source)).thenReturn(new LexResult(List.of(
                new Token(TokenType.DELETE, "DELETE", 1, 1),
                new Token(TokenType.FROM, "FROM", 1, 8),
                new Token(TokenType.IDENTIFIER, "ghosts", 1, 13),
                new Token(TokenType.SEMICOLON, ";", 1, 19),
                new Token(TokenType.EOF, "", 1, 20)), List.of()));

        CompilationResult result = new SqlCompiler(CompilerConfig.defaults(), tokenizer).compile(source);

        verify(tokenizer).tokenize(source);
        assertEquals(1, result.statements().size());
        assertEquals(1, result.diagnostics().size());
        assertEquals("Table 'ghosts' not found.", result.diagnostics().get(0).message());
    }
}
