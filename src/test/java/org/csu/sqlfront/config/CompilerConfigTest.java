package org.csu.sqlfront.config;

import org.csu.sqlfront.compiler.lexer.LexicalErrorPolicy;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerConfigTest {

    @Test
    void testDefaults() {
        CompilerConfig config = CompilerConfig.defaults();
        assertEquals(LexicalErrorPolicy.SKIP, config.getLexicalErrorPolicy());
        assertFalse(config.isSkipAnalysisOnSyntaxErrors());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(CompilerConfig.LEXER_ERROR_POLICY, " abort ");
        properties.setProperty(CompilerConfig.SKIP_ANALYSIS_ON_SYNTAX_ERRORS, "TRUE");

        CompilerConfig config = CompilerConfig.fromProperties(properties);
        assertEquals(LexicalErrorPolicy.ABORT, config.getLexicalErrorPolicy());
        assertTrue(config.isSkipAnalysisOnSyntaxErrors());
    }

    @Test
    void testMissingKeysFallBackToDefaults() {
        CompilerConfig config = CompilerConfig.fromProperties(new Properties());
        assertEquals(LexicalErrorPolicy.SKIP, config.getLexicalErrorPolicy());
        assertFalse(config.isSkipAnalysisOnSyntaxErrors());
    }

    @Test
    void testInvalidValuesAreRejected() {
        Properties badPolicy = new Properties();
        badPolicy.setProperty(CompilerConfig.LEXER_ERROR_POLICY, "IGNORE");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilerConfig.fromProperties(badPolicy));
        assertTrue(e.getMessage().contains(CompilerConfig.LEXER_ERROR_POLICY));

        Properties badFlag = new Properties();
        badFlag.setProperty(CompilerConfig.SKIP_ANALYSIS_ON_SYNTAX_ERRORS, "yes");
        assertThrows(IllegalArgumentException.class, () -> CompilerConfig.fromProperties(badFlag));
    }

    @Test
    void testLoadFromClasspath() {
        // 类路径上的 sqlfront.properties 使用默认值
        CompilerConfig config = CompilerConfig.load();
        assertEquals(LexicalErrorPolicy.SKIP, config.getLexicalErrorPolicy());
        assertFalse(config.isSkipAnalysisOnSyntaxErrors());
    }
}
