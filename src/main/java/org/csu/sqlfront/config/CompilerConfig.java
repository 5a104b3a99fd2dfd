package org.csu.sqlfront.config;

import lombok.Getter;
import org.csu.sqlfront.compiler.lexer.LexicalErrorPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * 编译器配置。默认值可被类路径上的 sqlfront.properties 覆盖:
 * <pre>
 * lexer.error-policy=SKIP | ABORT
 * analyzer.skip-on-syntax-errors=true | false
 * </pre>
 */
@Getter
public class CompilerConfig {

    public static final String RESOURCE_NAME = "sqlfront.properties";
    public static final String LEXER_ERROR_POLICY = "lexer.error-policy";
    public static final String SKIP_ANALYSIS_ON_SYNTAX_ERRORS = "analyzer.skip-on-syntax-errors";

    private final LexicalErrorPolicy lexicalErrorPolicy;
    private final boolean skipAnalysisOnSyntaxErrors;

    public CompilerConfig(LexicalErrorPolicy lexicalErrorPolicy, boolean skipAnalysisOnSyntaxErrors) {
        this.lexicalErrorPolicy = lexicalErrorPolicy;
        this.skipAnalysisOnSyntaxErrors = skipAnalysisOnSyntaxErrors;
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(LexicalErrorPolicy.SKIP, false);
    }

    /**
     * 从属性集合构造配置，缺省的键使用默认值。
     * @throws IllegalArgumentException 属性值不合法时
     */
    public static CompilerConfig fromProperties(Properties properties) {
        CompilerConfig defaults = defaults();

        LexicalErrorPolicy policy = defaults.getLexicalErrorPolicy();
        String policyValue = properties.getProperty(LEXER_ERROR_POLICY);
        if (policyValue != null) {
            try {
                policy = LexicalErrorPolicy.valueOf(policyValue.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for " + LEXER_ERROR_POLICY + ": '" + policyValue
                        + "' (expected SKIP or ABORT)", e);
            }
        }

        boolean skipAnalysis = defaults.isSkipAnalysisOnSyntaxErrors();
        String skipValue = properties.getProperty(SKIP_ANALYSIS_ON_SYNTAX_ERRORS);
        if (skipValue != null) {
            skipAnalysis = parseBoolean(SKIP_ANALYSIS_ON_SYNTAX_ERRORS, skipValue.trim());
        }
        return new CompilerConfig(policy, skipAnalysis);
    }

    /**
     * 读取类路径上的 sqlfront.properties，不存在时返回默认配置。
     */
    public static CompilerConfig load() {
        try (InputStream in = CompilerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    // Boolean.parseBoolean 会把任何拼错的值当成 false，这里要求严格的 true/false
    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "' (expected true or false)");
    }

    @Override
    public String toString() {
        return "CompilerConfig[" + LEXER_ERROR_POLICY + "=" + lexicalErrorPolicy + ", "
                + SKIP_ANALYSIS_ON_SYNTAX_ERRORS + "=" + skipAnalysisOnSyntaxErrors + "]";
    }
}
