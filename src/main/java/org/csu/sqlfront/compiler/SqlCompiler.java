package org.csu.sqlfront.compiler;

import lombok.Getter;
import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.compiler.lexer.LexResult;
import org.csu.sqlfront.compiler.lexer.LexicalErrorPolicy;
import org.csu.sqlfront.compiler.lexer.Token;
import org.csu.sqlfront.compiler.lexer.Tokenizer;
import org.csu.sqlfront.compiler.parser.ParseResult;
import org.csu.sqlfront.compiler.parser.Parser;
import org.csu.sqlfront.compiler.semantic.AnalysisResult;
import org.csu.sqlfront.compiler.semantic.SemanticAnalyzer;
import org.csu.sqlfront.config.CompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 把词法分析、语法分析、语义分析串成一次编译。
 * 每次 {@link #compile(String)} 都使用新的语义分析器，多次调用之间不共享表结构和用户。
 */
public class SqlCompiler {

    private static final Logger log = LoggerFactory.getLogger(SqlCompiler.class);

    @Getter
    private final CompilerConfig config;
    private final Tokenizer tokenizer;

    public SqlCompiler() {
        this(CompilerConfig.load());
    }

    public SqlCompiler(CompilerConfig config) {
        this(config, Tokenizer.standard());
    }

    public SqlCompiler(CompilerConfig config, Tokenizer tokenizer) {
        this.config = config;
        this.tokenizer = tokenizer;
    }

    public CompilationResult compile(String source) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        // 1. 词法分析
        LexResult lexResult = tokenizer.tokenize(source);
        diagnostics.addAll(lexResult.diagnostics());
        if (lexResult.hasErrors()) {
            log.debug("{} lexical error(s), policy {}", lexResult.diagnostics().size(), config.getLexicalErrorPolicy());
            if (config.getLexicalErrorPolicy() == LexicalErrorPolicy.ABORT) {
                return new CompilationResult(lexResult.tokens(), List.of(), null, diagnostics);
            }
        }

        // 2. 语法分析 (SKIP 策略下丢弃 ILLEGAL Token)
        List<Token> parserInput = lexResult.tokensWithoutIllegal();
        ParseResult parseResult = new Parser(parserInput).parse();
        diagnostics.addAll(parseResult.errors());
        if (parseResult.hasErrors() && config.isSkipAnalysisOnSyntaxErrors()) {
            log.debug("Skipping semantic analysis because of {} syntax error(s)", parseResult.errors().size());
            return new CompilationResult(lexResult.tokens(), parseResult.statements(), null, diagnostics);
        }

        // 3. 语义分析
        AnalysisResult analysis = new SemanticAnalyzer().analyze(parseResult.statements());
        diagnostics.addAll(analysis.diagnostics());

        log.debug("Compiled {} statement(s), {} validated, {} diagnostic(s)",
                parseResult.statements().size(), analysis.validatedStatements().size(), diagnostics.size());
        return new CompilationResult(lexResult.tokens(), parseResult.statements(), analysis, diagnostics);
    }
}
