package org.csu.sqlfront.compiler.lexer;

import org.csu.sqlfront.common.diagnostic.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 词法分析的结果: 以 EOF 结尾的 Token 序列，以及扫描过程中发现的词法错误。
 */
public record LexResult(List<Token> tokens, List<Diagnostic> diagnostics) {

    public LexResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * 去掉 ILLEGAL Token 之后的序列，供 SKIP 策略下的语法分析使用。
     */
    public List<Token> tokensWithoutIllegal() {
        return tokens.stream()
                .filter(t -> t.type() != TokenType.ILLEGAL)
                .collect(Collectors.toList());
    }
}
