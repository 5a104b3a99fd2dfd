package org.csu.sqlfront.compiler.lexer;

/**
 * 词法分析器的接入点。任何实现都必须返回以 EOF 结尾、带 1 起始行列号的 Token 序列，
 * 并且在遇到错误时也要继续向前推进。
 */
@FunctionalInterface
public interface Tokenizer {

    LexResult tokenize(String source);

    /**
     * 默认实现: 每次调用都用一个新的 {@link Lexer} 扫描整段文本
     */
    static Tokenizer standard() {
        return source -> new Lexer(source).tokenize();
    }
}
