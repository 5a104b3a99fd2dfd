package org.csu.sqlfront.compiler.lexer;

/**
 * 出现词法错误时整个编译过程的处理策略，一次运行中只使用一种。
 */
public enum LexicalErrorPolicy {
    /** 记录错误，丢弃非法 Token 后继续语法分析 */
    SKIP,
    /** 只要有词法错误就在词法分析之后结束本次运行 */
    ABORT
}
