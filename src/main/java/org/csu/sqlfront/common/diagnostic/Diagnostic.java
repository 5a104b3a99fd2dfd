package org.csu.sqlfront.common.diagnostic;

import org.csu.sqlfront.compiler.lexer.Token;

/**
 * 编译过程中产生的一条诊断信息。
 * 行号和列号都从 1 开始；只有在确实没有更精确位置时才使用 0。
 *
 * @param phase    产生该诊断的阶段
 * @param severity 严重程度
 * @param message  可读的错误描述
 * @param line     行号
 * @param column   列号
 */
public record Diagnostic(Phase phase, Severity severity, String message, int line, int column) {

    public static Diagnostic error(Phase phase, String message, int line, int column) {
        return new Diagnostic(phase, Severity.ERROR, message, line, column);
    }

    public static Diagnostic error(Phase phase, String message, Token token) {
        return error(phase, message, token.line(), token.column());
    }

    public static Diagnostic warning(Phase phase, String message, int line, int column) {
        return new Diagnostic(phase, Severity.WARNING, message, line, column);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * 格式: [Line L, Col C] Syntax Error: message
     */
    public String format() {
        return String.format("[Line %d, Col %d] %s %s: %s",
                line, column, phase.getLabel(), severity.getLabel(), message);
    }

    @Override
    public String toString() {
        return format();
    }
}
