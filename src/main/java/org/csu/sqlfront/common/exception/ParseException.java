package org.csu.sqlfront.common.exception;

import lombok.Getter;
import org.csu.sqlfront.common.diagnostic.Diagnostic;

/**
 * 语法分析阶段的异常，仅供希望以异常方式处理语法错误的调用方使用。
 */
@Getter
public class ParseException extends RuntimeException {

    private final Diagnostic diagnostic;

    public ParseException(Diagnostic diagnostic) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
    }
}
