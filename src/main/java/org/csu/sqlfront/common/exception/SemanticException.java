package org.csu.sqlfront.common.exception;

import lombok.Getter;
import org.csu.sqlfront.common.diagnostic.Diagnostic;

/**
 * 语义分析阶段的自定义异常
 */
@Getter
public class SemanticException extends RuntimeException {

    private final Diagnostic diagnostic;

    public SemanticException(Diagnostic diagnostic) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
    }
}
