package org.csu.sqlfront.common.diagnostic;

import lombok.Getter;

/**
 * 诊断信息所属的编译阶段
 */
@Getter
public enum Phase {
    LEXICAL("Lexical"),
    SYNTAX("Syntax"),
    SEMANTIC("Semantic");

    private final String label;

    Phase(String label) {
        this.label = label;
    }
}
