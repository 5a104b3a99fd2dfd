package org.csu.sqlfront.compiler.parser.ast;

import lombok.Getter;
import org.csu.sqlfront.compiler.lexer.TokenType;

@Getter
public enum ComparisonOperator {
    EQUAL("="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return 对应的比较运算符；不是比较运算符 Token 时返回 null
     */
    public static ComparisonOperator fromTokenType(TokenType type) {
        return switch (type) {
            case EQUAL -> EQUAL;
            case NOT_EQUAL -> NOT_EQUAL;
            case LESS -> LESS;
            case LESS_EQUAL -> LESS_EQUAL;
            case GREATER -> GREATER;
            case GREATER_EQUAL -> GREATER_EQUAL;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
