package org.csu.sqlfront.common.model;

import org.csu.sqlfront.compiler.lexer.TokenType;

/**
 * 列可声明的数据类型，以及字面量与列类型之间的兼容规则。
 */
public enum DataType {
    INT,
    FLOAT,
    TEXT;

    /**
     * INT 只接受不含小数点的数字字面量，FLOAT 接受任意数字字面量，TEXT 只接受字符串字面量。
     *
     * @param literalType 字面量 Token 的类型
     * @return 该列能否接收此字面量
     */
    public boolean accepts(TokenType literalType) {
        return switch (this) {
            case INT -> literalType == TokenType.INTEGER_CONST;
            case FLOAT -> literalType == TokenType.INTEGER_CONST || literalType == TokenType.DECIMAL_CONST;
            case TEXT -> literalType == TokenType.STRING_CONST;
        };
    }

    /**
     * 推断字面量自身的类型 (用于错误信息)
     */
    public static DataType ofLiteral(TokenType literalType) {
        return switch (literalType) {
            case INTEGER_CONST -> INT;
            case DECIMAL_CONST -> FLOAT;
            case STRING_CONST -> TEXT;
            default -> throw new IllegalArgumentException("Not a literal token type: " + literalType);
        };
    }

    /**
     * 由类型关键字 (INT / FLOAT / TEXT) 得到数据类型，不是类型关键字时返回 null。
     */
    public static DataType ofKeyword(TokenType keyword) {
        return switch (keyword) {
            case INT -> INT;
            case FLOAT -> FLOAT;
            case TEXT -> TEXT;
            default -> null;
        };
    }
}
