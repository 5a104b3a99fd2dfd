package org.csu.sqlfront.compiler.lexer;

/**
 * 定义词法单元（Token）的类型，即“种别码”
 */
public enum TokenType {
    // ---- 语句关键字 ----
    SELECT,     // "SELECT"
    FROM,       // "FROM"
    WHERE,      // "WHERE"
    CREATE,     // "CREATE"
    TABLE,      // "TABLE"
    INSERT,     // "INSERT"
    INTO,       // "INTO"
    VALUES,     // "VALUES"
    DELETE,     // "DELETE"
    UPDATE,     // "UPDATE"
    SET,        // "SET"

    // ---- 数据类型 ----
    INT,        // "INT"
    FLOAT,      // "FLOAT"
    TEXT,       // "TEXT"

    // ====== 权限管理关键字 ======
    USER,       // "USER"
    IDENTIFIED, // "IDENTIFIED"
    BY,         // "BY"
    GRANT,      // "GRANT"
    ON,         // "ON"
    TO,         // "TO"

    // ---- 逻辑运算 ----
    AND,        // "AND"
    OR,         // "OR"
    NOT,        // "NOT"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 表名、列名、用户名等

    // ---- 常量 (Constants) ----
    INTEGER_CONST,    // 整数常量, e.g., 123
    DECIMAL_CONST,    // 小数常量, e.g., 85.5
    STRING_CONST,     // 字符串常量, e.g., 'hello'

    // ---- 比较运算符 ----
    EQUAL,          // =
    NOT_EQUAL,      // != 或 <>
    LESS,           // <
    LESS_EQUAL,     // <=
    GREATER,        // >
    GREATER_EQUAL,  // >=

    // ---- 分隔符 (Delimiters) ----
    ASTERISK,   // *
    COMMA,      // ,
    SEMICOLON,  // ;
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    EOF,        // End-Of-File，表示输入流结束
    ILLEGAL;    // 非法字符或未闭合的字符串，用于错误处理

    public boolean isLiteral() {
        return this == INTEGER_CONST || this == DECIMAL_CONST || this == STRING_CONST;
    }
}
