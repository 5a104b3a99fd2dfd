package org.csu.sqlfront.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元在源文本中的原样文本 (字符串常量包含引号)
 * @param line 所在的行号，从 1 开始
 * @param column 所在的列号，从 1 开始
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-15s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
