package org.csu.sqlfront.compiler.parser.ast;

import org.csu.sqlfront.compiler.lexer.Token;
import org.csu.sqlfront.compiler.lexer.TokenType;

/**
 * AST 节点: 表示一个字面量 (如数字、字符串)，保留原始 Token 以便输出原样文本。
 */
public record LiteralNode(Token literal) implements AstNode {

    public TokenType type() {
        return literal.type();
    }

    public String text() {
        return literal.lexeme();
    }

    /**
     * 去掉字符串常量两侧的引号后的内容；数字常量原样返回。
     */
    public String value() {
        String lexeme = literal.lexeme();
        if (literal.type() == TokenType.STRING_CONST && lexeme.length() >= 2) {
            return lexeme.substring(1, lexeme.length() - 1);
        }
        return lexeme;
    }

    public int line() {
        return literal.line();
    }

    public int column() {
        return literal.column();
    }

    @Override
    public String toString() {
        return literal.lexeme();
    }
}
