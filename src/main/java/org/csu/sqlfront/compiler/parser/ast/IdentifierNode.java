package org.csu.sqlfront.compiler.parser.ast;

import org.csu.sqlfront.compiler.lexer.Token;

/**
 * AST 节点: 表示一个标识符，如表名、列名或用户名，同时记录它在源文本中的位置。
 */
public record IdentifierNode(String name, int line, int column) implements AstNode {

    public static IdentifierNode of(Token token) {
        return new IdentifierNode(token.lexeme(), token.line(), token.column());
    }

    @Override
    public String toString() {
        return name;
    }
}
