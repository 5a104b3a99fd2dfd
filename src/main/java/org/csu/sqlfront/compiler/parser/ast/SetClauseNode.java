package org.csu.sqlfront.compiler.parser.ast;

/**
 * UPDATE 语句中的一个赋值 column = literal
 */
public record SetClauseNode(IdentifierNode column, LiteralNode value) implements AstNode {

    @Override
    public String toString() {
        return column + " = " + value;
    }
}
