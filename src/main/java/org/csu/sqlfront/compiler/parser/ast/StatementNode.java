package org.csu.sqlfront.compiler.parser.ast;

/**
 * 语句节点。语句种类是封闭的，通过 {@link StatementVisitor} 分派，
 * 新增语句类型时编译器会强制所有访问者同步处理。
 */
public sealed interface StatementNode extends AstNode
        permits CreateTableStatementNode, InsertStatementNode, SelectStatementNode,
        UpdateStatementNode, DeleteStatementNode, CreateUserStatementNode, GrantStatementNode {

    /** 语句首个关键字所在的行 */
    int line();

    /** 语句首个关键字所在的列 */
    int column();

    <R> R accept(StatementVisitor<R> visitor);
}
