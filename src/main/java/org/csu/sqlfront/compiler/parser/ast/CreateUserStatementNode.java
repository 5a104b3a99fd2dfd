package org.csu.sqlfront.compiler.parser.ast;

/**
 * AST 节点: 表示 CREATE USER 语句
 * e.g., CREATE USER alice IDENTIFIED BY 'password123';
 */
public record CreateUserStatementNode(
        IdentifierNode username,
        LiteralNode password,
        int line,
        int column
) implements StatementNode {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCreateUser(this);
    }

    @Override
    public String toString() {
        // 不输出密码
        return "CreateUserStatementNode[username=" + username + ", password=***]";
    }
}
