package org.csu.sqlfront.compiler.parser.ast;

/**
 * AST 节点: 表示 GRANT 语句
 * e.g., GRANT SELECT ON students TO alice;
 * 权限名在语义分析阶段校验。
 */
public record GrantStatementNode(
        IdentifierNode privilege,
        IdentifierNode tableName,
        IdentifierNode username,
        int line,
        int column
) implements StatementNode {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitGrant(this);
    }
}
