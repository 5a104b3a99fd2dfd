package org.csu.sqlfront.compiler.parser.ast;

import java.util.List;

/**
 * 表示 SELECT 语句。isSelectAll 为 true 时 selectList 为空；
 * 没有 WHERE 子句时 whereClause 为 null。
 */
public record SelectStatementNode(
        List<IdentifierNode> selectList,
        IdentifierNode fromTable,
        ConditionNode whereClause,
        boolean isSelectAll,
        int line,
        int column
) implements StatementNode {

    public SelectStatementNode {
        selectList = List.copyOf(selectList);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }
}
