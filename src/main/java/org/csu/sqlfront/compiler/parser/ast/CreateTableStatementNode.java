package org.csu.sqlfront.compiler.parser.ast;

import java.util.List;

/**
 * 表示一个 CREATE TABLE 语句
 * e.g., CREATE TABLE students (id INT, name TEXT, grade FLOAT);
 */
public record CreateTableStatementNode(
        IdentifierNode tableName,
        List<ColumnDefinitionNode> columns,
        int line,
        int column
) implements StatementNode {

    public CreateTableStatementNode {
        columns = List.copyOf(columns);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCreateTable(this);
    }
}
