package org.csu.sqlfront.compiler.parser.ast;

import java.util.List;

/**
 * 表示 INSERT 语句，值按表中列的声明顺序给出
 * e.g., INSERT INTO students VALUES (1, 'Ali', 85.5);
 */
public record InsertStatementNode(
        IdentifierNode tableName,
        List<LiteralNode> values,
        int line,
        int column
) implements StatementNode {

    public InsertStatementNode {
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitInsert(this);
    }
}
