package org.csu.sqlfront.compiler.parser.ast;

public record DeleteStatementNode(
        IdentifierNode tableName,
        ConditionNode whereClause,
        int line,
        int column
) implements StatementNode {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDelete(this);
    }
}
