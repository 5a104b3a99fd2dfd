package org.csu.sqlfront.compiler.parser.ast;

import java.util.List;

public record UpdateStatementNode(
        IdentifierNode tableName,
        List<SetClauseNode> setClauses,
        ConditionNode whereClause,
        int line,
        int column
) implements StatementNode {

    public UpdateStatementNode {
        setClauses = List.copyOf(setClauses);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitUpdate(this);
    }
}
