package org.csu.sqlfront.compiler.parser.ast;

public interface StatementVisitor<R> {

    R visitCreateTable(CreateTableStatementNode node);

    R visitInsert(InsertStatementNode node);

    R visitSelect(SelectStatementNode node);

    R visitUpdate(UpdateStatementNode node);

    R visitDelete(DeleteStatementNode node);

    R visitCreateUser(CreateUserStatementNode node);

    R visitGrant(GrantStatementNode node);
}
