package org.csu.sqlfront.compiler.parser;

import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.diagnostic.Phase;
import org.csu.sqlfront.common.model.DataType;
import org.csu.sqlfront.common.result.Result;
import org.csu.sqlfront.compiler.lexer.Token;
import org.csu.sqlfront.compiler.lexer.TokenType;
import org.csu.sqlfront.compiler.parser.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 语法分析器
 * 采用递归下降法，将Token流转换为语句的抽象语法树(AST)。
 *
 * 每条产生式对应一个解析方法，方法返回 {@link Result}：成功时是构造好的节点，失败时是
 * 指向出错 Token 的语法错误。顶层循环记录错误后进入恐慌模式恢复，跳到下一条语句继续解析。
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    // 恐慌模式下的同步点: 这些关键字开始一条新语句
    private static final Set<TokenType> STATEMENT_KEYWORDS = EnumSet.of(
            TokenType.CREATE, TokenType.INSERT, TokenType.SELECT,
            TokenType.UPDATE, TokenType.DELETE, TokenType.GRANT
    );

    // WHERE 条件中括号嵌套的最大层数
    static final int MAX_CONDITION_DEPTH = 256;
    // 一个 WHERE 条件中比较式的最大个数，限制 AND/OR 链构成的树高
    static final int MAX_CONDITION_TERMS = 1024;

    private final List<Token> tokens;
    private int position = 0;
    private int conditionDepth = 0;
    private int conditionTerms = 0;

    public Parser(List<Token> tokens) {
        this.tokens = withEofSentinel(tokens);
    }

    /**
     * 解析整个 Token 序列。单条语句的语法错误不会中断整批解析。
     * @return 成功解析的语句以及所有语法错误
     */
    public ParseResult parse() {
        position = 0;
        List<StatementNode> statements = new ArrayList<>();
        List<Diagnostic> errors = new ArrayList<>();

        while (!isAtEnd()) {
            Result<StatementNode> statement = parseStatement();
            if (statement.isSuccess()) {
                statements.add(statement.getValue());
            } else {
                Diagnostic error = statement.getDiagnostic();
                log.debug("Syntax error, synchronizing: {}", error);
                errors.add(error);
                synchronize();
            }
        }
        log.debug("Parsed {} statement(s) with {} syntax error(s)", statements.size(), errors.size());
        return new ParseResult(statements, errors);
    }

    private Result<StatementNode> parseStatement() {
        Token keyword = peek();
        switch (keyword.type()) {
            case CREATE -> {
                advance();
                if (match(TokenType.TABLE)) {
                    return parseCreateTableStatement(keyword);
                }
                if (match(TokenType.USER)) {
                    return parseCreateUserStatement(keyword);
                }
                return error(peek(), "Expected 'TABLE' or 'USER' after 'CREATE'");
            }
            case INSERT -> {
                advance();
                return parseInsertStatement(keyword);
            }
            case SELECT -> {
                advance();
                return parseSelectStatement(keyword);
            }
            case UPDATE -> {
                advance();
                return parseUpdateStatement(keyword);
            }
            case DELETE -> {
                advance();
                return parseDeleteStatement(keyword);
            }
            case GRANT -> {
                advance();
                return parseGrantStatement(keyword);
            }
            default -> {
                return error(keyword, "Expected a statement (CREATE, INSERT, SELECT, UPDATE, DELETE, GRANT)");
            }
        }
    }

    // CREATE TABLE id '(' (id TYPE (',' id TYPE)*)? ')' ';'
    private Result<StatementNode> parseCreateTableStatement(Token keyword) {
        Result<Token> tableName = consume(TokenType.IDENTIFIER, "Expected table name after 'TABLE'");
        if (tableName.isFailure()) return tableName.propagate();

        Result<Token> lparen = consume(TokenType.LPAREN, "Expected '(' after table name");
        if (lparen.isFailure()) return lparen.propagate();

        List<ColumnDefinitionNode> columns = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                Result<ColumnDefinitionNode> column = parseColumnDefinition();
                if (column.isFailure()) return column.propagate();
                columns.add(column.getValue());
            } while (match(TokenType.COMMA));
        }

        Result<Token> rparen = consume(TokenType.RPAREN, "Expected ')' after column definitions");
        if (rparen.isFailure()) return rparen.propagate();

        Result<Token> end = consume(TokenType.SEMICOLON, "Expected ';' after CREATE TABLE statement");
        if (end.isFailure()) return end.propagate();

        return Result.success(new CreateTableStatementNode(
                IdentifierNode.of(tableName.getValue()), columns, keyword.line(), keyword.column()));
    }

    private Result<ColumnDefinitionNode> parseColumnDefinition() {
        Result<Token> columnName = consume(TokenType.IDENTIFIER, "Expected column name");
        if (columnName.isFailure()) return columnName.propagate();

        Token typeToken = peek();
        DataType dataType = DataType.ofKeyword(typeToken.type());
        if (dataType == null) {
            return error(typeToken, "Expected data type (INT, FLOAT, TEXT)");
        }
        advance();
        return Result.success(new ColumnDefinitionNode(IdentifierNode.of(columnName.getValue()), dataType));
    }

    // CREATE USER id IDENTIFIED BY string ';'
    private Result<StatementNode> parseCreateUserStatement(Token keyword) {
        Result<Token> username = consume(TokenType.IDENTIFIER, "Expected user name after 'USER'");
        if (username.isFailure()) return username.propagate();

        Result<Token> identified = consume(TokenType.IDENTIFIED, "Expected 'IDENTIFIED' after user name");
        if (identified.isFailure()) return identified.propagate();

        Result<Token> by = consume(TokenType.BY, "Expected 'BY' after 'IDENTIFIED'");
        if (by.isFailure()) return by.propagate();

        Result<Token> password = consume(TokenType.STRING_CONST, "Expected password string after 'BY'");
        if (password.isFailure()) return password.propagate();

        Result<Token> end = consume(TokenType.SEMICOLON, "Expected ';' after CREATE USER statement");
        if (end.isFailure()) return end.propagate();

        return Result.success(new CreateUserStatementNode(
                IdentifierNode.of(username.getValue()), new LiteralNode(password.getValue()),
                keyword.line(), keyword.column()));
    }

    // GRANT privilege ON id TO id ';'
    private Result<StatementNode> parseGrantStatement(Token keyword) {
        // 权限可以是具体的关键字(SELECT等)，也可以是通用的标识符(例如ALL)，合法性留给语义分析
        if (!match(TokenType.SELECT, TokenType.INSERT, TokenType.UPDATE, TokenType.DELETE, TokenType.IDENTIFIER)) {
            return error(peek(), "Expected a privilege (SELECT, INSERT, UPDATE, DELETE, ALL) after 'GRANT'");
        }
        Token privilege = previous();

        Result<Token> on = consume(TokenType.ON, "Expected 'ON' after privilege");
        if (on.isFailure()) return on.propagate();

        Result<Token> tableName = consume(TokenType.IDENTIFIER, "Expected table name after 'ON'");
        if (tableName.isFailure()) return tableName.propagate();

        Result<Token> to = consume(TokenType.TO, "Expected 'TO' after table name");
        if (to.isFailure()) return to.propagate();

        Result<Token> username = consume(TokenType.IDENTIFIER, "Expected user name after 'TO'");
        if (username.isFailure()) return username.propagate();

        Result<Token> end = consume(TokenType.SEMICOLON, "Expected ';' after GRANT statement");
        if (end.isFailure()) return end.propagate();

        return Result.success(new GrantStatementNode(
                IdentifierNode.of(privilege), IdentifierNode.of(tableName.getValue()),
                IdentifierNode.of(username.getValue()), keyword.line(), keyword.column()));
    }

    // INSERT INTO id VALUES '(' literal (',' literal)* ')' ';'
    private Result<StatementNode> parseInsertStatement(Token keyword) {
        Result<Token> into = consume(TokenType.INTO, "Expected 'INTO' after 'INSERT'");
        if (into.isFailure()) return into.propagate();

        Result<Token> tableName = consume(TokenType.IDENTIFIER, "Expected table name after 'INTO'");
        if (tableName.isFailure()) return tableName.propagate();

        Result<Token> values = consume(TokenType.VALUES, "Expected 'VALUES' after table name");
        if (values.isFailure()) return values.propagate();

        Result<Token> lparen = consume(TokenType.LPAREN, "Expected '(' after 'VALUES'");
        if (lparen.isFailure()) return lparen.propagate();

        List<LiteralNode> literals = new ArrayList<>();
        do {
            Result<LiteralNode> literal = parseLiteral();
            if (literal.isFailure()) return literal.propagate();
            literals.add(literal.getValue());
        } while (match(TokenType.COMMA));

        Result<Token> rparen = consume(TokenType.RPAREN, "Expected ')' after value list");
        if (rparen.isFailure()) return rparen.propagate();

        Result<Token> end = consume(TokenType.SEMICOLON, "Expected ';' after INSERT statement");
        if (end.isFailure()) return end.propagate();

        return Result.success(new InsertStatementNode(
                IdentifierNode.of(tableName.getValue()), literals, keyword.line(), keyword.column()));
    }

    // SELECT ('*' | id (',' id)*) FROM id (WHERE Condition)? ';'
    private Result<StatementNode> parseSelectStatement(Token keyword) {
        List<IdentifierNode> selectList = new ArrayList<>();
        boolean isSelectAll = false;
        if (match(TokenType.ASTERISK)) {
            isSelectAll = true;
        } else {
            do {
                Result<Token> column = consume(TokenType.IDENTIFIER, "Expected column name or '*' in select list");
                if (column.isFailure()) return column.propagate();
                selectList.add(IdentifierNode.of(column.getValue()));
            } while (match(TokenType.COMMA));
        }

        Result<Token> from = consume(TokenType.FROM, "Expected 'FROM' after select list");
        if (from.isFailure()) return from.propagate();

        Result<Token> tableName = consume(TokenType.IDENTIFIER, "Expected table name after 'FROM'");
        if (tableName.isFailure()) return tableName.propagate();

        Result<ConditionNode> whereClause = parseOptionalWhereClause();
        if (whereClause.isFailure()) return whereClause.propagate();

        Result<Token> end = consume(TokenType.SEMICOLON, "Expected ';' after SELECT statement");
        if (end.isFailure()) return end.propagate();

        return Result.success(new SelectStatementNode(selectList, IdentifierNode.of(tableName.getValue()),
                whereClause.getValue(), isSelectAll, keyword.line(), keyword.column()));
    }

    // UPDATE id SET id '=' literal (',' id '=' literal)* (WHERE Condition)? ';'
    private Result<StatementNode> parseUpdateStatement(Token keyword) {
        Result<Token> tableName = consume(TokenType.IDENTIFIER, "Expected table name after 'UPDATE'");
        if (tableName.isFailure()) return tableName.propagate();

        Result<Token> set = consume(TokenType.SET, "Expected 'SET' after table name");
        if (set.isFailure()) return set.propagate();

        List<SetClauseNode> setClauses = new ArrayList<>();
        do {
            Result<SetClauseNode> clause = parseSetClause();
            if (clause.isFailure()) return clause.propagate();
            setClauses.add(clause.getValue());
        } while (match(TokenType.COMMA));

        Result<ConditionNode> whereClause = parseOptionalWhereClause();
        if (whereClause.isFailure()) return whereClause.propagate();

        Result<Token> end = consume(TokenType.SEMICOLON, "Expected ';' after UPDATE statement");
        if (end.isFailure()) return end.propagate();

        return Result.success(new UpdateStatementNode(IdentifierNode.of(tableName.getValue()), setClauses,
                whereClause.getValue(), keyword.line(), keyword.column()));
    }

    private Result<SetClauseNode> parseSetClause() {
        Result<Token> column = consume(TokenType.IDENTIFIER, "Expected column name in SET clause");
        if (column.isFailure()) return column.propagate();

        return consume(TokenType.EQUAL, "Expected '=' after column name")
                .flatMap(equal -> parseLiteral())
                .map(value -> new SetClauseNode(IdentifierNode.of(column.getValue()), value));
    }

    // DELETE FROM id (WHERE Condition)? ';'
    private Result<StatementNode> parseDeleteStatement(Token keyword) {
        Result<Token> from = consume(TokenType.FROM, "Expected 'FROM' after 'DELETE'");
        if (from.isFailure()) return from.propagate();

        Result<Token> tableName = consume(TokenType.IDENTIFIER, "Expected table name after 'FROM'");
        if (tableName.isFailure()) return tableName.propagate();

        Result<ConditionNode> whereClause = parseOptionalWhereClause();
        if (whereClause.isFailure()) return whereClause.propagate();

        Result<Token> end = consume(TokenType.SEMICOLON, "Expected ';' after DELETE statement");
        if (end.isFailure()) return end.propagate();

        return Result.success(new DeleteStatementNode(IdentifierNode.of(tableName.getValue()),
                whereClause.getValue(), keyword.line(), keyword.column()));
    }

    /**
     * 没有 WHERE 时返回值为 null 的成功结果
     */
    private Result<ConditionNode> parseOptionalWhereClause() {
        if (match(TokenType.WHERE)) {
            conditionDepth = 0;
            conditionTerms = 0;
            return parseCondition();
        }
        return Result.success(null);
    }

    private Result<LiteralNode> parseLiteral() {
        if (peek().type().isLiteral()) {
            return Result.success(new LiteralNode(advance()));
        }
        return error(peek(), "Expected a literal value (number or string)");
    }

    // ---- 条件表达式: 优先级从低到高为 OR, AND, NOT ----

    private Result<ConditionNode> parseCondition() {
        return parseOrCondition();
    }

    private Result<ConditionNode> parseOrCondition() {
        Result<ConditionNode> left = parseAndCondition();
        if (left.isFailure()) return left;

        ConditionNode node = left.getValue();
        while (match(TokenType.OR)) {
            Result<ConditionNode> right = parseAndCondition();
            if (right.isFailure()) return right;
            node = new OrNode(node, right.getValue());
        }
        return Result.success(node);
    }

    private Result<ConditionNode> parseAndCondition() {
        Result<ConditionNode> left = parseNotCondition();
        if (left.isFailure()) return left;

        ConditionNode node = left.getValue();
        while (match(TokenType.AND)) {
            Result<ConditionNode> right = parseNotCondition();
            if (right.isFailure()) return right;
            node = new AndNode(node, right.getValue());
        }
        return Result.success(node);
    }

    private Result<ConditionNode> parseNotCondition() {
        if (match(TokenType.NOT)) {
            return parsePrimaryCondition().map(NotNode::new);
        }
        return parsePrimaryCondition();
    }

    private Result<ConditionNode> parsePrimaryCondition() {
        if (match(TokenType.LPAREN)) {
            if (conditionDepth >= MAX_CONDITION_DEPTH) {
                return Result.failure(Diagnostic.error(Phase.SYNTAX,
                        "Condition nested too deeply (more than " + MAX_CONDITION_DEPTH + " levels)", previous()));
            }
            conditionDepth++;
            Result<ConditionNode> inner = parseCondition();
            conditionDepth--;
            if (inner.isFailure()) return inner;

            Result<Token> rparen = consume(TokenType.RPAREN, "Expected ')' after condition");
            if (rparen.isFailure()) return rparen.propagate();
            return inner;
        }
        return parseComparison();
    }

    // id CompareOp literal
    private Result<ConditionNode> parseComparison() {
        Result<Token> column = consume(TokenType.IDENTIFIER, "Expected column name in condition");
        if (column.isFailure()) return column.propagate();
        if (++conditionTerms > MAX_CONDITION_TERMS) {
            return Result.failure(Diagnostic.error(Phase.SYNTAX,
                    "Condition has too many comparisons (more than " + MAX_CONDITION_TERMS + ")", column.getValue()));
        }

        ComparisonOperator operator = ComparisonOperator.fromTokenType(peek().type());
        if (operator == null) {
            return error(peek(), "Expected comparison operator (=, !=, <, <=, >, >=)");
        }
        advance();

        return parseLiteral().map(value -> new ComparisonNode(IdentifierNode.of(column.getValue()), operator, value));
    }

    // ---- 错误恢复 ----

    /**
     * 恐慌模式: 先无条件吃掉一个 Token，然后继续丢弃，直到刚吃掉的是 ';'
     * 或者下一个 Token 是语句起始关键字。
     */
    private void synchronize() {
        advance();
        while (!isAtEnd()) {
            if (previous().type() == TokenType.SEMICOLON) {
                return;
            }
            if (STATEMENT_KEYWORDS.contains(peek().type())) {
                return;
            }
            advance();
        }
    }

    private <T> Result<T> error(Token token, String expectation) {
        String message;
        if (token.type() == TokenType.EOF) {
            message = expectation + " at end of input";
        } else if (token.type() == TokenType.ILLEGAL) {
            message = expectation + ", but found illegal token '" + token.lexeme() + "'";
        } else {
            message = expectation + ", but found '" + token.lexeme() + "'";
        }
        return Result.failure(Diagnostic.error(Phase.SYNTAX, message, token));
    }

    // ---- Token 流辅助方法 ----

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Result<Token> consume(TokenType type, String message) {
        if (check(type)) return Result.success(advance());
        return error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }

    private static List<Token> withEofSentinel(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.EOF) {
            return List.copyOf(tokens);
        }
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty()) {
            copy.add(new Token(TokenType.EOF, "", 1, 1));
        } else {
            Token last = copy.get(copy.size() - 1);
            copy.add(new Token(TokenType.EOF, "", last.line(), last.column() + last.lexeme().length()));
        }
        return copy;
    }
}
