package org.csu.sqlfront.compiler.semantic;

import org.csu.sqlfront.catalog.GrantEntry;
import org.csu.sqlfront.catalog.SchemaTable;
import org.csu.sqlfront.catalog.TableInfo;
import org.csu.sqlfront.catalog.UserInfo;
import org.csu.sqlfront.catalog.UserTable;
import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.diagnostic.Phase;
import org.csu.sqlfront.common.model.Column;
import org.csu.sqlfront.common.model.DataType;
import org.csu.sqlfront.common.model.Privilege;
import org.csu.sqlfront.common.result.Result;
import org.csu.sqlfront.compiler.parser.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 语义分析器
 * 按源顺序检查每条语句的逻辑正确性，同时建立表结构符号表和用户权限表。
 *
 * 一个分析器实例只服务一次编译过程，独占自己的两张表。遇到第一个语义错误即停止，
 * 结果中保留此前已通过的语句和表的当前状态。
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final SchemaTable schemaTable = new SchemaTable();
    private final UserTable userTable = new UserTable();
    private final List<Diagnostic> warnings = new ArrayList<>();
    private boolean used = false;

    /**
     * 分析整个语句列表。每个实例只能调用一次。
     * @param statements 语法分析得到的语句 (按源顺序)
     * @return 分析结果，包含已验证的语句、两张表、警告以及可能的致命错误
     */
    public AnalysisResult analyze(List<StatementNode> statements) {
        if (used) {
            throw new IllegalStateException("SemanticAnalyzer instances are single-use; create a new one per run");
        }
        used = true;

        StatementChecker checker = new StatementChecker();
        List<StatementNode> validated = new ArrayList<>();
        for (StatementNode statement : statements) {
            Result<Void> result = statement.accept(checker);
            if (result.isFailure()) {
                Diagnostic error = result.getDiagnostic();
                log.debug("Semantic analysis halted: {}", error);
                return new AnalysisResult(validated, schemaTable, userTable, warnings, error);
            }
            log.debug("Validated {}", statement);
            validated.add(statement);
        }
        return new AnalysisResult(validated, schemaTable, userTable, warnings, null);
    }

    private static <T> Result<T> error(String message, int line, int column) {
        return Result.failure(Diagnostic.error(Phase.SEMANTIC, message, line, column));
    }

    private Result<TableInfo> lookupTable(IdentifierNode tableName) {
        Optional<TableInfo> table = schemaTable.find(tableName.name());
        if (table.isEmpty()) {
            return error("Table '" + tableName.name() + "' not found.", tableName.line(), tableName.column());
        }
        return Result.success(table.get());
    }

    private static Result<Column> lookupColumn(TableInfo table, IdentifierNode columnName) {
        Optional<Column> column = table.getSchema().findColumn(columnName.name());
        if (column.isEmpty()) {
            return error("Column '" + columnName.name() + "' not found in table '" + table.getTableName() + "'.",
                    columnName.line(), columnName.column());
        }
        return Result.success(column.get());
    }

    private void warn(String message, int line, int column) {
        log.warn(message);
        warnings.add(Diagnostic.warning(Phase.SEMANTIC, message, line, column));
    }

    private static String literalKind(LiteralNode literal) {
        return DataType.ofLiteral(literal.type()).name();
    }

    /**
     * 每种语句一个检查方法
     */
    private class StatementChecker implements StatementVisitor<Result<Void>> {

        @Override
        public Result<Void> visitCreateTable(CreateTableStatementNode node) {
            IdentifierNode tableName = node.tableName();
            if (schemaTable.contains(tableName.name())) {
                return error("Table '" + tableName.name() + "' already exists.", tableName.line(), tableName.column());
            }

            Set<String> seen = new HashSet<>();
            List<Column> columns = new ArrayList<>();
            for (ColumnDefinitionNode definition : node.columns()) {
                IdentifierNode columnName = definition.columnName();
                if (!seen.add(columnName.name().toLowerCase(Locale.ROOT))) {
                    return error("Duplicate column '" + columnName.name() + "' in table '" + tableName.name() + "'.",
                            columnName.line(), columnName.column());
                }
                columns.add(new Column(columnName.name(), definition.dataType()));
            }

            TableInfo table = schemaTable.register(tableName.name(), columns);
            log.info("Table '{}' defined with columns {}", table.getTableName(), table.getSchema());
            return Result.ok();
        }

        @Override
        public Result<Void> visitCreateUser(CreateUserStatementNode node) {
            IdentifierNode username = node.username();
            if (userTable.contains(username.name())) {
                return error("User '" + username.name() + "' already exists.", username.line(), username.column());
            }
            userTable.register(username.name(), node.password().value());
            log.info("User '{}' created", username.name());
            return Result.ok();
        }

        @Override
        public Result<Void> visitGrant(GrantStatementNode node) {
            IdentifierNode username = node.username();
            Optional<UserInfo> user = userTable.find(username.name());
            if (user.isEmpty()) {
                return error("User '" + username.name() + "' not found.", username.line(), username.column());
            }

            Result<TableInfo> table = lookupTable(node.tableName());
            if (table.isFailure()) return table.propagate();

            String tableName = table.getValue().getTableName();
            IdentifierNode privilegeName = node.privilege();
            GrantEntry grant = new GrantEntry(tableName, privilegeName.name());
            if (grant.privilege().isEmpty()) {
                // 未知权限名照样记录，只给出提示
                warn("Unknown privilege '" + privilegeName.name() + "' recorded as given; expected one of "
                        + Arrays.toString(Privilege.values()) + ".", privilegeName.line(), privilegeName.column());
            }

            if (user.get().addGrant(grant)) {
                log.info("Granted {} on '{}' to '{}'", grant.privilegeName(), tableName, user.get().getUsername());
            } else {
                warn("User '" + user.get().getUsername() + "' already has " + grant.privilegeName()
                        + " on '" + tableName + "'.", node.line(), node.column());
            }
            return Result.ok();
        }

        @Override
        public Result<Void> visitInsert(InsertStatementNode node) {
            Result<TableInfo> lookup = lookupTable(node.tableName());
            if (lookup.isFailure()) return lookup.propagate();
            TableInfo table = lookup.getValue();

            List<Column> columns = table.getSchema().getColumns();
            List<LiteralNode> values = node.values();
            if (values.size() != columns.size()) {
                return error("Column count mismatch for table '" + table.getTableName() + "'. Expected "
                        + columns.size() + " values, got " + values.size() + ".", node.line(), node.column());
            }

            for (int i = 0; i < columns.size(); i++) {
                Column column = columns.get(i);
                LiteralNode value = values.get(i);
                if (!column.getType().accepts(value.type())) {
                    return error("Type mismatch at column " + (i + 1) + " ('" + column.getName() + "'). Expected "
                                    + column.getType() + " but got " + literalKind(value) + " literal " + value + ".",
                            value.line(), value.column());
                }
            }
            return Result.ok();
        }

        @Override
        public Result<Void> visitSelect(SelectStatementNode node) {
            Result<TableInfo> lookup = lookupTable(node.fromTable());
            if (lookup.isFailure()) return lookup.propagate();
            TableInfo table = lookup.getValue();

            if (!node.isSelectAll()) {
                for (IdentifierNode columnName : node.selectList()) {
                    Result<Column> column = lookupColumn(table, columnName);
                    if (column.isFailure()) return column.propagate();
                }
            }
            return checkWhere(table, node.whereClause());
        }

        @Override
        public Result<Void> visitUpdate(UpdateStatementNode node) {
            Result<TableInfo> lookup = lookupTable(node.tableName());
            if (lookup.isFailure()) return lookup.propagate();
            TableInfo table = lookup.getValue();

            for (SetClauseNode clause : node.setClauses()) {
                Result<Column> lookupColumn = lookupColumn(table, clause.column());
                if (lookupColumn.isFailure()) return lookupColumn.propagate();
                Column column = lookupColumn.getValue();

                LiteralNode value = clause.value();
                if (!column.getType().accepts(value.type())) {
                    return error("Type mismatch for column '" + column.getName() + "'. Expected " + column.getType()
                                    + " but got " + literalKind(value) + " literal " + value + ".",
                            value.line(), value.column());
                }
            }
            return checkWhere(table, node.whereClause());
        }

        @Override
        public Result<Void> visitDelete(DeleteStatementNode node) {
            Result<TableInfo> lookup = lookupTable(node.tableName());
            if (lookup.isFailure()) return lookup.propagate();
            return checkWhere(lookup.getValue(), node.whereClause());
        }

        private Result<Void> checkWhere(TableInfo table, ConditionNode whereClause) {
            if (whereClause == null) {
                return Result.ok();
            }
            return whereClause.accept(new ConditionChecker(table));
        }
    }

    /**
     * 递归检查 WHERE 条件树，先左后右，遇到第一个非法节点即返回。
     */
    private static class ConditionChecker implements ConditionVisitor<Result<Void>> {

        private final TableInfo table;

        ConditionChecker(TableInfo table) {
            this.table = table;
        }

        @Override
        public Result<Void> visitComparison(ComparisonNode node) {
            Result<Column> lookup = lookupColumn(table, node.getColumn());
            if (lookup.isFailure()) return lookup.propagate();
            Column column = lookup.getValue();

            LiteralNode value = node.getValue();
            if (!column.getType().accepts(value.type())) {
                return error("Type mismatch in WHERE clause. Column '" + column.getName() + "' is "
                                + column.getType() + " but compared with " + literalKind(value) + " literal " + value + ".",
                        value.line(), value.column());
            }
            node.setResolvedType(column.getType());
            return Result.ok();
        }

        @Override
        public Result<Void> visitAnd(AndNode node) {
            Result<Void> left = node.left().accept(this);
            if (left.isFailure()) return left;
            return node.right().accept(this);
        }

        @Override
        public Result<Void> visitOr(OrNode node) {
            Result<Void> left = node.left().accept(this);
            if (left.isFailure()) return left;
            return node.right().accept(this);
        }

        @Override
        public Result<Void> visitNot(NotNode node) {
            return node.operand().accept(this);
        }
    }
}
