package org.csu.sqlfront.compiler.parser.ast;

import org.csu.sqlfront.common.model.DataType;

/**
 * 用于 CREATE TABLE 语句中的列定义
 */
public record ColumnDefinitionNode(IdentifierNode columnName, DataType dataType) implements AstNode {

    @Override
    public String toString() {
        return columnName + " " + dataType;
    }
}
