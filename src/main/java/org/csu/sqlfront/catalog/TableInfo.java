package org.csu.sqlfront.catalog;

import lombok.Getter;
import org.csu.sqlfront.common.model.Schema;

/**
 * 在内存中表示一个表的信息。
 */
@Getter
public class TableInfo {
    private final String tableName;
    private final Schema schema;

    public TableInfo(String tableName, Schema schema) {
        this.tableName = tableName;
        this.schema = schema;
    }

    @Override
    public String toString() {
        return tableName + schema;
    }
}
