package org.csu.sqlfront.catalog;

import org.csu.sqlfront.common.model.Column;
import org.csu.sqlfront.common.model.Schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 一次编译过程中的表结构符号表: 表名 -> 有序的列定义。
 * 表名查找忽略大小写，但保留声明时的写法；遍历顺序即建表顺序。
 */
public class SchemaTable {

    private final Map<String, TableInfo> tables = new LinkedHashMap<>();

    public boolean contains(String tableName) {
        return tables.containsKey(key(tableName));
    }

    public Optional<TableInfo> find(String tableName) {
        return Optional.ofNullable(tables.get(key(tableName)));
    }

    /**
     * 注册一张新表。调用方负责先检查表名和列名是否重复。
     */
    public TableInfo register(String tableName, List<Column> columns) {
        if (contains(tableName)) {
            throw new IllegalStateException("Table '" + tableName + "' is already registered");
        }
        TableInfo tableInfo = new TableInfo(tableName, new Schema(columns));
        tables.put(key(tableName), tableInfo);
        return tableInfo;
    }

    public Collection<TableInfo> getTables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    public int size() {
        return tables.size();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    private static String key(String tableName) {
        return tableName.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return tables.values().toString();
    }
}
