package org.csu.sqlfront.common.model;

import lombok.Getter;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 定义表的模式，包含列的定义。列的顺序即声明顺序。
 */
@Getter
public class Schema {
    private final List<Column> columns;

    public Schema(List<Column> columns) {
        this.columns = List.copyOf(columns);
    }

    public int size() {
        return columns.size();
    }

    public List<String> getColumnNames() {
        return columns.stream()
                .map(Column::getName)
                .collect(Collectors.toList());
    }

    /**
     * 根据列名查找列（忽略大小写）。
     * @param columnName 要查找的列名
     * @return 匹配的 Column，找不到时为空
     */
    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
