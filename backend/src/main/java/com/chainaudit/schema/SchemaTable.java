package com.chainaudit.schema;

import java.util.List;
import java.util.Optional;

/**
 * 表定义；name 为源码中的变量名，sqlName 为数据库表名
 */
public record SchemaTable(String name, String sqlName, List<SchemaColumn> columns) {

    public SchemaTable {
        columns = List.copyOf(columns);
    }

    public Optional<SchemaColumn> findColumn(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    public List<SchemaColumn> requiredColumns() {
        return columns.stream().filter(SchemaColumn::isRequired).toList();
    }

    /** 列的数据库名；未知列原样返回 */
    public String columnSqlName(String columnName) {
        return findColumn(columnName).map(SchemaColumn::sqlName).orElse(columnName);
    }
}
