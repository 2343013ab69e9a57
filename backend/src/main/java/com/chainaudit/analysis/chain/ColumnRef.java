package com.chainaudit.analysis.chain;

/**
 * 列引用，如 users.id；table 可能为 null（裸列名或无法识别的表达式）
 */
public record ColumnRef(String table, String column) {

    public ColumnRef withTable(String newTable) {
        return new ColumnRef(newTable, column);
    }
}
