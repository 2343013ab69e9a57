package com.chainaudit.analysis.chain;

/**
 * where 条件；IS NULL / IS NOT NULL 的 value 为 null
 */
public record WhereCondition(ColumnRef column, String operator, ValueInfo value) {

    public boolean takesValue() {
        return value != null;
    }
}
