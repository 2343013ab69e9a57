package com.chainaudit.analysis.chain;

/**
 * 排序项
 */
public record OrderByItem(ColumnRef column, Direction direction) {

    public enum Direction {
        ASC, DESC
    }
}
