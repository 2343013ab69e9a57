package com.chainaudit.schema;

/**
 * 表中的一列
 *
 * @param name            源码中的属性名
 * @param sqlName         数据库列名
 * @param type            列类型
 * @param enumName        枚举列引用的枚举变量名，非枚举列为 null
 * @param notNull         是否非空
 * @param hasDefault      是否有默认值
 * @param isAutoGenerated 是否由数据库或 ORM 自动生成
 */
public record SchemaColumn(String name, String sqlName, ColumnType type, String enumName,
                           boolean notNull, boolean hasDefault, boolean isAutoGenerated) {

    /**
     * 插入时必须显式提供
     */
    public boolean isRequired() {
        return notNull && !hasDefault && !isAutoGenerated;
    }

    public boolean isEnum() {
        return type == ColumnType.ENUM && enumName != null;
    }
}
