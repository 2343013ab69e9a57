package com.chainaudit.schema;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * 列类型，对应 ORM 列构造函数名（text、integer、serial ...）
 */
public enum ColumnType {
    TEXT("text"),
    VARCHAR("varchar"),
    CHAR("char"),
    INTEGER("integer"),
    SMALLINT("smallint"),
    BIGINT("bigint"),
    SERIAL("serial"),
    SMALLSERIAL("smallserial"),
    BIGSERIAL("bigserial"),
    BOOLEAN("boolean"),
    TIMESTAMP("timestamp"),
    DATE("date"),
    TIME("time"),
    JSON("json"),
    JSONB("jsonb"),
    UUID("uuid"),
    REAL("real"),
    DOUBLE_PRECISION("doublePrecision"),
    NUMERIC("numeric"),
    DECIMAL("decimal"),
    ENUM("enum"),
    UNKNOWN("unknown");

    private static final Set<ColumnType> NUMERIC_TYPES = EnumSet.of(
            INTEGER, SMALLINT, BIGINT, SERIAL, SMALLSERIAL, BIGSERIAL, REAL, DOUBLE_PRECISION, NUMERIC, DECIMAL);

    private static final Set<ColumnType> SERIAL_TYPES = EnumSet.of(SERIAL, SMALLSERIAL, BIGSERIAL);

    private final String drizzleName;

    ColumnType(String drizzleName) {
        this.drizzleName = drizzleName;
    }

    public String getDrizzleName() {
        return drizzleName;
    }

    public boolean isNumeric() {
        return NUMERIC_TYPES.contains(this);
    }

    public boolean isBoolean() {
        return this == BOOLEAN;
    }

    /** 自增类型，插入时由数据库生成 */
    public boolean isSerial() {
        return SERIAL_TYPES.contains(this);
    }

    public static ColumnType fromDrizzleName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(t -> t.drizzleName.equals(name))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
