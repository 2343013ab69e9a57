package com.chainaudit.analysis.source;

import java.util.EnumSet;
import java.util.Set;

/**
 * 值的来源分类
 *
 * @param origin       来源
 * @param scalarType   可推断出的标量类型
 * @param literalValue 字面量的文本值，非字面量为 null
 * @param fieldName    外部输入的字段名（表单字段、路由参数名、请求体属性名）
 * @param validated    是否经过 schema 校验（parse / safeParse ...）
 */
public record DataSource(Origin origin, ScalarType scalarType, String literalValue, String fieldName,
                         boolean validated) {

    public enum Origin {
        LITERAL, EXTERNAL_FIELD, ROUTE_PARAM, REQUEST_BODY, VARIABLE, UNKNOWN
    }

    public enum ScalarType {
        STRING, NUMBER, BOOLEAN, NULL, UNKNOWN
    }

    private static final Set<Origin> EXTERNAL_ORIGINS = EnumSet.of(
            Origin.EXTERNAL_FIELD, Origin.ROUTE_PARAM, Origin.REQUEST_BODY);

    public static DataSource unknown() {
        return new DataSource(Origin.UNKNOWN, ScalarType.UNKNOWN, null, null, false);
    }

    public static DataSource variable() {
        return new DataSource(Origin.VARIABLE, ScalarType.UNKNOWN, null, null, false);
    }

    public static DataSource validatedVariable() {
        return new DataSource(Origin.VARIABLE, ScalarType.UNKNOWN, null, null, true);
    }

    public static DataSource literal(ScalarType scalarType, String value) {
        return new DataSource(Origin.LITERAL, scalarType, value, null, false);
    }

    public static DataSource external(Origin origin, ScalarType scalarType, String fieldName) {
        return new DataSource(origin, scalarType, null, fieldName, false);
    }

    public DataSource withScalarType(ScalarType type) {
        return new DataSource(origin, type, literalValue, fieldName, validated);
    }

    /** 表单字段、路由参数或请求体 */
    public boolean isExternal() {
        return EXTERNAL_ORIGINS.contains(origin);
    }
}
