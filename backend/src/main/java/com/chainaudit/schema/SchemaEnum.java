package com.chainaudit.schema;

import java.util.List;

/**
 * 枚举定义，如 pgEnum('status', ['active', 'pending'])
 */
public record SchemaEnum(String name, String sqlName, List<String> values) {

    public SchemaEnum {
        values = List.copyOf(values);
    }
}
