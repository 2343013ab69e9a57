package com.chainaudit.sql;

import java.util.Locale;

/**
 * SQL 报告输出格式
 */
public enum OutputFormat {
    TEXT, JSON;

    /** 不区分大小写；null 或空串按 TEXT 处理 */
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("不支持的输出格式: " + value, e);
        }
    }
}
