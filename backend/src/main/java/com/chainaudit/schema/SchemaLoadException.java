package com.chainaudit.schema;

/**
 * schema 文件缺失或无法读取
 */
public class SchemaLoadException extends RuntimeException {

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
