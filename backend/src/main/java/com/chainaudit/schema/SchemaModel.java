package com.chainaudit.schema;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 从 schema 声明文件解析出的表、列与枚举；构建后只读，可在多个文件的分析间共享
 */
public record SchemaModel(List<SchemaTable> tables, List<SchemaEnum> enums, Path schemaPath) {

    public SchemaModel {
        tables = List.copyOf(tables);
        enums = List.copyOf(enums);
    }

    /** 未提供 schema 时使用：所有名称原样输出 */
    public static SchemaModel empty() {
        return new SchemaModel(List.of(), List.of(), null);
    }

    public Optional<SchemaTable> findTable(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return tables.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    public Optional<SchemaEnum> findEnum(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return enums.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    /** 表的数据库名；未知表原样返回 */
    public String tableSqlName(String name) {
        return findTable(name).map(SchemaTable::sqlName).orElse(name);
    }
}
