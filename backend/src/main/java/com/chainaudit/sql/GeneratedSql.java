package com.chainaudit.sql;

import com.chainaudit.analysis.chain.Operation;

import java.util.List;

/**
 * SQL 生成结果
 */
public record GeneratedSql(Operation type, String sql, List<String> tables, List<QueryParameter> parameters) {

    public GeneratedSql {
        tables = List.copyOf(tables);
        parameters = List.copyOf(parameters);
    }
}
