package com.chainaudit.sql;

import com.chainaudit.model.SourceLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把提取到的 SQL 渲染为文本或 JSON 报告，文件路径相对于扫描根目录
 */
@Component
public class SqlReportFormatter {

    private final ObjectMapper objectMapper;

    public SqlReportFormatter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String synthesizeSql(List<ExtractedQuery> queries, OutputFormat format, Path root) {
        return format == OutputFormat.JSON ? toJson(queries, root) : toText(queries, root);
    }

    private String toText(List<ExtractedQuery> queries, Path root) {
        if (queries.isEmpty()) {
            return "No SQL queries found.\n";
        }
        StringBuilder out = new StringBuilder();
        out.append("Found ").append(queries.size())
                .append(queries.size() == 1 ? " SQL query:" : " SQL queries:")
                .append("\n\n");
        for (ExtractedQuery query : queries) {
            out.append("File: ").append(relativize(query.getLocation(), root)).append('\n');
            out.append("  ").append(query.getSql()).append('\n');
            List<QueryParameter> parameters = query.getParameters();
            if (parameters != null && !parameters.isEmpty()) {
                out.append("  Parameters:\n");
                for (QueryParameter parameter : parameters) {
                    out.append("    $").append(parameter.getPosition()).append(": ").append(parameter.getSource());
                    if (parameter.getColumnType() != null) {
                        out.append(" (").append(parameter.getColumnType()).append(')');
                    }
                    out.append('\n');
                }
            }
            out.append('\n');
        }
        return out.toString();
    }

    private String toJson(List<ExtractedQuery> queries, Path root) {
        List<ExtractedQuery> relative = queries.stream()
                .map(q -> q.toBuilder().location(relativize(q.getLocation(), root)).build())
                .toList();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("totalQueries", relative.size());
        payload.put("queries", relative);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("SQL 报告序列化失败", e);
        }
    }

    private static SourceLocation relativize(SourceLocation location, Path root) {
        return location == null ? null : location.relativeTo(root);
    }
}
