package com.chainaudit.service;

import com.chainaudit.model.ScanReport;
import com.chainaudit.model.SourceLocation;
import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.sql.ExtractedQuery;
import com.chainaudit.sql.QueryParameter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 扫描报告导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportMarkdown(ScanReport report) {
        String markdown = buildMarkdown(report);
        byte[] content = markdown.getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                "chain-audit-report-" + formatFileTs(report.getScanTime()) + ".md",
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(ScanReport report) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            return new ExportPayload(
                    "chain-audit-report-" + formatFileTs(report.getScanTime()) + ".json",
                    "application/json;charset=UTF-8",
                    content);
        } catch (Exception e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    private String buildMarkdown(ScanReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# ORM 调用链审查报告\n\n");
        md.append("**扫描时间:** ").append(report.getScanTime() != null ? report.getScanTime() : LocalDateTime.now()).append("\n");
        md.append("**扫描范围:** `").append(escapeInlineCode(report.getRepoPath())).append("`\n");
        md.append("**Schema:** `").append(escapeInlineCode(notBlank(report.getSchemaPath())
                ? report.getSchemaPath() : "未找到")).append("`\n\n");

        if (report.isLimitReached()) {
            md.append("> ⚠️ **警告：扫描结果被截断**\n");
            md.append("> 问题数量超过上限，仅保存并展示前 ").append(report.getTotalIssues())
                    .append(" 条。建议缩小扫描范围。\n\n");
        }

        List<String> notices = report.getNotices() != null ? report.getNotices() : List.of();
        for (String notice : notices) {
            md.append("> ").append(notice).append("\n");
        }
        if (!notices.isEmpty()) {
            md.append("\n");
        }

        md.append("## 📊 统计摘要\n");
        md.append("- **扫描文件总数:** ").append(report.getTotalFiles()).append("\n");
        md.append("- **还原 SQL 总数:** ").append(report.getTotalQueries()).append("\n");
        md.append("- **写操作总数:** ").append(report.getTotalOperations()).append("\n");
        md.append("- **问题总数:** ").append(report.getTotalIssues())
                .append(" (❌ 错误: ").append(report.getErrorCount())
                .append(", ⚠️ 警告: ").append(report.getWarningCount())
                .append(")\n\n");

        List<PersistenceIssue> issues = report.getIssues() != null ? report.getIssues() : List.of();
        if (issues.isEmpty()) {
            md.append("✅ **未发现持久化问题**\n\n");
        } else {
            md.append("## 🚫 问题详情\n\n");
            for (Map.Entry<String, List<PersistenceIssue>> entry : groupByFile(issues).entrySet()) {
                md.append("### 📄 `").append(escapeInlineCode(entry.getKey())).append("` (")
                        .append(entry.getValue().size()).append(" 项)\n\n");
                for (PersistenceIssue issue : entry.getValue()) {
                    String severity = issue.getSeverity() != null ? issue.getSeverity().name() : "UNKNOWN";
                    md.append("**[").append(severity).append("]** ").append(orEmpty(issue.getRuleId())).append("\n");
                    md.append("- **位置:** ").append(position(issue.getLocation())).append("\n");
                    md.append("- **说明:** ").append(orEmpty(issue.getMessage())).append("\n");
                    if (notBlank(issue.getSuggestion())) {
                        md.append("- **修复建议:** ").append(issue.getSuggestion()).append("\n");
                    }
                    if (notBlank(issue.getCode())) {
                        md.append("- **相关代码:** `").append(escapeInlineCode(issue.getCode())).append("`\n");
                    }
                    md.append("\n");
                }
            }
        }

        List<ExtractedQuery> queries = report.getQueries() != null ? report.getQueries() : List.of();
        if (!queries.isEmpty()) {
            md.append("## 🧾 还原的 SQL\n\n");
            for (ExtractedQuery query : queries) {
                md.append("**").append(orEmpty(query.getType())).append("** `")
                        .append(escapeInlineCode(query.getLocation() != null ? query.getLocation().toString() : "unknown"))
                        .append("`\n\n");
                md.append("```sql\n").append(orEmpty(query.getSql())).append("\n```\n");
                List<QueryParameter> parameters = query.getParameters() != null ? query.getParameters() : List.of();
                for (QueryParameter parameter : parameters) {
                    md.append("- `$").append(parameter.getPosition()).append("`: `")
                            .append(escapeInlineCode(parameter.getSource())).append("`");
                    if (notBlank(parameter.getColumnType())) {
                        md.append(" (").append(parameter.getColumnType()).append(")");
                    }
                    md.append("\n");
                }
                md.append("\n");
            }
        }

        List<String> files = report.getScannedFiles() != null ? report.getScannedFiles() : List.of();
        md.append("## 📁 扫描文件列表\n\n");
        for (String file : files) {
            md.append("- `").append(escapeInlineCode(file)).append("`\n");
        }
        return md.toString();
    }

    private Map<String, List<PersistenceIssue>> groupByFile(List<PersistenceIssue> issues) {
        Map<String, List<PersistenceIssue>> grouped = new LinkedHashMap<>();
        for (PersistenceIssue issue : issues) {
            String path = "unknown";
            if (issue.getLocation() != null && notBlank(issue.getLocation().file())) {
                path = issue.getLocation().file();
            }
            grouped.computeIfAbsent(path, k -> new ArrayList<>()).add(issue);
        }
        return grouped;
    }

    private String position(SourceLocation location) {
        if (location == null) {
            return "未知";
        }
        return "行 " + location.line() + ", 列 " + location.column();
    }

    private String escapeInlineCode(String text) {
        return orEmpty(text).replace("`", "\\`");
    }

    private String orEmpty(String text) {
        return text == null ? "" : text;
    }

    private boolean notBlank(String text) {
        return text != null && !text.isBlank();
    }

    private String formatFileTs(LocalDateTime time) {
        LocalDateTime effective = time != null ? time : LocalDateTime.now();
        return effective.format(FILE_TS);
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
