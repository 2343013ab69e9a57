package com.chainaudit.service;

import com.chainaudit.model.ScanReport;
import com.chainaudit.model.SourceLocation;
import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.persistence.Severity;
import com.chainaudit.sql.ExtractedQuery;
import com.chainaudit.sql.QueryParameter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportExportServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ReportExportService exportService = new ReportExportService(objectMapper);

    private ScanReport report() {
        return ScanReport.builder()
                .repoPath("/repo")
                .schemaPath("/repo/app/db/schema.ts")
                .scanTime(LocalDateTime.of(2024, 5, 1, 10, 30, 0))
                .totalFiles(2)
                .totalQueries(1)
                .totalOperations(1)
                .totalIssues(1)
                .errorCount(1)
                .issues(List.of(PersistenceIssue.builder()
                        .ruleId("MISSING_REQUIRED_COLUMN")
                        .severity(Severity.ERROR)
                        .message("db.insert(users) 缺少必填列 'status'")
                        .location(new SourceLocation("app/routes/users.new.tsx", 6, 9))
                        .code("db.insert(users).values({...})")
                        .suggestion("在 values 对象中补充 'status'")
                        .build()))
                .queries(List.of(ExtractedQuery.builder()
                        .type("INSERT")
                        .sql("INSERT INTO users (name) VALUES ($1)")
                        .tables(List.of("users"))
                        .location(new SourceLocation("app/routes/users.new.tsx", 6, 9))
                        .parameters(List.of(new QueryParameter(1, "formData.get('name')", "text")))
                        .build()))
                .scannedFiles(List.of("app/routes/users.new.tsx", "app/db/schema.ts"))
                .notices(List.of())
                .build();
    }

    @Test
    void shouldExportMarkdown() {
        ReportExportService.ExportPayload payload = exportService.exportMarkdown(report());

        assertEquals("chain-audit-report-20240501-103000.md", payload.filename());
        String markdown = new String(payload.content(), StandardCharsets.UTF_8);
        assertTrue(markdown.contains("### 📄 `app/routes/users.new.tsx` (1 项)"));
        assertTrue(markdown.contains("**[ERROR]** MISSING_REQUIRED_COLUMN"));
        assertTrue(markdown.contains("- **位置:** 行 6, 列 9"));
        assertTrue(markdown.contains("```sql\nINSERT INTO users (name) VALUES ($1)\n```"));
        assertTrue(markdown.contains("- `$1`: `formData.get('name')` (text)"));
    }

    @Test
    void shouldExportJson() throws Exception {
        ReportExportService.ExportPayload payload = exportService.exportJson(report());

        assertTrue(payload.contentType().startsWith("application/json"));
        JsonNode node = objectMapper.readTree(payload.content());
        assertEquals(1, node.get("totalIssues").asInt());
        assertEquals("persistence", node.get("issues").get(0).get("category").asText());
        assertEquals("INSERT", node.get("queries").get(0).get("type").asText());
    }

    @Test
    void shouldCongratulateWhenNoIssues() {
        ScanReport clean = report();
        clean.setIssues(List.of());

        String markdown = new String(exportService.exportMarkdown(clean).content(), StandardCharsets.UTF_8);

        assertTrue(markdown.contains("未发现持久化问题"));
    }
}
