package com.chainaudit.controller;

import com.chainaudit.model.ScanReport;
import com.chainaudit.schema.SchemaLoadException;
import com.chainaudit.service.ReportExportService;
import com.chainaudit.service.ScanService;
import com.chainaudit.sql.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * ORM 调用链审查 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ScanService scanService;
    private final ReportExportService reportExportService;

    public ScanController(ScanService scanService, ReportExportService reportExportService) {
        this.scanService = scanService;
        this.reportExportService = reportExportService;
    }

    /**
     * 扫描指定仓库路径：还原 SQL 并检查写操作
     */
    @PostMapping("/scan")
    public ResponseEntity<?> scan(@RequestBody Map<String, String> request) {
        String repoPath = request.get("repoPath");
        if (repoPath == null || repoPath.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供仓库路径 (repoPath)"));
        }

        try {
            log.info("收到扫描请求: {}", repoPath);
            ScanReport report = scanService.scan(repoPath, request.get("schemaPath"));
            scanService.cacheLastScanReport(report);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException | SchemaLoadException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("扫描失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "扫描过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 只还原 SQL，format 为 text（默认）或 json
     */
    @PostMapping("/sql")
    public ResponseEntity<?> synthesizeSql(@RequestBody Map<String, String> request) {
        String repoPath = request.get("repoPath");
        if (repoPath == null || repoPath.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供仓库路径 (repoPath)"));
        }

        try {
            OutputFormat format = OutputFormat.parse(request.get("format"));
            log.info("收到 SQL 还原请求: {}, 格式: {}", repoPath, format);
            String body = scanService.synthesizeSql(repoPath, request.get("schemaPath"), format);
            MediaType contentType = format == OutputFormat.JSON
                    ? MediaType.APPLICATION_JSON
                    : new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);
            return ResponseEntity.ok().contentType(contentType).body(body);
        } catch (IllegalArgumentException | SchemaLoadException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("SQL 还原失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "SQL 还原过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 导出 Markdown 报告（优先使用请求体中的报告；未传时回退到服务端最近一次扫描结果）
     */
    @PostMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdown(@RequestBody(required = false) ScanReport report) {
        return exportReport("markdown", report);
    }

    /**
     * 导出 JSON 报告（优先使用请求体中的报告；未传时回退到服务端最近一次扫描结果）
     */
    @PostMapping("/report/export/json")
    public ResponseEntity<?> exportJson(@RequestBody(required = false) ScanReport report) {
        return exportReport("json", report);
    }

    /**
     * 直接下载最近一次 Markdown 报告
     */
    @GetMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdownLatest() {
        return exportReport("markdown", null);
    }

    /**
     * 直接下载最近一次 JSON 报告
     */
    @GetMapping("/report/export/json")
    public ResponseEntity<?> exportJsonLatest() {
        return exportReport("json", null);
    }

    private ResponseEntity<?> exportReport(String format, ScanReport requestReport) {
        try {
            ScanReport report = resolveReportForExport(requestReport);
            if (report == null) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(Map.of("error", "暂无可导出的审查报告，请先执行一次扫描"));
            }

            ReportExportService.ExportPayload payload;
            if ("markdown".equalsIgnoreCase(format)) {
                payload = reportExportService.exportMarkdown(report);
            } else if ("json".equalsIgnoreCase(format)) {
                payload = reportExportService.exportJson(report);
            } else {
                return ResponseEntity.badRequest().body(Map.of("error", "不支持的导出格式: " + format));
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentLength(payload.content().length);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (Exception e) {
            log.error("导出报告失败, format={}", format, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "导出失败: " + e.getMessage()));
        }
    }

    private ScanReport resolveReportForExport(ScanReport requestReport) {
        if (requestReport != null && requestReport.getScanTime() != null) {
            return requestReport;
        }
        return scanService.getLastScanReport().orElse(null);
    }
}
