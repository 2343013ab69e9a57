package com.chainaudit.service;

import com.chainaudit.config.AuditProperties;
import com.chainaudit.model.ScanReport;
import com.chainaudit.model.SourceLocation;
import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.TsParser;
import com.chainaudit.persistence.DbOperation;
import com.chainaudit.persistence.OperationExtractor;
import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.persistence.PersistenceValidator;
import com.chainaudit.persistence.Severity;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaModelLoader;
import com.chainaudit.sql.ExtractedQuery;
import com.chainaudit.sql.OutputFormat;
import com.chainaudit.sql.QueryExtractor;
import com.chainaudit.sql.SqlReportFormatter;
import com.chainaudit.util.SourceTextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 代码仓库扫描服务：查找源文件，还原 SQL 并检查写操作
 */
@Service
public class ScanService {

    private static final Logger log = LoggerFactory.getLogger(ScanService.class);

    private static final Pattern WINDOWS_DRIVE_PATH = Pattern.compile("^[A-Za-z]:[\\\\/].*");
    private static final Pattern WSL_UNC_PATH = Pattern.compile("^//wsl(?:\\$|\\.localhost)/[^/]+(/.*)?$",
            Pattern.CASE_INSENSITIVE);

    private final AuditProperties properties;
    private final SchemaModelLoader schemaLoader;
    private final QueryExtractor queryExtractor;
    private final OperationExtractor operationExtractor;
    private final PersistenceValidator persistenceValidator;
    private final SqlReportFormatter sqlReportFormatter;

    private final AtomicReference<ScanReport> lastScanReport = new AtomicReference<>();

    public ScanService(AuditProperties properties, SchemaModelLoader schemaLoader, QueryExtractor queryExtractor,
                       OperationExtractor operationExtractor, PersistenceValidator persistenceValidator,
                       SqlReportFormatter sqlReportFormatter) {
        this.properties = properties;
        this.schemaLoader = schemaLoader;
        this.queryExtractor = queryExtractor;
        this.operationExtractor = operationExtractor;
        this.persistenceValidator = persistenceValidator;
        this.sqlReportFormatter = sqlReportFormatter;
    }

    /**
     * 扫描指定路径下的 TS/JS 项目
     *
     * @param repoPath   仓库路径，支持 Windows 路径与 WSL UNC 路径
     * @param schemaPath schema 文件路径，相对路径按仓库根目录解析；为空时自动查找
     * @throws IllegalArgumentException                     仓库路径不存在或不是目录
     * @throws com.chainaudit.schema.SchemaLoadException 指定的 schema 无法读取
     */
    public ScanReport scan(String repoPath, String schemaPath) {
        List<String> notices = new ArrayList<>();
        Path repoRoot = resolveRepoRoot(repoPath, notices);
        log.info("开始扫描仓库: {} (原始输入: {})", repoRoot, repoPath);

        // 1. 加载 schema
        SchemaModel schema = resolveSchema(repoRoot, schemaPath, notices);

        // 2. 查找源文件
        List<File> sourceFiles = findSourceFiles(repoRoot, notices);

        // 3. 提取 SQL 与写操作
        List<ExtractedQuery> queries = new ArrayList<>();
        List<DbOperation> operations = new ArrayList<>();
        for (File file : sourceFiles) {
            analyzeFile(file.toPath(), repoRoot, schema, notices, queries, operations);
        }
        log.info("还原了 {} 条 SQL，{} 个写操作", queries.size(), operations.size());

        // 4. 持久化检查
        List<PersistenceIssue> allIssues = persistenceValidator.validatePersistence(operations, schema);
        int maxIssues = properties.getMaxIssues();
        boolean limitReached = allIssues.size() > maxIssues;
        List<PersistenceIssue> issues = limitReached ? allIssues.subList(0, maxIssues) : allIssues;
        if (limitReached) {
            log.warn("问题数量达到上限 {}，其余结果已丢弃", maxIssues);
        } else {
            log.info("发现 {} 个问题", issues.size());
        }

        // 5. 构建报告
        List<PersistenceIssue> reportedIssues = issues.stream()
                .map(issue -> issue.toBuilder().location(relativize(issue.getLocation(), repoRoot)).build())
                .toList();
        List<ExtractedQuery> reportedQueries = queries.stream()
                .map(query -> query.toBuilder().location(relativize(query.getLocation(), repoRoot)).build())
                .toList();
        long errorCount = issues.stream().filter(i -> i.getSeverity() == Severity.ERROR).count();
        long warningCount = issues.stream().filter(i -> i.getSeverity() == Severity.WARNING).count();

        List<String> scannedFiles = sourceFiles.stream()
                .map(f -> repoRoot.relativize(f.toPath().toAbsolutePath().normalize()).toString().replace('\\', '/'))
                .toList();

        return ScanReport.builder()
                .repoPath(repoRoot.toString())
                .schemaPath(schema.schemaPath() != null ? schema.schemaPath().toString() : null)
                .scanTime(LocalDateTime.now())
                .totalFiles(sourceFiles.size())
                .totalQueries(queries.size())
                .totalOperations(operations.size())
                .totalIssues(issues.size())
                .errorCount((int) errorCount)
                .warningCount((int) warningCount)
                .issues(reportedIssues)
                .queries(reportedQueries)
                .scannedFiles(scannedFiles)
                .notices(List.copyOf(notices))
                .limitReached(limitReached)
                .build();
    }

    /**
     * 只还原 SQL，按指定格式输出
     */
    public String synthesizeSql(String repoPath, String schemaPath, OutputFormat format) {
        List<String> notices = new ArrayList<>();
        Path repoRoot = resolveRepoRoot(repoPath, notices);
        SchemaModel schema = resolveSchema(repoRoot, schemaPath, notices);
        List<ExtractedQuery> queries = new ArrayList<>();
        for (File file : findSourceFiles(repoRoot, notices)) {
            analyzeFile(file.toPath(), repoRoot, schema, notices, queries, null);
        }
        log.info("从 {} 还原了 {} 条 SQL", repoRoot, queries.size());
        return sqlReportFormatter.synthesizeSql(queries, format, repoRoot);
    }

    public void cacheLastScanReport(ScanReport report) {
        lastScanReport.set(report);
    }

    public Optional<ScanReport> getLastScanReport() {
        return Optional.ofNullable(lastScanReport.get());
    }

    private Path resolveRepoRoot(String repoPath, List<String> notices) {
        String resolvedRepoPath = normalizeRepoPath(repoPath, notices);
        if (resolvedRepoPath == null || resolvedRepoPath.isBlank()) {
            throw new IllegalArgumentException("请提供仓库路径 (repoPath)");
        }
        File repoDir = new File(resolvedRepoPath);
        if (!repoDir.exists() || !repoDir.isDirectory()) {
            throw new IllegalArgumentException("路径不存在或不是目录: " + resolvedRepoPath);
        }
        if (isLikelyWsl() && resolvedRepoPath.startsWith("/mnt/")) {
            notices.add("当前扫描目录位于 /mnt 下（Windows 文件系统），WSL 中扫描大仓库可能较慢。建议复制到 /home 下再扫描。");
        }
        return repoDir.toPath().toAbsolutePath().normalize();
    }

    /**
     * 指定了 schema 时加载失败直接抛出；未指定时自动查找，找不到则使用空 schema
     */
    private SchemaModel resolveSchema(Path repoRoot, String schemaPath, List<String> notices) {
        if (schemaPath != null && !schemaPath.isBlank()) {
            Path path = Path.of(stripWrappingQuotes(schemaPath.trim()));
            return schemaLoader.loadSchema(path.isAbsolute() ? path : repoRoot.resolve(path).normalize());
        }
        Optional<Path> discovered = schemaLoader.discoverSchemaPath(repoRoot);
        if (discovered.isPresent()) {
            return schemaLoader.loadSchema(discovered.get());
        }
        notices.add("未找到 schema 文件，已跳过持久化检查，SQL 中的表名与列名按源码输出。");
        return SchemaModel.empty();
    }

    /**
     * 单个文件的解析与提取；任何失败只跳过该文件并记入提示，不影响其他文件
     *
     * @param operations 为 null 时只提取 SQL
     */
    private void analyzeFile(Path file, Path repoRoot, SchemaModel schema, List<String> notices,
                             List<ExtractedQuery> queries, List<DbOperation> operations) {
        String relative = repoRoot.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
        try {
            SourceTextReader.SourceText text = SourceTextReader.read(file);
            if (text.binary()) {
                log.info("跳过二进制文件: {}", file);
                notices.add("文件 " + relative + " 含有 NUL 字节，按二进制文件跳过。");
                return;
            }
            String notice = text.buildNotice(relative);
            if (notice != null) {
                notices.add(notice);
            }
            SourceFile source = TsParser.parseFile(file, text.text());
            List<ExtractedQuery> fileQueries = queryExtractor.extractQueries(source, schema);
            List<DbOperation> fileOperations = operations == null
                    ? List.of()
                    : operationExtractor.extractOperations(source);
            queries.addAll(fileQueries);
            if (operations != null) {
                operations.addAll(fileOperations);
            }
        } catch (IOException e) {
            log.warn("读取文件失败，已跳过 {}: {}", file, e.getMessage());
            notices.add("文件 " + relative + " 读取失败，已跳过: " + e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("分析文件失败，已跳过 {}", file, e);
            notices.add("文件 " + relative + " 分析失败，已跳过: " + e.getClass().getSimpleName());
        }
    }

    private static SourceLocation relativize(SourceLocation location, Path repoRoot) {
        return location == null ? null : location.relativeTo(repoRoot);
    }

    private List<File> findSourceFiles(Path repoRoot, List<String> notices) {
        List<File> sourceFiles = new ArrayList<>();
        findSourceFiles(repoRoot.toFile(), sourceFiles, new HashSet<>());
        log.info("找到 {} 个源文件", sourceFiles.size());
        if (sourceFiles.isEmpty()) {
            notices.add("未发现 TS/JS 源文件，请确认目录路径正确。");
        }
        return sourceFiles;
    }

    /**
     * 递归查找源文件
     */
    private void findSourceFiles(File dir, List<File> result, Set<Path> visitedDirs) {
        try {
            Path dirPath = dir.toPath();
            if (Files.isSymbolicLink(dirPath)) {
                log.info("跳过符号链接目录: {}", dir.getAbsolutePath());
                return;
            }
            Path realDir = dirPath.toRealPath();
            if (!visitedDirs.add(realDir)) {
                log.info("跳过重复目录（可能由软链接导致）: {}", realDir);
                return;
            }
        } catch (IOException e) {
            log.warn("无法访问目录，已跳过: {}", dir.getAbsolutePath(), e);
            return;
        }

        File[] files = dir.listFiles();
        if (files == null)
            return;
        Arrays.sort(files, Comparator.comparing(File::getName));

        for (File file : files) {
            if (file.isDirectory()) {
                if (!properties.getExcludedDirs().contains(file.getName())) {
                    findSourceFiles(file, result, visitedDirs);
                }
            } else if (Files.isSymbolicLink(file.toPath())) {
                log.info("跳过符号链接文件: {}", file.getAbsolutePath());
            } else if (isSourceFile(file.getName())) {
                result.add(file);
            }
        }
    }

    private boolean isSourceFile(String name) {
        if (name.endsWith(".d.ts")) {
            return false;
        }
        return properties.getSourceExtensions().stream().anyMatch(name::endsWith);
    }

    private String normalizeRepoPath(String rawPath, List<String> notices) {
        if (rawPath == null) {
            return null;
        }
        String path = stripWrappingQuotes(rawPath.trim());
        if (path.isBlank()) {
            return path;
        }

        String slashPath = path.replace('\\', '/');

        Matcher uncMatcher = WSL_UNC_PATH.matcher(slashPath);
        if (uncMatcher.matches()) {
            String converted = Optional.ofNullable(uncMatcher.group(1)).filter(s -> !s.isBlank()).orElse("/");
            if (!Objects.equals(converted, path)) {
                notices.add("检测到 WSL UNC 路径，已自动转换为 Linux 路径: " + converted);
            }
            return converted;
        }

        if (WINDOWS_DRIVE_PATH.matcher(path).matches() && !new File(path).isDirectory()) {
            char drive = Character.toLowerCase(path.charAt(0));
            String remainder = path.substring(2).replace('\\', '/');
            String converted = "/mnt/" + drive + remainder;
            notices.add("检测到 Windows 路径格式，已尝试自动转换为 WSL 路径: " + converted);
            return converted;
        }

        return path;
    }

    private String stripWrappingQuotes(String path) {
        if (path == null || path.length() < 2) {
            return path;
        }
        char first = path.charAt(0);
        char last = path.charAt(path.length() - 1);
        if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }

    private boolean isLikelyWsl() {
        if (!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("linux")) {
            return false;
        }
        if (System.getenv("WSL_DISTRO_NAME") != null) {
            return true;
        }
        try {
            return Files.exists(Path.of("/proc/version"))
                    && Files.readString(Path.of("/proc/version")).toLowerCase(Locale.ROOT).contains("microsoft");
        } catch (IOException e) {
            log.debug("无法读取 /proc/version: {}", e.getMessage());
            return false;
        }
    }
}
