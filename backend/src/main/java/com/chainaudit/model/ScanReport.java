package com.chainaudit.model;

import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.sql.ExtractedQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 扫描结果报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanReport {

    /** 扫描的仓库路径 */
    private String repoPath;

    /** 使用的 schema 文件，未找到时为 null */
    private String schemaPath;

    /** 扫描时间 */
    private LocalDateTime scanTime;

    /** 扫描的源文件总数 */
    private int totalFiles;

    /** 还原出的 SQL 总数 */
    private int totalQueries;

    /** 写操作总数 */
    private int totalOperations;

    /** 问题总数 */
    private int totalIssues;

    /** ERROR 级别问题数 */
    private int errorCount;

    /** WARNING 级别问题数 */
    private int warningCount;

    /** 持久化问题 */
    private List<PersistenceIssue> issues;

    /** 还原出的 SQL */
    private List<ExtractedQuery> queries;

    /** 扫描的文件列表（相对路径） */
    private List<String> scannedFiles;

    /** 扫描过程中的提示信息 */
    private List<String> notices;

    /** 是否因为问题过多达上限而截断 */
    private boolean limitReached;
}
