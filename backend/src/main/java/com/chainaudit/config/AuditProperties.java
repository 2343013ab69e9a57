package com.chainaudit.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 审查配置，对应 application.yml 中的 chain-audit.*
 */
@Data
@NoArgsConstructor
@ConfigurationProperties(prefix = "chain-audit")
public class AuditProperties {

    /** 数据库句柄变量名；从模块导入并改名的句柄会自动追加 */
    private List<String> dbHandleNames = new ArrayList<>(List.of("db"));

    /** 参与扫描的源码扩展名 */
    private List<String> sourceExtensions = new ArrayList<>(
            List.of(".ts", ".tsx", ".js", ".jsx", ".mts", ".cts"));

    /** 递归扫描时跳过的目录 */
    private List<String> excludedDirs = new ArrayList<>(List.of(
            ".git", ".idea", ".vscode", "target", "build", "node_modules",
            "bin", "out", "dist", ".next", "coverage", ".cache"));

    /** 未指定 schema 时依次尝试的相对路径 */
    private List<String> schemaDiscoveryPaths = new ArrayList<>(List.of(
            "src/db/schema.ts", "db/schema.ts", "lib/db/schema.ts",
            "src/schema.ts", "app/db/schema.ts", "server/db/schema.ts"));

    /** 单次扫描保留的最大问题数 */
    private int maxIssues = 1000;

    /** 是否对不带 where 的 update/delete 给出警告 */
    private boolean requireWhere = true;
}
