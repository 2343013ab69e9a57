package com.chainaudit.persistence.checker;

import com.chainaudit.analysis.chain.Operation;
import com.chainaudit.config.AuditProperties;
import com.chainaudit.persistence.DbOperation;
import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.persistence.Severity;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaTable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * 检查 update / delete 调用链是否带 where
 */
@Component
public class RequireWhereChecker implements PersistenceChecker {

    private final AuditProperties properties;

    public RequireWhereChecker(AuditProperties properties) {
        this.properties = properties;
    }

    @Override
    public String ruleId() {
        return "REQUIRE_WHERE";
    }

    @Override
    public List<PersistenceIssue> check(DbOperation operation, SchemaTable table, SchemaModel schema) {
        if (!properties.isRequireWhere() || operation.isHasWhere()) {
            return List.of();
        }
        String action;
        if (operation.getType() == Operation.UPDATE) {
            action = "更新";
        } else if (operation.getType() == Operation.DELETE) {
            action = "删除";
        } else {
            return List.of();
        }
        return List.of(PersistenceIssue.builder()
                .ruleId(ruleId())
                .severity(Severity.WARNING)
                .message("db." + operation.getType().name().toLowerCase(Locale.ROOT) + "(" + operation.getTableName()
                        + ") 未调用 where，将全表" + action)
                .location(operation.getLocation())
                .code(abbreviate(operation.getCode()))
                .suggestion("添加 .where(...) 限定范围")
                .build());
    }

    private static String abbreviate(String code) {
        if (code == null) {
            return null;
        }
        return code.length() > 100 ? code.substring(0, 100) + "..." : code;
    }
}
