package com.chainaudit.persistence.checker;

import com.chainaudit.analysis.chain.Operation;
import com.chainaudit.persistence.ColumnValue;
import com.chainaudit.persistence.DbOperation;
import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.persistence.Severity;
import com.chainaudit.schema.SchemaColumn;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * insert 缺少必填列（非空、无默认值、非自动生成）
 */
@Component
public class MissingRequiredColumnChecker implements PersistenceChecker {

    @Override
    public String ruleId() {
        return "MISSING_REQUIRED_COLUMN";
    }

    @Override
    public List<PersistenceIssue> check(DbOperation operation, SchemaTable table, SchemaModel schema) {
        if (operation.getType() != Operation.INSERT || !operation.isPayloadComplete()) {
            return List.of();
        }
        Set<String> provided = operation.getColumnValues().stream()
                .map(ColumnValue::getColumnName)
                .collect(Collectors.toSet());

        List<PersistenceIssue> issues = new ArrayList<>();
        for (SchemaColumn column : table.requiredColumns()) {
            if (provided.contains(column.name())) {
                continue;
            }
            issues.add(PersistenceIssue.builder()
                    .ruleId(ruleId())
                    .severity(Severity.ERROR)
                    .message("db.insert(" + operation.getTableName() + ") 缺少必填列 '" + column.name() + "'")
                    .location(operation.getLocation())
                    .code("db.insert(" + operation.getTableName() + ").values({...})")
                    .suggestion("在 values 对象中补充 '" + column.name() + "'")
                    .build());
        }
        return issues;
    }
}
