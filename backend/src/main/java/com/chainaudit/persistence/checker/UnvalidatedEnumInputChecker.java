package com.chainaudit.persistence.checker;

import com.chainaudit.analysis.source.DataSource;
import com.chainaudit.persistence.ColumnValue;
import com.chainaudit.persistence.DbOperation;
import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.persistence.Severity;
import com.chainaudit.schema.SchemaColumn;
import com.chainaudit.schema.SchemaEnum;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 枚举列直接写入未经校验的外部输入（表单字段、路由参数、请求体）
 * <p>
 * 越界的枚举字面量不在检查范围内。
 */
@Component
public class UnvalidatedEnumInputChecker implements PersistenceChecker {

    @Override
    public String ruleId() {
        return "UNVALIDATED_ENUM_INPUT";
    }

    @Override
    public List<PersistenceIssue> check(DbOperation operation, SchemaTable table, SchemaModel schema) {
        List<PersistenceIssue> issues = new ArrayList<>();
        for (ColumnValue value : operation.getColumnValues()) {
            Optional<SchemaColumn> column = table.findColumn(value.getColumnName());
            if (column.isEmpty() || !column.get().isEnum()) {
                continue;
            }
            DataSource source = value.getDataSource();
            if (source.validated() || !source.isExternal()) {
                continue;
            }
            String allowed = schema.findEnum(column.get().enumName())
                    .map(SchemaEnum::values)
                    .filter(values -> !values.isEmpty())
                    .map(values -> values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", ")))
                    .orElse("枚举定义中的值");
            issues.add(PersistenceIssue.builder()
                    .ruleId(ruleId())
                    .severity(Severity.ERROR)
                    .message("枚举列 '" + column.get().name() + "' 直接写入了未经校验的外部输入")
                    .location(operation.getLocation())
                    .code(value.getColumnName() + ": " + value.getExpression())
                    .suggestion("先用 zod 等 schema 校验，或检查取值是否属于: " + allowed)
                    .build());
        }
        return issues;
    }
}
