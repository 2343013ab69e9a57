package com.chainaudit.persistence.checker;

import com.chainaudit.analysis.source.DataSource;
import com.chainaudit.analysis.source.DataSource.Origin;
import com.chainaudit.analysis.source.DataSource.ScalarType;
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
import java.util.Optional;

/**
 * 数值列或布尔列直接写入表单字段、路由参数这类字符串值
 */
@Component
public class TypeMismatchChecker implements PersistenceChecker {

    @Override
    public String ruleId() {
        return "TYPE_MISMATCH";
    }

    @Override
    public List<PersistenceIssue> check(DbOperation operation, SchemaTable table, SchemaModel schema) {
        List<PersistenceIssue> issues = new ArrayList<>();
        for (ColumnValue value : operation.getColumnValues()) {
            Optional<SchemaColumn> column = table.findColumn(value.getColumnName());
            DataSource source = value.getDataSource();
            if (column.isEmpty() || !isUncheckedString(source)) {
                continue;
            }
            String name = value.getColumnName();
            if (column.get().type().isNumeric()) {
                issues.add(issue(operation, value, column.get(), column.get().type().getDrizzleName(),
                        "使用 parseInt(" + name + ", 10) 或 Number(" + name + ") 转换"));
            } else if (column.get().type().isBoolean()) {
                issues.add(issue(operation, value, column.get(), "boolean",
                        "使用 Boolean(" + name + ") 或 " + name + " === 'true' 转换"));
            }
        }
        return issues;
    }

    /** 未经校验、来自表单字段或路由参数的字符串 */
    private static boolean isUncheckedString(DataSource source) {
        return !source.validated()
                && source.scalarType() == ScalarType.STRING
                && (source.origin() == Origin.EXTERNAL_FIELD || source.origin() == Origin.ROUTE_PARAM);
    }

    private PersistenceIssue issue(DbOperation operation, ColumnValue value, SchemaColumn column,
                                   String expected, String suggestion) {
        return PersistenceIssue.builder()
                .ruleId(ruleId())
                .severity(Severity.ERROR)
                .message("列 '" + column.name() + "' 期望 " + expected + "，但写入的是来自 "
                        + describe(value.getDataSource()) + " 的字符串")
                .location(operation.getLocation())
                .code(value.getColumnName() + ": " + value.getExpression())
                .suggestion(suggestion)
                .build();
    }

    private static String describe(DataSource source) {
        String origin = source.origin() == Origin.ROUTE_PARAM ? "路由参数" : "表单字段";
        return source.fieldName() != null ? origin + " '" + source.fieldName() + "'" : origin;
    }
}
