package com.chainaudit.sql;

import com.chainaudit.analysis.chain.*;
import com.chainaudit.schema.SchemaColumn;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 由 {@link ChainInfo} 生成规范 SQL
 * <p>
 * 子句顺序固定为 SELECT → JOIN → WHERE → GROUP BY → ORDER BY → LIMIT → OFFSET，与源码中的调用顺序无关。
 * 表名与列名优先使用 schema 中声明的数据库名，找不到时原样输出。字符串字面量加单引号（内部单引号双写），
 * null 输出 NULL，数字与布尔原样输出，其余值一律替换为 $n 占位符。
 */
@Component
public class SqlSynthesizer {

    /**
     * insert/update 没有可提取的值对象、或 select 无法确定主表时返回空
     */
    public Optional<GeneratedSql> synthesize(ChainInfo info, SchemaModel schema) {
        if (info.tableName() == null || info.tableName().isEmpty()) {
            return Optional.empty();
        }
        Statement statement = new Statement(info, schema);
        return switch (info.operation()) {
            case SELECT -> Optional.of(statement.select());
            case INSERT -> info.insertValues() == null || info.insertValues().isEmpty()
                    ? Optional.empty()
                    : Optional.of(statement.insert());
            case UPDATE -> info.setValues() == null || info.setValues().isEmpty()
                    ? Optional.empty()
                    : Optional.of(statement.update());
            case DELETE -> Optional.of(statement.delete());
        };
    }

    /** 单条语句的生成状态：占位符计数与参数列表 */
    private static final class Statement {

        private final ChainInfo info;
        private final SchemaModel schema;
        private final SchemaTable table;
        private final String tableSqlName;
        private final List<String> tables = new ArrayList<>();
        private final List<QueryParameter> parameters = new ArrayList<>();

        Statement(ChainInfo info, SchemaModel schema) {
            this.info = info;
            this.schema = schema;
            this.table = schema.findTable(info.tableName()).orElse(null);
            this.tableSqlName = schema.tableSqlName(info.tableName());
            this.tables.add(tableSqlName);
        }

        GeneratedSql select() {
            StringBuilder sql = new StringBuilder("SELECT ");
            if (info.selectColumns().isEmpty()) {
                sql.append("*");
            } else {
                sql.append(info.selectColumns().stream().map(this::mainColumn).collect(Collectors.joining(", ")));
            }
            sql.append(" FROM ").append(tableSqlName);

            for (JoinInfo join : info.joins()) {
                String joinTable = schema.tableSqlName(join.table());
                tables.add(joinTable);
                sql.append(' ').append(join.kind().name()).append(" JOIN ").append(joinTable);
                if (!join.onConditions().isEmpty()) {
                    sql.append(" ON ").append(join.onConditions().stream()
                            .map(c -> qualified(c.left()) + " " + c.operator() + " " + qualified(c.right()))
                            .collect(Collectors.joining(" AND ")));
                }
            }
            appendWhere(sql);
            if (!info.groupBy().isEmpty()) {
                sql.append(" GROUP BY ").append(info.groupBy().stream()
                        .map(this::qualified)
                        .collect(Collectors.joining(", ")));
            }
            if (!info.orderBy().isEmpty()) {
                sql.append(" ORDER BY ").append(info.orderBy().stream()
                        .map(o -> column(o.column()) + " " + o.direction().name())
                        .collect(Collectors.joining(", ")));
            }
            if (info.limit() != null) {
                sql.append(" LIMIT ").append(info.limit());
            }
            if (info.offset() != null) {
                sql.append(" OFFSET ").append(info.offset());
            }
            return result(Operation.SELECT, sql);
        }

        GeneratedSql insert() {
            List<String> columns = new ArrayList<>();
            List<String> values = new ArrayList<>();
            for (Map.Entry<String, ValueInfo> entry : info.insertValues().entrySet()) {
                columns.add(mainColumn(entry.getKey()));
                values.add(value(entry.getValue(), columnType(table, entry.getKey())));
            }
            StringBuilder sql = new StringBuilder("INSERT INTO ").append(tableSqlName)
                    .append(" (").append(String.join(", ", columns)).append(")")
                    .append(" VALUES (").append(String.join(", ", values)).append(")");
            return result(Operation.INSERT, sql);
        }

        GeneratedSql update() {
            List<String> assignments = new ArrayList<>();
            for (Map.Entry<String, ValueInfo> entry : info.setValues().entrySet()) {
                assignments.add(mainColumn(entry.getKey()) + " = "
                        + value(entry.getValue(), columnType(table, entry.getKey())));
            }
            StringBuilder sql = new StringBuilder("UPDATE ").append(tableSqlName)
                    .append(" SET ").append(String.join(", ", assignments));
            appendWhere(sql);
            return result(Operation.UPDATE, sql);
        }

        GeneratedSql delete() {
            StringBuilder sql = new StringBuilder("DELETE FROM ").append(tableSqlName);
            appendWhere(sql);
            return result(Operation.DELETE, sql);
        }

        private void appendWhere(StringBuilder sql) {
            if (info.whereConditions().isEmpty()) {
                return;
            }
            List<String> conditions = new ArrayList<>();
            for (WhereCondition condition : info.whereConditions()) {
                String column = column(condition.column());
                if (!condition.takesValue()) {
                    conditions.add(column + " " + condition.operator());
                    continue;
                }
                String value = value(condition.value(), columnType(tableOf(condition.column()),
                        condition.column().column()));
                if (condition.operator().endsWith("IN")) {
                    value = "(" + value + ")";
                }
                conditions.add(column + " " + condition.operator() + " " + value);
            }
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }

        private String value(ValueInfo value, String columnType) {
            if (value.isLiteral()) {
                if ("string".equals(value.dataType())) {
                    return "'" + value.value().replace("'", "''") + "'";
                }
                if ("null".equals(value.dataType())) {
                    return "NULL";
                }
                return value.value();
            }
            int position = parameters.size() + 1;
            parameters.add(QueryParameter.builder()
                    .position(position)
                    .source(value.source() != null ? value.source() : "unknown")
                    .columnType(columnType)
                    .build());
            return "$" + position;
        }

        /** 主表中的列名 */
        private String mainColumn(String name) {
            return table != null ? table.columnSqlName(name) : name;
        }

        /** where / order by 中的列，只输出列名 */
        private String column(ColumnRef ref) {
            SchemaTable owner = tableOf(ref);
            return owner != null ? owner.columnSqlName(ref.column()) : ref.column();
        }

        /** table.column，两部分都换成数据库名 */
        private String qualified(ColumnRef ref) {
            SchemaTable owner = schema.findTable(ref.table()).orElse(null);
            String tableName = owner != null ? owner.sqlName() : ref.table();
            String columnName = owner != null ? owner.columnSqlName(ref.column()) : ref.column();
            return tableName + "." + columnName;
        }

        /** 列引用所属的表；未限定表名或表未知时退回主表 */
        private SchemaTable tableOf(ColumnRef ref) {
            if (ref.table() != null) {
                Optional<SchemaTable> owner = schema.findTable(ref.table());
                if (owner.isPresent()) {
                    return owner.get();
                }
            }
            return table;
        }

        private static String columnType(SchemaTable owner, String column) {
            if (owner == null) {
                return null;
            }
            return owner.findColumn(column).map(SchemaColumn::type).map(t -> t.getDrizzleName()).orElse(null);
        }

        private GeneratedSql result(Operation type, StringBuilder sql) {
            return new GeneratedSql(type, sql.toString(), tables, parameters);
        }
    }
}
