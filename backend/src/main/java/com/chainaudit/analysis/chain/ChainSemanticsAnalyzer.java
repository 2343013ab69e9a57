package com.chainaudit.analysis.chain;

import com.chainaudit.analysis.chain.OrderByItem.Direction;
import com.chainaudit.analysis.source.DataSource;
import com.chainaudit.analysis.source.DataSourceClassifier;
import com.chainaudit.parser.ts.SyntaxNode;
import com.chainaudit.parser.ts.SyntaxNode.*;
import com.chainaudit.parser.ts.SyntaxNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 把方法链的环列表解释为 {@link ChainInfo}
 * <p>
 * 先找锚点（数据库句柄上的 select/insert/update/delete），再按方法名逐环累积子句；
 * 最后经 {@link ImportAliasResolver} 把导入别名还原为 schema 中的导出名。
 */
public final class ChainSemanticsAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ChainSemanticsAnalyzer.class);

    static final Map<String, String> WHERE_OPERATORS = Map.ofEntries(
            Map.entry("eq", "="),
            Map.entry("ne", "!="),
            Map.entry("lt", "<"),
            Map.entry("lte", "<="),
            Map.entry("gt", ">"),
            Map.entry("gte", ">="),
            Map.entry("like", "LIKE"),
            Map.entry("ilike", "ILIKE"),
            Map.entry("isNull", "IS NULL"),
            Map.entry("isNotNull", "IS NOT NULL"),
            Map.entry("inArray", "IN"),
            Map.entry("notInArray", "NOT IN"));

    static final Map<String, String> JOIN_OPERATORS = Map.of(
            "eq", "=", "ne", "!=", "lt", "<", "lte", "<=", "gt", ">", "gte", ">=");

    private static final List<String> NULL_CHECKS = List.of("isNull", "isNotNull");
    private static final List<String> COMBINATORS = List.of("and", "or");

    private ChainSemanticsAnalyzer() {
    }

    /**
     * 解释并解析别名；找不到锚点时返回空
     */
    public static Optional<ChainInfo> analyze(List<ChainSegment> segments, FileContext context) {
        return interpret(segments, context).map(info -> ImportAliasResolver.resolve(info, context.importAliases()));
    }

    /**
     * 只做解释，不解析别名
     */
    public static Optional<ChainInfo> interpret(List<ChainSegment> segments, FileContext context) {
        Anchor anchor = findAnchor(segments, context);
        if (anchor == null) {
            return Optional.empty();
        }

        Call outer = segments.get(segments.size() - 1).call();
        ChainInfo.ChainInfoBuilder info = ChainInfo.builder()
                .operation(anchor.operation())
                .tableName(anchor.tableName())
                .span(outer.span())
                .code(context.file().snippet(outer));

        Payload insertValues = null;
        Payload setValues = null;
        List<WhereCondition> where = new ArrayList<>();
        boolean hasWhere = false;
        List<JoinInfo> joins = new ArrayList<>();
        List<ColumnRef> groupBy = new ArrayList<>();
        List<OrderByItem> orderBy = new ArrayList<>();
        String tableName = anchor.tableName();

        for (ChainSegment segment : segments) {
            List<SyntaxNode> args = segment.arguments();
            switch (segment.method()) {
                case "select" -> {
                    if (!args.isEmpty() && args.get(0) instanceof ObjectLiteral columns) {
                        info.selectColumns(selectColumns(columns));
                    }
                }
                case "from" -> {
                    if (!args.isEmpty() && tableName.isEmpty()) {
                        tableName = tableNameOf(args.get(0));
                    }
                }
                case "values" -> {
                    if (!args.isEmpty()) {
                        insertValues = payload(args.get(0), context);
                    }
                }
                case "set" -> {
                    if (!args.isEmpty()) {
                        setValues = payload(args.get(0), context);
                    }
                }
                case "where" -> {
                    hasWhere = true;
                    if (!args.isEmpty()) {
                        where.addAll(whereConditions(args.get(0), context));
                    }
                }
                case "innerJoin", "leftJoin", "rightJoin", "fullJoin" -> {
                    if (args.size() >= 2) {
                        joins.add(new JoinInfo(JoinInfo.Kind.fromMethod(segment.method()),
                                tableNameOf(args.get(0)), onConditions(args.get(1))));
                    }
                }
                case "groupBy" -> {
                    groupBy.clear();
                    for (SyntaxNode arg : args) {
                        ColumnRef ref = qualifiedColumn(arg);
                        if (ref != null) {
                            groupBy.add(ref);
                        }
                    }
                }
                case "orderBy" -> {
                    if (!args.isEmpty()) {
                        orderBy.clear();
                        args.forEach(arg -> orderBy.add(orderByItem(arg, context)));
                    }
                }
                case "limit" -> info.limit(integerLiteral(args));
                case "offset" -> info.offset(integerLiteral(args));
                default -> {
                    // returning / execute / onConflictDoNothing 等不影响语句形态
                }
            }
        }

        Payload payload = anchor.operation() == Operation.INSERT ? insertValues
                : anchor.operation() == Operation.UPDATE ? setValues : null;
        return Optional.of(info
                .tableName(tableName)
                .insertValues(insertValues != null ? insertValues.values() : null)
                .setValues(setValues != null ? setValues.values() : null)
                .payloadComplete(payload != null && payload.complete())
                .whereConditions(where)
                .hasWhere(hasWhere)
                .joins(joins)
                .groupBy(groupBy)
                .orderBy(orderBy)
                .build());
    }

    private record Anchor(Operation operation, String tableName) {
    }

    private record Payload(Map<String, ValueInfo> values, boolean complete) {
    }

    private static Anchor findAnchor(List<ChainSegment> segments, FileContext context) {
        for (ChainSegment segment : segments) {
            Operation operation = Operation.fromAnchorMethod(segment.method());
            if (operation == null || !(segment.receiver() instanceof Identifier handle)
                    || !context.dbHandles().contains(handle.name())) {
                continue;
            }
            if (operation == Operation.SELECT) {
                String table = segments.stream()
                        .filter(s -> s.method().equals("from") && !s.arguments().isEmpty())
                        .findFirst()
                        .map(s -> tableNameOf(s.arguments().get(0)))
                        .orElse("");
                return new Anchor(operation, table);
            }
            String table = segment.arguments().isEmpty() ? "" : tableNameOf(segment.arguments().get(0));
            if (!table.isEmpty()) {
                return new Anchor(operation, table);
            }
            log.debug("跳过缺少目标表的 {} 调用", segment.method());
        }
        return null;
    }

    /** users → users；schema.users → users；其他表达式返回空串 */
    static String tableNameOf(SyntaxNode node) {
        if (node instanceof Identifier id) {
            return id.name();
        }
        if (node instanceof PropertyAccess access) {
            return access.name();
        }
        return "";
    }

    private static List<String> selectColumns(ObjectLiteral columns) {
        List<String> result = new ArrayList<>();
        for (SyntaxNode property : columns.properties()) {
            if (property instanceof PropertyAssignment assignment && assignment.key() != null) {
                result.add(assignment.key());
            } else if (property instanceof ShorthandProperty shorthand) {
                result.add(shorthand.name().name());
            }
        }
        return result;
    }

    /** values({...}) / set({...})；批量插入 values([{...}, ...]) 取第一个对象 */
    private static Payload payload(SyntaxNode argument, FileContext context) {
        SyntaxNode node = argument;
        if (node instanceof ArrayLiteral array && !array.elements().isEmpty()) {
            node = array.elements().get(0);
        }
        if (!(node instanceof ObjectLiteral object)) {
            return new Payload(Map.of(), false);
        }
        Map<String, ValueInfo> values = new LinkedHashMap<>();
        boolean complete = true;
        for (SyntaxNode property : object.properties()) {
            if (property instanceof PropertyAssignment assignment && assignment.key() != null) {
                values.put(assignment.key(), analyzeValue(assignment.value(), context));
            } else if (property instanceof ShorthandProperty shorthand) {
                values.put(shorthand.name().name(), analyzeValue(shorthand.name(), context));
            } else {
                complete = false;
            }
        }
        return new Payload(values, complete);
    }

    /**
     * 字面量 → LITERAL；标识符 → VARIABLE；其余（表单字段、路由参数、类型转换等）→ PARAMETER
     */
    static ValueInfo analyzeValue(SyntaxNode expression, FileContext context) {
        SyntaxNode node = SyntaxNodes.unwrapAwait(expression);
        DataSource source = DataSourceClassifier.classify(node, context.scope());
        if (node instanceof StringLiteral literal) {
            return new ValueInfo(ValueInfo.Kind.LITERAL, literal.value(), null, "string", source, node.span());
        }
        if (node instanceof NumberLiteral literal) {
            return new ValueInfo(ValueInfo.Kind.LITERAL, literal.text(), null, "number", source, node.span());
        }
        if (node instanceof BooleanLiteral literal) {
            return new ValueInfo(ValueInfo.Kind.LITERAL, String.valueOf(literal.value()), null, "boolean", source,
                    node.span());
        }
        if (node instanceof NullLiteral) {
            return new ValueInfo(ValueInfo.Kind.LITERAL, null, null, "null", source, node.span());
        }
        if (node instanceof Identifier id) {
            return new ValueInfo(ValueInfo.Kind.VARIABLE, null, id.name(), null, source, node.span());
        }
        return new ValueInfo(ValueInfo.Kind.PARAMETER, null, context.file().snippet(node),
                dataTypeOf(source), source, node.span());
    }

    private static String dataTypeOf(DataSource source) {
        return switch (source.scalarType()) {
            case STRING -> "string";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            default -> null;
        };
    }

    private static List<WhereCondition> whereConditions(SyntaxNode expression, FileContext context) {
        List<WhereCondition> result = new ArrayList<>();
        if (!(expression instanceof Call call) || SyntaxNodes.functionName(call) == null) {
            return result;
        }
        String function = SyntaxNodes.functionName(call);
        List<SyntaxNode> args = call.arguments();
        String operator = WHERE_OPERATORS.get(function);
        if (operator != null && !args.isEmpty()) {
            ColumnRef column = columnOf(args.get(0), context);
            if (NULL_CHECKS.contains(function)) {
                result.add(new WhereCondition(column, operator, null));
            } else if (args.size() >= 2) {
                result.add(new WhereCondition(column, operator, analyzeValue(args.get(1), context)));
            }
        }
        if (COMBINATORS.contains(function)) {
            // or() 与 and() 一样展开为 AND 列表
            for (SyntaxNode arg : args) {
                result.addAll(whereConditions(arg, context));
            }
        }
        return result;
    }

    private static List<JoinInfo.OnCondition> onConditions(SyntaxNode expression) {
        List<JoinInfo.OnCondition> result = new ArrayList<>();
        if (!(expression instanceof Call call) || SyntaxNodes.functionName(call) == null) {
            return result;
        }
        String function = SyntaxNodes.functionName(call);
        String operator = JOIN_OPERATORS.get(function);
        if (operator != null && call.arguments().size() >= 2) {
            ColumnRef left = qualifiedColumn(call.arguments().get(0));
            ColumnRef right = qualifiedColumn(call.arguments().get(1));
            if (left != null && right != null) {
                result.add(new JoinInfo.OnCondition(left, operator, right));
            }
        }
        if (COMBINATORS.contains(function)) {
            for (SyntaxNode arg : call.arguments()) {
                result.addAll(onConditions(arg));
            }
        }
        return result;
    }

    /** table.column 形式的列引用；表名无法识别时返回 null */
    private static ColumnRef qualifiedColumn(SyntaxNode node) {
        if (node instanceof PropertyAccess access) {
            String table = tableNameOf(access.expression());
            if (!table.isEmpty()) {
                return new ColumnRef(table, access.name());
            }
        }
        return null;
    }

    /** where / orderBy 中的列：table.column、裸标识符，其余按源码文本 */
    private static ColumnRef columnOf(SyntaxNode node, FileContext context) {
        if (node instanceof PropertyAccess access) {
            String table = tableNameOf(access.expression());
            return new ColumnRef(table.isEmpty() ? null : table, access.name());
        }
        if (node instanceof Identifier id) {
            return new ColumnRef(null, id.name());
        }
        return new ColumnRef(null, context.file().snippet(node));
    }

    private static OrderByItem orderByItem(SyntaxNode arg, FileContext context) {
        if (arg instanceof Call call && SyntaxNodes.functionName(call) != null && !call.arguments().isEmpty()) {
            Direction direction = "desc".equals(SyntaxNodes.functionName(call)) ? Direction.DESC : Direction.ASC;
            return new OrderByItem(columnOf(call.arguments().get(0), context), direction);
        }
        return new OrderByItem(columnOf(arg, context), Direction.ASC);
    }

    private static Long integerLiteral(List<SyntaxNode> args) {
        if (!args.isEmpty() && args.get(0) instanceof NumberLiteral literal && literal.isInteger()) {
            try {
                return Long.parseLong(literal.text());
            } catch (NumberFormatException e) {
                log.debug("limit/offset 数值超出范围: {}", literal.text());
            }
        }
        return null;
    }
}
