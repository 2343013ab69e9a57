package com.chainaudit.analysis.chain;

import com.chainaudit.parser.ts.SyntaxNode.Span;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一条 ORM 方法链的语义
 *
 * @param operation       操作类型
 * @param tableName       主表（源码中的变量名）
 * @param selectColumns   select 指定的输出列，为空表示全部列
 * @param insertValues    values({...}) 的列值，按源码顺序；未调用或无法提取时为 null
 * @param setValues       set({...}) 的列值，按源码顺序；未调用或无法提取时为 null
 * @param payloadComplete 值对象是否完整可见（对象字面量且不含展开）
 * @param whereConditions 所有 where 调用中的条件，and/or 均展开到同一列表
 * @param hasWhere        是否调用过 where（条件可能无法识别）
 * @param joins           连接子句
 * @param groupBy         分组列
 * @param orderBy         排序项
 * @param limit           limit 数值字面量
 * @param offset          offset 数值字面量
 * @param span            整条链（最外层调用）的区间
 * @param code            整条链的源码，空白已折叠
 */
@Builder(toBuilder = true)
public record ChainInfo(Operation operation,
                        String tableName,
                        List<String> selectColumns,
                        Map<String, ValueInfo> insertValues,
                        Map<String, ValueInfo> setValues,
                        boolean payloadComplete,
                        List<WhereCondition> whereConditions,
                        boolean hasWhere,
                        List<JoinInfo> joins,
                        List<ColumnRef> groupBy,
                        List<OrderByItem> orderBy,
                        Long limit,
                        Long offset,
                        Span span,
                        String code) {

    public ChainInfo {
        selectColumns = selectColumns == null ? List.of() : List.copyOf(selectColumns);
        insertValues = orderedCopy(insertValues);
        setValues = orderedCopy(setValues);
        whereConditions = whereConditions == null ? List.of() : List.copyOf(whereConditions);
        joins = joins == null ? List.of() : List.copyOf(joins);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    /** insert 取 values，update 取 set，其余为 null */
    public Map<String, ValueInfo> payload() {
        return switch (operation) {
            case INSERT -> insertValues;
            case UPDATE -> setValues;
            default -> null;
        };
    }

    private static Map<String, ValueInfo> orderedCopy(Map<String, ValueInfo> values) {
        return values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
