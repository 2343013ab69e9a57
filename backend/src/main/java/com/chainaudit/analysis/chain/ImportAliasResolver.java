package com.chainaudit.analysis.chain;

import java.util.Map;

/**
 * 把链中的表名从本地导入别名还原为导出名，如 {@code import { users as usersTable }} 中的 usersTable → users。
 * 返回新的 {@link ChainInfo}，输入保持不变。
 */
public final class ImportAliasResolver {

    private ImportAliasResolver() {
    }

    public static ChainInfo resolve(ChainInfo info, Map<String, String> aliases) {
        if (aliases.isEmpty()) {
            return info;
        }
        return info.toBuilder()
                .tableName(resolveName(info.tableName(), aliases))
                .joins(info.joins().stream()
                        .map(join -> new JoinInfo(join.kind(), resolveName(join.table(), aliases),
                                join.onConditions().stream()
                                        .map(c -> new JoinInfo.OnCondition(resolveRef(c.left(), aliases),
                                                c.operator(), resolveRef(c.right(), aliases)))
                                        .toList()))
                        .toList())
                .groupBy(info.groupBy().stream().map(ref -> resolveRef(ref, aliases)).toList())
                .whereConditions(info.whereConditions().stream()
                        .map(c -> new WhereCondition(resolveRef(c.column(), aliases), c.operator(), c.value()))
                        .toList())
                .orderBy(info.orderBy().stream()
                        .map(o -> new OrderByItem(resolveRef(o.column(), aliases), o.direction()))
                        .toList())
                .build();
    }

    private static String resolveName(String name, Map<String, String> aliases) {
        if (name == null) {
            return null;
        }
        return aliases.getOrDefault(name, name);
    }

    private static ColumnRef resolveRef(ColumnRef ref, Map<String, String> aliases) {
        if (ref == null || ref.table() == null) {
            return ref;
        }
        return ref.withTable(resolveName(ref.table(), aliases));
    }
}
