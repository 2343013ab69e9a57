package com.chainaudit.analysis.chain;

import java.util.List;

/**
 * 连接子句
 */
public record JoinInfo(Kind kind, String table, List<OnCondition> onConditions) {

    public JoinInfo {
        onConditions = List.copyOf(onConditions);
    }

    public enum Kind {
        INNER, LEFT, RIGHT, FULL;

        /** innerJoin / leftJoin / rightJoin / fullJoin 之外返回 null */
        public static Kind fromMethod(String method) {
            return switch (method) {
                case "innerJoin" -> INNER;
                case "leftJoin" -> LEFT;
                case "rightJoin" -> RIGHT;
                case "fullJoin" -> FULL;
                default -> null;
            };
        }
    }

    /** ON 条件，两侧均为列引用 */
    public record OnCondition(ColumnRef left, String operator, ColumnRef right) {
    }
}
