package com.chainaudit.analysis.chain;

/**
 * 链的操作类型，由锚点方法名决定
 */
public enum Operation {
    SELECT, INSERT, UPDATE, DELETE;

    /** select / insert / update / delete 之外返回 null */
    public static Operation fromAnchorMethod(String method) {
        if (method == null) {
            return null;
        }
        return switch (method) {
            case "select" -> SELECT;
            case "insert" -> INSERT;
            case "update" -> UPDATE;
            case "delete" -> DELETE;
            default -> null;
        };
    }

    public boolean isWrite() {
        return this != SELECT;
    }
}
