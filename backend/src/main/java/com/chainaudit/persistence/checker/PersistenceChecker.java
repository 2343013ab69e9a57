package com.chainaudit.persistence.checker;

import com.chainaudit.persistence.DbOperation;
import com.chainaudit.persistence.PersistenceIssue;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaTable;

import java.util.List;

/**
 * 写操作检查器接口；各检查器相互独立，由 {@code PersistenceValidator} 依次调用
 */
public interface PersistenceChecker {

    /**
     * 规则标识，写入 {@link PersistenceIssue#getRuleId()}
     */
    String ruleId();

    /**
     * 检查一次写操作；table 为操作目标表在 schema 中的定义
     */
    List<PersistenceIssue> check(DbOperation operation, SchemaTable table, SchemaModel schema);
}
