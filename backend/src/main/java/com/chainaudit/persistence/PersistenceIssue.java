package com.chainaudit.persistence;

import com.chainaudit.model.SourceLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 持久化检查发现的问题
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PersistenceIssue {

    public static final String CATEGORY = "persistence";

    /** 问题分类，固定为 persistence */
    @Builder.Default
    private String category = CATEGORY;

    /** 规则标识，如 MISSING_REQUIRED_COLUMN */
    private String ruleId;

    private Severity severity;

    /** 问题描述 */
    private String message;

    /** 写操作所在位置 */
    private SourceLocation location;

    /** 相关源码 */
    private String code;

    /** 修复建议 */
    private String suggestion;

    /** 是否可自动修复；持久化问题均需人工处理 */
    private boolean fixable;
}
