package com.chainaudit.sql;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 参数化查询中的一个占位符
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryParameter {

    /** 占位符序号，$1 为 1 */
    private int position;

    /** 值的源码表达式 */
    private String source;

    /** 目标列在 schema 中的类型，未知时为 null */
    private String columnType;
}
