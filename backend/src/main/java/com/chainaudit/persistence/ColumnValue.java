package com.chainaudit.persistence;

import com.chainaudit.analysis.source.DataSource;
import com.chainaudit.model.SourceSpan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 写操作中一列的取值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnValue {

    /** 列名（源码中的属性名） */
    private String columnName;

    /** 值的来源分类 */
    private DataSource dataSource;

    /** 值表达式的区间 */
    private SourceSpan span;

    /** 值表达式源码，空白已折叠 */
    private String expression;
}
