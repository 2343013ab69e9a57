package com.chainaudit.persistence;

import com.chainaudit.analysis.chain.Operation;
import com.chainaudit.model.SourceLocation;
import com.chainaudit.model.SourceSpan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次写操作（insert / update / delete）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DbOperation {

    private Operation type;

    /** 目标表，已还原导入别名 */
    private String tableName;

    /** values / set 中的列值，按源码顺序 */
    private List<ColumnValue> columnValues;

    /** 是否调用过 where */
    private boolean hasWhere;

    /** 值对象是否完整可见；不完整时不检查缺失列 */
    private boolean payloadComplete;

    private SourceLocation location;

    private SourceSpan span;

    /** 调用链源码，空白已折叠 */
    private String code;
}
