package com.chainaudit.sql;

import com.chainaudit.model.SourceLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 从源码中还原出的一条 SQL
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedQuery {

    /** SELECT / INSERT / UPDATE / DELETE */
    private String type;

    /** 生成的 SQL 文本 */
    private String sql;

    /** 涉及的表（数据库表名），主表在前 */
    private List<String> tables;

    /** 调用链在源码中的位置 */
    private SourceLocation location;

    /** 调用链源码，空白已折叠 */
    private String code;

    /** 占位符参数，按出现顺序 */
    private List<QueryParameter> parameters;
}
