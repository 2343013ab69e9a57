package com.chainaudit.analysis.chain;

import com.chainaudit.analysis.source.DataSource;
import com.chainaudit.parser.ts.SyntaxNode.Span;

/**
 * 写入列或参与比较的值
 *
 * @param kind       字面量、参数或变量
 * @param value      字面量文本；null 字面量与非字面量为 null
 * @param source     非字面量的源码文本（空白已折叠）
 * @param dataType   可推断出的类型：string / number / boolean / null
 * @param dataSource 同一表达式的来源分类
 * @param span       值表达式在源码中的区间
 */
public record ValueInfo(Kind kind, String value, String source, String dataType, DataSource dataSource,
                        Span span) {

    public enum Kind {
        LITERAL, PARAMETER, VARIABLE
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }
}
