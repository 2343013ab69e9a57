package com.chainaudit.model;

import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.SyntaxNode.Span;

/**
 * 源码区间：start/end 为从 0 开始的字符偏移（end 不含），line/column 从 1 开始
 */
public record SourceSpan(String file, int start, int end, int line, int column) {

    public static SourceSpan of(SourceFile source, Span span) {
        SourceFile.LineColumn position = source.lineColumn(span.start());
        return new SourceSpan(String.valueOf(source.path()), span.start(), span.end(),
                position.line(), position.column());
    }
}
