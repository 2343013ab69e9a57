package com.chainaudit.persistence;

import com.chainaudit.analysis.chain.ChainFinder;
import com.chainaudit.analysis.chain.ChainInfo;
import com.chainaudit.analysis.chain.FileContext;
import com.chainaudit.analysis.chain.ValueInfo;
import com.chainaudit.config.AuditProperties;
import com.chainaudit.model.SourceLocation;
import com.chainaudit.model.SourceSpan;
import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.SyntaxNode.Span;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 从源文件中提取写操作，供持久化检查使用
 */
@Component
public class OperationExtractor {

    private final AuditProperties properties;

    public OperationExtractor(AuditProperties properties) {
        this.properties = properties;
    }

    public List<DbOperation> extractOperations(SourceFile source) {
        FileContext context = FileContext.of(source, properties.getDbHandleNames());
        List<DbOperation> operations = new ArrayList<>();
        for (ChainInfo chain : ChainFinder.findChains(context)) {
            if (!chain.operation().isWrite()) {
                continue;
            }
            operations.add(DbOperation.builder()
                    .type(chain.operation())
                    .tableName(chain.tableName())
                    .columnValues(columnValues(chain, source))
                    .hasWhere(chain.hasWhere())
                    .payloadComplete(chain.payloadComplete())
                    .location(SourceLocation.at(source, chain.span().start()))
                    .span(SourceSpan.of(source, chain.span()))
                    .code(chain.code())
                    .build());
        }
        return operations;
    }

    private static List<ColumnValue> columnValues(ChainInfo chain, SourceFile source) {
        Map<String, ValueInfo> payload = chain.payload();
        if (payload == null) {
            return List.of();
        }
        List<ColumnValue> values = new ArrayList<>();
        payload.forEach((column, value) -> values.add(ColumnValue.builder()
                .columnName(column)
                .dataSource(value.dataSource())
                .span(SourceSpan.of(source, value.span()))
                .expression(expression(source, value.span()))
                .build()));
        return values;
    }

    private static String expression(SourceFile source, Span span) {
        return source.text().substring(span.start(), span.end()).replaceAll("\\s+", " ").trim();
    }
}
