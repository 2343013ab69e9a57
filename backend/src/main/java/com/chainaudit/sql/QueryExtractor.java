package com.chainaudit.sql;

import com.chainaudit.analysis.chain.ChainFinder;
import com.chainaudit.analysis.chain.ChainInfo;
import com.chainaudit.analysis.chain.FileContext;
import com.chainaudit.config.AuditProperties;
import com.chainaudit.model.SourceLocation;
import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.TsParser;
import com.chainaudit.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 从源文件中提取所有数据库调用链并还原为 SQL
 */
@Component
public class QueryExtractor {

    private static final Logger log = LoggerFactory.getLogger(QueryExtractor.class);

    private final AuditProperties properties;
    private final SqlSynthesizer synthesizer;

    public QueryExtractor(AuditProperties properties, SqlSynthesizer synthesizer) {
        this.properties = properties;
        this.synthesizer = synthesizer;
    }

    /**
     * 读取、解析或分析失败的文件返回空列表
     */
    public List<ExtractedQuery> extractQueries(Path file, SchemaModel schema) {
        try {
            return extractQueries(TsParser.parseFile(file), schema);
        } catch (IOException e) {
            log.warn("读取文件失败，已跳过 {}: {}", file, e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("分析文件失败，已跳过 {}", file, e);
        }
        return List.of();
    }

    public List<ExtractedQuery> extractQueries(SourceFile source, SchemaModel schema) {
        FileContext context = FileContext.of(source, properties.getDbHandleNames());
        List<ExtractedQuery> queries = new ArrayList<>();
        for (ChainInfo chain : ChainFinder.findChains(context)) {
            Optional<GeneratedSql> generated = synthesizer.synthesize(chain, schema);
            if (generated.isEmpty()) {
                log.debug("{} 处的调用链无法生成 SQL", SourceLocation.at(source, chain.span().start()));
                continue;
            }
            GeneratedSql sql = generated.get();
            queries.add(ExtractedQuery.builder()
                    .type(sql.type().name())
                    .sql(sql.sql())
                    .tables(sql.tables())
                    .location(SourceLocation.at(source, chain.span().start()))
                    .code(chain.code())
                    .parameters(sql.parameters())
                    .build());
        }
        return queries;
    }
}
