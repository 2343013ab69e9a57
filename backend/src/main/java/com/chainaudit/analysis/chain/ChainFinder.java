package com.chainaudit.analysis.chain;

import com.chainaudit.parser.ts.SyntaxNode.Call;
import com.chainaudit.parser.ts.SyntaxWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 找出文件中所有以数据库句柄为锚点的方法链
 * <p>
 * 只检查链尾调用，每条链至多产出一个结果；结果按链的起始位置去重。
 */
public final class ChainFinder {

    private static final Logger log = LoggerFactory.getLogger(ChainFinder.class);

    private ChainFinder() {
    }

    public static List<ChainInfo> findChains(FileContext context) {
        List<ChainInfo> result = new ArrayList<>();
        Set<Integer> seenStarts = new HashSet<>();
        for (Call call : SyntaxWalker.collect(context.file().program(), Call.class)) {
            if (!ChainCollector.isChainEnd(call, context.file())) {
                continue;
            }
            List<ChainSegment> segments = ChainCollector.unwrap(call);
            if (segments.isEmpty()) {
                continue;
            }
            Optional<ChainInfo> info = ChainSemanticsAnalyzer.analyze(segments, context);
            if (info.isPresent() && seenStarts.add(call.span().start())) {
                result.add(info.get());
            }
        }
        log.debug("{} 中识别到 {} 条数据库调用链", context.file().path(), result.size());
        return result;
    }
}
