package com.chainaudit.parser.ts;

import com.chainaudit.parser.ts.SyntaxNode.Program;
import com.chainaudit.util.SourceTextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.io.IOException;
import java.nio.file.Path;

/**
 * TS/TSX 源码解析入口
 * <p>
 * 语法分析交给 tree-sitter 的 TypeScript 语法，出错的片段由 tree-sitter 收敛为 ERROR 节点，
 * 其余部分照常成树；再由 {@link SyntaxTreeBuilder} 转换为分析器使用的 {@link SyntaxNode}。
 * TSParser 不是线程安全的，每个线程持有一个实例。
 */
public final class TsParser {

    private static final Logger log = LoggerFactory.getLogger(TsParser.class);

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterTypescript())) {
            log.error("无法为 TSParser 设置 TypeScript 语法");
        }
        return parser;
    });

    private TsParser() {
    }

    /**
     * 读取并解析源文件，编码处理见 {@link SourceTextReader}
     */
    public static SourceFile parseFile(Path path) throws IOException {
        return parseFile(path, SourceTextReader.read(path).text());
    }

    /**
     * 解析文件内容并建立父节点索引
     *
     * @throws TsParseException tree-sitter 未能产出语法树
     */
    public static SourceFile parseFile(Path path, String text) {
        String source = text != null ? text : "";
        TSTree tree = PARSER.get().parseString(null, source);
        if (tree == null) {
            throw new TsParseException("tree-sitter 未返回语法树: " + path);
        }
        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            log.debug("{} 含有无法识别的语法片段，已按 ERROR 节点跳过", path);
        }
        Program program = new SyntaxTreeBuilder(source).buildProgram(root);
        return new SourceFile(path, source, program);
    }
}
