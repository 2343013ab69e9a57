package com.chainaudit.parser.ts;

import com.chainaudit.parser.ts.SyntaxNode.Program;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个已解析的源文件：原文、语法树、父节点索引与偏移到行列的映射
 * <p>
 * 语法树节点是记录类型，值相等的两个节点可能位于不同位置，因此父节点索引按对象身份建立。
 */
public class SourceFile {

    private final Path path;
    private final String text;
    private final Program program;
    private final Map<SyntaxNode, SyntaxNode> parents = new IdentityHashMap<>();
    private final int[] lineStarts;

    public SourceFile(Path path, String text, Program program) {
        this.path = path;
        this.text = text;
        this.program = program;
        SyntaxWalker.walk(program, node -> {
            for (SyntaxNode child : node.children()) {
                parents.put(child, node);
            }
        });
        this.lineStarts = computeLineStarts(text);
    }

    public Path path() {
        return path;
    }

    public String text() {
        return text;
    }

    public Program program() {
        return program;
    }

    /**
     * 父节点；根节点或不属于本文件的节点返回 null
     */
    public SyntaxNode parentOf(SyntaxNode node) {
        return parents.get(node);
    }

    /**
     * 偏移量对应的行列号（均从 1 开始）
     */
    public LineColumn lineColumn(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        int line = idx >= 0 ? idx : -idx - 2;
        return new LineColumn(line + 1, offset - lineStarts[line] + 1);
    }

    /** 节点对应的原始源码 */
    public String text(SyntaxNode node) {
        int start = Math.max(0, node.span().start());
        int end = Math.min(text.length(), node.span().end());
        return start >= end ? "" : text.substring(start, end);
    }

    /** 节点源码，连续空白折叠为单个空格 */
    public String snippet(SyntaxNode node) {
        return text(node).replaceAll("\\s+", " ").trim();
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public record LineColumn(int line, int column) {
    }
}
