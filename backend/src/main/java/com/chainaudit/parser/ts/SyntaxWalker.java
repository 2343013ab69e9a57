package com.chainaudit.parser.ts;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * 语法树深度优先（先序）遍历
 */
public final class SyntaxWalker {

    private SyntaxWalker() {
    }

    /**
     * 按源码顺序先序访问 root 及其全部后代；使用显式栈，深层嵌套的 JSX 不会导致栈溢出
     */
    public static void walk(SyntaxNode root, Consumer<SyntaxNode> visitor) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            visitor.accept(node);
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                SyntaxNode child = children.get(i);
                if (child != null) {
                    stack.push(child);
                }
            }
        }
    }

    /**
     * 收集指定类型的全部节点（先序）
     */
    public static <T extends SyntaxNode> List<T> collect(SyntaxNode root, Class<T> type) {
        List<T> result = new ArrayList<>();
        walk(root, node -> {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        });
        return result;
    }
}
