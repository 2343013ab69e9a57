package com.chainaudit.analysis.chain;

import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.SyntaxNode;
import com.chainaudit.parser.ts.SyntaxNode.Call;
import com.chainaudit.parser.ts.SyntaxNode.PropertyAccess;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 把一条方法链展开为有序的环列表，下标 0 为最先调用的方法
 * <p>
 * 无论从链中哪一个调用开始（锚点调用、values 调用或末尾的 limit），都先沿父节点上行到最外层调用，
 * 再沿 callee 反向展开，因此得到同一个列表。await、括号、as、! 与 satisfies 在语法树中不产生节点。
 */
public final class ChainCollector {

    private ChainCollector() {
    }

    public static List<ChainSegment> collect(Call call, SourceFile file) {
        return unwrap(outermostCall(call, file));
    }

    /**
     * 上行到链的最外层调用：call → 属性访问 → 以该属性访问为 callee 的调用
     */
    public static Call outermostCall(Call call, SourceFile file) {
        Call current = call;
        while (true) {
            SyntaxNode parent = file.parentOf(current);
            if (!(parent instanceof PropertyAccess access)) {
                return current;
            }
            if (!(file.parentOf(access) instanceof Call outer) || outer.callee() != access) {
                return current;
            }
            current = outer;
        }
    }

    /** 链上的下一个调用不是以当前调用为接收者时，当前调用就是链尾 */
    public static boolean isChainEnd(Call call, SourceFile file) {
        return outermostCall(call, file) == call;
    }

    /**
     * 沿 callee 反向展开，遇到非调用的接收者（通常是标识符锚点）停止
     */
    public static List<ChainSegment> unwrap(Call call) {
        Deque<ChainSegment> segments = new ArrayDeque<>();
        SyntaxNode current = call;
        while (current instanceof Call c && c.callee() instanceof PropertyAccess access) {
            segments.addFirst(new ChainSegment(access.expression(), access.name(), c.arguments(), c));
            current = access.expression();
        }
        return List.copyOf(segments);
    }
}
