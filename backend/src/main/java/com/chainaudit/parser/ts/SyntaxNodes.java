package com.chainaudit.parser.ts;

import com.chainaudit.parser.ts.SyntaxNode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 语法节点的常用判断
 */
public final class SyntaxNodes {

    private SyntaxNodes() {
    }

    /** 去掉外层 await */
    public static SyntaxNode unwrapAwait(SyntaxNode node) {
        SyntaxNode current = node;
        while (current instanceof Await await) {
            current = await.expression();
        }
        return current;
    }

    /** 字符串字面量的值；其他节点返回 null */
    public static String stringValue(SyntaxNode node) {
        return node instanceof StringLiteral literal ? literal.value() : null;
    }

    /** 第一个实参的字符串值 */
    public static String firstStringArgument(Call call) {
        return call.arguments().isEmpty() ? null : stringValue(call.arguments().get(0));
    }

    /** receiver.method(...) 形式调用的方法名；其他形式返回 null */
    public static String methodName(Call call) {
        return call.callee() instanceof PropertyAccess access ? access.name() : null;
    }

    /** name(...) 形式调用的函数名；其他形式返回 null */
    public static String functionName(Call call) {
        return call.callee() instanceof Identifier id ? id.name() : null;
    }

    /** 属性访问链最左侧的标识符，如 a.b.c 返回 a */
    public static Identifier rootIdentifier(SyntaxNode node) {
        SyntaxNode current = node;
        while (true) {
            if (current instanceof Identifier id) {
                return id;
            } else if (current instanceof PropertyAccess access) {
                current = access.expression();
            } else if (current instanceof ElementAccess element) {
                current = element.expression();
            } else {
                return null;
            }
        }
    }

    /** 解构模式中绑定的全部本地名称（含嵌套模式，不含默认值表达式） */
    public static List<Identifier> boundIdentifiers(SyntaxNode binding) {
        List<Identifier> result = new ArrayList<>();
        collectBound(binding, result);
        return result;
    }

    private static void collectBound(SyntaxNode binding, List<Identifier> out) {
        if (binding instanceof Identifier id) {
            out.add(id);
        } else if (binding instanceof ObjectBindingPattern pattern) {
            for (BindingElement element : pattern.elements()) {
                collectBound(element.binding(), out);
            }
        } else if (binding instanceof ArrayBindingPattern pattern) {
            for (SyntaxNode element : pattern.elements()) {
                collectBound(element, out);
            }
        }
    }
}
