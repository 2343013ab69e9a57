package com.chainaudit.parser.ts;

import java.util.ArrayList;
import java.util.List;

/**
 * TS/TSX 源码语法树节点（封闭类型集合）
 * <p>
 * 只建模分析器用得到的节点形态：调用、属性访问、对象字面量、字面量、标识符、解构模式等；
 * 其余表达式统一折叠为 {@link Other}，仅保留子节点供遍历。
 */
public sealed interface SyntaxNode {

    /** 节点在源文本中的字符区间 [start, end) */
    Span span();

    /** 直接子节点（按源码顺序） */
    default List<SyntaxNode> children() {
        return List.of();
    }

    record Span(int start, int end) {
        public static Span of(Span from, Span to) {
            return new Span(from.start(), to.end());
        }
    }

    /** 整个文件 */
    record Program(Span span, List<SyntaxNode> statements) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return statements;
        }
    }

    /** { ... } 语句块 */
    record Block(Span span, List<SyntaxNode> statements) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return statements;
        }
    }

    /** 函数声明、函数表达式、箭头函数与对象/类方法；body 为 Block 或表达式 */
    record FunctionNode(Span span, String name, List<SyntaxNode> parameters, SyntaxNode body) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            List<SyntaxNode> result = new ArrayList<>(parameters);
            if (body != null) {
                result.add(body);
            }
            return result;
        }
    }

    /** import { a as b } from 'module' */
    record ImportDeclaration(Span span, String moduleName, List<ImportBinding> bindings) implements SyntaxNode {
    }

    /** importedName 为模块导出名，localName 为本地绑定名；默认导入的 importedName 为 "default" */
    record ImportBinding(String importedName, String localName) {
        public boolean isRenamed() {
            return !importedName.equals(localName);
        }
    }

    /** const/let/var 声明中的单个声明项 */
    record VariableDeclaration(Span span, SyntaxNode binding, SyntaxNode initializer) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return initializer == null ? List.of(binding) : List.of(binding, initializer);
        }
    }

    /** const { a, b: c = 1, ...rest } = ... */
    record ObjectBindingPattern(Span span, List<BindingElement> elements) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.copyOf(elements);
        }
    }

    /** const [a, b] = ... */
    record ArrayBindingPattern(Span span, List<SyntaxNode> elements) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return elements;
        }
    }

    /** 解构模式中的单个元素；propertyName 为被取的属性名，binding 为本地绑定（标识符或嵌套模式） */
    record BindingElement(Span span, String propertyName, SyntaxNode binding, SyntaxNode defaultValue,
                          boolean rest) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return defaultValue == null ? List.of(binding) : List.of(binding, defaultValue);
        }
    }

    record Identifier(Span span, String name) implements SyntaxNode {
    }

    /** 字符串字面量；无插值的模板字符串也归入此类 */
    record StringLiteral(Span span, String value) implements SyntaxNode {
    }

    record NumberLiteral(Span span, String text) implements SyntaxNode {
        public boolean isInteger() {
            return text.chars().allMatch(Character::isDigit);
        }
    }

    record BooleanLiteral(Span span, boolean value) implements SyntaxNode {
    }

    record NullLiteral(Span span) implements SyntaxNode {
    }

    /** expression.name（含可选链 ?.） */
    record PropertyAccess(Span span, SyntaxNode expression, String name) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of(expression);
        }
    }

    /** expression[argument] */
    record ElementAccess(Span span, SyntaxNode expression, SyntaxNode argument) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of(expression, argument);
        }
    }

    /** callee(arguments...) */
    record Call(Span span, SyntaxNode callee, List<SyntaxNode> arguments) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            List<SyntaxNode> result = new ArrayList<>(arguments.size() + 1);
            result.add(callee);
            result.addAll(arguments);
            return result;
        }
    }

    record ObjectLiteral(Span span, List<SyntaxNode> properties) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return properties;
        }
    }

    /** key: value；key 为标识符名、字符串或数字文本，计算属性名时为 null */
    record PropertyAssignment(Span span, String key, SyntaxNode value) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of(value);
        }
    }

    /** { name } 简写属性 */
    record ShorthandProperty(Span span, Identifier name) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of(name);
        }
    }

    /** ...expression（对象、数组、实参中） */
    record Spread(Span span, SyntaxNode expression) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of(expression);
        }
    }

    record ArrayLiteral(Span span, List<SyntaxNode> elements) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return elements;
        }
    }

    record Await(Span span, SyntaxNode expression) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of(expression);
        }
    }

    /** 分析器不关心的其他表达式（二元、条件、new、带插值模板、正则等），kind 仅用于调试 */
    record Other(Span span, String kind, List<SyntaxNode> parts) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return parts;
        }
    }
}
