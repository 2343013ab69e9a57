package com.chainaudit.parser.ts;

import com.chainaudit.parser.ts.SyntaxNode.*;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 把 tree-sitter 的 TypeScript 语法树转换为 {@link SyntaxNode}
 * <p>
 * 括号、as、satisfies、非空断言与尖括号类型断言不产生节点，直接返回内部表达式；类型注解、接口与类型别名整体丢弃；
 * 其余不关心的节点折叠为 {@link Other}。tree-sitter 的偏移量是 UTF-8 字节偏移，这里统一换算为字符偏移。
 * 嵌套超过 {@link #MAX_DEPTH} 层的子树折叠为空的 {@link Other}，后续分析的递归深度因此有上限。
 */
final class SyntaxTreeBuilder {

    static final int MAX_DEPTH = 400;

    private static final Set<String> TRANSPARENT = Set.of(
            "parenthesized_expression", "as_expression", "satisfies_expression", "non_null_expression",
            "expression_statement");

    private static final Set<String> SKIPPED = Set.of(
            "comment", "type_annotation", "type_arguments", "type_parameters", "interface_declaration",
            "type_alias_declaration", "ambient_declaration", "asserts_annotation", "type_predicate_annotation",
            "opting_type_annotation", "omitting_type_annotation", "accessibility_modifier", "override_modifier",
            "decorator");

    private static final Set<String> FUNCTIONS = Set.of(
            "function_declaration", "function_expression", "function", "generator_function_declaration",
            "generator_function", "arrow_function", "method_definition");

    private final String text;
    private final int[] charIndex;

    SyntaxTreeBuilder(String text) {
        this.text = text;
        this.charIndex = byteToCharIndex(text);
    }

    Program buildProgram(TSNode root) {
        return new Program(new Span(0, text.length()), convertChildren(root, 1));
    }

    private SyntaxNode convert(TSNode node, int depth) {
        if (node == null || node.isNull()) {
            return null;
        }
        Span span = span(node);
        if (depth > MAX_DEPTH) {
            return new Other(span, "truncated", List.of());
        }
        String type = node.getType();
        if (TRANSPARENT.contains(type)) {
            TSNode inner = node.getNamedChildCount() > 0 ? node.getNamedChild(0) : null;
            return inner == null ? new Other(span, type, List.of()) : convert(inner, depth + 1);
        }
        if (FUNCTIONS.contains(type)) {
            return function(node, depth);
        }
        switch (type) {
            case "statement_block":
                return new Block(span, convertChildren(node, depth + 1));
            case "import_statement":
                return importDeclaration(node, span);
            case "lexical_declaration":
            case "variable_declaration":
                return declarations(node, span, depth);
            case "variable_declarator":
                return declarator(node, span, depth);
            case "object_pattern":
                return objectPattern(node, span, depth);
            case "array_pattern":
                return new ArrayBindingPattern(span, convertChildren(node, depth + 1));
            case "identifier":
            case "shorthand_property_identifier_pattern":
            case "this":
            case "super":
            case "undefined":
                return new Identifier(span, text(node));
            case "string":
                return new StringLiteral(span, unquote(text(node)));
            case "template_string":
                return template(node, span, depth);
            case "number":
                return new NumberLiteral(span, text(node).replace("_", ""));
            case "true":
                return new BooleanLiteral(span, true);
            case "false":
                return new BooleanLiteral(span, false);
            case "null":
                return new NullLiteral(span);
            case "member_expression":
                return memberAccess(node, span, depth);
            case "subscript_expression":
                return elementAccess(node, span, depth);
            case "call_expression":
                return call(node, span, depth);
            case "await_expression": {
                SyntaxNode inner = convert(node.getNamedChild(0), depth + 1);
                return inner == null ? new Other(span, type, List.of()) : new Await(span, inner);
            }
            case "object":
                return objectLiteral(node, span, depth);
            case "array":
                return new ArrayLiteral(span, convertChildren(node, depth + 1));
            case "spread_element": {
                SyntaxNode inner = convert(node.getNamedChild(0), depth + 1);
                return inner == null ? new Other(span, type, List.of()) : new Spread(span, inner);
            }
            case "type_assertion":
            case "sequence_expression":
                // <T>value 与 (a, b) 都取最后一个子节点
                return node.getNamedChildCount() == 0
                        ? new Other(span, type, List.of())
                        : convert(node.getNamedChild(node.getNamedChildCount() - 1), depth + 1);
            default:
                return new Other(span, type, convertChildren(node, depth + 1));
        }
    }

    private List<SyntaxNode> convertChildren(TSNode node, int depth) {
        List<SyntaxNode> result = new ArrayList<>();
        int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getNamedChild(i);
            if (child == null || child.isNull() || SKIPPED.contains(child.getType())) {
                continue;
            }
            SyntaxNode converted = convert(child, depth);
            if (converted != null) {
                result.add(converted);
            }
        }
        return result;
    }

    private SyntaxNode declarations(TSNode node, Span span, int depth) {
        List<SyntaxNode> declarators = convertChildren(node, depth + 1);
        if (declarators.size() == 1) {
            return declarators.get(0);
        }
        return new Other(span, node.getType(), declarators);
    }

    private SyntaxNode declarator(TSNode node, Span span, int depth) {
        SyntaxNode binding = convert(field(node, "name"), depth + 1);
        SyntaxNode initializer = convert(field(node, "value"), depth + 1);
        if (binding == null) {
            return new Other(span, "variable_declarator", initializer == null ? List.of() : List.of(initializer));
        }
        return new VariableDeclaration(span, binding, initializer);
    }

    private ImportDeclaration importDeclaration(TSNode node, Span span) {
        TSNode source = field(node, "source");
        String moduleName = source == null ? "" : unquote(text(source));
        List<ImportBinding> bindings = new ArrayList<>();
        TSNode clause = firstNamedChild(node, "import_clause");
        if (clause != null) {
            for (int i = 0; i < clause.getNamedChildCount(); i++) {
                TSNode part = clause.getNamedChild(i);
                switch (part.getType()) {
                    case "identifier" -> bindings.add(new ImportBinding("default", text(part)));
                    case "namespace_import" -> {
                        TSNode local = firstNamedChild(part, "identifier");
                        if (local != null) {
                            bindings.add(new ImportBinding("*", text(local)));
                        }
                    }
                    case "named_imports" -> {
                        for (int j = 0; j < part.getNamedChildCount(); j++) {
                            TSNode specifier = part.getNamedChild(j);
                            if (!"import_specifier".equals(specifier.getType())) {
                                continue;
                            }
                            TSNode name = field(specifier, "name");
                            TSNode alias = field(specifier, "alias");
                            if (name == null) {
                                continue;
                            }
                            String imported = keyText(name);
                            bindings.add(new ImportBinding(imported, alias == null ? imported : text(alias)));
                        }
                    }
                    default -> {
                    }
                }
            }
        }
        return new ImportDeclaration(span, moduleName, List.copyOf(bindings));
    }

    private FunctionNode function(TSNode node, int depth) {
        Span span = span(node);
        TSNode nameNode = field(node, "name");
        String name = nameNode == null ? null : keyText(nameNode);
        List<SyntaxNode> parameters = new ArrayList<>();
        TSNode single = field(node, "parameter");
        if (single != null) {
            parameters.add(convert(single, depth + 1));
        }
        TSNode formal = field(node, "parameters");
        if (formal != null) {
            for (int i = 0; i < formal.getNamedChildCount(); i++) {
                TSNode parameter = formal.getNamedChild(i);
                TSNode pattern = field(parameter, "pattern");
                SyntaxNode converted = convert(pattern != null ? pattern : parameter, depth + 1);
                if (converted != null) {
                    parameters.add(converted);
                }
            }
        }
        return new FunctionNode(span, name, List.copyOf(parameters), convert(field(node, "body"), depth + 1));
    }

    private ObjectBindingPattern objectPattern(TSNode node, Span span, int depth) {
        List<BindingElement> elements = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode member = node.getNamedChild(i);
            Span memberSpan = span(member);
            switch (member.getType()) {
                case "shorthand_property_identifier_pattern" -> {
                    String name = text(member);
                    elements.add(new BindingElement(memberSpan, name, new Identifier(memberSpan, name), null, false));
                }
                case "object_assignment_pattern" -> {
                    // { status = 'active' }
                    TSNode left = field(member, "left");
                    if (left == null) {
                        continue;
                    }
                    SyntaxNode binding = convert(left, depth + 1);
                    String name = binding instanceof Identifier id ? id.name() : null;
                    elements.add(new BindingElement(memberSpan, name, binding,
                            convert(field(member, "right"), depth + 1), false));
                }
                case "pair_pattern" -> {
                    TSNode key = field(member, "key");
                    TSNode value = field(member, "value");
                    if (value == null) {
                        continue;
                    }
                    String propertyName = key == null ? null : keyText(key);
                    SyntaxNode binding;
                    SyntaxNode defaultValue = null;
                    if ("assignment_pattern".equals(value.getType())) {
                        binding = convert(field(value, "left"), depth + 1);
                        defaultValue = convert(field(value, "right"), depth + 1);
                    } else {
                        binding = convert(value, depth + 1);
                    }
                    if (binding != null) {
                        elements.add(new BindingElement(memberSpan, propertyName, binding, defaultValue, false));
                    }
                }
                case "rest_pattern" -> {
                    SyntaxNode binding = convert(member.getNamedChild(0), depth + 1);
                    if (binding != null) {
                        elements.add(new BindingElement(memberSpan, null, binding, null, true));
                    }
                }
                default -> {
                }
            }
        }
        return new ObjectBindingPattern(span, List.copyOf(elements));
    }

    private SyntaxNode template(TSNode node, Span span, int depth) {
        List<SyntaxNode> substitutions = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode part = node.getNamedChild(i);
            if ("template_substitution".equals(part.getType())) {
                substitutions.addAll(convertChildren(part, depth + 1));
            }
        }
        boolean substituted = !substitutions.isEmpty() || text(node).contains("${");
        if (substituted) {
            return new Other(span, "template", substitutions);
        }
        return new StringLiteral(span, unquote(text(node)));
    }

    private SyntaxNode memberAccess(TSNode node, Span span, int depth) {
        SyntaxNode object = convert(field(node, "object"), depth + 1);
        TSNode property = field(node, "property");
        if (object == null || property == null) {
            return new Other(span, "member_expression", object == null ? List.of() : List.of(object));
        }
        return new PropertyAccess(span, object, text(property));
    }

    private SyntaxNode elementAccess(TSNode node, Span span, int depth) {
        SyntaxNode object = convert(field(node, "object"), depth + 1);
        SyntaxNode index = convert(field(node, "index"), depth + 1);
        if (object == null || index == null) {
            List<SyntaxNode> parts = new ArrayList<>();
            if (object != null) {
                parts.add(object);
            }
            if (index != null) {
                parts.add(index);
            }
            return new Other(span, "subscript_expression", parts);
        }
        return new ElementAccess(span, object, index);
    }

    private SyntaxNode call(TSNode node, Span span, int depth) {
        SyntaxNode callee = convert(field(node, "function"), depth + 1);
        TSNode arguments = field(node, "arguments");
        if (callee == null) {
            return new Other(span, "call_expression", List.of());
        }
        if (arguments == null || !"arguments".equals(arguments.getType())) {
            // sql`...` 标签模板
            List<SyntaxNode> parts = new ArrayList<>();
            parts.add(callee);
            SyntaxNode template = convert(arguments, depth + 1);
            if (template != null) {
                parts.add(template);
            }
            return new Other(span, "tagged_template", parts);
        }
        return new Call(span, callee, List.copyOf(convertChildren(arguments, depth + 1)));
    }

    private ObjectLiteral objectLiteral(TSNode node, Span span, int depth) {
        List<SyntaxNode> properties = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode member = node.getNamedChild(i);
            Span memberSpan = span(member);
            switch (member.getType()) {
                case "pair" -> {
                    SyntaxNode value = convert(field(member, "value"), depth + 1);
                    if (value != null) {
                        properties.add(new PropertyAssignment(memberSpan, keyText(field(member, "key")), value));
                    }
                }
                case "shorthand_property_identifier" -> {
                    Identifier name = new Identifier(memberSpan, text(member));
                    properties.add(new ShorthandProperty(memberSpan, name));
                }
                case "method_definition" -> {
                    FunctionNode method = function(member, depth + 1);
                    properties.add(new PropertyAssignment(memberSpan, method.name(), method));
                }
                case "comment" -> {
                }
                default -> {
                    SyntaxNode converted = convert(member, depth + 1);
                    if (converted != null) {
                        properties.add(converted);
                    }
                }
            }
        }
        return new ObjectLiteral(span, List.copyOf(properties));
    }

    /** 属性名文本：标识符原样，字符串去引号，计算属性名返回 null */
    private String keyText(TSNode key) {
        if (key == null || "computed_property_name".equals(key.getType())) {
            return null;
        }
        if ("string".equals(key.getType())) {
            return unquote(text(key));
        }
        if ("number".equals(key.getType())) {
            return text(key).replace("_", "");
        }
        return text(key);
    }

    private static TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private static TSNode firstNamedChild(TSNode node, String type) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private Span span(TSNode node) {
        return new Span(toCharOffset(node.getStartByte()), toCharOffset(node.getEndByte()));
    }

    private String text(TSNode node) {
        Span span = span(node);
        return text.substring(span.start(), span.end());
    }

    private int toCharOffset(int byteOffset) {
        if (byteOffset <= 0) {
            return 0;
        }
        return byteOffset >= charIndex.length ? text.length() : charIndex[byteOffset];
    }

    /** 去掉首尾引号（' " `）并处理转义 */
    static String unquote(String literal) {
        if (literal.length() < 2) {
            return literal;
        }
        String body = literal.substring(1, literal.length() - 1);
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                case 'u' -> {
                    if (i + 4 < body.length() && body.substring(i + 1, i + 5).chars().allMatch(SyntaxTreeBuilder::isHex)) {
                        sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                        i += 4;
                    } else {
                        sb.append(next);
                    }
                }
                case '\n' -> {
                    // 行延续
                }
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(int c) {
        return Character.digit(c, 16) >= 0;
    }

    /**
     * UTF-8 字节偏移到字符偏移的映射；孤立代理字符按编码器替换为单字节 '?' 计算
     */
    static int[] byteToCharIndex(String text) {
        int byteLength = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            byteLength += utf8Length(cp);
            i += Character.charCount(cp);
        }
        int[] map = new int[byteLength + 1];
        int b = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            int length = utf8Length(cp);
            for (int k = 0; k < length; k++) {
                map[b + k] = i;
            }
            b += length;
            i += Character.charCount(cp);
        }
        map[b] = text.length();
        return map;
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80 || (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
            return 1;
        }
        if (cp < 0x800) {
            return 2;
        }
        return cp < 0x10000 ? 3 : 4;
    }
}
