package com.chainaudit.analysis.source;

import com.chainaudit.analysis.source.DataSource.Origin;
import com.chainaudit.analysis.source.DataSource.ScalarType;
import com.chainaudit.analysis.source.SourceScope.RequestAccessor;
import com.chainaudit.parser.ts.SyntaxNode;
import com.chainaudit.parser.ts.SyntaxNode.*;
import com.chainaudit.parser.ts.SyntaxNodes;

import java.util.Map;
import java.util.Set;

/**
 * 推断值表达式的来源，按以下顺序取第一个匹配：
 * <ol>
 *     <li>表单变量的 get/getAll 调用：外部字段，字符串</li>
 *     <li>params 的属性访问、get 调用或下标访问：路由参数，字符串；请求体变量的属性访问：请求体</li>
 *     <li>字面量</li>
 *     <li>Number/parseInt/parseFloat/Boolean 包装：沿用内层来源，覆盖标量类型</li>
 *     <li>标识符：已校验集合，其次来源表，否则为未校验变量</li>
 *     <li>已校验变量上的属性访问：已校验变量</li>
 * </ol>
 * 都不匹配时为未知来源。
 */
public final class DataSourceClassifier {

    static final String ROUTE_PARAMS = "params";

    private static final Set<String> FORM_FIELD_GETTERS = Set.of("get", "getAll");

    private static final Map<String, ScalarType> COERCIONS = Map.of(
            "Number", ScalarType.NUMBER,
            "parseInt", ScalarType.NUMBER,
            "parseFloat", ScalarType.NUMBER,
            "Boolean", ScalarType.BOOLEAN);

    private DataSourceClassifier() {
    }

    public static DataSource classify(SyntaxNode expression, SourceScope scope) {
        SyntaxNode node = SyntaxNodes.unwrapAwait(expression);

        DataSource external = classifyRequestAccess(node, scope);
        if (external != null) {
            return external;
        }

        DataSource literal = classifyLiteral(node);
        if (literal != null) {
            return literal;
        }

        if (node instanceof Call call && !call.arguments().isEmpty()) {
            ScalarType coercedType = coercionOf(call);
            if (coercedType != null) {
                return classify(call.arguments().get(0), scope).withScalarType(coercedType);
            }
        }

        if (node instanceof Identifier id) {
            if (scope.isValidated(id.name())) {
                return DataSource.validatedVariable();
            }
            DataSource known = scope.sourceOf(id.name());
            return known != null ? known : DataSource.variable();
        }

        if (node instanceof PropertyAccess || node instanceof ElementAccess) {
            Identifier root = SyntaxNodes.rootIdentifier(node);
            if (root != null && scope.isValidated(root.name())) {
                return DataSource.validatedVariable();
            }
        }
        return DataSource.unknown();
    }

    private static ScalarType coercionOf(Call call) {
        String function = SyntaxNodes.functionName(call);
        return function == null ? null : COERCIONS.get(function);
    }

    private static DataSource classifyRequestAccess(SyntaxNode node, SourceScope scope) {
        if (node instanceof Call call && call.callee() instanceof PropertyAccess access
                && access.expression() instanceof Identifier receiver) {
            if (FORM_FIELD_GETTERS.contains(access.name())
                    && scope.accessorOf(receiver.name()) == RequestAccessor.FORM_DATA) {
                return DataSource.external(Origin.EXTERNAL_FIELD, ScalarType.STRING,
                        SyntaxNodes.firstStringArgument(call));
            }
            if ("get".equals(access.name()) && ROUTE_PARAMS.equals(receiver.name())) {
                return DataSource.external(Origin.ROUTE_PARAM, ScalarType.STRING,
                        SyntaxNodes.firstStringArgument(call));
            }
            return null;
        }

        Identifier receiver;
        String field;
        if (node instanceof PropertyAccess access && access.expression() instanceof Identifier id) {
            receiver = id;
            field = access.name();
        } else if (node instanceof ElementAccess element && element.expression() instanceof Identifier id) {
            receiver = id;
            field = SyntaxNodes.stringValue(element.argument());
        } else {
            return null;
        }
        if (ROUTE_PARAMS.equals(receiver.name())) {
            return DataSource.external(Origin.ROUTE_PARAM, ScalarType.STRING, field);
        }
        if (scope.accessorOf(receiver.name()) == RequestAccessor.JSON_BODY) {
            return DataSource.external(Origin.REQUEST_BODY, ScalarType.UNKNOWN, field);
        }
        return null;
    }

    private static DataSource classifyLiteral(SyntaxNode node) {
        if (node instanceof StringLiteral literal) {
            return DataSource.literal(ScalarType.STRING, literal.value());
        }
        if (node instanceof NumberLiteral literal) {
            return DataSource.literal(ScalarType.NUMBER, literal.text());
        }
        if (node instanceof BooleanLiteral literal) {
            return DataSource.literal(ScalarType.BOOLEAN, String.valueOf(literal.value()));
        }
        if (node instanceof NullLiteral) {
            return DataSource.literal(ScalarType.NULL, null);
        }
        return null;
    }
}
