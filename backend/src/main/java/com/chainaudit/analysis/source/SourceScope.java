package com.chainaudit.analysis.source;

import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.SyntaxNode;
import com.chainaudit.parser.ts.SyntaxNode.*;
import com.chainaudit.parser.ts.SyntaxNodes;
import com.chainaudit.parser.ts.SyntaxWalker;
import com.chainaudit.analysis.source.DataSource.Origin;
import com.chainaudit.analysis.source.DataSource.ScalarType;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个文件内的来源信息：请求访问器变量、已校验变量集合与变量来源表
 * <p>
 * 三者由三个按顺序执行的遍历各自生成，互不修改；值分类之前必须全部完成，
 * 因为后面的表达式会引用前面声明的变量。作用域按文件划分，同名变量以文档顺序中最后一次声明为准。
 */
public final class SourceScope {

    /** 变量绑定的请求访问器类型 */
    public enum RequestAccessor {
        /** await request.formData() */
        FORM_DATA,
        /** await request.json() */
        JSON_BODY
    }

    private static final Set<String> VALIDATION_METHODS = Set.of("parse", "safeParse", "parseAsync", "safeParseAsync");

    private final Map<String, RequestAccessor> requestAccessors;
    private final Set<String> validatedVariables;
    private final Map<String, DataSource> sources;

    SourceScope(Map<String, RequestAccessor> requestAccessors, Set<String> validatedVariables,
                Map<String, DataSource> sources) {
        this.requestAccessors = requestAccessors;
        this.validatedVariables = validatedVariables;
        this.sources = sources;
    }

    /**
     * 依次执行三个遍历并组合结果
     */
    public static SourceScope build(SourceFile file) {
        List<VariableDeclaration> declarations = SyntaxWalker.collect(file.program(), VariableDeclaration.class);
        Map<String, RequestAccessor> accessors = requestAccessorPass(declarations);
        Set<String> validated = validationPass(declarations);
        Map<String, DataSource> sources = sourceMapPass(declarations, accessors, validated);
        return new SourceScope(accessors, validated, sources);
    }

    /**
     * 第一遍：绑定到 x.formData() / x.json() 的变量
     */
    static Map<String, RequestAccessor> requestAccessorPass(List<VariableDeclaration> declarations) {
        Map<String, RequestAccessor> result = new LinkedHashMap<>();
        for (VariableDeclaration declaration : declarations) {
            if (declaration.binding() instanceof Identifier id && declaration.initializer() != null) {
                RequestAccessor accessor = accessorOf(declaration.initializer());
                if (accessor != null) {
                    result.put(id.name(), accessor);
                } else {
                    result.remove(id.name());
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * 第二遍：初始值为 .parse/.safeParse/.parseAsync/.safeParseAsync 调用的变量，
     * 以及以此类调用为初始值的对象解构中的每个绑定
     */
    static Set<String> validationPass(List<VariableDeclaration> declarations) {
        Set<String> result = new HashSet<>();
        for (VariableDeclaration declaration : declarations) {
            if (declaration.initializer() == null || !isValidationCall(declaration.initializer())) {
                continue;
            }
            if (declaration.binding() instanceof Identifier id) {
                result.add(id.name());
            } else if (declaration.binding() instanceof ObjectBindingPattern pattern) {
                SyntaxNodes.boundIdentifiers(pattern).forEach(id -> result.add(id.name()));
            }
        }
        return Set.copyOf(result);
    }

    /**
     * 第三遍：按文档顺序对每个声明的初始值分类，后面的同名声明覆盖前面的；
     * 对 params 或请求体变量的对象解构按成员记录来源
     */
    static Map<String, DataSource> sourceMapPass(List<VariableDeclaration> declarations,
                                                 Map<String, RequestAccessor> accessors,
                                                 Set<String> validated) {
        Map<String, DataSource> result = new LinkedHashMap<>();
        SourceScope partial = new SourceScope(accessors, validated, result);
        for (VariableDeclaration declaration : declarations) {
            SyntaxNode initializer = declaration.initializer();
            if (initializer == null) {
                continue;
            }
            if (declaration.binding() instanceof Identifier id) {
                result.put(id.name(), DataSourceClassifier.classify(initializer, partial));
            } else if (declaration.binding() instanceof ObjectBindingPattern pattern) {
                Origin origin = destructuredOrigin(SyntaxNodes.unwrapAwait(initializer), accessors);
                if (origin == null) {
                    continue;
                }
                ScalarType type = origin == Origin.ROUTE_PARAM ? ScalarType.STRING : ScalarType.UNKNOWN;
                for (BindingElement element : pattern.elements()) {
                    if (!element.rest() && element.binding() instanceof Identifier local) {
                        String field = element.propertyName() != null ? element.propertyName() : local.name();
                        result.put(local.name(), DataSource.external(origin, type, field));
                    }
                }
            }
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    private static Origin destructuredOrigin(SyntaxNode base, Map<String, RequestAccessor> accessors) {
        if (base instanceof Identifier id) {
            if (DataSourceClassifier.ROUTE_PARAMS.equals(id.name())) {
                return Origin.ROUTE_PARAM;
            }
            if (accessors.get(id.name()) == RequestAccessor.JSON_BODY) {
                return Origin.REQUEST_BODY;
            }
        }
        // const { status } = await request.json()
        if (accessorOf(base) == RequestAccessor.JSON_BODY) {
            return Origin.REQUEST_BODY;
        }
        return null;
    }

    private static RequestAccessor accessorOf(SyntaxNode initializer) {
        SyntaxNode expression = SyntaxNodes.unwrapAwait(initializer);
        if (!(expression instanceof Call call)) {
            return null;
        }
        String method = SyntaxNodes.methodName(call);
        if ("formData".equals(method)) {
            return RequestAccessor.FORM_DATA;
        }
        if ("json".equals(method)) {
            return RequestAccessor.JSON_BODY;
        }
        return null;
    }

    private static boolean isValidationCall(SyntaxNode initializer) {
        SyntaxNode expression = SyntaxNodes.unwrapAwait(initializer);
        if (!(expression instanceof Call call)) {
            return false;
        }
        String method = SyntaxNodes.methodName(call);
        return method != null && VALIDATION_METHODS.contains(method);
    }

    public RequestAccessor accessorOf(String variableName) {
        return requestAccessors.get(variableName);
    }

    public boolean isValidated(String variableName) {
        return validatedVariables.contains(variableName);
    }

    public DataSource sourceOf(String variableName) {
        return sources.get(variableName);
    }
}
