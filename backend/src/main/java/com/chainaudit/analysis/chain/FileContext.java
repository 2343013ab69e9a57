package com.chainaudit.analysis.chain;

import com.chainaudit.analysis.source.SourceScope;
import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.SyntaxNode.ImportBinding;
import com.chainaudit.parser.ts.SyntaxNode.ImportDeclaration;
import com.chainaudit.parser.ts.SyntaxWalker;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 单个文件的分析上下文：源文件、来源作用域、数据库句柄名与导入别名表
 *
 * @param file          已解析的源文件
 * @param scope         来源作用域，三个遍历均已完成
 * @param dbHandles     视为数据库句柄的标识符
 * @param importAliases 本地别名到导出名的映射，如 usersTable -> users
 */
public record FileContext(SourceFile file, SourceScope scope, Set<String> dbHandles,
                          Map<String, String> importAliases) {

    private static final String DB_EXPORT = "db";

    /**
     * 从源文件构建上下文：收集导入别名，并把 db 的导入别名加入句柄集合
     */
    public static FileContext of(SourceFile file, Collection<String> configuredHandles) {
        Set<String> handles = new LinkedHashSet<>(configuredHandles);
        handles.add(DB_EXPORT);
        Map<String, String> aliases = new HashMap<>();
        for (ImportDeclaration declaration : SyntaxWalker.collect(file.program(), ImportDeclaration.class)) {
            for (ImportBinding binding : declaration.bindings()) {
                if (DB_EXPORT.equals(binding.importedName()) || DB_EXPORT.equals(binding.localName())) {
                    handles.add(binding.localName());
                }
                if (binding.isRenamed() && !"default".equals(binding.importedName())
                        && !"*".equals(binding.importedName())) {
                    aliases.put(binding.localName(), binding.importedName());
                }
            }
        }
        return new FileContext(file, SourceScope.build(file), Collections.unmodifiableSet(handles),
                Collections.unmodifiableMap(aliases));
    }
}
