package com.chainaudit.schema;

import com.chainaudit.config.AuditProperties;
import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.SyntaxNode;
import com.chainaudit.parser.ts.SyntaxNode.*;
import com.chainaudit.parser.ts.SyntaxWalker;
import com.chainaudit.parser.ts.TsParseException;
import com.chainaudit.parser.ts.TsParser;
import com.chainaudit.util.SourceTextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * schema 声明文件解析器
 * <p>
 * 识别绑定到变量的 pgTable / mysqlTable / sqliteTable 表声明与 pgEnum 枚举声明：
 * 第一遍收集枚举，第二遍收集表。每个列声明按修饰链（如 {@code text('name').notNull().default('x')}）
 * 拆出基础类型与修饰符集合，再推导非空、默认值、自动生成与必填标记。
 */
@Component
public class SchemaModelLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaModelLoader.class);

    private static final Set<String> TABLE_FACTORIES = Set.of("pgTable", "mysqlTable", "sqliteTable");
    private static final String ENUM_FACTORY = "pgEnum";

    private static final Set<String> NOT_NULL_MODIFIERS = Set.of("notNull", "primaryKey");
    private static final Set<String> DEFAULT_MODIFIERS = Set.of("default", "defaultNow", "defaultRandom");
    private static final Set<String> AUTO_GENERATED_MODIFIERS = Set.of(
            "$defaultFn", "$default", "generatedAlwaysAsIdentity", "generatedByDefaultAsIdentity");

    private static final List<String> CONFIG_FILES = List.of("drizzle.config.ts", "drizzle.config.js");

    private final AuditProperties properties;

    public SchemaModelLoader(AuditProperties properties) {
        this.properties = properties;
    }

    /**
     * 读取并解析 schema 文件
     *
     * @throws SchemaLoadException 文件不存在、无法读取或无法得到语法树
     */
    public SchemaModel loadSchema(Path schemaPath) {
        if (schemaPath == null || !Files.isRegularFile(schemaPath)) {
            throw new SchemaLoadException("未找到 schema 文件: " + schemaPath);
        }
        String text;
        try {
            text = SourceTextReader.read(schemaPath).text();
        } catch (IOException e) {
            throw new SchemaLoadException("读取 schema 文件失败: " + schemaPath, e);
        }
        try {
            return parseSchema(schemaPath, text);
        } catch (TsParseException e) {
            throw new SchemaLoadException("无法解析 schema 文件: " + schemaPath + ", " + e.getMessage(), e);
        }
    }

    /**
     * 解析 schema 源码文本
     */
    public SchemaModel parseSchema(Path schemaPath, String text) {
        SourceFile file = TsParser.parseFile(schemaPath, text);
        List<VariableDeclaration> declarations = SyntaxWalker.collect(file.program(), VariableDeclaration.class)
                .stream()
                .filter(d -> d.binding() instanceof Identifier && d.initializer() != null)
                .toList();

        // 1. 枚举
        Map<String, SchemaEnum> enums = new LinkedHashMap<>();
        for (VariableDeclaration declaration : declarations) {
            String name = ((Identifier) declaration.binding()).name();
            parseEnum(name, declaration.initializer()).ifPresent(e -> enums.putIfAbsent(e.name(), e));
        }

        // 2. 表
        Map<String, SchemaTable> tables = new LinkedHashMap<>();
        for (VariableDeclaration declaration : declarations) {
            String name = ((Identifier) declaration.binding()).name();
            parseTable(name, declaration.initializer(), enums).ifPresent(t -> tables.putIfAbsent(t.name(), t));
        }

        log.info("解析 schema {}: {} 张表, {} 个枚举", schemaPath, tables.size(), enums.size());
        return new SchemaModel(List.copyOf(tables.values()), List.copyOf(enums.values()), schemaPath);
    }

    /**
     * 在项目根目录下查找 schema 文件：先尝试常见位置，再读取 drizzle.config.ts/js 中的 schema 配置
     */
    public Optional<Path> discoverSchemaPath(Path root) {
        for (String relative : properties.getSchemaDiscoveryPaths()) {
            Path candidate = root.resolve(relative);
            if (Files.isRegularFile(candidate)) {
                log.info("自动发现 schema 文件: {}", candidate);
                return Optional.of(candidate);
            }
        }
        for (String configName : CONFIG_FILES) {
            Path config = root.resolve(configName);
            if (!Files.isRegularFile(config)) {
                continue;
            }
            Optional<Path> fromConfig = schemaPathFromConfig(config, root).filter(Files::isRegularFile);
            if (fromConfig.isPresent()) {
                log.info("从 {} 读取到 schema 文件: {}", configName, fromConfig.get());
                return fromConfig;
            }
        }
        return Optional.empty();
    }

    private Optional<Path> schemaPathFromConfig(Path config, Path root) {
        SourceFile file;
        try {
            file = TsParser.parseFile(config, SourceTextReader.read(config).text());
        } catch (IOException | TsParseException e) {
            log.warn("无法读取配置文件 {}: {}", config, e.getMessage());
            return Optional.empty();
        }

        String schema = null;
        for (PropertyAssignment property : SyntaxWalker.collect(file.program(), PropertyAssignment.class)) {
            if (!"schema".equals(property.key())) {
                continue;
            }
            // schema: "./src/db/schema.ts" 或 schema: ["./src/db/schema.ts", ...]
            if (property.value() instanceof StringLiteral literal) {
                schema = literal.value();
            } else if (property.value() instanceof ArrayLiteral array && !array.elements().isEmpty()
                    && array.elements().get(0) instanceof StringLiteral first) {
                schema = first.value();
            }
        }
        return Optional.ofNullable(schema).map(s -> root.resolve(s).normalize());
    }

    private Optional<SchemaEnum> parseEnum(String variableName, SyntaxNode initializer) {
        if (!(initializer instanceof Call call) || !isCallTo(call, Set.of(ENUM_FACTORY))) {
            return Optional.empty();
        }
        List<SyntaxNode> args = call.arguments();
        if (args.size() < 2 || !(args.get(0) instanceof StringLiteral sqlName)
                || !(args.get(1) instanceof ArrayLiteral valueList)) {
            log.debug("跳过无法识别的枚举声明: {}", variableName);
            return Optional.empty();
        }
        List<String> values = valueList.elements().stream()
                .filter(StringLiteral.class::isInstance)
                .map(e -> ((StringLiteral) e).value())
                .toList();
        return Optional.of(new SchemaEnum(variableName, sqlName.value(), values));
    }

    private Optional<SchemaTable> parseTable(String variableName, SyntaxNode initializer,
                                             Map<String, SchemaEnum> enums) {
        if (!(initializer instanceof Call call) || !isCallTo(call, TABLE_FACTORIES)) {
            return Optional.empty();
        }
        List<SyntaxNode> args = call.arguments();
        if (args.size() < 2 || !(args.get(0) instanceof StringLiteral sqlName)
                || !(args.get(1) instanceof ObjectLiteral columnMap)) {
            log.debug("跳过无法识别的表声明: {}", variableName);
            return Optional.empty();
        }

        Map<String, SchemaColumn> columns = new LinkedHashMap<>();
        for (SyntaxNode property : columnMap.properties()) {
            if (property instanceof PropertyAssignment assignment && assignment.key() != null) {
                parseColumn(assignment.key(), assignment.value(), enums)
                        .ifPresent(c -> columns.putIfAbsent(c.name(), c));
            }
        }
        return Optional.of(new SchemaTable(variableName, sqlName.value(), List.copyOf(columns.values())));
    }

    private Optional<SchemaColumn> parseColumn(String columnName, SyntaxNode declaration,
                                               Map<String, SchemaEnum> enums) {
        Set<String> modifiers = new HashSet<>();
        SyntaxNode current = declaration;
        while (current instanceof Call call && call.callee() instanceof PropertyAccess access) {
            modifiers.add(access.name());
            current = access.expression();
        }
        if (!(current instanceof Call base)) {
            log.debug("跳过无法识别的列声明: {}", columnName);
            return Optional.empty();
        }

        String typeName = null;
        String enumName = null;
        if (base.callee() instanceof Identifier function) {
            if (enums.containsKey(function.name())) {
                typeName = ColumnType.ENUM.getDrizzleName();
                enumName = function.name();
            } else {
                typeName = function.name();
            }
        } else if (base.callee() instanceof Call inner && inner.callee() instanceof Identifier function
                && enums.containsKey(function.name())) {
            typeName = ColumnType.ENUM.getDrizzleName();
            enumName = function.name();
        }

        String sqlName = !base.arguments().isEmpty() && base.arguments().get(0) instanceof StringLiteral literal
                ? literal.value()
                : columnName;
        ColumnType type = ColumnType.fromDrizzleName(typeName);

        boolean notNull = modifiers.stream().anyMatch(NOT_NULL_MODIFIERS::contains);
        boolean hasDefault = modifiers.stream().anyMatch(DEFAULT_MODIFIERS::contains);
        boolean autoGenerated = type.isSerial() || modifiers.stream().anyMatch(AUTO_GENERATED_MODIFIERS::contains);
        return Optional.of(new SchemaColumn(columnName, sqlName, type, enumName, notNull, hasDefault, autoGenerated));
    }

    private static boolean isCallTo(Call call, Set<String> functionNames) {
        return call.callee() instanceof Identifier id && functionNames.contains(id.name());
    }
}
