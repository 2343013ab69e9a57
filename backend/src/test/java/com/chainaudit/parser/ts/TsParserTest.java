package com.chainaudit.parser.ts;

import com.chainaudit.parser.ts.SyntaxNode.*;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TsParserTest {

    private static SourceFile parse(String code) {
        return TsParser.parseFile(Path.of("test.ts"), code);
    }

    @Test
    void shouldDecodeStringAndTemplateLiterals() {
        SourceFile file = parse("const a = 'x\\'y'; const b = `plain`; const c = `id-${id}`; const d = 1_000;");

        List<VariableDeclaration> declarations = SyntaxWalker.collect(file.program(), VariableDeclaration.class);
        assertEquals("x'y", assertInstanceOf(StringLiteral.class, declarations.get(0).initializer()).value());
        assertEquals("plain", assertInstanceOf(StringLiteral.class, declarations.get(1).initializer()).value());
        Other template = assertInstanceOf(Other.class, declarations.get(2).initializer());
        assertEquals("template", template.kind());
        assertEquals("1000", assertInstanceOf(NumberLiteral.class, declarations.get(3).initializer()).text());
    }

    @Test
    void shouldParseImportsWithAliases() {
        SourceFile file = parse("""
                import { db as database } from '~/db';
                import { users as usersTable, orders } from '~/db/schema';
                import type { User } from './types';
                """);

        List<ImportDeclaration> imports = SyntaxWalker.collect(file.program(), ImportDeclaration.class);
        assertEquals(3, imports.size());
        ImportBinding dbBinding = imports.get(0).bindings().get(0);
        assertEquals("db", dbBinding.importedName());
        assertEquals("database", dbBinding.localName());
        assertTrue(dbBinding.isRenamed());
        assertFalse(imports.get(1).bindings().get(1).isRenamed());
    }

    @Test
    void shouldParseMethodChainThroughAwaitAndTypeAssertions() {
        SourceFile file = parse("""
                export async function loader({ params }: LoaderArgs) {
                  const rows = (await db.select().from(users).limit(10)) as User[];
                  return json(rows!);
                }
                """);

        List<Call> calls = SyntaxWalker.collect(file.program(), Call.class);
        Call limit = calls.stream().filter(c -> "limit".equals(SyntaxNodes.methodName(c))).findFirst().orElseThrow();
        assertEquals("db.select().from(users).limit(10)", file.text(limit));
        assertInstanceOf(Await.class, file.parentOf(limit));
    }

    @Test
    void shouldParseObjectLiteralsWithShorthandAndSpread() {
        SourceFile file = parse("const payload = { name, email: 'a@b.c', ...rest, age: Number(x) };");

        ObjectLiteral object = SyntaxWalker.collect(file.program(), ObjectLiteral.class).get(0);
        assertEquals(4, object.properties().size());
        assertInstanceOf(ShorthandProperty.class, object.properties().get(0));
        assertEquals("email", ((PropertyAssignment) object.properties().get(1)).key());
        assertInstanceOf(Spread.class, object.properties().get(2));
    }

    @Test
    void shouldParseDestructuringDeclarations() {
        SourceFile file = parse("const { id, slug: postSlug, ...others } = params;");

        VariableDeclaration declaration = SyntaxWalker.collect(file.program(), VariableDeclaration.class).get(0);
        ObjectBindingPattern pattern = assertInstanceOf(ObjectBindingPattern.class, declaration.binding());
        assertEquals(3, pattern.elements().size());
        assertEquals("slug", pattern.elements().get(1).propertyName());
        assertEquals(List.of("id", "postSlug", "others"),
                SyntaxNodes.boundIdentifiers(pattern).stream().map(Identifier::name).toList());
    }

    @Test
    void shouldDropTypeDeclarationsWithoutLosingLaterStatements() {
        SourceFile file = parse("""
                interface Props { id: number }
                type Row = { name: string };
                export default function remove(props: Props): Promise<void> {
                  return db.delete(users).where(eq(users.id, props.id));
                }
                const after = db.delete(orders);
                """);

        List<Call> deletes = SyntaxWalker.collect(file.program(), Call.class).stream()
                .filter(c -> "delete".equals(SyntaxNodes.methodName(c)))
                .toList();
        assertEquals(2, deletes.size());
        assertEquals(1, SyntaxWalker.collect(file.program(), FunctionNode.class).size());
    }

    @Test
    void shouldReportOneBasedLineAndColumn() {
        SourceFile file = parse("const a = 1;\n  db.delete(users);\n");

        Call call = SyntaxWalker.collect(file.program(), Call.class).get(0);
        SourceFile.LineColumn position = file.lineColumn(call.span().start());
        assertEquals(2, position.line());
        assertEquals(3, position.column());
    }

    @Test
    void shouldMapOffsetsOfMultibyteSourceToCharacters() {
        SourceFile file = parse("const 名称 = '中文 😀';\ndb.delete(users);\n");

        Call call = SyntaxWalker.collect(file.program(), Call.class).get(0);
        assertEquals("db.delete(users)", file.text(call));
        assertEquals("中文 😀", ((StringLiteral) SyntaxWalker.collect(file.program(), VariableDeclaration.class)
                .get(0).initializer()).value());
        assertEquals(2, file.lineColumn(call.span().start()).line());
    }

    @Test
    void shouldCollapseDeeplyNestedExpressions() {
        String nested = "g(".repeat(3000) + "1" + ")".repeat(3000);
        SourceFile file = parse("const deep = " + nested + ";\nconst after = db.delete(users);\n");

        List<Call> calls = SyntaxWalker.collect(file.program(), Call.class);
        assertTrue(calls.size() < 3000);
        assertTrue(calls.stream().anyMatch(c -> "delete".equals(SyntaxNodes.methodName(c))));
        assertTrue(SyntaxWalker.collect(file.program(), Other.class).stream()
                .anyMatch(o -> "truncated".equals(o.kind())));
    }
}
