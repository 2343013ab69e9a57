package com.chainaudit.sql;

import com.chainaudit.TestFixtures;
import com.chainaudit.analysis.chain.ChainInfo;
import com.chainaudit.analysis.chain.Operation;
import com.chainaudit.config.AuditProperties;
import com.chainaudit.schema.SchemaModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlSynthesizerTest {

    private final SchemaModel schema = TestFixtures.schema();
    private final QueryExtractor extractor = new QueryExtractor(new AuditProperties(), new SqlSynthesizer());

    private List<ExtractedQuery> extract(String code) {
        return extractor.extractQueries(TestFixtures.source(code), schema);
    }

    private ExtractedQuery single(String code) {
        List<ExtractedQuery> queries = extract(code);
        assertEquals(1, queries.size());
        return queries.get(0);
    }

    @Test
    void shouldRenderSimpleSelect() {
        ExtractedQuery query = single("const all = await db.select().from(users);");

        assertEquals("SELECT", query.getType());
        assertEquals("SELECT * FROM users", query.getSql());
        assertEquals(List.of("users"), query.getTables());
        assertTrue(query.getParameters().isEmpty());
    }

    @Test
    void shouldRenderJoinWithSqlColumnNames() {
        ExtractedQuery query = single("""
                const rows = await db.select().from(users).innerJoin(orders, eq(users.id, orders.userId));
                """);

        assertEquals("SELECT * FROM users INNER JOIN orders ON users.id = orders.user_id", query.getSql());
        assertEquals(List.of("users", "orders"), query.getTables());
    }

    @Test
    void shouldRenderClausesInCanonicalOrderRegardlessOfCallOrder() {
        ExtractedQuery query = single("""
                const rows = await db.select({ name: users.name, createdAt: users.createdAt })
                  .from(users)
                  .limit(10)
                  .orderBy(desc(users.createdAt))
                  .groupBy(users.isActive)
                  .where(eq(users.status, 'active'))
                  .offset(5);
                """);

        assertEquals("SELECT name, created_at FROM users WHERE status = 'active' GROUP BY users.is_active "
                + "ORDER BY created_at DESC LIMIT 10 OFFSET 5", query.getSql());
    }

    @Test
    void shouldOmitLimitAndOffsetWithNonLiteralArguments() {
        ExtractedQuery query = single("""
                const pageSize = 20;
                const rows = await db.select().from(users).limit(pageSize).offset(page * pageSize);
                """);

        assertEquals("SELECT * FROM users", query.getSql());
        assertTrue(query.getParameters().isEmpty());
    }

    @Test
    void shouldResolveImportAliasToSchemaName() {
        ExtractedQuery query = single("""
                import { users as usersTable } from '~/db/schema';
                const rows = await db.select().from(usersTable).where(eq(usersTable.isActive, true));
                """);

        assertEquals("SELECT * FROM users WHERE is_active = true", query.getSql());
        assertEquals(List.of("users"), query.getTables());
    }

    @Test
    void shouldNumberParametersInOrderAndRecordColumnTypes() {
        ExtractedQuery query = single("""
                export async function action({ request, params }) {
                  const formData = await request.formData();
                  await db.insert(users).values({
                    name: formData.get('name'),
                    email: 'a@b.c',
                    age: Number(formData.get('age')),
                    status,
                  });
                }
                """);

        assertEquals("INSERT INTO users (name, email, age, status) VALUES ($1, 'a@b.c', $2, $3)", query.getSql());
        List<QueryParameter> parameters = query.getParameters();
        assertEquals(3, parameters.size());
        assertEquals(1, parameters.get(0).getPosition());
        assertEquals("formData.get('name')", parameters.get(0).getSource());
        assertEquals("text", parameters.get(0).getColumnType());
        assertEquals("integer", parameters.get(1).getColumnType());
        assertEquals("status", parameters.get(2).getSource());
        assertEquals("enum", parameters.get(2).getColumnType());
    }

    @Test
    void shouldQuoteStringsAndRenderNullAndBooleans() {
        ExtractedQuery query = single("""
                await db.update(users).set({ name: "O'Brien", bio: null, isActive: false }).where(eq(users.id, 7));
                """);

        assertEquals("UPDATE users SET name = 'O''Brien', bio = NULL, is_active = false WHERE id = 7", query.getSql());
    }

    @Test
    void shouldRenderNullChecksAndInLists() {
        ExtractedQuery query = single("""
                await db.delete(orders).where(and(isNull(orders.notes), inArray(orders.id, ids), ne(orders.status, 'closed')));
                """);

        assertEquals("DELETE FROM orders WHERE notes IS NULL AND id IN ($1) AND status != 'closed'", query.getSql());
        assertEquals("ids", query.getParameters().get(0).getSource());
        assertEquals("serial", query.getParameters().get(0).getColumnType());
    }

    @Test
    void shouldRenderDeleteWithoutWhere() {
        assertEquals("DELETE FROM orders", single("await db.delete(orders);").getSql());
    }

    @Test
    void shouldPassThroughUnknownTablesAndColumns() {
        ExtractedQuery query = single("await db.select().from(audit_log).where(eq(audit_log.actorId, actor));");

        assertEquals("SELECT * FROM audit_log WHERE actorId = $1", query.getSql());
        assertNull(query.getParameters().get(0).getColumnType());
    }

    @Test
    void shouldSkipWritesWithoutPayload() {
        assertTrue(extract("""
                await db.insert(users).values(payload);
                await db.update(users).set(changes).where(eq(users.id, 1));
                """).isEmpty());
    }

    @Test
    void shouldSynthesizeFromChainInfoDirectly() {
        ChainInfo info = ChainInfo.builder().operation(Operation.SELECT).tableName("orders").build();

        GeneratedSql sql = new SqlSynthesizer().synthesize(info, schema).orElseThrow();

        assertEquals(Operation.SELECT, sql.type());
        assertEquals("SELECT * FROM orders", sql.sql());
        assertTrue(new SqlSynthesizer().synthesize(info.toBuilder().tableName("").build(), schema).isEmpty());
    }
}
