package com.chainaudit.sql;

import com.chainaudit.TestFixtures;
import com.chainaudit.config.AuditProperties;
import com.chainaudit.schema.SchemaModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryExtractorTest {

    @TempDir
    Path tempDir;

    private final SchemaModel schema = TestFixtures.schema();
    private final QueryExtractor extractor = new QueryExtractor(new AuditProperties(), new SqlSynthesizer());

    @Test
    void shouldExtractQueriesWithLocations() throws Exception {
        Path file = tempDir.resolve("orders.tsx");
        Files.writeString(file, """
                import { db } from '~/db.server';
                import { orders } from '~/db/schema';

                export async function loader({ params }) {
                  return db.select().from(orders).where(eq(orders.userId, Number(params.userId)));
                }
                """);

        List<ExtractedQuery> queries = extractor.extractQueries(file, schema);

        assertEquals(1, queries.size());
        ExtractedQuery query = queries.get(0);
        assertEquals("SELECT * FROM orders WHERE user_id = $1", query.getSql());
        assertEquals(file.toString(), query.getLocation().file());
        assertEquals(5, query.getLocation().line());
        assertEquals(10, query.getLocation().column());
        assertTrue(query.getCode().startsWith("db.select().from(orders)"));
    }

    @Test
    void shouldBeIdempotent() throws Exception {
        Path file = tempDir.resolve("users.ts");
        Files.writeString(file, """
                await db.insert(users).values({ name: 'a', email: 'b', status: 'active' });
                await db.update(users).set({ age: 3 }).where(eq(users.id, 1));
                """);

        List<ExtractedQuery> first = extractor.extractQueries(file, schema);
        List<ExtractedQuery> second = extractor.extractQueries(file, schema);

        assertEquals(2, first.size());
        assertEquals(first, second);
    }

    @Test
    void shouldReturnEmptyListForMissingOrGarbledFile() throws Exception {
        Path file = tempDir.resolve("broken.ts");
        Files.writeString(file, ")))}}} (( @@ =>");

        assertTrue(extractor.extractQueries(file, schema).isEmpty());
        assertTrue(extractor.extractQueries(tempDir.resolve("missing.ts"), schema).isEmpty());
    }
}
