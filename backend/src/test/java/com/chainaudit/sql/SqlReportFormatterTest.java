package com.chainaudit.sql;

import com.chainaudit.model.SourceLocation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlReportFormatterTest {

    private final SqlReportFormatter formatter = new SqlReportFormatter();
    private final Path root = Path.of("/repo").toAbsolutePath();

    private ExtractedQuery query(String sql, List<QueryParameter> parameters) {
        return ExtractedQuery.builder()
                .type("SELECT")
                .sql(sql)
                .tables(List.of("users"))
                .location(new SourceLocation(root.resolve("app/routes/users.tsx").toString(), 12, 5))
                .code("db.select().from(users)")
                .parameters(parameters)
                .build();
    }

    @Test
    void shouldReportNoQueries() {
        assertEquals("No SQL queries found.\n", formatter.synthesizeSql(List.of(), OutputFormat.TEXT, root));
    }

    @Test
    void shouldFormatTextWithRelativePathsAndParameters() {
        String text = formatter.synthesizeSql(List.of(query("SELECT * FROM users WHERE id = $1",
                List.of(new QueryParameter(1, "params.id", "serial")))), OutputFormat.TEXT, root);

        assertTrue(text.startsWith("Found 1 SQL query:\n"));
        assertTrue(text.contains("File: app/routes/users.tsx:12:5\n"));
        assertTrue(text.contains("  SELECT * FROM users WHERE id = $1\n"));
        assertTrue(text.contains("  Parameters:\n    $1: params.id (serial)\n"));
    }

    @Test
    void shouldUsePluralHeaderAndOmitUnknownTypes() {
        String text = formatter.synthesizeSql(List.of(
                query("SELECT * FROM users", List.of()),
                query("SELECT * FROM users WHERE x = $1", List.of(new QueryParameter(1, "x", null)))),
                OutputFormat.TEXT, root);

        assertTrue(text.startsWith("Found 2 SQL queries:\n"));
        assertTrue(text.contains("    $1: x\n"));
    }

    @Test
    void shouldFormatJson() throws Exception {
        String json = formatter.synthesizeSql(List.of(query("SELECT * FROM users", List.of())), OutputFormat.JSON, root);

        JsonNode node = new ObjectMapper().readTree(json);
        assertEquals(1, node.get("totalQueries").asInt());
        JsonNode first = node.get("queries").get(0);
        assertEquals("SELECT * FROM users", first.get("sql").asText());
        assertEquals("app/routes/users.tsx", first.get("location").get("file").asText());
        assertEquals(12, first.get("location").get("line").asInt());
    }

    @Test
    void shouldParseOutputFormat() {
        assertEquals(OutputFormat.JSON, OutputFormat.parse("json"));
        assertEquals(OutputFormat.TEXT, OutputFormat.parse(null));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.parse("xml"));
    }
}
