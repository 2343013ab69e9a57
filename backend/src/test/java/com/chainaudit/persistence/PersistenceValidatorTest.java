package com.chainaudit.persistence;

import com.chainaudit.TestFixtures;
import com.chainaudit.analysis.chain.Operation;
import com.chainaudit.analysis.source.DataSource.Origin;
import com.chainaudit.config.AuditProperties;
import com.chainaudit.persistence.checker.MissingRequiredColumnChecker;
import com.chainaudit.persistence.checker.RequireWhereChecker;
import com.chainaudit.persistence.checker.TypeMismatchChecker;
import com.chainaudit.persistence.checker.UnvalidatedEnumInputChecker;
import com.chainaudit.schema.SchemaModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PersistenceValidatorTest {

    private final SchemaModel schema = TestFixtures.schema();
    private final AuditProperties properties = new AuditProperties();
    private final OperationExtractor extractor = new OperationExtractor(properties);
    private final PersistenceValidator validator = new PersistenceValidator(List.of(
            new MissingRequiredColumnChecker(),
            new UnvalidatedEnumInputChecker(),
            new TypeMismatchChecker(),
            new RequireWhereChecker(properties)));

    private List<PersistenceIssue> validate(String code) {
        return validator.validatePersistence(extractor.extractOperations(TestFixtures.source(code)), schema);
    }

    @Test
    void shouldExtractOnlyWriteOperations() {
        List<DbOperation> operations = extractor.extractOperations(TestFixtures.source("""
                const formData = await request.formData();
                const rows = await db.select().from(users);
                await db.insert(users).values({ name: formData.get('name'), email: 'x' });
                await db.delete(orders).where(eq(orders.id, 1));
                """));

        assertEquals(List.of(Operation.INSERT, Operation.DELETE),
                operations.stream().map(DbOperation::getType).toList());
        DbOperation insert = operations.get(0);
        assertEquals("users", insert.getTableName());
        assertEquals(2, insert.getColumnValues().size());
        ColumnValue name = insert.getColumnValues().get(0);
        assertEquals(Origin.EXTERNAL_FIELD, name.getDataSource().origin());
        assertEquals("formData.get('name')", name.getExpression());
        assertEquals(3, name.getSpan().line());
        assertTrue(operations.get(1).isHasWhere());
        assertTrue(operations.get(1).getColumnValues().isEmpty());
    }

    @Test
    void shouldReportExactlyOneMissingRequiredColumn() {
        List<PersistenceIssue> issues = validate("""
                await db.insert(users).values({ name: 'Ann', email: 'ann@example.com' });
                """);

        assertEquals(1, issues.size());
        PersistenceIssue issue = issues.get(0);
        assertEquals("MISSING_REQUIRED_COLUMN", issue.getRuleId());
        assertEquals(Severity.ERROR, issue.getSeverity());
        assertEquals("persistence", issue.getCategory());
        assertTrue(issue.getMessage().contains("'status'"));
        assertEquals("db.insert(users).values({...})", issue.getCode());
        assertFalse(issue.isFixable());
        assertEquals(1, issue.getLocation().line());
    }

    @Test
    void shouldSkipMissingColumnCheckWhenPayloadIsIncomplete() {
        assertTrue(validate("await db.insert(users).values({ ...base, name: 'Ann' });").isEmpty());
    }

    @Test
    void shouldReportUnvalidatedEnumInputWithAllowedValues() {
        List<PersistenceIssue> issues = validate("""
                export async function action({ request }) {
                  const formData = await request.formData();
                  await db.insert(users).values({
                    name: 'Ann',
                    email: 'ann@example.com',
                    status: formData.get('status'),
                  });
                }
                """);

        assertEquals(1, issues.size());
        PersistenceIssue issue = issues.get(0);
        assertEquals("UNVALIDATED_ENUM_INPUT", issue.getRuleId());
        assertTrue(issue.getSuggestion().contains("'active', 'pending', 'closed'"));
        assertEquals("status: formData.get('status')", issue.getCode());
    }

    @Test
    void shouldAcceptValidatedEnumInput() {
        assertTrue(validate("""
                export async function action({ request }) {
                  const formData = await request.formData();
                  const data = UserSchema.parse(Object.fromEntries(formData));
                  await db.insert(users).values({
                    name: data.name,
                    email: data.email,
                    status: data.status,
                  });
                }
                """).isEmpty());
    }

    @Test
    void shouldReportEnumInputFromRouteParamsAndRequestBody() {
        List<PersistenceIssue> issues = validate("""
                export async function action({ request, params }) {
                  const { status } = await request.json();
                  await db.update(users).set({ status }).where(eq(users.id, 1));
                  await db.update(orders).set({ status: params.status }).where(eq(orders.id, 2));
                }
                """);

        assertEquals(2, issues.size());
        assertTrue(issues.stream().allMatch(i -> "UNVALIDATED_ENUM_INPUT".equals(i.getRuleId())));
    }

    @Test
    void shouldIgnoreEnumLiterals() {
        assertTrue(validate("""
                await db.update(users).set({ status: 'archived' }).where(eq(users.id, 1));
                """).isEmpty());
    }

    @Test
    void shouldReportStringIntoIntegerColumn() {
        List<PersistenceIssue> issues = validate("""
                export async function action({ request }) {
                  const formData = await request.formData();
                  await db.update(users).set({ age: formData.get('age') }).where(eq(users.id, 1));
                }
                """);

        assertEquals(1, issues.size());
        PersistenceIssue issue = issues.get(0);
        assertEquals("TYPE_MISMATCH", issue.getRuleId());
        assertTrue(issue.getMessage().contains("integer"));
        assertTrue(issue.getSuggestion().contains("Number(age)"));
    }

    @Test
    void shouldAcceptCoercedNumbers() {
        assertTrue(validate("""
                export async function action({ request }) {
                  const formData = await request.formData();
                  await db.update(users).set({ age: Number(formData.get('age')) }).where(eq(users.id, 1));
                }
                """).isEmpty());
    }

    @Test
    void shouldReportStringIntoBooleanColumnFromRouteParam() {
        List<PersistenceIssue> issues = validate("""
                await db.update(users).set({ isActive: params.active }).where(eq(users.id, 1));
                """);

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).getMessage().contains("boolean"));
        assertTrue(issues.get(0).getSuggestion().contains("isActive === 'true'"));
    }

    @Test
    void shouldWarnOnUpdateAndDeleteWithoutWhere() {
        List<PersistenceIssue> issues = validate("""
                await db.update(users).set({ bio: 'x' });
                await db.delete(orders);
                """);

        assertEquals(2, issues.size());
        assertTrue(issues.stream().allMatch(i -> i.getSeverity() == Severity.WARNING));
        assertTrue(issues.stream().allMatch(i -> "REQUIRE_WHERE".equals(i.getRuleId())));
    }

    @Test
    void shouldAllowDisablingRequireWhere() {
        properties.setRequireWhere(false);

        assertTrue(validate("await db.delete(orders);").isEmpty());
    }

    @Test
    void shouldIgnoreTablesAndColumnsMissingFromSchema() {
        assertTrue(validate("""
                await db.insert(sessions).values({ token: params.token });
                await db.update(users).set({ nickname: params.nick }).where(eq(users.id, 1));
                """).isEmpty());
    }
}
