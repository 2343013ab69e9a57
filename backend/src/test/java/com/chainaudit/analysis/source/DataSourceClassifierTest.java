package com.chainaudit.analysis.source;

import com.chainaudit.TestFixtures;
import com.chainaudit.analysis.source.DataSource.Origin;
import com.chainaudit.analysis.source.DataSource.ScalarType;
import com.chainaudit.analysis.source.SourceScope.RequestAccessor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceClassifierTest {

    private static SourceScope scope(String code) {
        return SourceScope.build(TestFixtures.source(code));
    }

    @Test
    void shouldCollectRequestAccessors() {
        SourceScope scope = scope("""
                export async function action({ request }) {
                  const formData = await request.formData();
                  const body = await request.json();
                  const other = compute();
                }
                """);

        assertEquals(RequestAccessor.FORM_DATA, scope.accessorOf("formData"));
        assertEquals(RequestAccessor.JSON_BODY, scope.accessorOf("body"));
        assertNull(scope.accessorOf("other"));
    }

    @Test
    void shouldClassifyFormFieldsAsExternalStrings() {
        SourceScope scope = scope("""
                const form = await request.formData();
                const name = form.get('name');
                const tags = form.getAll('tags');
                """);

        DataSource name = scope.sourceOf("name");
        assertEquals(Origin.EXTERNAL_FIELD, name.origin());
        assertEquals(ScalarType.STRING, name.scalarType());
        assertEquals("name", name.fieldName());
        assertFalse(name.validated());
        assertEquals("tags", scope.sourceOf("tags").fieldName());
    }

    @Test
    void shouldClassifyRouteParams() {
        SourceScope scope = scope("""
                const a = params.id;
                const b = params['slug'];
                const c = params.get('page');
                const { userId, postId: pid } = params;
                """);

        for (String name : new String[]{"a", "b", "c", "userId", "pid"}) {
            assertEquals(Origin.ROUTE_PARAM, scope.sourceOf(name).origin(), name);
            assertEquals(ScalarType.STRING, scope.sourceOf(name).scalarType(), name);
        }
        assertEquals("slug", scope.sourceOf("b").fieldName());
        assertEquals("postId", scope.sourceOf("pid").fieldName());
    }

    @Test
    void shouldClassifyRequestBodyMembers() {
        SourceScope scope = scope("""
                const body = await request.json();
                const status = body.status;
                const { role } = await request.json();
                """);

        assertEquals(Origin.REQUEST_BODY, scope.sourceOf("status").origin());
        assertEquals("status", scope.sourceOf("status").fieldName());
        assertEquals(Origin.REQUEST_BODY, scope.sourceOf("role").origin());
        assertTrue(scope.sourceOf("role").isExternal());
    }

    @Test
    void shouldApplyCoercionToInnerClassification() {
        SourceScope scope = scope("""
                const form = await request.formData();
                const age = Number(form.get('age'));
                const count = parseInt(params.count, 10);
                const flag = Boolean(form.get('flag'));
                """);

        DataSource age = scope.sourceOf("age");
        assertEquals(Origin.EXTERNAL_FIELD, age.origin());
        assertEquals(ScalarType.NUMBER, age.scalarType());
        assertEquals(ScalarType.NUMBER, scope.sourceOf("count").scalarType());
        assertEquals(Origin.ROUTE_PARAM, scope.sourceOf("count").origin());
        assertEquals(ScalarType.BOOLEAN, scope.sourceOf("flag").scalarType());
    }

    @Test
    void shouldClassifyLiterals() {
        SourceScope scope = scope("""
                const s = 'active';
                const n = 42;
                const b = false;
                const z = null;
                """);

        assertEquals(DataSource.literal(ScalarType.STRING, "active"), scope.sourceOf("s"));
        assertEquals(DataSource.literal(ScalarType.NUMBER, "42"), scope.sourceOf("n"));
        assertEquals(DataSource.literal(ScalarType.BOOLEAN, "false"), scope.sourceOf("b"));
        assertEquals(ScalarType.NULL, scope.sourceOf("z").scalarType());
    }

    @Test
    void shouldMarkValidatedVariables() {
        SourceScope scope = scope("""
                const form = await request.formData();
                const parsed = schema.parse(Object.fromEntries(form));
                const result = await schema.safeParseAsync(input);
                const { status, role } = StatusSchema.parse(raw);
                const fromParsed = parsed.data.status;
                """);

        assertTrue(scope.isValidated("parsed"));
        assertTrue(scope.isValidated("result"));
        assertTrue(scope.isValidated("status"));
        assertTrue(scope.isValidated("role"));
        assertFalse(scope.isValidated("form"));
        DataSource fromParsed = scope.sourceOf("fromParsed");
        assertEquals(Origin.VARIABLE, fromParsed.origin());
        assertTrue(fromParsed.validated());
    }

    @Test
    void shouldFollowIdentifiersThroughSourceMap() {
        SourceScope scope = scope("""
                const form = await request.formData();
                const raw = form.get('status');
                const copy = raw;
                const unknownCall = lookup(raw);
                const plain = other;
                """);

        assertEquals(Origin.EXTERNAL_FIELD, scope.sourceOf("copy").origin());
        assertEquals(Origin.UNKNOWN, scope.sourceOf("unknownCall").origin());
        assertEquals(DataSource.variable(), scope.sourceOf("plain"));
    }

    @Test
    void shouldLetLaterDeclarationsReplaceEarlierOnes() {
        SourceScope scope = scope("""
                function first() {
                  const value = params.id;
                }
                function second() {
                  const value = 'fixed';
                }
                """);

        assertEquals(Origin.LITERAL, scope.sourceOf("value").origin());
    }
}
