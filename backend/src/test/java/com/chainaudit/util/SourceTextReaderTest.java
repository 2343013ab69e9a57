package com.chainaudit.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadPlainUtf8WithoutNotice() throws Exception {
        Path file = tempDir.resolve("users.ts");
        Files.writeString(file, "const label = '用户';", StandardCharsets.UTF_8);

        SourceTextReader.SourceText text = SourceTextReader.read(file);

        assertEquals("const label = '用户';", text.text());
        assertEquals(StandardCharsets.UTF_8, text.charset());
        assertFalse(text.binary());
        assertNull(text.buildNotice("users.ts"));
    }

    @Test
    void shouldStripUtf8Bom() {
        byte[] body = "db.delete(users);".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);

        SourceTextReader.SourceText text = SourceTextReader.decode(bytes);

        assertEquals("db.delete(users);", text.text());
        assertFalse(text.usedFallback());
    }

    @Test
    void shouldDecodeUtf16LittleEndianBom() {
        byte[] body = "select()".getBytes(StandardCharsets.UTF_16LE);
        byte[] bytes = new byte[body.length + 2];
        bytes[0] = (byte) 0xFF;
        bytes[1] = (byte) 0xFE;
        System.arraycopy(body, 0, bytes, 2, body.length);

        SourceTextReader.SourceText text = SourceTextReader.decode(bytes);

        assertEquals("select()", text.text());
        assertEquals(StandardCharsets.UTF_16LE, text.charset());
        assertFalse(text.binary());
    }

    @Test
    void shouldFallBackToGb18030WithNotice() {
        Charset gb18030 = Charset.forName("GB18030");
        byte[] bytes = "const a = '中文';".getBytes(gb18030);

        SourceTextReader.SourceText text = SourceTextReader.decode(bytes);

        assertEquals("const a = '中文';", text.text());
        assertEquals(gb18030, text.charset());
        assertTrue(text.usedFallback());
        assertTrue(text.buildNotice("legacy.ts").contains("GB18030"));
    }

    @Test
    void shouldFlagNulBytesAsBinary() {
        SourceTextReader.SourceText text = SourceTextReader.decode(new byte[]{'a', 0, 'b'});

        assertTrue(text.binary());
    }

    @Test
    void shouldReturnEmptyTextForEmptyInput() {
        SourceTextReader.SourceText text = SourceTextReader.decode(new byte[0]);

        assertEquals("", text.text());
        assertFalse(text.binary());
    }
}
