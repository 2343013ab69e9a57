package com.chainaudit.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 读取待分析的 TS/JS 源文件
 * <p>
 * 有 BOM 时按 BOM 解码并去掉 BOM；否则依次严格尝试 UTF-8 与 GB18030，都失败时按 ISO-8859-1 逐字节映射，
 * 保证 ASCII 部分（标识符、字符串引号、括号）原样保留，链分析不受影响。
 * 语法树偏移量按解码后的字符计算，与编码无关。前 8KB 内出现 NUL 字节的文件视为二进制文件。
 */
public final class SourceTextReader {

    private static final int BINARY_SNIFF_LENGTH = 8192;

    private static final List<Bom> BOMS = List.of(
            new Bom(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, StandardCharsets.UTF_8),
            new Bom(new byte[]{(byte) 0xFF, (byte) 0xFE}, StandardCharsets.UTF_16LE),
            new Bom(new byte[]{(byte) 0xFE, (byte) 0xFF}, StandardCharsets.UTF_16BE));

    private static final List<Charset> FALLBACK_CHARSETS = List.of(Charset.forName("GB18030"));

    private record Bom(byte[] prefix, Charset charset) {
        boolean matches(byte[] bytes) {
            if (bytes.length < prefix.length) {
                return false;
            }
            for (int i = 0; i < prefix.length; i++) {
                if (bytes[i] != prefix[i]) {
                    return false;
                }
            }
            return true;
        }
    }

    private SourceTextReader() {
    }

    public static SourceText read(Path file) throws IOException {
        return decode(Files.readAllBytes(file));
    }

    public static SourceText decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new SourceText("", StandardCharsets.UTF_8, false, false);
        }
        for (Bom bom : BOMS) {
            if (bom.matches(bytes)) {
                int offset = bom.prefix().length;
                return new SourceText(new String(bytes, offset, bytes.length - offset, bom.charset()),
                        bom.charset(), false, false);
            }
        }
        boolean binary = containsNul(bytes);
        Optional<String> utf8 = strictDecode(bytes, StandardCharsets.UTF_8);
        if (utf8.isPresent()) {
            return new SourceText(utf8.get(), StandardCharsets.UTF_8, false, binary);
        }
        for (Charset charset : FALLBACK_CHARSETS) {
            Optional<String> decoded = strictDecode(bytes, charset);
            if (decoded.isPresent()) {
                return new SourceText(decoded.get(), charset, true, binary);
            }
        }
        return new SourceText(new String(bytes, StandardCharsets.ISO_8859_1), StandardCharsets.ISO_8859_1, true, binary);
    }

    private static Optional<String> strictDecode(byte[] bytes, Charset charset) {
        try {
            return Optional.of(charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static boolean containsNul(byte[] bytes) {
        int limit = Math.min(bytes.length, BINARY_SNIFF_LENGTH);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param text         解码后的文本
     * @param charset      实际使用的编码
     * @param usedFallback 是否因 UTF-8 解码失败而回退
     * @param binary       是否像二进制文件（含 NUL 字节）
     */
    public record SourceText(String text, Charset charset, boolean usedFallback, boolean binary) {

        /**
         * 扫描报告中的编码提示；按 UTF-8 或 BOM 正常解码时返回 null
         */
        public String buildNotice(String fileName) {
            if (!usedFallback) {
                return null;
            }
            return "源文件 " + fileName + " 不是有效的 UTF-8，已按 " + charset.name() + " 解码，中文字符串可能显示异常。";
        }
    }
}
