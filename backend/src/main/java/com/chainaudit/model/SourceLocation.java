package com.chainaudit.model;

import com.chainaudit.parser.ts.SourceFile;

import java.nio.file.Path;

/**
 * 源码位置，行列号从 1 开始
 */
public record SourceLocation(String file, int line, int column) {

    public static SourceLocation at(SourceFile source, int offset) {
        SourceFile.LineColumn position = source.lineColumn(offset);
        return new SourceLocation(String.valueOf(source.path()), position.line(), position.column());
    }

    /**
     * 换成相对 root 的路径（分隔符统一为 /）；root 为空或文件不在 root 下时原样返回
     */
    public SourceLocation relativeTo(Path root) {
        if (root == null || file == null) {
            return this;
        }
        Path base = root.toAbsolutePath().normalize();
        Path absolute = Path.of(file).toAbsolutePath().normalize();
        if (!absolute.startsWith(base)) {
            return this;
        }
        return new SourceLocation(base.relativize(absolute).toString().replace('\\', '/'), line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
