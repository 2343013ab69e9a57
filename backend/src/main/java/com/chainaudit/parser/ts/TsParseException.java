package com.chainaudit.parser.ts;

/**
 * 源码无法得到语法树时抛出
 */
public class TsParseException extends RuntimeException {

    public TsParseException(String message) {
        super(message);
    }
}
