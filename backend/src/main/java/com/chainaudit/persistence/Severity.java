package com.chainaudit.persistence;

/**
 * 问题严重级别
 */
public enum Severity {
    ERROR,
    WARNING
}
