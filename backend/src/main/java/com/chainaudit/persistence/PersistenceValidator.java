package com.chainaudit.persistence;

import com.chainaudit.persistence.checker.PersistenceChecker;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 按 schema 检查写操作；目标表不在 schema 中的操作不产生问题
 */
@Component
public class PersistenceValidator {

    private static final Logger log = LoggerFactory.getLogger(PersistenceValidator.class);

    private final List<PersistenceChecker> checkers;

    public PersistenceValidator(List<PersistenceChecker> checkers) {
        this.checkers = List.copyOf(checkers);
    }

    public List<PersistenceIssue> validatePersistence(List<DbOperation> operations, SchemaModel schema) {
        List<PersistenceIssue> issues = new ArrayList<>();
        for (DbOperation operation : operations) {
            Optional<SchemaTable> table = schema.findTable(operation.getTableName());
            if (table.isEmpty()) {
                log.debug("schema 中没有表 {}，跳过 {}", operation.getTableName(), operation.getLocation());
                continue;
            }
            for (PersistenceChecker checker : checkers) {
                issues.addAll(checker.check(operation, table.get(), schema));
            }
        }
        return issues;
    }
}
