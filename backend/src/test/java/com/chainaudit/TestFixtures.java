package com.chainaudit;

import com.chainaudit.config.AuditProperties;
import com.chainaudit.parser.ts.SourceFile;
import com.chainaudit.parser.ts.TsParser;
import com.chainaudit.schema.SchemaModel;
import com.chainaudit.schema.SchemaModelLoader;

import java.nio.file.Path;

/**
 * 测试共用的 schema 与源码解析
 */
public final class TestFixtures {

    public static final String SCHEMA = """
            import { pgTable, pgEnum, serial, text, integer, timestamp, boolean } from 'drizzle-orm/pg-core';

            // 枚举
            export const statusEnum = pgEnum('status', ['active', 'pending', 'closed']);

            export const users = pgTable('users', {
              id: serial('id').primaryKey(),
              name: text('name').notNull(),
              email: text('email').notNull(),
              bio: text('bio'),
              status: statusEnum('status').notNull(),
              age: integer('age'),
              isActive: boolean('is_active'),
              createdAt: timestamp('created_at').defaultNow(),
            });

            export const orders = pgTable('orders', {
              id: serial('id').primaryKey(),
              userId: integer('user_id').notNull(),
              status: statusEnum('status').notNull(),
              total: integer('total').notNull(),
              notes: text('notes'),
              createdAt: timestamp('created_at').defaultNow(),
            });
            """;

    private TestFixtures() {
    }

    public static SchemaModel schema() {
        return new SchemaModelLoader(new AuditProperties()).parseSchema(Path.of("db/schema.ts"), SCHEMA);
    }

    public static SourceFile source(String code) {
        return TsParser.parseFile(Path.of("app/routes/test.tsx"), code);
    }
}
