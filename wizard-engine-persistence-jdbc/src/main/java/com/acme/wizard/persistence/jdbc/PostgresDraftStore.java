package com.acme.wizard.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of DraftStore. JSON columns are JSONB.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresDraftStore extends JdbcDraftStore {

    public PostgresDraftStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO wizard_draft
                (id, wizard_type, owner_id, reference_number, context_snapshot, current_step_index,
                 guard_flags, step_data, created_at, updated_at, completed)
                VALUES (?, ?, ?, ?, ?::jsonb, ?, ?::jsonb, ?::jsonb, ?, ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql() {
        return """
                UPDATE wizard_draft
                SET context_snapshot = ?::jsonb, current_step_index = ?, guard_flags = ?::jsonb,
                    step_data = ?::jsonb, updated_at = ?, completed = ?
                WHERE id = ?
                """;
    }

    @Override
    protected String getFindByIdSql() {
        return """
                SELECT id, wizard_type, owner_id, reference_number, context_snapshot::text AS context_snapshot,
                       current_step_index, guard_flags::text AS guard_flags, step_data::text AS step_data,
                       created_at, updated_at, completed
                FROM wizard_draft
                WHERE id = ?
                """;
    }

    @Override
    protected String getDeleteSql() {
        return "DELETE FROM wizard_draft WHERE id = ?";
    }

    @Override
    protected String getFindIncompleteSql() {
        return """
                SELECT id, wizard_type, owner_id, reference_number, context_snapshot::text AS context_snapshot,
                       current_step_index, guard_flags::text AS guard_flags, step_data::text AS step_data,
                       created_at, updated_at, completed
                FROM wizard_draft
                WHERE wizard_type = ? AND completed = FALSE
                ORDER BY updated_at DESC
                LIMIT ?
                """;
    }
}
