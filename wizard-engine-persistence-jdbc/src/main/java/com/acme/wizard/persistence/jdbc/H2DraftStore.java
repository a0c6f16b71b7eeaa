package com.acme.wizard.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * H2-specific implementation of DraftStore
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DraftStore extends JdbcDraftStore {

    public H2DraftStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO wizard_draft
                (id, wizard_type, owner_id, reference_number, context_snapshot, current_step_index,
                 guard_flags, step_data, created_at, updated_at, completed)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql() {
        return """
                UPDATE wizard_draft
                SET context_snapshot = ?, current_step_index = ?, guard_flags = ?, step_data = ?,
                    updated_at = ?, completed = ?
                WHERE id = ?
                """;
    }

    @Override
    protected String getFindByIdSql() {
        return """
                SELECT id, wizard_type, owner_id, reference_number, context_snapshot, current_step_index,
                       guard_flags, step_data, created_at, updated_at, completed
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
                SELECT id, wizard_type, owner_id, reference_number, context_snapshot, current_step_index,
                       guard_flags, step_data, created_at, updated_at, completed
                FROM wizard_draft
                WHERE wizard_type = ? AND completed = FALSE
                ORDER BY updated_at DESC
                LIMIT ?
                """;
    }
}
