package com.acme.wizard.persistence.jdbc;

import com.acme.wizard.draft.DraftRecord;
import com.acme.wizard.draft.DraftStore;
import com.acme.wizard.persistence.jdbc.mapper.DraftMapper;
import com.acme.wizard.persistence.jdbc.model.DraftEntity;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of DraftStore using Template Method pattern. Subclasses supply
 * the database-specific SQL.
 */
public abstract class JdbcDraftStore implements DraftStore {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcDraftStore.class);

  protected final DataSource dataSource;

  protected JdbcDraftStore(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /** Parameters: id, wizard_type, owner_id, reference_number, context_snapshot,
   * current_step_index, guard_flags, step_data, created_at, updated_at, completed */
  protected abstract String getInsertSql();

  /** Parameters: context_snapshot, current_step_index, guard_flags, step_data, updated_at,
   * completed, id */
  protected abstract String getUpdateSql();

  protected abstract String getFindByIdSql();

  protected abstract String getDeleteSql();

  /** Parameters: wizard_type, limit */
  protected abstract String getFindIncompleteSql();

  @Override
  public String save(DraftRecord draft) {
    DraftEntity entity = DraftMapper.toEntity(draft);
    Instant now = Instant.now();
    if (entity.getCreatedAt() == null) {
      entity.setCreatedAt(now);
    }
    if (entity.getUpdatedAt() == null) {
      entity.setUpdatedAt(now);
    }

    try (Connection conn = dataSource.getConnection()) {
      if (entity.getId() != null && update(conn, entity) > 0) {
        LOG.debug("Updated draft {} at step {}", entity.getId(), entity.getCurrentStepIndex());
        return entity.getId();
      }
      if (entity.getId() == null) {
        entity.setId(UUID.randomUUID().toString());
      }
      insert(conn, entity);
      LOG.info(
          "Inserted draft {} type={} reference={}",
          entity.getId(),
          entity.getWizardType(),
          entity.getReferenceNumber());
      return entity.getId();

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "save draft", LOG);
    }
  }

  @Override
  public Optional<DraftRecord> load(String id) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindByIdSql())) {

      ps.setString(1, id);

      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return Optional.of(DraftMapper.toDomain(mapResultSet(rs)));
        }
      }
      return Optional.empty();

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "load draft", LOG);
    }
  }

  @Override
  public void delete(String id) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getDeleteSql())) {

      ps.setString(1, id);
      int deleted = ps.executeUpdate();
      if (deleted > 0) {
        LOG.info("Deleted draft {}", id);
      } else {
        LOG.debug("No draft to delete for id {}", id);
      }

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "delete draft", LOG);
    }
  }

  @Override
  public List<DraftRecord> findIncomplete(String wizardType, int limit) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindIncompleteSql())) {

      ps.setString(1, wizardType);
      ps.setInt(2, limit);

      List<DraftRecord> drafts = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          drafts.add(DraftMapper.toDomain(mapResultSet(rs)));
        }
      }
      return drafts;

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find incomplete drafts", LOG);
    }
  }

  private void insert(Connection conn, DraftEntity entity) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(getInsertSql())) {
      ps.setString(1, entity.getId());
      ps.setString(2, entity.getWizardType());
      ps.setString(3, entity.getOwnerId());
      ps.setString(4, entity.getReferenceNumber());
      ps.setString(5, entity.getContextSnapshot());
      ps.setInt(6, entity.getCurrentStepIndex());
      ps.setString(7, entity.getGuardFlags());
      ps.setString(8, entity.getStepData());
      ps.setTimestamp(9, Timestamp.from(entity.getCreatedAt()));
      ps.setTimestamp(10, Timestamp.from(entity.getUpdatedAt()));
      ps.setBoolean(11, entity.isCompleted());
      ps.executeUpdate();
    }
  }

  private int update(Connection conn, DraftEntity entity) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(getUpdateSql())) {
      ps.setString(1, entity.getContextSnapshot());
      ps.setInt(2, entity.getCurrentStepIndex());
      ps.setString(3, entity.getGuardFlags());
      ps.setString(4, entity.getStepData());
      ps.setTimestamp(5, Timestamp.from(entity.getUpdatedAt()));
      ps.setBoolean(6, entity.isCompleted());
      ps.setString(7, entity.getId());
      return ps.executeUpdate();
    }
  }

  private DraftEntity mapResultSet(ResultSet rs) throws SQLException {
    return new DraftEntity(
        rs.getString("id"),
        rs.getString("wizard_type"),
        rs.getString("owner_id"),
        rs.getString("reference_number"),
        rs.getString("context_snapshot"),
        rs.getInt("current_step_index"),
        rs.getString("guard_flags"),
        rs.getString("step_data"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant(),
        rs.getBoolean("completed"));
  }
}
