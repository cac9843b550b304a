package dev.commentguard.entity;

/**
 * Entities with pre-assigned Snowflake IDs that implement
 * {@link org.springframework.data.domain.Persistable} track whether they were
 * loaded from the database through this flag, so that {@code save()} issues
 * an UPDATE for loaded rows and an INSERT for fresh ones.
 *
 * @see dev.commentguard.config.PersistableEntityCallback
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
