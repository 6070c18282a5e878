package com.libragraph.emlstore.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(HistoryRecord.class)
public interface HistoryItemDao {

    @SqlUpdate("INSERT INTO history_item (blob_hash, display_name, original_source_ref, last_accessed, " +
            "subject, sender_email, sender_name, recipient_emails, recipient_names, " +
            "email_date, has_attachments, body_preview) " +
            "VALUES (:blobHash, :displayName, :originalSourceRef, :lastAccessed, " +
            ":subject, :senderEmail, :senderName, :recipientEmails, :recipientNames, " +
            ":emailDate, :hasAttachments, :bodyPreview)")
    @GetGeneratedKeys("id")
    long insert(@Bind("blobHash") String blobHash,
                @Bind("displayName") String displayName,
                @Bind("originalSourceRef") String originalSourceRef,
                @Bind("lastAccessed") long lastAccessed,
                @Bind("subject") String subject,
                @Bind("senderEmail") String senderEmail,
                @Bind("senderName") String senderName,
                @Bind("recipientEmails") String recipientEmails,
                @Bind("recipientNames") String recipientNames,
                @Bind("emailDate") long emailDate,
                @Bind("hasAttachments") boolean hasAttachments,
                @Bind("bodyPreview") String bodyPreview);

    @SqlQuery("SELECT * FROM history_item WHERE id = :id")
    Optional<HistoryRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM history_item WHERE blob_hash = :hash ORDER BY id")
    List<HistoryRecord> findByBlobHash(@Bind("hash") String hash);

    @SqlQuery("SELECT * FROM history_item ORDER BY last_accessed DESC, id DESC")
    List<HistoryRecord> findAllOrderedByAccess();

    @SqlQuery("SELECT * FROM history_item ORDER BY last_accessed ASC, id ASC LIMIT :limit")
    List<HistoryRecord> findOldest(@Bind("limit") int limit);

    @SqlUpdate("UPDATE history_item SET last_accessed = :timestamp WHERE id = :id")
    int updateLastAccessed(@Bind("id") long id, @Bind("timestamp") long timestamp);

    @SqlUpdate("DELETE FROM history_item WHERE id = :id")
    int deleteById(@Bind("id") long id);

    @SqlUpdate("DELETE FROM history_item")
    int deleteAll();

    @SqlQuery("SELECT COUNT(*) FROM history_item")
    int count();

    @SqlQuery("SELECT COUNT(*) FROM history_item WHERE blob_hash = :hash")
    int countByBlobHash(@Bind("hash") String hash);
}
