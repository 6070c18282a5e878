package com.libragraph.emlstore.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * One user-facing history entry pointing at a stored blob, with the email
 * metadata denormalized for search, filter and sort.
 *
 * <p>{@code emailDate == 0} means the Date header was missing or unparseable.
 */
public record HistoryRecord(
        @ColumnName("id") long id,
        @ColumnName("blob_hash") String blobHash,
        @ColumnName("display_name") String displayName,
        @ColumnName("original_source_ref") String originalSourceRef,
        @ColumnName("last_accessed") long lastAccessed,
        @ColumnName("subject") String subject,
        @ColumnName("sender_email") String senderEmail,
        @ColumnName("sender_name") String senderName,
        @ColumnName("recipient_emails") String recipientEmails,
        @ColumnName("recipient_names") String recipientNames,
        @ColumnName("email_date") long emailDate,
        @ColumnName("has_attachments") boolean hasAttachments,
        @ColumnName("body_preview") String bodyPreview
) {

    /** The email date when known, otherwise the last access time. */
    public long effectiveDate() {
        return emailDate > 0 ? emailDate : lastAccessed;
    }

    /** Sender name when present, otherwise the sender address. */
    public String displaySender() {
        return senderName != null && !senderName.isEmpty() ? senderName : senderEmail;
    }

    public HistoryRecord withLastAccessed(long timestamp) {
        return new HistoryRecord(id, blobHash, displayName, originalSourceRef, timestamp,
                subject, senderEmail, senderName, recipientEmails, recipientNames,
                emailDate, hasAttachments, bodyPreview);
    }
}
