package com.libragraph.emlstore.core.dao;

/**
 * Already-parsed projection of an email, supplied by the caller at ingest time.
 * Absent values normalise to empty strings, {@code 0} and {@code false};
 * {@code bodyPreview} is cut to at most {@value #MAX_PREVIEW_LENGTH} characters
 * without splitting a surrogate pair.
 *
 * @param recipientEmails comma-joined addresses
 * @param recipientNames  comma-joined display names
 * @param emailDate       epoch millis from the Date header, 0 if unknown
 */
public record EmailMetadata(
        String subject,
        String senderEmail,
        String senderName,
        String recipientEmails,
        String recipientNames,
        long emailDate,
        boolean hasAttachments,
        String bodyPreview
) {
    public static final int MAX_PREVIEW_LENGTH = 500;

    private static final EmailMetadata EMPTY =
            new EmailMetadata("", "", "", "", "", 0, false, "");

    public EmailMetadata {
        subject = orEmpty(subject);
        senderEmail = orEmpty(senderEmail);
        senderName = orEmpty(senderName);
        recipientEmails = orEmpty(recipientEmails);
        recipientNames = orEmpty(recipientNames);
        emailDate = Math.max(emailDate, 0);
        bodyPreview = orEmpty(bodyPreview);
        if (bodyPreview.length() > MAX_PREVIEW_LENGTH) {
            int end = Character.isHighSurrogate(bodyPreview.charAt(MAX_PREVIEW_LENGTH - 1))
                    ? MAX_PREVIEW_LENGTH - 1
                    : MAX_PREVIEW_LENGTH;
            bodyPreview = bodyPreview.substring(0, end);
        }
    }

    public static EmailMetadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    public static final class Builder {
        private String subject;
        private String senderEmail;
        private String senderName;
        private String recipientEmails;
        private String recipientNames;
        private long emailDate;
        private boolean hasAttachments;
        private String bodyPreview;

        private Builder() {
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder sender(String email, String name) {
            this.senderEmail = email;
            this.senderName = name;
            return this;
        }

        public Builder recipients(String emails, String names) {
            this.recipientEmails = emails;
            this.recipientNames = names;
            return this;
        }

        public Builder emailDate(long emailDate) {
            this.emailDate = emailDate;
            return this;
        }

        public Builder hasAttachments(boolean hasAttachments) {
            this.hasAttachments = hasAttachments;
            return this;
        }

        public Builder bodyPreview(String bodyPreview) {
            this.bodyPreview = bodyPreview;
            return this;
        }

        public EmailMetadata build() {
            return new EmailMetadata(subject, senderEmail, senderName, recipientEmails,
                    recipientNames, emailDate, hasAttachments, bodyPreview);
        }
    }
}
