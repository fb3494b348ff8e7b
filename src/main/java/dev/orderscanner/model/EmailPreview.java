package dev.orderscanner.model;

/**
 * Lightweight view of the email currently being processed.
 */
public record EmailPreview(String id, String subject, String sender) {

    public static EmailPreview of(RawEmail email) {
        return new EmailPreview(email.getId(), email.getSubject(), email.getSender());
    }
}
