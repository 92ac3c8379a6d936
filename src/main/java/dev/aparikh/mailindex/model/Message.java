package dev.aparikh.mailindex.model;

/**
 * Indexed message. Immutable once created; identifiers are assigned by the store
 * and never reused.
 *
 * <p>{@code dateKey} is compared lexicographically only. Callers supply a sortable
 * representation such as ISO-8601 ({@code 2025-01-02}).
 */
public record Message(
        long id,
        String sender,
        String subject,
        String body,
        String dateKey
) {
    /**
     * Text the term index is built from.
     */
    public String searchableText() {
        return subject + " " + body;
    }
}
