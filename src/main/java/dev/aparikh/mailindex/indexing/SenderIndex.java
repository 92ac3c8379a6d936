package dev.aparikh.mailindex.indexing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sender to identifiers, append-only, in insertion order. Senders match exactly (case-sensitive).
 */
class SenderIndex {

    private final Map<String, List<Long>> bySender = new HashMap<>();

    void insert(String sender, long id) {
        bySender.computeIfAbsent(sender, k -> new ArrayList<>()).add(id);
    }

    List<Long> lookup(String sender) {
        List<Long> ids = bySender.get(sender);
        return ids == null ? List.of() : List.copyOf(ids);
    }

    int senderCount() {
        return bySender.size();
    }
}
