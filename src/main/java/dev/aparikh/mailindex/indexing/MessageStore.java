package dev.aparikh.mailindex.indexing;

import dev.aparikh.mailindex.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns every message. Identifiers start at 1 and map directly onto positions in the backing list.
 */
class MessageStore {

    private final List<Message> messages = new ArrayList<>();

    Message create(String sender, String subject, String body, String dateKey) {
        validate(sender, dateKey);
        long id = messages.size() + 1L;
        Message message = new Message(id, sender, nullToEmpty(subject), nullToEmpty(body), dateKey);
        messages.add(message);
        return message;
    }

    static void validate(String sender, String dateKey) {
        if (sender == null || sender.isEmpty()) {
            throw new InvalidMessageException("sender must not be empty");
        }
        if (dateKey == null) {
            throw new InvalidMessageException("dateKey must be provided");
        }
    }

    Message get(long id) {
        if (!contains(id)) {
            throw new MessageNotFoundException(id);
        }
        return messages.get((int) (id - 1));
    }

    boolean contains(long id) {
        return id >= 1 && id <= messages.size();
    }

    int size() {
        return messages.size();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
