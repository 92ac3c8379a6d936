package dev.aparikh.mailindex.indexing;

public class MessageNotFoundException extends RuntimeException {

    private final long id;

    public MessageNotFoundException(long id) {
        super("Message not found: " + id);
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
