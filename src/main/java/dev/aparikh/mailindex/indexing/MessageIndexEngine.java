package dev.aparikh.mailindex.indexing;

import dev.aparikh.mailindex.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Owns the message store and the three indexes built over it. All mutation goes through
 * {@link #ingest}, which holds the write lock; lookups share the read lock.
 */
public class MessageIndexEngine {

    private static final Logger log = LoggerFactory.getLogger(MessageIndexEngine.class);

    private final MessageStore store;
    private final DateOrderedIndex orderedIndex;
    private final SenderIndex senderIndex;
    private final TermIndex termIndex;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile IndexInvariantViolationException failure;

    public MessageIndexEngine() {
        this(new MessageStore(), new DateOrderedIndex(), new SenderIndex(), new TermIndex());
    }

    MessageIndexEngine(MessageStore store, DateOrderedIndex orderedIndex,
                       SenderIndex senderIndex, TermIndex termIndex) {
        this.store = store;
        this.orderedIndex = orderedIndex;
        this.senderIndex = senderIndex;
        this.termIndex = termIndex;
    }

    /**
     * Stores a new message and indexes it by date, sender and term.
     *
     * @throws InvalidMessageException if the sender is empty; nothing is stored or indexed
     * @throws IndexInvariantViolationException if an index rejected an already stored message
     */
    public Message ingest(String sender, String subject, String body, String dateKey) {
        lock.writeLock().lock();
        try {
            ensureUsable();
            Message message = store.create(sender, subject, body, dateKey);
            try {
                orderedIndex.insert(message.dateKey(), message.id());
                senderIndex.insert(message.sender(), message.id());
                termIndex.insert(message.id(), Tokenizer.tokenize(message.searchableText()));
            } catch (RuntimeException e) {
                failure = new IndexInvariantViolationException(
                        "Failed to index message " + message.id() + "; indexes are no longer consistent", e);
                log.error("Index update failed for message {}", message.id(), e);
                throw failure;
            }
            log.debug("Ingested message {} from {} dated {}", message.id(), message.sender(), message.dateKey());
            return message;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Message getById(long id) {
        return read(() -> store.get(id));
    }

    /**
     * Lazy enumeration in ascending date key order, insertion order within equal keys.
     * Every call walks the index afresh. An ingest landing mid-walk makes the stream fail
     * with {@link java.util.ConcurrentModificationException}.
     */
    public Stream<Message> allOrdered() {
        ensureUsable();
        Iterable<Message> messages = OrderedMessageIterator::new;
        return StreamSupport.stream(messages.spliterator(), false);
    }

    /**
     * One window of the date-ordered enumeration, collected under a single read lock so a
     * concurrent ingest cannot interrupt it.
     */
    public List<Message> orderedPage(long offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must be >= 0");
        }
        return read(() -> {
            List<Message> page = new ArrayList<>(Math.min(limit, store.size()));
            long skipped = 0;
            for (Long id : orderedIndex.inOrder()) {
                if (page.size() == limit) break;
                if (skipped < offset) {
                    skipped++;
                    continue;
                }
                page.add(store.get(id));
            }
            return page;
        });
    }

    public List<Message> bySender(String sender) {
        return read(() -> senderIndex.lookup(sender).stream()
                .map(store::get)
                .toList());
    }

    /**
     * Messages whose subject or body contains {@code word} as a whole token, compared
     * after lower-casing. Ordered by identifier.
     */
    public Set<Message> byKeyword(String word) {
        return read(() -> {
            Set<Message> result = new LinkedHashSet<>();
            for (Long id : termIndex.lookup(word)) {
                result.add(store.get(id));
            }
            return Collections.unmodifiableSet(result);
        });
    }

    public int size() {
        return read(store::size);
    }

    public IndexStats stats() {
        return read(() -> new IndexStats(
                store.size(),
                senderIndex.senderCount(),
                termIndex.termCount(),
                orderedIndex.height()));
    }

    private <T> T read(Supplier<T> action) {
        ensureUsable();
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureUsable() {
        IndexInvariantViolationException f = failure;
        if (f != null) {
            throw new IndexInvariantViolationException("Engine is unusable after an earlier index failure", f);
        }
    }

    private final class OrderedMessageIterator implements Iterator<Message> {

        private final Iterator<Long> ids = read(() -> orderedIndex.inOrder().iterator());

        @Override
        public boolean hasNext() {
            return read(ids::hasNext);
        }

        @Override
        public Message next() {
            return read(() -> store.get(ids.next()));
        }
    }
}
