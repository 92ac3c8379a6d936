package dev.aparikh.mailindex.search;

import dev.aparikh.mailindex.indexing.IndexInvariantViolationException;
import dev.aparikh.mailindex.indexing.IndexStats;
import dev.aparikh.mailindex.indexing.MessageIndexEngine;
import dev.aparikh.mailindex.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;

@Service
class MessageSearchService {

    private static final Logger LOG = LoggerFactory.getLogger(MessageSearchService.class);

    private final MessageIndexEngine engine;

    MessageSearchService(MessageIndexEngine engine) {
        this.engine = engine;
    }

    public Message getById(long id) {
        return engine.getById(id);
    }

    public long count() {
        return engine.size();
    }

    public IndexStats stats() {
        return engine.stats();
    }

    public List<Message> ordered(ListQuery query) {
        return engine.orderedPage(query.offset(), query.size());
    }

    public List<Message> bySender(String sender) {
        return engine.bySender(sender);
    }

    public List<Message> byKeyword(String word) {
        List<Message> hits = List.copyOf(engine.byKeyword(word));
        LOG.debug("Keyword '{}' matched {} messages", word, hits.size());
        return hits;
    }

    /**
     * Emits the whole date-ordered listing, pulling {@code batchSize} messages at a time.
     */
    public Flux<Message> streamOrdered(int batchSize) {
        if (batchSize <= 0) {
            return Flux.error(new IllegalArgumentException("batchSize must be > 0"));
        }
        return Flux.fromStream(engine::allOrdered)
                .limitRate(batchSize)
                .onErrorMap(e -> !(e instanceof IndexInvariantViolationException),
                        e -> new RuntimeException("Ordered stream failed", e));
    }
}
