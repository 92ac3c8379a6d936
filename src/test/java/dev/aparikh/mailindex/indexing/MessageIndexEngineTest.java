package dev.aparikh.mailindex.indexing;

import dev.aparikh.mailindex.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class MessageIndexEngineTest {

    private MessageIndexEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MessageIndexEngine();
    }

    @Test
    void twoSenderScenario() {
        Message a = engine.ingest("a@x.com", "Hi", "Hi there", "2025-01-02");
        Message b = engine.ingest("b@x.com", "Yo", "Hi all", "2025-01-01");

        assertThat(engine.allOrdered()).containsExactly(b, a);
        assertThat(engine.bySender("a@x.com")).containsExactly(a);
        assertThat(engine.byKeyword("hi")).containsExactlyInAnyOrder(a, b);
        assertThat(engine.byKeyword("there")).containsExactly(a);
    }

    @Test
    void ingestThenGetReturnsEqualMessage() {
        Message created = engine.ingest("a@x.com", "Subject", "Body text", "2025-03-01");

        assertThat(engine.getById(created.id())).isEqualTo(created);
        assertThat(created).isEqualTo(new Message(1L, "a@x.com", "Subject", "Body text", "2025-03-01"));
    }

    @Test
    void allOrderedIsNonDecreasingAndStableForTies() {
        Message m1 = engine.ingest("a", "", "", "2025-01-02");
        Message m2 = engine.ingest("b", "", "", "2025-01-01");
        Message m3 = engine.ingest("c", "", "", "2025-01-02");
        Message m4 = engine.ingest("d", "", "", "2025-01-03");
        Message m5 = engine.ingest("e", "", "", "2025-01-01");

        List<Message> ordered = engine.allOrdered().toList();

        assertThat(ordered).containsExactly(m2, m5, m1, m3, m4);
        assertThat(ordered).extracting(Message::dateKey).isSorted();
    }

    @Test
    void bySenderReturnsOnlyThatSenderInIngestOrder() {
        Message a1 = engine.ingest("a@x.com", "one", "", "2025-01-03");
        engine.ingest("b@x.com", "two", "", "2025-01-01");
        Message a2 = engine.ingest("a@x.com", "three", "", "2025-01-02");

        assertThat(engine.bySender("a@x.com")).containsExactly(a1, a2);
        assertThat(engine.bySender("A@x.com")).isEmpty();
        assertThat(engine.bySender("nobody@x.com")).isEmpty();
    }

    @Test
    void byKeywordMatchesWholeTokensOfSubjectAndBody() {
        Message m1 = engine.ingest("a", "Quarterly Report", "see attached", "2025-01-01");
        Message m2 = engine.ingest("b", "lunch", "REPORT due, thanks!", "2025-01-02");
        engine.ingest("c", "reporting", "nothing here", "2025-01-03");

        assertThat(engine.byKeyword("report")).containsExactly(m1, m2);
        assertThat(engine.byKeyword("Thanks")).containsExactly(m2);
        assertThat(engine.byKeyword("repor")).isEmpty();
        assertThat(engine.byKeyword("")).isEmpty();
    }

    @Test
    void keywordMembershipMatchesTokenizedText() {
        List<Message> messages = List.of(
                engine.ingest("a", "Hello, World", "foo-bar 42", "1"),
                engine.ingest("b", "", "hello again", "2"),
                engine.ingest("c", "WORLD", "", "3"));

        for (String word : List.of("hello", "world", "foo", "bar", "42", "again", "absent")) {
            Set<Message> expected = messages.stream()
                    .filter(m -> Tokenizer.tokenize(m.searchableText()).contains(word))
                    .collect(Collectors.toSet());
            assertThat(engine.byKeyword(word)).containsExactlyInAnyOrderElementsOf(expected);
        }
    }

    @Test
    void subjectAndBodyAreJoinedWithASpace() {
        Message m = engine.ingest("a", "end", "start", "1");

        assertThat(engine.byKeyword("end")).containsExactly(m);
        assertThat(engine.byKeyword("start")).containsExactly(m);
        assertThat(engine.byKeyword("endstart")).isEmpty();
    }

    @Test
    void emptySenderIsRejectedAndLeavesIndexesUntouched() {
        Message kept = engine.ingest("a@x.com", "Hi", "there", "2025-01-01");

        assertThatThrownBy(() -> engine.ingest("", "Hi", "there", "2024-12-31"))
                .isInstanceOf(InvalidMessageException.class);

        assertThat(engine.size()).isEqualTo(1);
        assertThat(engine.allOrdered()).containsExactly(kept);
        assertThat(engine.bySender("")).isEmpty();
        assertThat(engine.byKeyword("hi")).containsExactly(kept);

        Message next = engine.ingest("b@x.com", "", "", "2025-01-02");
        assertThat(next.id()).isEqualTo(2L);
    }

    @Test
    void readsAreIdempotent() {
        engine.ingest("a@x.com", "Hi", "Hi there", "2025-01-02");
        engine.ingest("b@x.com", "Yo", "Hi all", "2025-01-01");

        assertThat(engine.allOrdered().toList()).isEqualTo(engine.allOrdered().toList());
        assertThat(engine.bySender("a@x.com")).isEqualTo(engine.bySender("a@x.com"));
        assertThat(engine.byKeyword("hi")).isEqualTo(engine.byKeyword("hi"));
    }

    @Test
    void getByUnknownIdIsNotFound() {
        assertThatThrownBy(() -> engine.getById(7))
                .isInstanceOf(MessageNotFoundException.class);
    }

    @Test
    void statsReflectIndexes() {
        engine.ingest("a@x.com", "Hi", "Hi there", "2025-01-02");
        engine.ingest("b@x.com", "Yo", "Hi all", "2025-01-01");
        engine.ingest("b@x.com", "", "", "2025-01-01");

        IndexStats stats = engine.stats();

        assertThat(stats.messages()).isEqualTo(3);
        assertThat(stats.senders()).isEqualTo(2);
        // hi, there, yo, all
        assertThat(stats.terms()).isEqualTo(4);
        assertThat(stats.dateTreeHeight()).isEqualTo(2);
    }

    @Test
    void ingestDuringTraversalFailsTheTraversal() {
        engine.ingest("a", "", "", "1");
        engine.ingest("b", "", "", "2");

        Iterator<Message> it = engine.allOrdered().iterator();
        it.next();
        engine.ingest("c", "", "", "3");

        assertThatThrownBy(it::hasNext).isInstanceOf(ConcurrentModificationException.class);
    }

    @Test
    void orderedPageReturnsWindowOfOrderedListing() {
        Message m1 = engine.ingest("a", "", "", "3");
        Message m2 = engine.ingest("b", "", "", "1");
        Message m3 = engine.ingest("c", "", "", "2");

        assertThat(engine.orderedPage(0, 2)).containsExactly(m2, m3);
        assertThat(engine.orderedPage(2, 2)).containsExactly(m1);
        assertThat(engine.orderedPage(3, 2)).isEmpty();
        assertThat(engine.orderedPage(0, 0)).isEmpty();
        assertThatThrownBy(() -> engine.orderedPage(-1, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void orderedPageIsNotBrokenByIngestBetweenReads() {
        engine.ingest("a", "", "", "1");
        engine.ingest("b", "", "", "2");

        List<Message> before = engine.orderedPage(0, 10);
        engine.ingest("c", "", "", "0");
        List<Message> after = engine.orderedPage(0, 10);

        assertThat(before).extracting(Message::sender).containsExactly("a", "b");
        assertThat(after).extracting(Message::sender).containsExactly("c", "a", "b");
    }

    @Test
    void orderedPageSurvivesConcurrentIngest() throws Exception {
        for (int i = 0; i < 200; i++) {
            engine.ingest("seed", "", "", String.format("%05d", i));
        }
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = executor.submit(() -> {
                for (int i = 0; i < 2_000; i++) {
                    engine.ingest("writer", "", "", String.format("%05d", i % 500));
                }
            });
            Future<Integer> reader = executor.submit(() -> {
                int pages = 0;
                while (!writer.isDone()) {
                    List<Message> page = engine.orderedPage(0, 150);
                    assertThat(page).hasSize(150);
                    assertThat(page).extracting(Message::dateKey).isSorted();
                    pages++;
                }
                return pages;
            });

            writer.get(30, TimeUnit.SECONDS);
            assertThat(reader.get(30, TimeUnit.SECONDS)).isGreaterThanOrEqualTo(0);
        } finally {
            executor.shutdownNow();
        }
        assertThat(engine.size()).isEqualTo(2_200);
    }

    @Test
    void indexFailureIsFatal() {
        SenderIndex senderIndex = spy(new SenderIndex());
        engine = new MessageIndexEngine(new MessageStore(), new DateOrderedIndex(), senderIndex, new TermIndex());
        engine.ingest("a@x.com", "Hi", "", "2025-01-01");

        doThrow(new IllegalStateException("boom")).when(senderIndex).insert(anyString(), anyLong());

        assertThatThrownBy(() -> engine.ingest("b@x.com", "Yo", "", "2025-01-02"))
                .isInstanceOf(IndexInvariantViolationException.class)
                .hasMessageContaining("message 2")
                .hasRootCauseMessage("boom");

        assertThatThrownBy(() -> engine.byKeyword("hi"))
                .isInstanceOf(IndexInvariantViolationException.class);
        assertThatThrownBy(() -> engine.allOrdered())
                .isInstanceOf(IndexInvariantViolationException.class);
        assertThatThrownBy(() -> engine.ingest("c@x.com", "", "", "2025-01-03"))
                .isInstanceOf(IndexInvariantViolationException.class);
    }
}
