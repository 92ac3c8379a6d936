package dev.aparikh.mailindex.indexing;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Sparse term-by-message matrix held as postings: token to the set of identifiers containing it.
 * Membership only, no frequencies or positions.
 */
class TermIndex {

    private final Map<String, Set<Long>> postings = new HashMap<>();

    void insert(long id, Collection<String> tokens) {
        // dedupe first so a repeated token touches its posting set once
        for (String token : new LinkedHashSet<>(tokens)) {
            postings.computeIfAbsent(token, k -> new LinkedHashSet<>()).add(id);
        }
    }

    /**
     * Exact match on the lower-cased term. Returns an empty set for unknown terms.
     */
    Set<Long> lookup(String term) {
        Set<Long> ids = postings.get(Tokenizer.normalize(term));
        return ids == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }

    int termCount() {
        return postings.size();
    }
}
