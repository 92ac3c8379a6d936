package dev.aparikh.mailindex.indexing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Unbalanced binary search tree keyed by date key. Identifiers with an equal key share one node
 * and keep their insertion order inside that node's bucket.
 *
 * <p>Insert and traversal are iterative, so tree height (which reaches n for sorted input) never
 * translates into call stack depth.
 */
class DateOrderedIndex {

    private static final class Node {
        final String key;
        final List<Long> bucket = new ArrayList<>(1);
        Node left;
        Node right;

        Node(String key, long id) {
            this.key = key;
            this.bucket.add(id);
        }
    }

    private Node root;
    private int size;
    private int modCount;

    void insert(String dateKey, long id) {
        if (dateKey == null) {
            throw new IllegalArgumentException("dateKey must not be null");
        }
        modCount++;
        size++;
        if (root == null) {
            root = new Node(dateKey, id);
            return;
        }
        Node current = root;
        while (true) {
            int cmp = dateKey.compareTo(current.key);
            if (cmp == 0) {
                current.bucket.add(id);
                return;
            }
            if (cmp < 0) {
                if (current.left == null) {
                    current.left = new Node(dateKey, id);
                    return;
                }
                current = current.left;
            } else {
                if (current.right == null) {
                    current.right = new Node(dateKey, id);
                    return;
                }
                current = current.right;
            }
        }
    }

    /**
     * Lazy ascending traversal. Each call to {@link Iterable#iterator()} starts a fresh walk.
     * The iterator fails fast if the tree is modified while it is in use.
     */
    Iterable<Long> inOrder() {
        return InOrderIterator::new;
    }

    int size() {
        return size;
    }

    /**
     * Length of the longest root-to-leaf path, counted in nodes.
     */
    int height() {
        if (root == null) return 0;
        int max = 0;
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            Node n = nodes.pop();
            int d = depths.pop();
            max = Math.max(max, d);
            if (n.left != null) {
                nodes.push(n.left);
                depths.push(d + 1);
            }
            if (n.right != null) {
                nodes.push(n.right);
                depths.push(d + 1);
            }
        }
        return max;
    }

    private final class InOrderIterator implements Iterator<Long> {

        private final Deque<Node> stack = new ArrayDeque<>();
        private final int expectedModCount = modCount;
        private Node current;
        private int bucketPos;

        InOrderIterator() {
            pushLeftSpine(root);
            advanceNode();
        }

        @Override
        public boolean hasNext() {
            checkForComodification();
            return current != null;
        }

        @Override
        public Long next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Long id = current.bucket.get(bucketPos++);
            if (bucketPos == current.bucket.size()) {
                advanceNode();
            }
            return id;
        }

        private void advanceNode() {
            bucketPos = 0;
            if (stack.isEmpty()) {
                current = null;
                return;
            }
            current = stack.pop();
            pushLeftSpine(current.right);
        }

        private void pushLeftSpine(Node node) {
            while (node != null) {
                stack.push(node);
                node = node.left;
            }
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException("index modified during traversal");
            }
        }
    }
}
