package com.pulsesentinel.core.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Thread-safe, append-only ring buffer. Once {@code capacity} is reached the
 * oldest element is evicted on every append.
 *
 * @param <T> element type; elements are expected to be immutable
 * @since 1.0.0
 */
public final class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> items = new ArrayDeque<>();

    /**
     * @param capacity maximum number of retained elements; must be &gt; 0
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void append(T item) {
        items.addLast(Objects.requireNonNull(item, "item must not be null"));
        while (items.size() > capacity) {
            items.pollFirst();
        }
    }

    /**
     * @return the most recently appended element, if any
     */
    public synchronized Optional<T> latest() {
        return Optional.ofNullable(items.peekLast());
    }

    /**
     * @param limit maximum number of elements
     * @return up to {@code limit} most recent elements, newest first
     */
    public synchronized List<T> newestFirst(int limit) {
        List<T> out = new ArrayList<>(Math.min(Math.max(limit, 0), items.size()));
        Iterator<T> it = items.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    /**
     * @param limit maximum number of elements
     * @return up to {@code limit} most recent elements, oldest first
     */
    public synchronized List<T> tail(int limit) {
        int skip = Math.max(0, items.size() - Math.max(limit, 0));
        List<T> out = new ArrayList<>(items.size() - skip);
        int i = 0;
        for (T item : items) {
            if (i++ >= skip) {
                out.add(item);
            }
        }
        return out;
    }

    /**
     * @return every retained element, oldest first
     */
    public synchronized List<T> toList() {
        return new ArrayList<>(items);
    }

    /**
     * Replace the contents, keeping only the last {@code capacity} elements of
     * {@code replacement} (given oldest first).
     */
    public synchronized void replaceAll(Collection<? extends T> replacement) {
        items.clear();
        for (T item : replacement) {
            append(item);
        }
    }

    public synchronized int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }
}
