package com.driftguard.core.drift;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded FIFO of the most recent text embeddings of a stream, used to judge
 * whether the current text follows the recent trend.
 *
 * <p>
 * Owned by a single monitoring session. Not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class RecentSampleWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Default capacity. */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<EmbeddingVector> samples = new ArrayDeque<>();

    public RecentSampleWindow() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of embeddings kept
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public RecentSampleWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Recent sample capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append an embedding, evicting the oldest ones beyond capacity.
     *
     * @param embedding the embedding; must not be {@code null}
     */
    public void add(EmbeddingVector embedding) {
        Objects.requireNonNull(embedding, "embedding must not be null");
        samples.addLast(embedding);
        while (samples.size() > capacity) {
            samples.pollFirst();
        }
    }

    /**
     * @param count maximum number of embeddings to return
     * @return the newest {@code min(count, size())} embeddings, oldest first
     */
    public List<EmbeddingVector> latest(int count) {
        int n = Math.min(count, samples.size());
        List<EmbeddingVector> result = new ArrayList<>(n);
        Iterator<EmbeddingVector> it = samples.descendingIterator();
        while (result.size() < n && it.hasNext()) {
            result.add(0, it.next());
        }
        return result;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }
}
