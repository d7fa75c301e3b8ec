package org.routemap.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * A binary Min-Priority Queue whose entries can be re-prioritised or removed in place.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Live Handles:</strong> {@link #add(Comparable, Object)} returns the {@link Entry} itself.
 * Each entry records its current heap slot, so {@link #updateKey(Entry, Comparable)} and
 * {@link #remove(Entry)} reach it in O(1) before restoring heap order in O(log n).</li>
 * <li><strong>Both Directions:</strong> keys may be lowered (swim) or raised (sink).</li>
 * <li><strong>Strict Contracts:</strong> an entry that has left the queue, or that another queue
 * issued, is rejected with {@link InvalidHandleException}.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 *
 * @param <K> priority key type
 * @param <T> payload type
 */
public class AdaptablePriorityQueue<K extends Comparable<? super K>, T> {

    static final int DETACHED = -1;

    // 0-based binary heap: children of i are 2i+1 and 2i+2
    private final ObjectArrayList<Entry<K, T>> heap = new ObjectArrayList<>();

    /**
     * Inserts {@code value} with priority {@code key}.
     *
     * @return the handle for later {@link #updateKey}, {@link #remove} or {@link #getKey} calls.
     * @throws NullPointerException if {@code key} is null.
     */
    public Entry<K, T> add(K key, T value) {
        Objects.requireNonNull(key, "key");
        Entry<K, T> entry = new Entry<>(this, key, value, heap.size());
        heap.add(entry);
        swim(entry.index);
        return entry;
    }

    /**
     * Returns the entry with the smallest key without removing it.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public Entry<K, T> min() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return heap.get(0);
    }

    /**
     * Extracts the entry with the smallest key.
     * <p>
     * The returned entry is detached: its key and value stay readable, but the queue no
     * longer accepts it.
     * </p>
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public Entry<K, T> removeMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return detachAt(0);
    }

    /**
     * Changes the key of a queued entry and restores heap order.
     * <p>
     * A smaller key moves the entry towards the root, a larger key moves it towards the
     * leaves, and an equal key leaves the heap untouched.
     * </p>
     *
     * @throws InvalidHandleException if {@code entry} is not in this queue.
     * @throws NullPointerException   if {@code newKey} is null.
     */
    public void updateKey(Entry<K, T> entry, K newKey) {
        Objects.requireNonNull(newKey, "newKey");
        validate(entry);
        int cmp = newKey.compareTo(entry.key);
        entry.key = newKey;
        if (cmp < 0) {
            swim(entry.index);
        } else if (cmp > 0) {
            sink(entry.index);
        }
    }

    /**
     * Removes an arbitrary queued entry.
     *
     * @return the removed (now detached) entry.
     * @throws InvalidHandleException if {@code entry} is not in this queue.
     */
    public Entry<K, T> remove(Entry<K, T> entry) {
        validate(entry);
        return detachAt(entry.index);
    }

    /**
     * Returns the current key of a queued entry.
     *
     * @throws InvalidHandleException if {@code entry} is not in this queue.
     */
    public K getKey(Entry<K, T> entry) {
        validate(entry);
        return entry.key;
    }

    /**
     * Returns whether {@code entry} is currently held by this queue.
     */
    public boolean contains(Entry<K, T> entry) {
        return entry != null
                && entry.owner == this
                && entry.index >= 0
                && entry.index < heap.size()
                && heap.get(entry.index) == entry;
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    /**
     * Removes every entry, detaching all outstanding handles.
     */
    public void clear() {
        for (Entry<K, T> entry : heap) {
            entry.detach();
        }
        heap.clear();
    }

    /**
     * Verifies heap order and the slot back-pointer of every entry.
     *
     * @return {@code true} when every entry sits at its recorded index and no child is
     * smaller than its parent.
     */
    boolean isConsistent() {
        for (int i = 0; i < heap.size(); i++) {
            Entry<K, T> entry = heap.get(i);
            if (entry.index != i || entry.owner != this) {
                return false;
            }
            if (i > 0 && greater((i - 1) / 2, i)) {
                return false;
            }
        }
        return true;
    }

    // --- Heap Helper Methods ---

    /**
     * Moves the entry at {@code i} into the last slot, pops it and repairs the vacated slot.
     * <p>
     * The entry moved into slot {@code i} may belong higher or lower; sink and swim both run
     * and at most one of them moves anything.
     * </p>
     */
    private Entry<K, T> detachAt(int i) {
        int last = heap.size() - 1;
        if (i != last) {
            swap(i, last);
        }
        Entry<K, T> removed = heap.remove(last);
        removed.detach();
        if (i < heap.size()) {
            sink(i);
            swim(i);
        }
        return removed;
    }

    private void validate(Entry<K, T> entry) {
        Objects.requireNonNull(entry, "entry");
        if (!contains(entry)) {
            throw new InvalidHandleException("Entry " + entry + " is not in this queue");
        }
    }

    /**
     * Heap up-heap operation for newly inserted or decreased-key entries.
     */
    private void swim(int k) {
        while (k > 0 && greater((k - 1) / 2, k)) {
            swap(k, (k - 1) / 2);
            k = (k - 1) / 2;
        }
    }

    /**
     * Heap down-heap operation after extraction or increased key.
     */
    private void sink(int k) {
        int size = heap.size();
        while (2 * k + 1 < size) {
            int j = 2 * k + 1;
            if (j + 1 < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Returns whether heap index {@code i} has lower priority than index {@code j}.
     */
    private boolean greater(int i, int j) {
        return heap.get(i).key.compareTo(heap.get(j).key) > 0;
    }

    /**
     * Swaps two heap entries and updates both back-pointers.
     */
    private void swap(int i, int j) {
        Entry<K, T> e1 = heap.get(i);
        Entry<K, T> e2 = heap.get(j);

        heap.set(i, e2);
        heap.set(j, e1);

        e1.index = j;
        e2.index = i;
    }

    /**
     * A queue entry and the caller's handle to it.
     * <p>
     * Key and value remain readable after the entry leaves the queue; only the owning
     * queue may change the key.
     * </p>
     */
    @Accessors(fluent = true)
    public static final class Entry<K, T> {
        private AdaptablePriorityQueue<?, ?> owner;
        @Getter
        private K key;
        @Getter
        private final T value;
        // Current heap slot, DETACHED once removed
        private int index;

        private Entry(AdaptablePriorityQueue<?, ?> owner, K key, T value, int index) {
            this.owner = owner;
            this.key = key;
            this.value = value;
            this.index = index;
        }

        /**
         * Returns the current heap slot, or a negative value once detached.
         */
        public int index() {
            return index;
        }

        public boolean isDetached() {
            return owner == null;
        }

        private void detach() {
            owner = null;
            index = DETACHED;
        }

        @Override
        public String toString() {
            return "Entry{" +
                    "key=" + key +
                    ", value=" + value +
                    ", index=" + index +
                    '}';
        }
    }
}
