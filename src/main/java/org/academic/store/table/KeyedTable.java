package org.academic.store.table;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Bounded, insertion-ordered collection of records keyed by a unique int.
 * Records are stored as private copies; callers only ever see copies.
 */
abstract class KeyedTable<T> {

    private static final Logger LOG = Logger.getLogger(KeyedTable.class);

    protected final LinkedHashMap<Integer, T> records = new LinkedHashMap<>();
    private final int capacity;
    private final ToIntFunction<T> keyOf;

    protected KeyedTable(int capacity, ToIntFunction<T> keyOf) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Table capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.keyOf = keyOf;
    }

    /**
     * Copy of {@code record} with text fitted to its storage slots and missing parts filled in.
     */
    protected abstract T normalize(T record);

    protected abstract T copyOf(T record);

    public int capacity() {
        return capacity;
    }

    public int size() {
        return records.size();
    }

    public boolean isFull() {
        return records.size() >= capacity;
    }

    public boolean contains(int key) {
        return records.containsKey(key);
    }

    public T find(int key) {
        T record = records.get(key);
        return record != null ? copyOf(record) : null;
    }

    /**
     * Removes the record, keeping the order of the rest. Returns the removed record or null.
     */
    public T remove(int key) {
        return records.remove(key);
    }

    /**
     * Read-only live view in insertion order, for writing to disk.
     */
    public Collection<T> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public void clear() {
        records.clear();
    }

    /**
     * Replaces the whole content with {@code loaded}. Records past capacity or
     * repeating a key already seen are dropped.
     *
     * @return number of records kept
     */
    public int replaceAll(Collection<T> loaded) {
        records.clear();
        for (T record : loaded) {
            int key = keyOf.applyAsInt(record);
            if (isFull()) {
                LOG.warnf("⚠️ Table full (%d) - dropped record %d", capacity, key);
                continue;
            }
            if (records.containsKey(key)) {
                LOG.warnf("⚠️ Duplicate key %d in loaded data - kept the first occurrence", key);
                continue;
            }
            records.put(key, normalize(record));
        }
        return records.size();
    }

    protected List<T> copies(Collection<T> source, int limit) {
        List<T> result = new ArrayList<>();
        for (T record : source) {
            if (result.size() >= limit) {
                break;
            }
            result.add(copyOf(record));
        }
        return result;
    }

    /**
     * Changes the key of one entry in place, keeping its position in insertion order.
     * The caller has already checked that {@code oldKey} exists and {@code newKey} does not.
     */
    protected void moveKey(int oldKey, int newKey) {
        LinkedHashMap<Integer, T> previous = new LinkedHashMap<>(records);
        records.clear();
        previous.forEach((key, record) -> records.put(key == oldKey ? newKey : key, record));
    }
}
