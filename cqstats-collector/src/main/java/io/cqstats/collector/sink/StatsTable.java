package io.cqstats.collector.sink;

import java.util.Optional;
import java.util.SortedMap;
import java.util.function.Predicate;

/**
 * Key/value table backing one statistics view. Upserts merge the delta into the stored value,
 * creating the row from zero when it is absent.
 *
 * @param <K> row key
 * @param <V> row value
 */
public interface StatsTable<K extends Comparable<K>, V> {

    UpsertResult<V> upsert(K key, V delta);

    Optional<V> get(K key);

    /**
     * Point-in-time copy of all rows, ordered by key.
     */
    SortedMap<K, V> scan();

    /**
     * Point-in-time copy of the rows whose key matches, ordered by key.
     */
    SortedMap<K, V> scan(Predicate<K> filter);

    boolean remove(K key);

    int removeIf(Predicate<K> filter);

    void clear();

    int size();

    record UpsertResult<V>(V value, boolean created) {
    }
}
