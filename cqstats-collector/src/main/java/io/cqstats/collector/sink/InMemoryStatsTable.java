package io.cqstats.collector.sink;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;

/**
 * {@link StatsTable} on a {@link ConcurrentHashMap}. {@code compute} serializes upserts per key,
 * upserts to different keys do not contend.
 */
public class InMemoryStatsTable<K extends Comparable<K>, V> implements StatsTable<K, V> {

    private final ConcurrentHashMap<K, V> rows = new ConcurrentHashMap<>();
    private final BinaryOperator<V> merger;
    private final V zero;

    public InMemoryStatsTable(V zero, BinaryOperator<V> merger) {
        this.zero = Objects.requireNonNull(zero, "zero");
        this.merger = Objects.requireNonNull(merger, "merger");
    }

    @Override
    public UpsertResult<V> upsert(K key, V delta) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(delta, "delta");
        boolean[] created = new boolean[1];
        V merged = rows.compute(key, (k, current) -> {
            if (current == null) {
                created[0] = true;
                return merger.apply(zero, delta);
            }
            return merger.apply(current, delta);
        });
        return new UpsertResult<>(merged, created[0]);
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(rows.get(key));
    }

    @Override
    public SortedMap<K, V> scan() {
        return new TreeMap<>(rows);
    }

    @Override
    public SortedMap<K, V> scan(Predicate<K> filter) {
        TreeMap<K, V> result = new TreeMap<>();
        for (Map.Entry<K, V> entry : rows.entrySet()) {
            if (filter.test(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    @Override
    public boolean remove(K key) {
        return rows.remove(key) != null;
    }

    @Override
    public int removeIf(Predicate<K> filter) {
        int removed = 0;
        for (K key : rows.keySet()) {
            if (filter.test(key) && rows.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clear() {
        rows.clear();
    }

    @Override
    public int size() {
        return rows.size();
    }
}
