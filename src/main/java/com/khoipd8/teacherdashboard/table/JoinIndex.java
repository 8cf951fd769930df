package com.khoipd8.teacherdashboard.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Records of one sheet keyed by a natural key column (roll number, assessment id, ...).
 *
 * <p>Built once per table per request. Keys compare by exact string equality, duplicates are
 * kept in row order, and rows with a missing key are not indexed.</p>
 */
public final class JoinIndex<T> {

    private final Map<String, List<T>> byKey;

    private JoinIndex(Map<String, List<T>> byKey) {
        this.byKey = byKey;
    }

    public static <T> JoinIndex<T> on(Collection<? extends T> records, Function<? super T, String> keyOf) {
        Map<String, List<T>> byKey = new LinkedHashMap<>();
        for (T record : records) {
            String key = keyOf.apply(record);
            if (key != null) {
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }
        return new JoinIndex<>(byKey);
    }

    /** First record in row order whose key equals {@code key}. */
    public Optional<T> findOne(String key) {
        List<T> matches = key == null ? null : byKey.get(key);
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }

    /** Every record whose key equals {@code key}, in row order. */
    public List<T> findAll(String key) {
        List<T> matches = key == null ? null : byKey.get(key);
        return matches == null ? Collections.emptyList() : Collections.unmodifiableList(matches);
    }

    public boolean contains(String key) {
        return key != null && byKey.containsKey(key);
    }
}
