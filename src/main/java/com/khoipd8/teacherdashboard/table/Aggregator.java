package com.khoipd8.teacherdashboard.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Counting and grouping over mapped records.
 *
 * <p>Two label modes are supported. A <em>fixed set</em> counts against a closed list of labels:
 * values outside the list are not reported anywhere. A <em>dynamic set</em> reports every
 * distinct value observed, in order of first appearance.</p>
 */
public final class Aggregator {

    private Aggregator() {
    }

    public static <T> List<LabelCount> countByLabels(Collection<? extends T> items,
                                                     Function<? super T, String> accessor,
                                                     List<String> labels) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        labels.forEach(label -> counts.put(label, 0));
        for (T item : items) {
            String value = accessor.apply(item);
            if (value != null && counts.containsKey(value)) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        return toLabelCounts(counts);
    }

    public static <T> List<LabelCount> countDistinct(Collection<? extends T> items,
                                                     Function<? super T, String> accessor) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (T item : items) {
            counts.merge(accessor.apply(item), 1, Integer::sum);
        }
        return toLabelCounts(counts);
    }

    /** Items grouped by accessor value; group order is first-appearance order. */
    public static <T> Map<String, List<T>> groupByDistinct(Collection<? extends T> items,
                                                           Function<? super T, String> accessor) {
        Map<String, List<T>> groups = new LinkedHashMap<>();
        for (T item : items) {
            groups.computeIfAbsent(accessor.apply(item), k -> new ArrayList<>()).add(item);
        }
        return groups;
    }

    public static <T> int distinctCount(Collection<? extends T> items, Function<? super T, String> accessor) {
        Set<String> seen = new LinkedHashSet<>();
        for (T item : items) {
            seen.add(accessor.apply(item));
        }
        return seen.size();
    }

    public static <T> int countMatching(Collection<? extends T> items, Predicate<? super T> predicate) {
        int count = 0;
        for (T item : items) {
            if (predicate.test(item)) {
                count++;
            }
        }
        return count;
    }

    public static <T> int countEqual(Collection<? extends T> items, Function<? super T, String> accessor, String value) {
        return countMatching(items, item -> Objects.equals(accessor.apply(item), value));
    }

    /**
     * For each member, probes {@code index} with the member's key and counts members whose first
     * match satisfies {@code predicate}. Members without a match are not counted.
     */
    public static <P, S> int countJoined(Collection<? extends P> members,
                                         Function<? super P, String> keyOf,
                                         JoinIndex<S> index,
                                         Predicate<? super S> predicate) {
        int count = 0;
        for (P member : members) {
            if (index.findOne(keyOf.apply(member)).filter(predicate).isPresent()) {
                count++;
            }
        }
        return count;
    }

    private static List<LabelCount> toLabelCounts(Map<String, Integer> counts) {
        List<LabelCount> result = new ArrayList<>(counts.size());
        counts.forEach((label, count) -> result.add(new LabelCount(label, count)));
        return result;
    }
}
