package com.khoipd8.teacherdashboard.table;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregatorTest {

    private static final Function<String, String> SELF = s -> s;

    @Test
    void fixedSetReportsEveryLabelAndDropsUnknownValues() {
        List<String> castes = List.of("OBC", "General", "obc", "Other", "OBC");

        List<LabelCount> counts = Aggregator.countByLabels(castes, SELF, List.of("General", "OBC", "SC"));

        assertEquals(List.of(new LabelCount("General", 1), new LabelCount("OBC", 2), new LabelCount("SC", 0)), counts);
        int total = counts.stream().mapToInt(LabelCount::getCount).sum();
        assertTrue(total <= castes.size());
    }

    @Test
    void dynamicSetFollowsFirstAppearance() {
        List<LabelCount> counts = Aggregator.countDistinct(List.of("Unit 2", "Unit 1", "Unit 2"), SELF);

        assertEquals(List.of(new LabelCount("Unit 2", 2), new LabelCount("Unit 1", 1)), counts);
    }

    @Test
    void groupingKeepsRowOrderInsideGroups() {
        Map<String, List<String>> groups = Aggregator.groupByDistinct(List.of("b1", "a1", "b2"), s -> s.substring(0, 1));

        assertEquals(List.of("b", "a"), List.copyOf(groups.keySet()));
        assertEquals(List.of("b1", "b2"), groups.get("b"));
    }

    @Test
    void countsDistinctAndMatching() {
        List<String> statuses = List.of("Present", "Absent", "Present");

        assertEquals(2, Aggregator.distinctCount(statuses, SELF));
        assertEquals(2, Aggregator.countEqual(statuses, SELF, "Present"));
        assertEquals(1, Aggregator.countMatching(statuses, s -> s.startsWith("A")));
    }

    @Test
    void joinedCountOnlyProbesFirstMatch() {
        JoinIndex<String[]> performance = JoinIndex.on(List.of(
                new String[]{"101", "Bright Learner"},
                new String[]{"101", "Late Bloomer"},
                new String[]{"102", "Late Bloomer"}), p -> p[0]);

        int bright = Aggregator.countJoined(List.of("101", "102", "103"), SELF, performance,
                p -> "Bright Learner".equals(p[1]));
        int late = Aggregator.countJoined(List.of("101", "102", "103"), SELF, performance,
                p -> "Late Bloomer".equals(p[1]));

        assertEquals(1, bright);
        assertEquals(1, late);
    }
}
