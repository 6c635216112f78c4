package org.xgen.generators.naming;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reproducible ordering for unordered name/value mappings, so that two runs
 * over the same mapping emit identical output.
 */
public final class SortedPairs {

    /** Value ascending, then key descending. */
    public static final Comparator<Pair> ORDER = Comparator
        .comparing(Pair::value)
        .thenComparing(Pair::key, Comparator.reverseOrder());

    public record Pair(String key, String value) {}

    private SortedPairs() {}

    public static List<Pair> toSortedPairs(Map<String, String> toSort) {
        List<Pair> pairs = new ArrayList<>(toSort.size());
        for (Map.Entry<String, String> entry : toSort.entrySet()) {
            pairs.add(new Pair(entry.getKey(), entry.getValue()));
        }
        pairs.sort(ORDER);
        return pairs;
    }
}
