package org.xgen.generators.naming;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Disambiguates repeated names within one scope: the first request for a name
 * returns it unchanged, later requests return it suffixed with the next free
 * number ({@code Item}, {@code Item2}, {@code Item3}).
 *
 * <p>A numbered name is never one already handed out, nor one that was
 * {@linkplain #reserve reserved}. Reserve the declared names of a scope up
 * front so that a declared {@code Item2} keeps its name when {@code Item}
 * is repeated before it.
 *
 * <p>Not thread-safe. Each scope owns its own counter; starting a new run means
 * constructing a new counter.
 */
public final class FieldNameCounter {

    private final Map<String, Integer> counts = new HashMap<>();
    private final Map<String, Integer> suffixes = new HashMap<>();
    private final Set<String> reserved = new HashSet<>();
    private final Set<String> taken = new HashSet<>();

    /**
     * Keep {@code name} for its own first request; numbered names skip it.
     */
    public void reserve(String name) {
        reserved.add(name);
    }

    public String next(String name) {
        counts.merge(name, 1, Integer::sum);
        if (taken.add(name)) {
            return name;
        }
        int suffix = suffixes.getOrDefault(name, 1);
        String candidate;
        do {
            suffix++;
            candidate = name + suffix;
        } while (taken.contains(candidate) || reserved.contains(candidate));
        suffixes.put(name, suffix);
        taken.add(candidate);
        return candidate;
    }

    /** How many times {@code name} has been requested so far. */
    public int count(String name) {
        return counts.getOrDefault(name, 0);
    }
}
