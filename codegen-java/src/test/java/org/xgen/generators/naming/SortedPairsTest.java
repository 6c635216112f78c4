package org.xgen.generators.naming;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

public class SortedPairsTest {

  @Test
  void shouldSortByValueThenKeyDescending() {
    List<SortedPairs.Pair> pairs = SortedPairs.toSortedPairs(Map.of("b", "2", "a", "2", "c", "1"));

    assertThat(pairs).containsExactly(
        new SortedPairs.Pair("c", "1"),
        new SortedPairs.Pair("b", "2"),
        new SortedPairs.Pair("a", "2"));
  }

  @Test
  void orderDoesNotDependOnMapIterationOrder() {
    Map<String, String> linked = new LinkedHashMap<>();
    linked.put("Decimal", "xs:decimal");
    linked.put("Text", "Max35Text");
    linked.put("Code", "Max35Text");
    linked.put("Flag", "xs:boolean");

    Map<String, String> reversed = new TreeMap<>(java.util.Comparator.reverseOrder());
    reversed.putAll(linked);

    assertThat(SortedPairs.toSortedPairs(linked))
        .isEqualTo(SortedPairs.toSortedPairs(new HashMap<>(linked)))
        .isEqualTo(SortedPairs.toSortedPairs(reversed))
        .extracting(SortedPairs.Pair::key)
        .containsExactly("Text", "Code", "Flag", "Decimal");
  }

  @Test
  void comparisonIsOrdinal() {
    List<SortedPairs.Pair> pairs = SortedPairs.toSortedPairs(Map.of("x", "b", "y", "B", "z", "a"));

    assertThat(pairs).extracting(SortedPairs.Pair::value).containsExactly("B", "a", "b");
  }

  @Test
  void emptyMapYieldsEmptyList() {
    assertThat(SortedPairs.toSortedPairs(Map.of())).isEmpty();
  }
}
