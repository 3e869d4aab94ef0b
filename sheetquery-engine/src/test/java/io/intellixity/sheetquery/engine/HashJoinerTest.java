package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.value.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class HashJoinerTest {
  private static Map<String, Value> row(Object... kv) {
    Map<String, Value> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) {
      Object v = kv[i + 1];
      m.put((String) kv[i], v instanceof Number n ? Value.number(n.doubleValue()) : Value.text((String) v));
    }
    return m;
  }

  private static List<CombinedRow> seed(String alias, List<Map<String, Value>> rows) {
    List<CombinedRow> out = new ArrayList<>();
    for (Map<String, Value> r : rows) out.add(CombinedRow.seed(alias, r));
    return out;
  }

  @Test
  void fansOutDuplicateKeysAndDropsUnmatched() {
    List<CombinedRow> left = seed("o", List.of(
        row("cust", "a", "id", 1),
        row("cust", "b", "id", 2),
        row("cust", "z", "id", 3)));
    List<Map<String, Value>> right = List.of(
        row("cust", "a", "n", 10),
        row("cust", "b", "n", 20),
        row("cust", "a", "n", 11));

    List<CombinedRow> out = HashJoiner.join(left, "o", "c", right, List.of("cust"));

    assertEquals(3, out.size());
    assertEquals(Value.number(1), out.get(0).get("o", "id"));
    assertEquals(Value.number(10), out.get(0).get("c", "n"));
    assertEquals(Value.number(11), out.get(1).get("c", "n"));
    assertEquals(Value.number(2), out.get(2).get("o", "id"));
  }

  @Test
  void resultSizeIsSumOfMatchCountsPerPrimaryRow() {
    Random rnd = new Random(42);
    List<Map<String, Value>> primary = new ArrayList<>();
    List<Map<String, Value>> other = new ArrayList<>();
    for (int i = 0; i < 200; i++) primary.add(row("k", "k" + rnd.nextInt(30)));
    for (int i = 0; i < 150; i++) other.add(row("k", "k" + rnd.nextInt(40)));

    Map<String, Integer> matches = new HashMap<>();
    for (Map<String, Value> r : other) matches.merge(r.get("k").toString(), 1, Integer::sum);
    int expected = 0;
    for (Map<String, Value> r : primary) expected += matches.getOrDefault(r.get("k").toString(), 0);

    assertEquals(expected, HashJoiner.join(seed("p", primary), "p", "o", other, List.of("k")).size());
  }

  @Test
  void keysAlwaysComeFromThePrimaryRow() {
    List<CombinedRow> left = seed("p", List.of(row("id", 1, "region", "north")));
    // Sheet a shares column region with p but holds a different value.
    left = HashJoiner.join(left, "p", "a", List.of(row("id", 1, "region", "south")), List.of("id"));
    List<CombinedRow> out = HashJoiner.join(left, "p", "b",
        List.of(row("region", "north", "tag", "hit"), row("region", "south", "tag", "miss")), List.of("region"));

    assertEquals(1, out.size());
    assertEquals(Value.text("hit"), out.get(0).get("b", "tag"));
    assertEquals(Value.text("south"), out.get(0).get("a", "region"));
  }

  @Test
  void compositeKeysUseRawEquality() {
    List<CombinedRow> left = seed("p", List.of(row("r", "north", "id", "1")));
    List<Map<String, Value>> right = List.of(row("r", "north", "id", 1), row("r", "north", "id", "1"));
    List<CombinedRow> out = HashJoiner.join(left, "p", "j", right, List.of("r", "id"));
    assertEquals(1, out.size());
    assertEquals(Value.text("1"), out.get(0).get("j", "id"));
  }

  @Test
  void emptyLeftShortCircuits() {
    assertTrue(HashJoiner.join(List.of(), "p", "j", List.of(row("k", "x")), List.of("k")).isEmpty());
  }
}
