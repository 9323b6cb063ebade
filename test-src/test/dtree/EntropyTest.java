package test.dtree;

import static org.junit.Assert.assertEquals;
import static test.dtree.Ents.e;
import static test.dtree.Ents.list;
import hex.dtree.Entity;
import hex.dtree.Entropy;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class EntropyTest {

  @Test public void testPureDistribution() {
    assertEquals(0.0, Entropy.entropy(Arrays.asList(1)), 0.0);
    assertEquals(0.0, Entropy.entropy(Arrays.asList(17)), 0.0);
  }

  @Test public void testEqualClasses() {
    assertEquals(1.0, Entropy.entropy(Arrays.asList(5, 5)), 1e-12);
    assertEquals(2.0, Entropy.entropy(Arrays.asList(3, 3, 3, 3)), 1e-12);
    assertEquals(Math.log(3) / Math.log(2), Entropy.entropy(Arrays.asList(7, 7, 7)), 1e-12);
  }

  @Test public void testSkewedDistribution() {
    // -(3/4 log2 3/4 + 1/4 log2 1/4)
    assertEquals(0.8112781244591328, Entropy.entropy(Arrays.asList(3, 1)), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyDistribution() {
    Entropy.entropy(Collections.<Integer>emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroCount() {
    Entropy.entropy(Arrays.asList(3, 0));
  }

  @Test public void testLabelCountsKeepEncounterOrder() {
    List<Entity> ents = list(e("B"), e("A"), e("B"), e("C"), e("A"), e("B"));
    Map<String,Integer> counts = Entropy.labelCounts(ents);
    assertEquals(Arrays.asList("B", "A", "C"), Arrays.asList(counts.keySet().toArray()));
    assertEquals(Integer.valueOf(3), counts.get("B"));
    assertEquals(Integer.valueOf(2), counts.get("A"));
    assertEquals(Integer.valueOf(1), counts.get("C"));
    assertEquals(Entropy.entropy(Arrays.asList(3, 2, 1)), Entropy.datasetEntropy(ents), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoEntities() {
    Entropy.datasetEntropy(Collections.<Entity>emptyList());
  }

  @Test public void testMajorityLabel() {
    Map<String,Integer> counts = new LinkedHashMap<String,Integer>();
    counts.put("x", 2);
    counts.put("y", 5);
    counts.put("z", 5);
    // ties go to the label met first
    assertEquals("y", Entropy.majorityLabel(counts));
    counts.put("w", 6);
    assertEquals("w", Entropy.majorityLabel(counts));
  }
}
