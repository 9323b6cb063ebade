package hex.dtree;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;

/** Shannon entropy of label distributions.
 *
 * The entropy of a distribution with counts c_i and n = sum(c_i) is
 *
 *   sum(c_i * log2(n / c_i)) / n
 *
 * which is 0 for a pure distribution and log2(k) for k equally sized classes.
 */
public class Entropy {
  static final double LOG2 = Math.log(2);

  private Entropy() { }

  public static double log2(double what) { return Math.log(what) / LOG2; }

  /** Entropy of the given class counts. All counts must be positive. */
  public static double entropy(Collection<Integer> counts) {
    Preconditions.checkArgument(!counts.isEmpty(), "entropy of an empty distribution");
    int n = 0;
    for( int c : counts ) {
      Preconditions.checkArgument(c > 0, "non-positive class count %s", c);
      n += c;
    }
    double etp = 0;
    for( int c : counts ) etp += c * log2(n / (double)c);
    return etp / n;
  }

  /** Label counts in the order the labels are first seen. */
  public static Map<String,Integer> labelCounts(Collection<? extends Entity> ents) {
    Preconditions.checkArgument(!ents.isEmpty(), "no entities");
    Map<String,Integer> counts = new LinkedHashMap<String,Integer>();
    for( Entity e : ents ) {
      String k = e.label();
      Integer c = counts.get(k);
      counts.put(k, c == null ? 1 : c + 1);
    }
    return counts;
  }

  public static double datasetEntropy(Collection<? extends Entity> ents) {
    return entropy(labelCounts(ents).values());
  }

  /** Returns the label with the largest count. Ties go to the label iterated
   * first, so the result is stable for a fixed input order. */
  public static String majorityLabel(Map<String,Integer> counts) {
    Preconditions.checkArgument(!counts.isEmpty(), "no labels");
    String best = null;
    int max = 0;
    for( Map.Entry<String,Integer> e : counts.entrySet() )
      if( best == null || max < e.getValue() ) {
        best = e.getKey();
        max = e.getValue();
      }
    return best;
  }

  /** Weighted entropy of a partition: sum(|s| * entropy(s)) / n. */
  static double weighted(Collection<? extends Collection<? extends Entity>> parts, int n) {
    double sum = 0;
    for( Collection<? extends Entity> es : parts )
      sum += es.size() * datasetEntropy(es);
    return sum / n;
  }
}
