package hex.dtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.primitives.Doubles;

/** Numeric threshold feature.
 *
 * The defined values are sorted and every boundary between two adjacent
 * distinct values is tried as a threshold; entities below the threshold go to
 * the {@code lt} branch, the others to the {@code ge} branch. The threshold
 * minimizing the weighted entropy over the defined entities wins. Entities
 * without a numeric value get their own {@code un} branch.
 *
 * The class distributions left and right of the candidate threshold are
 * maintained incrementally while scanning the sorted values.
 */
public class QuantitativeFeature extends Feature {
  public static final String LT = "lt";
  public static final String GE = "ge";
  public static final String UN = "un";

  public QuantitativeFeature(String attr) { super("QF:" + attr, attr); }

  /** The attribute as a finite number; NaN and infinities count as undefined. */
  @Override public Double extract(Entity e) {
    Object v = e.get(_attr);
    if( v == null ) return null;
    Double d = v instanceof Number ? Double.valueOf(((Number)v).doubleValue()) : Doubles.tryParse(v.toString().trim());
    return d == null || !Doubles.isFinite(d) ? null : d;
  }

  @Override public String identify(Object arg, Entity e) {
    Double v = extract(e);
    if( v == null ) return UN;
    return v < ((Number)arg).doubleValue() ? LT : GE;
  }

  @Override public boolean acceptsArg(Object arg) { return arg instanceof Number && Doubles.isFinite(((Number)arg).doubleValue()); }

  @Override public boolean acceptsValue(Object v) { return LT.equals(v) || GE.equals(v) || UN.equals(v); }

  private static class Pair {
    final Entity _e;
    final double _v;
    Pair(Entity e, double v) { _e = e; _v = v; }
  }

  private static final Comparator<Pair> BY_VALUE = new Comparator<Pair>() {
    @Override public int compare(Pair a, Pair b) { return Double.compare(a._v, b._v); }
  };

  @Override public Split split(List<? extends Entity> ents) throws InvalidSplitException {
    checkSize(ents);
    List<Pair> pairs = new ArrayList<Pair>(ents.size());
    List<Entity> undefs = new ArrayList<Entity>();
    for( Entity e : ents ) {
      Double v = extract(e);
      if( v == null ) undefs.add(e);
      else pairs.add(new Pair(e, v));
    }
    if( pairs.isEmpty() ) throw new InvalidSplitException(_name + ": no defined values");
    Collections.sort(pairs, BY_VALUE); // stable

    // class index per pair, then the distributions on both sides of the cut
    Map<String,Integer> classes = new HashMap<String,Integer>();
    int n = pairs.size();
    int[] cls = new int[n];
    for( int i = 0; i < n; i++ ) {
      String k = pairs.get(i)._e.label();
      Integer c = classes.get(k);
      if( c == null ) classes.put(k, c = classes.size());
      cls[i] = c;
    }
    int[] distL = new int[classes.size()];
    int[] distR = new int[classes.size()];
    for( int c : cls ) distR[c]++;

    int minSplit = -1;
    double minEtp = 0;
    for( int i = 1; i < n; i++ ) {
      distL[cls[i-1]]++;
      distR[cls[i-1]]--;
      if( pairs.get(i)._v == pairs.get(i-1)._v ) continue;
      double etp = (i * entropy(distL) + (n-i) * entropy(distR)) / n;
      if( minSplit == -1 || etp < minEtp ) {
        minSplit = i;  minEtp = etp;
      }
    }
    if( minSplit == -1 ) throw new InvalidSplitException(_name + ": single value");

    List<Entity> lt = new ArrayList<Entity>(minSplit);
    List<Entity> ge = new ArrayList<Entity>(n - minSplit);
    for( int i = 0; i < n; i++ ) (i < minSplit ? lt : ge).add(pairs.get(i)._e);
    List<Split.Part> parts = new ArrayList<Split.Part>(3);
    parts.add(new Split.Part(LT, lt));
    parts.add(new Split.Part(GE, ge));
    if( !undefs.isEmpty() ) parts.add(new Split.Part(UN, undefs));
    return new Split(this, pairs.get(minSplit)._v, minEtp, parts);
  }

  /** Entropy of a distribution that may contain empty classes. */
  static double entropy(int[] dist) {
    int n = 0;
    for( int c : dist ) n += c;
    double etp = 0;
    for( int c : dist )
      if( c != 0 ) etp += c * Entropy.log2(n / (double)c);
    return etp / n;
  }
}
