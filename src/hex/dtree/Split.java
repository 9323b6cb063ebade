package hex.dtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Split proposal of a particular feature.
 *
 * Holds the feature, the argument the feature needs to route a single entity
 * later on (a threshold, a token, or nothing), the weighted entropy after the
 * split and the partitions themselves. Lower entropy is better.
 */
public class Split {
  final Feature _feature;
  final Object _arg;
  final double _entropy;
  final List<Part> _parts;

  /** One partition: the branch value and the entities routed to it. */
  public static class Part {
    final Object _value;
    final List<Entity> _ents;
    Part(Object value, List<Entity> ents) { _value = value; _ents = ents; }
    public Object value()        { return _value; }
    public List<Entity> entities() { return _ents; }
    public int size()            { return _ents.size(); }
  }

  Split(Feature feature, Object arg, double entropy, List<Part> parts) {
    assert parts.size() >= 2;
    _feature = feature;  _arg = arg;  _entropy = entropy;
    _parts = Collections.unmodifiableList(parts);
  }

  public Feature feature()  { return _feature; }
  public Object arg()       { return _arg; }
  public double entropy()   { return _entropy; }
  public List<Part> parts() { return _parts; }

  final boolean betterThan(Split other) { return other == null || _entropy < other._entropy; }

  /** Entity lists of all parts, in order. */
  List<List<Entity>> subsets() {
    List<List<Entity>> res = new ArrayList<List<Entity>>(_parts.size());
    for( Part p : _parts ) res.add(p._ents);
    return res;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(_feature.name()).append(" arg=").append(_arg).append(" etp=").append(Utils.p3d(_entropy));
    sb.append(" (");
    for( int i = 0; i < _parts.size(); i++ ) {
      if( i > 0 ) sb.append(", ");
      sb.append(_parts.get(i)._value).append(':').append(_parts.get(i).size());
    }
    return sb.append(')').toString();
  }
}
