package hex.dtree;

import java.util.List;

import com.google.common.base.Preconditions;

/** Discrete feature over the index-th comma separated token of an attribute.
 * Entities with too few tokens have an undefined value. */
public class DiscreteIndexedFeature extends DiscreteFeature {
  final int _index;

  public DiscreteIndexedFeature(String attr) { this(attr, 0); }

  public DiscreteIndexedFeature(String attr, int index) {
    super("DF" + index + ":", attr);
    Preconditions.checkArgument(index >= 0, "negative token index %s", index);
    _index = index;
  }

  public int index() { return _index; }

  @Override public Object extract(Entity e) {
    String v = raw(e);
    if( v == null ) return null;
    List<String> f = Utils.tokens(v);
    return f.size() <= _index ? null : f.get(_index);
  }
}
