package hex.dtree;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;

/** Features by name, in registration order.
 *
 * The order matters: the tree builder tries the features in this order and
 * keeps the earlier one when two splits are equally good. The registry is
 * filled once and only read afterwards.
 */
public class FeatureRegistry {
  private final Map<String,Feature> _features = new LinkedHashMap<String,Feature>();

  public FeatureRegistry add(Feature f) {
    Preconditions.checkArgument(!_features.containsKey(f.name()), "duplicate feature %s", f.name());
    _features.put(f.name(), f);
    return this;
  }

  /** The feature of the given name, or null. */
  public Feature get(String name) { return _features.get(name); }

  public boolean contains(String name) { return _features.containsKey(name); }

  public Collection<Feature> features() { return Collections.unmodifiableCollection(_features.values()); }

  public int size() { return _features.size(); }

  @Override public String toString() { return _features.keySet().toString(); }
}
