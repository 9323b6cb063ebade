package hex.dtree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Groups entities by the exact value of an attribute. Absent values form
 * their own group. */
public class DiscreteFeature extends Feature {

  public DiscreteFeature(String attr) { this("DF:", attr); }

  protected DiscreteFeature(String prefix, String attr) { super(prefix + attr, attr); }

  @Override public Object extract(Entity e) { return raw(e); }

  @Override public Object identify(Object arg, Entity e) { return extract(e); }

  @Override public boolean acceptsArg(Object arg) { return arg == null; }

  @Override public boolean acceptsValue(Object v) { return v == null || v instanceof String; }

  @Override public Split split(List<? extends Entity> ents) throws InvalidSplitException {
    checkSize(ents);
    Map<Object,List<Entity>> groups = new LinkedHashMap<Object,List<Entity>>();
    for( Entity e : ents ) {
      Object v = extract(e);
      List<Entity> es = groups.get(v);
      if( es == null ) groups.put(v, es = new ArrayList<Entity>());
      es.add(e);
    }
    if( groups.size() < 2 ) throw new InvalidSplitException(_name + ": single value");
    List<Split.Part> parts = new ArrayList<Split.Part>(groups.size());
    for( Map.Entry<Object,List<Entity>> g : groups.entrySet() )
      parts.add(new Split.Part(g.getKey(), g.getValue()));
    return new Split(this, null, Entropy.weighted(groups.values(), ents.size()), parts);
  }
}
