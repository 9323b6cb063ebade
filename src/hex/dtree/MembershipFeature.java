package hex.dtree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Treats an attribute as a set of comma separated tokens and splits on the
 * single token whose presence best separates the classes.
 *
 * Every token seen in the entities is a candidate; entities that contain it go
 * to the {@code true} branch, all others to the {@code false} branch.
 * Candidates contained in every entity are skipped.
 */
public class MembershipFeature extends Feature {

  public MembershipFeature(String attr) { this("MF:", attr); }

  protected MembershipFeature(String prefix, String attr) { super(prefix + attr, attr); }

  /** Tokens of the attribute considered by this feature. */
  protected List<String> members(String v) { return Utils.tokens(v); }

  @Override public Set<String> extract(Entity e) {
    String v = raw(e);
    if( v == null ) return Collections.emptySet();
    return new LinkedHashSet<String>(members(v));
  }

  @Override public Boolean identify(Object arg, Entity e) { return extract(e).contains(arg); }

  @Override public boolean acceptsArg(Object arg) { return arg instanceof String; }

  @Override public boolean acceptsValue(Object v) { return v instanceof Boolean; }

  @Override public Split split(List<? extends Entity> ents) throws InvalidSplitException {
    checkSize(ents);
    List<Set<String>> tokens = new ArrayList<Set<String>>(ents.size());
    Map<String,List<Entity>> d = new LinkedHashMap<String,List<Entity>>();
    for( Entity e : ents ) {
      Set<String> ts = extract(e);
      tokens.add(ts);
      for( String t : ts ) {
        List<Entity> es = d.get(t);
        if( es == null ) d.put(t, es = new ArrayList<Entity>());
        es.add(e);
      }
    }
    int n = ents.size();
    String minArg = null;
    List<Entity> minWithout = null;
    double minEtp = 0;
    for( Map.Entry<String,List<Entity>> c : d.entrySet() ) {
      List<Entity> without = new ArrayList<Entity>();
      for( int i = 0; i < n; i++ )
        if( !tokens.get(i).contains(c.getKey()) ) without.add(ents.get(i));
      if( without.isEmpty() ) continue;
      double etp = Entropy.weighted(Arrays.asList(c.getValue(), without), n);
      if( minArg == null || etp < minEtp ) {
        minArg = c.getKey();  minWithout = without;  minEtp = etp;
      }
    }
    if( minArg == null ) throw new InvalidSplitException(_name + ": no separating token");
    List<Split.Part> parts = new ArrayList<Split.Part>(2);
    parts.add(new Split.Part(Boolean.TRUE, d.get(minArg)));
    parts.add(new Split.Part(Boolean.FALSE, minWithout));
    return new Split(this, minArg, minEtp, parts);
  }
}
