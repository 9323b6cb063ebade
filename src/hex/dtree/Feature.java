package hex.dtree;

import java.util.List;

/** A named rule that extracts a value from an entity and proposes the
 * partition of a set of entities that minimizes the weighted entropy.
 *
 * The name is prefix+attribute and identifies the feature both in the
 * registry and in persisted trees. Features keep no state between calls.
 */
public abstract class Feature {
  protected final String _name;
  protected final String _attr;

  protected Feature(String name, String attr) {
    _name = name;
    _attr = attr;
  }

  public final String name() { return _name; }
  public final String attr() { return _attr; }

  /** Value of the feature for the entity, null when undefined. */
  public abstract Object extract(Entity e);

  /** Best partition of the entities this feature can produce.
   * @throws InvalidSplitException if fewer than two non-empty partitions can
   * be formed, or there are fewer than two entities. */
  public abstract Split split(List<? extends Entity> ents) throws InvalidSplitException;

  /** Branch value of a single entity, given the split argument chosen during
   * training. Uses the same rule as {@link #split}. */
  public abstract Object identify(Object arg, Entity e);

  /** Whether a decoded split argument has the type this feature routes on. */
  public abstract boolean acceptsArg(Object arg);

  /** Whether a decoded branch value is one {@link #identify} can produce. */
  public abstract boolean acceptsValue(Object v);

  /** The raw attribute value as a string, null if absent. */
  protected final String raw(Entity e) {
    Object v = e.get(_attr);
    return v == null ? null : v.toString();
  }

  protected final void checkSize(List<? extends Entity> ents) throws InvalidSplitException {
    if( ents.size() < 2 ) throw new InvalidSplitException(_name + ": fewer than 2 entities");
  }

  @Override public String toString() { return "<" + getClass().getSimpleName() + ": " + _name + ">"; }
}
