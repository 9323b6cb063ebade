package hex.dtree;

/** A labeled record the tree is trained on and later classifies.
 *
 * Attribute values are strings (multi-valued attributes are comma separated),
 * numbers for derived attributes, or null when the attribute is absent. The
 * label is never null.
 */
public interface Entity {
  /** Returns the raw value of the attribute, or null if absent. */
  Object get(String attr);

  /** Returns the class of the entity. */
  String label();
}
