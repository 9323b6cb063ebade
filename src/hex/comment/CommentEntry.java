package hex.comment;

import hex.dtree.Entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

/** A source-code comment annotated with positional, typographic and lexical
 * attributes, labeled by one of its own attributes.
 *
 * Besides the raw attributes an entry carries the positional deltas the
 * target features split on: {@code deltaLine}, {@code deltaCols},
 * {@code deltaLeft} and {@code deltaRight}. Each is only present when the
 * attribute it is computed from is.
 */
public class CommentEntry implements Entity {
  final Map<String,Object> _attrs;
  final String _label;

  CommentEntry(Map<String,Object> attrs, String label) {
    _attrs = Collections.unmodifiableMap(new LinkedHashMap<String,Object>(attrs));
    _label = label;
  }

  /** Builds an entry from raw attributes, taking the label from
   * {@code keyProp} and adding the derived deltas. */
  public static CommentEntry derive(Map<String,?> raw, String keyProp) {
    Object key = raw.get(keyProp);
    Preconditions.checkArgument(key != null, "missing label attribute '%s'", keyProp);
    Map<String,Object> attrs = new LinkedHashMap<String,Object>(raw);
    int line = intAttr(raw, "line");
    int cols = intAttr(raw, "cols");
    if( raw.containsKey("prevLine") )  attrs.put("deltaLine",  line - intAttr(raw, "prevLine"));
    if( raw.containsKey("prevCols") )  attrs.put("deltaCols",  cols - intAttr(raw, "prevCols"));
    if( raw.containsKey("leftLine") )  attrs.put("deltaLeft",  line - intAttr(raw, "leftLine"));
    if( raw.containsKey("rightLine") ) attrs.put("deltaRight", line - intAttr(raw, "rightLine"));
    return new CommentEntry(attrs, key.toString());
  }

  static int intAttr(Map<String,?> raw, String name) {
    Object v = raw.get(name);
    Preconditions.checkArgument(v != null, "missing attribute '%s'", name);
    if( v instanceof Number ) return ((Number)v).intValue();
    Integer i = Ints.tryParse(v.toString().trim());
    Preconditions.checkArgument(i != null, "attribute '%s' is not an integer: %s", name, v);
    return i;
  }

  @Override public Object get(String attr) { return _attrs.get(attr); }
  @Override public String label() { return _label; }

  public Map<String,Object> attributes() { return _attrs; }

  @Override public String toString() { return "<CommentEntry " + _label + " " + _attrs + ">"; }
}
