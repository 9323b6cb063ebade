package hex.dtree;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/** Persists trees as JSON.
 *
 * A branch is the array {@code [featureName, splitArg, default, [[value, child], ...]]},
 * a leaf is its bare label. On import the shape alone tells the two apart:
 * arrays are branches, scalars are leaves. The reader is strict; anything that
 * does not fit this grammar is rejected.
 */
public class TreeCodec {
  static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  static final TypeAdapter<JsonElement> ELEMENTS = GSON.getAdapter(JsonElement.class);

  private TreeCodec() { }

  public static JsonElement export(Tree t) { return export(t.root()); }

  /** @throws IllegalArgumentException for a non-finite number, which strict
   * JSON cannot hold. */
  public static JsonElement export(Tree.INode node) {
    if( node instanceof Tree.LeafNode ) return new JsonPrimitive(((Tree.LeafNode)node)._label);
    Tree.BranchNode b = (Tree.BranchNode)node;
    JsonArray children = new JsonArray();
    for( Map.Entry<Object,Tree.INode> c : b._children.entrySet() ) {
      JsonArray pair = new JsonArray();
      pair.add(scalar(c.getKey()));
      pair.add(export(c.getValue()));
      children.add(pair);
    }
    JsonArray res = new JsonArray();
    res.add(new JsonPrimitive(b._feature.name()));
    res.add(scalar(b._arg));
    res.add(new JsonPrimitive(b._default));
    res.add(children);
    return res;
  }

  public static String toJson(Tree.INode node) { return GSON.toJson(export(node)); }

  public static Tree.INode parse(FeatureRegistry reg, String json) throws TreeParseException {
    return parse(reg, new StringReader(json));
  }

  /** Reads one JSON document and imports it. Trailing content is an error. */
  public static Tree.INode parse(FeatureRegistry reg, Reader in) throws TreeParseException {
    JsonElement data;
    try {
      JsonReader r = new JsonReader(in);
      r.setLenient(false);
      data = ELEMENTS.read(r);
      if( r.peek() != JsonToken.END_DOCUMENT ) throw new TreeParseException("Trailing content after tree");
    } catch( IOException e ) {
      throw new TreeParseException("Malformed tree: " + e.getMessage(), e);
    } catch( JsonParseException e ) {
      throw new TreeParseException("Malformed tree: " + e.getMessage(), e);
    } catch( IllegalStateException e ) {
      throw new TreeParseException("Malformed tree: " + e.getMessage(), e);
    }
    return importTree(reg, data);
  }

  public static Tree.INode importTree(FeatureRegistry reg, JsonElement data) throws TreeParseException {
    if( data == null || data.isJsonNull() ) throw new TreeParseException("Null node");
    if( data.isJsonObject() ) throw new TreeParseException("Unexpected object: " + data);
    if( data.isJsonPrimitive() ) return new Tree.LeafNode(data.getAsString());

    JsonArray a = data.getAsJsonArray();
    if( a.size() != 4 ) throw new TreeParseException("Branch needs 4 elements, got " + a.size() + ": " + a);
    JsonElement name = a.get(0);
    if( !name.isJsonPrimitive() || !name.getAsJsonPrimitive().isString() )
      throw new TreeParseException("Feature name must be a string: " + name);
    Feature f = reg.get(name.getAsString());
    if( f == null ) throw new UnknownFeatureException(name.getAsString());
    Object arg = value(a.get(1));
    if( !f.acceptsArg(arg) ) throw new TreeParseException("Bad split argument for " + f.name() + ": " + a.get(1));
    JsonElement dflt = a.get(2);
    if( !dflt.isJsonPrimitive() ) throw new TreeParseException("Default label must be a scalar: " + dflt);
    if( !a.get(3).isJsonArray() ) throw new TreeParseException("Children must be an array: " + a.get(3));

    Map<Object,Tree.INode> children = new LinkedHashMap<Object,Tree.INode>();
    for( JsonElement c : a.get(3).getAsJsonArray() ) {
      if( !c.isJsonArray() || c.getAsJsonArray().size() != 2 )
        throw new TreeParseException("Child must be a [value, node] pair: " + c);
      Object v = value(c.getAsJsonArray().get(0));
      if( !f.acceptsValue(v) ) throw new TreeParseException("Bad branch value for " + f.name() + ": " + c.getAsJsonArray().get(0));
      if( children.containsKey(v) ) throw new TreeParseException("Duplicate branch value " + v + " under " + f.name());
      children.put(v, importTree(reg, c.getAsJsonArray().get(1)));
    }
    return new Tree.BranchNode(f, arg, dflt.getAsString(), children);
  }

  static JsonElement scalar(Object v) {
    if( v == null ) return JsonNull.INSTANCE;
    if( v instanceof Boolean ) return new JsonPrimitive((Boolean)v);
    if( v instanceof Number ) {
      Preconditions.checkArgument(Doubles.isFinite(((Number)v).doubleValue()), "non-finite value %s", v);
      return new JsonPrimitive((Number)v);
    }
    return new JsonPrimitive(v.toString());
  }

  static Object value(JsonElement e) throws TreeParseException {
    if( e.isJsonNull() ) return null;
    if( !e.isJsonPrimitive() ) throw new TreeParseException("Expected a scalar: " + e);
    JsonPrimitive p = e.getAsJsonPrimitive();
    if( p.isBoolean() ) return p.getAsBoolean();
    if( p.isNumber() ) return p.getAsDouble();
    return p.getAsString();
  }
}
