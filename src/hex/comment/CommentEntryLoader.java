package hex.comment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/** Reads comment records, one JSON object per line.
 *
 * Scalar values are kept as strings, arrays are joined with commas into the
 * multi-valued form the features expect, and nulls are treated as absent.
 * Blank lines are skipped.
 */
public class CommentEntryLoader {
  static final Joiner COMMA = Joiner.on(',');

  final String _keyProp;

  public CommentEntryLoader(String keyProp) { _keyProp = keyProp; }

  public List<CommentEntry> load(Reader in) throws IOException {
    BufferedReader rd = in instanceof BufferedReader ? (BufferedReader)in : new BufferedReader(in);
    List<CommentEntry> ents = new ArrayList<CommentEntry>();
    String line;
    int lineno = 0;
    while( (line = rd.readLine()) != null ) {
      lineno++;
      if( line.trim().isEmpty() ) continue;
      try {
        ents.add(CommentEntry.derive(attributes(JsonParser.parseString(line)), _keyProp));
      } catch( JsonParseException e ) {
        throw new IOException("line " + lineno + ": malformed record: " + e.getMessage(), e);
      } catch( IllegalArgumentException e ) {
        throw new IOException("line " + lineno + ": " + e.getMessage(), e);
      }
    }
    return ents;
  }

  static Map<String,Object> attributes(JsonElement rec) {
    if( !rec.isJsonObject() ) throw new IllegalArgumentException("record is not an object: " + rec);
    JsonObject o = rec.getAsJsonObject();
    Map<String,Object> attrs = new LinkedHashMap<String,Object>();
    for( Map.Entry<String,JsonElement> a : o.entrySet() ) {
      JsonElement v = a.getValue();
      if( v.isJsonNull() ) continue;
      if( v.isJsonPrimitive() ) attrs.put(a.getKey(), v.getAsString());
      else if( v.isJsonArray() ) {
        List<String> vs = new ArrayList<String>();
        for( JsonElement x : v.getAsJsonArray() ) {
          if( !x.isJsonPrimitive() ) throw new IllegalArgumentException("nested value in '" + a.getKey() + "'");
          vs.add(x.getAsString());
        }
        attrs.put(a.getKey(), COMMA.join(vs));
      } else throw new IllegalArgumentException("nested object in '" + a.getKey() + "'");
    }
    return attrs;
  }
}
