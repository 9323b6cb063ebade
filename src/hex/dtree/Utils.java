package hex.dtree;

import java.util.List;
import java.util.Locale;

import com.google.common.base.Splitter;

public class Utils {
  static final Splitter COMMA = Splitter.on(',');

  private Utils() { }

  /** Comma separated tokens of an attribute value, empty tokens included. */
  public static List<String> tokens(String s) { return COMMA.splitToList(s); }

  public static String p3d(double d) { return String.format(Locale.ROOT, "%.3f", d); }

  /** Ratio with a NaN result for a zero denominator. */
  public static double ratio(int num, int den) { return den == 0 ? Double.NaN : num / (double)den; }

  public static String indent(int depth) {
    StringBuilder sb = new StringBuilder();
    for( int i = 0; i < depth; i++ ) sb.append("  ");
    return sb.toString();
  }
}
