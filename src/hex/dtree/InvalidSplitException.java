package hex.dtree;

/** Thrown by a feature that cannot form at least two non-empty partitions of
 * the given entities. The tree builder simply drops the feature as a candidate
 * for that node.
 */
public class InvalidSplitException extends Exception {
  private static final long serialVersionUID = 4150374925711633914L;

  public InvalidSplitException(String msg) { super(msg); }
}
