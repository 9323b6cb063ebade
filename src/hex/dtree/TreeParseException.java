package hex.dtree;

/** A persisted tree does not match the expected shape. */
public class TreeParseException extends Exception {
  private static final long serialVersionUID = -6232791750167513541L;

  public TreeParseException(String msg) { super(msg); }
  public TreeParseException(String msg, Throwable cause) { super(msg, cause); }
}
