package hex.dtree;

/** A persisted tree names a feature the registry does not know about. */
public class UnknownFeatureException extends TreeParseException {
  private static final long serialVersionUID = 2954712094857733620L;

  final String _name;

  public UnknownFeatureException(String name) {
    super("Unknown feature: " + name);
    _name = name;
  }

  public String featureName() { return _name; }
}
