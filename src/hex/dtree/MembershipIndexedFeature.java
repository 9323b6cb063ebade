package hex.dtree;

import java.util.List;

import com.google.common.base.Preconditions;

/** Membership feature restricted to the first few tokens of the attribute. */
public class MembershipIndexedFeature extends MembershipFeature {
  final int _nmems;

  public MembershipIndexedFeature(String attr) { this(attr, 1); }

  public MembershipIndexedFeature(String attr, int nmems) {
    super("MF" + nmems + ":", attr);
    Preconditions.checkArgument(nmems > 0, "token window must be positive: %s", nmems);
    _nmems = nmems;
  }

  public int nmems() { return _nmems; }

  @Override protected List<String> members(String v) {
    List<String> all = super.members(v);
    return all.size() <= _nmems ? all : all.subList(0, _nmems);
  }
}
