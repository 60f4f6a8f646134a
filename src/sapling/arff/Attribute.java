package sapling.arff;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** A declared attribute: its name and either an enumerated nominal domain or
 * the numeric marker.
 */
public final class Attribute {
  public final String _name;
  private final ImmutableList<String> _domain; // null for numeric attributes

  private Attribute(String name, ImmutableList<String> domain) {
    _name = Preconditions.checkNotNull(name);
    _domain = domain;
  }

  public static Attribute numeric(String name) { return new Attribute(name, null); }

  public static Attribute nominal(String name, List<String> values) {
    return new Attribute(name, ImmutableList.copyOf(values));
  }

  public boolean isNumeric() { return _domain == null; }

  /** The nominal values in declaration order; empty for numeric attributes. */
  public ImmutableList<String> domain() {
    return _domain == null ? ImmutableList.<String>of() : _domain;
  }

  @Override public boolean equals(Object o) {
    if( !(o instanceof Attribute) ) return false;
    Attribute a = (Attribute) o;
    return _name.equals(a._name) && (_domain == null ? a._domain == null : _domain.equals(a._domain));
  }

  @Override public int hashCode() { return _name.hashCode() * 31 + (_domain == null ? 0 : _domain.hashCode()); }

  @Override public String toString() {
    return _name + (isNumeric() ? " numeric" : " {" + Joiner.on(", ").join(_domain) + "}");
  }
}
