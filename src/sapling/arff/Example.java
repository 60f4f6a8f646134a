package sapling.arff;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** One labeled row: attribute name to observed value. The target label lives
 * under the reserved {@link #CLASSIFICATION} key.
 */
public final class Example {
  public static final String CLASSIFICATION = "classification";

  private final ImmutableMap<String, String> _values;

  public Example(Map<String, String> values) {
    _values = ImmutableMap.copyOf(values);
  }

  /** Builds an example from alternating name and value arguments. */
  public static Example of(String... namesAndValues) {
    Preconditions.checkArgument(namesAndValues.length % 2 == 0, "names and values must pair up");
    Map<String, String> m = Maps.newLinkedHashMap();
    for( int i = 0; i < namesAndValues.length; i += 2 ) m.put(namesAndValues[i], namesAndValues[i+1]);
    return new Example(m);
  }

  /** The value of the attribute, or null if the example does not carry it. */
  public String get(String attribute) { return _values.get(attribute); }

  public String classification() { return _values.get(CLASSIFICATION); }

  public boolean has(String attribute) { return _values.containsKey(attribute); }

  public int size() { return _values.size(); }

  public ImmutableMap<String, String> values() { return _values; }

  /** A copy of this example with the label removed, as seen by a classifier. */
  public Example unlabeled() {
    return new Example(Maps.filterKeys(_values, Predicates.not(Predicates.equalTo(CLASSIFICATION))));
  }

  @Override public boolean equals(Object o) {
    return o instanceof Example && _values.equals(((Example) o)._values);
  }

  @Override public int hashCode() { return _values.hashCode(); }

  @Override public String toString() { return _values.toString(); }
}
