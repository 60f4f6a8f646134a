package sapling.arff;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

/** The parsed contents of an ARFF file. Read-only once built.
 *
 * Attribute order is the declaration order; data rows were aligned to it. The
 * class attribute's values are stored under {@link Example#CLASSIFICATION} in
 * each example.
 */
public final class Dataset {
  private final String _relation;
  private final ImmutableMap<String, Attribute> _attributes;
  private final String _classAttribute;
  private final ImmutableList<Example> _examples;

  public Dataset(String relation, ImmutableMap<String, Attribute> attributes, String classAttribute,
                 ImmutableList<Example> examples) {
    _relation = relation;
    _attributes = attributes;
    _classAttribute = classAttribute;
    _examples = examples;
  }

  public String relation()                          { return _relation; }
  public ImmutableMap<String, Attribute> attributes() { return _attributes; }
  public Attribute attribute(String name)           { return _attributes.get(name); }
  public ImmutableList<Example> examples()          { return _examples; }
  public int rows()                                 { return _examples.size(); }

  /** Name of the attribute whose values are the labels, null with no attributes. */
  public String classAttribute() { return _classAttribute; }

  /** The attributes available for splitting, in declaration order. */
  public ImmutableList<String> inputAttributes() {
    ImmutableList.Builder<String> b = ImmutableList.builder();
    for( String name : _attributes.keySet() )
      if( !name.equals(_classAttribute) ) b.add(name);
    return b.build();
  }

  /** The class labels: the declared domain of a nominal class attribute,
   * otherwise the distinct labels in order of first appearance. */
  public ImmutableList<String> classLabels() {
    Attribute c = _classAttribute == null ? null : _attributes.get(_classAttribute);
    if( c != null && !c.isNumeric() ) return c.domain();
    Set<String> seen = Sets.newLinkedHashSet();
    for( Example e : _examples ) seen.add(e.classification());
    return ImmutableList.copyOf(seen);
  }

  public String toString() {
    return "@relation " + _relation + " (" + _attributes.size() + " attributes, " + _examples.size() + " rows)";
  }

  /** Convenience for callers that want plain lists. */
  public List<String> attributeNames() { return ImmutableList.copyOf(_attributes.keySet()); }
}
