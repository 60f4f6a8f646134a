package sapling.tree;

/** Evaluation reached a split whose attribute value has no branch: the value
 * was never seen during training, or the example does not carry the attribute
 * at all. Callers usually count these apart from right and wrong answers.
 */
public class UnknownValueException extends Exception {
  public final String _attribute;
  public final String _value;

  public UnknownValueException(String attribute, String value) {
    super(value == null
        ? "Example has no value for split attribute '" + attribute + "'"
        : "Unknown value '" + value + "' for split attribute '" + attribute + "'");
    _attribute = attribute;
    _value = value;
  }
}
