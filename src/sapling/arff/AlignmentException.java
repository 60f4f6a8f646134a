package sapling.arff;

/** A data row does not carry exactly one value per declared attribute. */
public class AlignmentException extends ParserException {
  public final int _expected;
  public final int _found;

  public AlignmentException(int expected, int found, int line, int column) {
    super(line, column, "Row/attribute count mismatch: " + expected
        + " attributes declared, but the row has " + found + " values");
    _expected = expected;
    _found = found;
  }
}
