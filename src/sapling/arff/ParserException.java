package sapling.arff;

/** The token stream does not follow the ARFF grammar.
 *
 * @see AlignmentException
 */
public class ParserException extends PositionedException {
  static final String END_OF_INPUT = "end of input";

  public ParserException(int line, int column, String msg) {
    super(line, column, msg);
  }

  /** Expected-versus-found error. A {@code null} token means the input ended. */
  public ParserException(Token.Type expected, Token found, int line, int column) {
    super(line, column, "Expected " + expected + ", but " + describe(found) + " found");
  }

  public ParserException(String expected, Token found, int line, int column) {
    super(line, column, "Expected " + expected + ", but " + describe(found) + " found");
  }

  static String describe(Token t) {
    return t == null ? END_OF_INPUT : t._type + " '" + t._text + "'";
  }
}
