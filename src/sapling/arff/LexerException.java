package sapling.arff;

/** Input that matches none of the lexical rules. */
public class LexerException extends PositionedException {
  public final char _char;

  public LexerException(char c, int line, int column) {
    super(line, column, "Unexpected character '" + c + "'");
    _char = c;
  }
}
