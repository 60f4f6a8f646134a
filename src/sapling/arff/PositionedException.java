package sapling.arff;

/** Base of the errors raised while reading ARFF text. Remembers where in the
 * source the problem was found.
 */
public abstract class PositionedException extends Exception {
  /** 1-based line of the offending input. */
  public final int _line;
  /** 0-based column of the offending input. */
  public final int _column;

  protected PositionedException(int line, int column, String msg) {
    super(msg + " (line " + line + ", column " + column + ")");
    _line = line;
    _column = column;
  }

  /** Returns the offending source line with a caret under the error column. */
  public String report(String source) {
    String[] lines = source.split("\r?\n", -1);
    StringBuilder sb = new StringBuilder();
    if( _line >= 1 && _line <= lines.length ) {
      sb.append(lines[_line-1]).append('\n');
      for( int i = 0; i < _column; ++i ) sb.append(' ');
      sb.append("^\n");
    }
    sb.append(getMessage());
    return sb.toString();
  }
}
