package sapling.arff;

/** A single lexeme produced by the {@link Lexer}.
 *
 * Tokens are immutable. The line is 1-based, the column is the 0-based offset
 * of the token from the start of its line.
 */
public final class Token {
  public enum Type {
    RELATION_DECL, // @relation
    ATTR_DECL,     // @attribute
    DATA_DECL,     // @data
    STRING,        // identifier or nominal value
    NUMBER,        // integer or decimal literal
    NUM_DATATYPE,  // numeric, integer, real
    LEFT_CURLY,    // {
    RIGHT_CURLY,   // }
    COMMA,         // ,
    MISSING,       // ?
    // Reserved words of an older grammar, kept for compatibility only.
    IF, THEN, ENDIF, NEXT, GOSUB, RETURN,
    ;
    public String toString() {
      switch (this) {
        case RELATION_DECL:
          return "relation declaration";
        case ATTR_DECL:
          return "attribute declaration";
        case DATA_DECL:
          return "data declaration";
        case STRING:
          return "string";
        case NUMBER:
          return "number";
        case NUM_DATATYPE:
          return "numeric datatype";
        case LEFT_CURLY:
          return "opening brace";
        case RIGHT_CURLY:
          return "closing brace";
        case COMMA:
          return "comma";
        case MISSING:
          return "missing value";
        default:
          return "reserved word " + name();
      }
    }

    /** True for the kinds whose lexeme can stand for a nominal or data value. */
    boolean isValue() {
      return this != RELATION_DECL && this != ATTR_DECL && this != DATA_DECL
          && this != LEFT_CURLY && this != RIGHT_CURLY && this != COMMA;
    }
  }

  public final Type _type;
  public final String _text;
  public final int _line;
  public final int _column;

  public Token(Type type, String text, int line, int column) {
    _type = type;
    _text = text;
    _line = line;
    _column = column;
  }

  public String toString() {
    return _type.name() + " '" + _text + "' at " + _line + ":" + _column;
  }
}
