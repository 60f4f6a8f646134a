package sapling.arff;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Multiset;

/** Splits ARFF text into {@link Token}s.
 *
 * The lexer is lazy and single pass: every call to {@link #next()} scans just
 * far enough to produce one token. It cannot be rewound, new text needs a new
 * lexer.
 *
 * Rules are tried in a fixed priority order. The longest match wins and a tie
 * goes to the rule listed first. A STRING match is then looked up against the
 * datatype and reserved-word tables, so {@code numeric} comes out as
 * NUM_DATATYPE and {@code GOSUB} as a reserved word.
 */
public class Lexer {

  private enum Rule {
    COMMENT      (null,                 "%[^\\r\\n]*"),
    RELATION_DECL(Token.Type.RELATION_DECL, "@relation"),
    STRING       (Token.Type.STRING,    "[\\w$<>=]+(?:[-–][\\w$<>=]+)*"),  // letters of any script
    ATTR_DECL    (Token.Type.ATTR_DECL, "@attribute"),
    NUM_DATATYPE (Token.Type.NUM_DATATYPE, "numeric|integer|real"),
    LEFT_CURLY   (Token.Type.LEFT_CURLY, "\\{"),
    RIGHT_CURLY  (Token.Type.RIGHT_CURLY, "\\}"),
    COMMA        (Token.Type.COMMA,     ","),
    DATA_DECL    (Token.Type.DATA_DECL, "@data"),
    MISSING      (Token.Type.MISSING,   "\\?"),
    NUMBER       (Token.Type.NUMBER,    "-?\\d+(?:\\.\\d+)?"),
    NEWLINE      (null,                 "\\r?\\n|\\r"),
    SKIP         (null,                 "[ \\t\\f]+"),
    ;
    final Token.Type _type;     // null for rules that emit nothing
    final Pattern _pattern;
    Rule(Token.Type type, String regex) {
      _type = type;
      _pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    }
  }

  /** Datatype keywords; all three mean the same thing. Case-insensitive. */
  static final ImmutableSet<String> DATATYPES = ImmutableSet.of("numeric", "integer", "real");

  /** Reserved words, matched exactly. */
  static final ImmutableMap<String, Token.Type> RESERVED = ImmutableMap.<String, Token.Type>builder()
      .put("IF",     Token.Type.IF)
      .put("THEN",   Token.Type.THEN)
      .put("ENDIF",  Token.Type.ENDIF)
      .put("NEXT",   Token.Type.NEXT)
      .put("GOSUB",  Token.Type.GOSUB)
      .put("RETURN", Token.Type.RETURN)
      .build();

  private final String _s;
  private final Matcher[] _matchers;
  private int _pos = 0;
  private int _line = 1;
  private int _lineStart = 0;

  public Lexer(String source) {
    _s = source;
    Rule[] rules = Rule.values();
    _matchers = new Matcher[rules.length];
    for( int i = 0; i < rules.length; ++i ) _matchers[i] = rules[i]._pattern.matcher(source);
  }

  /** Returns the next token, or null once the input is exhausted.
   * @throws LexerException when no rule matches the current position */
  public Token next() throws LexerException {
    while( _pos < _s.length() ) {
      Rule best = null;
      int bestEnd = -1;
      for( Rule r : Rule.values() ) {
        Matcher m = _matchers[r.ordinal()];
        m.region(_pos, _s.length());
        if( m.lookingAt() && m.end() > bestEnd && m.end() > _pos ) {
          best = r;
          bestEnd = m.end();
        }
      }
      if( best == null )
        throw new LexerException(_s.charAt(_pos), _line, _pos - _lineStart);
      int start = _pos;
      _pos = bestEnd;
      if( best == Rule.NEWLINE ) {
        _line++;
        _lineStart = _pos;
        continue;
      }
      if( best._type == null ) continue; // comment or whitespace
      String text = _s.substring(start, bestEnd);
      return new Token(retag(best._type, text), text, _line, start - _lineStart);
    }
    return null;
  }

  private static Token.Type retag(Token.Type type, String text) {
    if( type != Token.Type.STRING ) return type;
    if( DATATYPES.contains(text.toLowerCase()) ) return Token.Type.NUM_DATATYPE;
    Token.Type reserved = RESERVED.get(text);
    return reserved == null ? type : reserved;
  }

  /** Drains a fresh lexer over the given text. */
  public static List<Token> tokenize(String source) throws LexerException {
    List<Token> result = Lists.newArrayList();
    Lexer lexer = new Lexer(source);
    for( Token t = lexer.next(); t != null; t = lexer.next() ) result.add(t);
    return result;
  }

  /** Counts the tokens of each type, handy for sanity checks on a file. */
  public static Multiset<Token.Type> histogram(List<Token> tokens) {
    Multiset<Token.Type> counts = EnumMultiset.create(Token.Type.class);
    for( Token t : tokens ) counts.add(t._type);
    return counts;
  }
}
