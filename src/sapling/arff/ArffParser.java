package sapling.arff;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Files;

/** Recursive descent reader for the ARFF subset, with one token of lookahead.
 *
 * <pre>
 * file         := RELATION_DECL STRING attribute* data-section
 * attribute    := ATTR_DECL STRING ( NUM_DATATYPE | '{' nominal-list '}' )
 * nominal-list := value (',' value)*
 * data-section := DATA_DECL data-row*
 * data-row     := value (',' value)*
 * </pre>
 *
 * Each data row sits on a line of its own. A value is any token that carries
 * a lexeme of its own (string, number, missing marker, datatype keyword or
 * reserved word). The missing marker is kept as the literal {@code ?}.
 *
 * Every error is fatal; the reader makes one pass and cannot be resumed.
 */
public class ArffParser {
  private static final Logger LOG = Logger.getLogger(ArffParser.class.getName());

  private final Lexer _lexer;
  private final String _classAttribute;
  private Token _top;
  // Position of the last consumed token, reported when the input runs out.
  private int _line = 1, _column = 0;

  /** Reader that treats the last declared attribute as the class. */
  public ArffParser(Lexer lexer) { this(lexer, null); }

  /** Reader with an explicit class attribute; null picks the last declared one. */
  public ArffParser(Lexer lexer, String classAttribute) {
    _lexer = lexer;
    _classAttribute = classAttribute;
  }

  public static Dataset parse(String text) throws LexerException, ParserException {
    return new ArffParser(new Lexer(text)).parse();
  }

  /** Reads the whole file as UTF-8 and parses it. */
  public static Dataset parse(File file) throws IOException, LexerException, ParserException {
    return parse(Files.asCharSource(file, Charsets.UTF_8).read());
  }

  // ---------------------------------------------------------------------------
  // Token plumbing

  /** Non-consuming check of the current token; false at end of input. */
  protected boolean expect(Token.Type type) {
    return _top != null && _top._type == type;
  }

  /** Consumes and returns the current token if it has the given type. */
  protected Token accept(Token.Type type) throws LexerException, ParserException {
    if( !expect(type) ) throw new ParserException(type, _top, line(), column());
    return pop();
  }

  private Token pop() throws LexerException {
    Token x = _top;
    _line = x._line;
    _column = x._column;
    _top = _lexer.next();
    return x;
  }

  private int line()   { return _top == null ? _line   : _top._line; }
  private int column() { return _top == null ? _column : _top._column; }

  private String value() throws LexerException, ParserException {
    if( _top == null || !_top._type.isValue() )
      throw new ParserException("value", _top, line(), column());
    return pop()._text;
  }

  // ---------------------------------------------------------------------------
  // Grammar

  public Dataset parse() throws LexerException, ParserException {
    _top = _lexer.next();
    accept(Token.Type.RELATION_DECL);
    String relation = accept(Token.Type.STRING)._text;

    Map<String, Attribute> attributes = Maps.newLinkedHashMap();
    Map<String, Token> declarations = Maps.newHashMap();
    while( expect(Token.Type.ATTR_DECL) ) {
      Token decl = _top;
      Attribute a = attribute();
      if( attributes.containsKey(a._name) )
        throw new ParserException(_line, _column, "Duplicate attribute '" + a._name + "'");
      attributes.put(a._name, a);
      declarations.put(a._name, decl);
    }

    if( !expect(Token.Type.DATA_DECL) )
      throw new ParserException(line(), column(), "No data section found: expected "
          + Token.Type.DATA_DECL + ", but " + ParserException.describe(_top) + " found");
    Token data = pop();

    String classAttribute = _classAttribute;
    if( classAttribute == null ) {
      for( String name : attributes.keySet() ) classAttribute = name;
    } else if( !attributes.containsKey(classAttribute) ) {
      throw new ParserException(data._line, data._column,
          "Class attribute '" + classAttribute + "' is not declared");
    }
    // Input attributes share the example map with the class label
    Token reserved = declarations.get(Example.CLASSIFICATION);
    if( reserved != null && !Example.CLASSIFICATION.equals(classAttribute) )
      throw new ParserException(reserved._line, reserved._column,
          "Attribute name '" + Example.CLASSIFICATION + "' is reserved for the class attribute");

    List<String> names = ImmutableList.copyOf(attributes.keySet());
    ImmutableList.Builder<Example> examples = ImmutableList.builder();
    int rows = 0;
    while( _top != null ) {
      examples.add(row(names, classAttribute));
      rows++;
    }
    Dataset ds = new Dataset(relation, ImmutableMap.copyOf(attributes), classAttribute, examples.build());
    LOG.fine("Parsed relation " + relation + ": " + attributes.size() + " attributes, " + rows + " rows");
    return ds;
  }

  private Attribute attribute() throws LexerException, ParserException {
    accept(Token.Type.ATTR_DECL);
    String name = accept(Token.Type.STRING)._text;
    if( expect(Token.Type.NUM_DATATYPE) ) {
      pop();
      return Attribute.numeric(name);
    }
    if( !expect(Token.Type.LEFT_CURLY) )
      throw new ParserException(Token.Type.NUM_DATATYPE + " or nominal value list", _top, line(), column());
    pop();
    List<String> values = Lists.newArrayList();
    values.add(value());
    while( expect(Token.Type.COMMA) ) {
      pop();
      values.add(value());
    }
    accept(Token.Type.RIGHT_CURLY);
    return Attribute.nominal(name, values);
  }

  private Example row(List<String> names, String classAttribute) throws LexerException, ParserException {
    int line = line(), column = column();
    List<String> values = Lists.newArrayList();
    values.add(value());
    while( expect(Token.Type.COMMA) ) {
      pop();
      values.add(value());
    }
    // A row ends with its line
    if( _top != null && _top._line == _line )
      throw new ParserException(Token.Type.COMMA + " or end of line", _top, _top._line, _top._column);
    if( values.size() != names.size() )
      throw new AlignmentException(names.size(), values.size(), line, column);
    Map<String, String> m = Maps.newLinkedHashMap();
    for( int i = 0; i < names.size(); ++i ) {
      String name = names.get(i);
      m.put(name.equals(classAttribute) ? Example.CLASSIFICATION : name, values.get(i));
    }
    return new Example(m);
  }
}
