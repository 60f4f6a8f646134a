package sapling.util;

import java.io.Flushable;
import java.io.IOException;

import com.google.common.base.Strings;

/** Appendable that prefixes every line with the current indent. The indent
 * is written lazily, when the first character of a line arrives. */
public class IndentingAppender implements Appendable, Flushable {
  private final Appendable _a;
  private final String _step;
  private int _level = 0;
  private boolean _pending = true;  // at the start of a line

  public IndentingAppender(Appendable base) { this(base, "  "); }

  public IndentingAppender(Appendable base, String step) {
    _a = base;
    _step = step;
  }

  public IndentingAppender incrementIndent() { _level++; return this; }

  public IndentingAppender decrementIndent() {
    if( _level == 0 ) throw new IllegalStateException("indent is already zero");
    _level--;
    return this;
  }

  public int level() { return _level; }

  @Override public IndentingAppender append(CharSequence csq) throws IOException {
    return append(csq, 0, csq.length());
  }

  @Override public IndentingAppender append(CharSequence csq, int start, int end) throws IOException {
    for( int i = start; i < end; ++i ) append(csq.charAt(i));
    return this;
  }

  @Override public IndentingAppender append(char c) throws IOException {
    if( _pending && c != '\n' ) {
      _a.append(Strings.repeat(_step, _level));
      _pending = false;
    }
    _a.append(c);
    if( c == '\n' ) _pending = true;
    return this;
  }

  @Override public void flush() throws IOException {
    if( _a instanceof Flushable ) ((Flushable) _a).flush();
  }
}
