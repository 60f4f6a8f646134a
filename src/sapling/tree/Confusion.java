package sapling.tree;

import java.util.List;
import java.util.logging.Logger;

import sapling.arff.Example;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Confusion Matrix. Scores a tree against a list of labeled examples. Each
 * example lands in exactly one of three tallies: classified correctly,
 * classified wrongly, or not scored because evaluation hit an unknown value
 * or the example's own label is not one of the classes. Only scored examples
 * enter the matrix and the error rate.
 */
public class Confusion {
  private static final Logger LOG = Logger.getLogger(Confusion.class.getName());

  public static final String JSON_ROWS = "rows";
  public static final String JSON_ERRORS = "errors";
  public static final String JSON_UNKNOWN = "unknown";
  public static final String JSON_ERROR_RATE = "error_rate";
  public static final String JSON_CM_HEADER = "header";
  public static final String JSON_CM_MATRIX = "matrix";
  public static final String JSON_CM = "confusion_matrix";

  /** Class labels, the order of the matrix rows and columns. */
  public final ImmutableList<String> _classes;
  /** The matrix, referenced as _matrix[actual][predicted]. */
  public final long[][] _matrix;
  /** Number of classified examples. */
  private long _rows;
  /** Number of mistaken classifications. */
  private long _errors;
  /** Number of examples that could not be scored. */
  private long _unknown;

  public Confusion(List<String> classes) {
    _classes = ImmutableList.copyOf(classes);
    _matrix = new long[_classes.size()][_classes.size()];
  }

  /** Classifies every example with the tree and tallies the outcome. */
  public static Confusion make(Tree tree, List<Example> examples, List<String> classes) {
    Confusion cm = new Confusion(classes);
    for( Example e : examples ) {
      String actual = e.classification();
      if( !cm._classes.contains(actual) ) {
        // unlabeled (missing marker) or a label outside the class list
        LOG.fine("Example label '" + actual + "' is not one of " + cm._classes);
        cm._unknown++;
        continue;
      }
      try {
        cm.add(actual, tree.classify(e));
      } catch( UnknownValueException ex ) {
        LOG.fine(ex.getMessage());
        cm._unknown++;
      }
    }
    return cm;
  }

  public void add(String actual, String predicted) {
    int a = _classes.indexOf(actual), p = _classes.indexOf(predicted);
    Preconditions.checkArgument(a >= 0, "label %s is not one of %s", actual, _classes);
    Preconditions.checkArgument(p >= 0, "prediction %s is not one of %s", predicted, _classes);
    _matrix[a][p]++;
    _rows++;
    if( a != p ) _errors++;
  }

  public long rows()    { return _rows; }
  public long errors()  { return _errors; }
  public long unknown() { return _unknown; }
  public long correct() { return _rows - _errors; }

  /** Fraction of classified examples that were wrong; 0 with none classified. */
  public double errorRate() { return _rows == 0 ? 0 : _errors / (double) _rows; }

  /** Text table, actual classes down, predicted classes across. */
  public String confusionMatrix() {
    int w = 7;
    for( String c : _classes ) w = Math.max(w, c.length() + 1);
    for( long[] r : _matrix ) w = Math.max(w, Long.toString(Longs.max(r)).length() + 1);
    StringBuilder sb = new StringBuilder();
    sb.append(Strings.padStart("", w, ' '));
    for( String c : _classes ) sb.append(Strings.padStart(c, w, ' '));
    sb.append('\n');
    for( int i = 0; i < _matrix.length; ++i ) {
      sb.append(Strings.padStart(_classes.get(i), w, ' '));
      for( long v : _matrix[i] ) sb.append(Strings.padStart(Long.toString(v), w, ' '));
      sb.append('\n');
    }
    return sb.toString();
  }

  public String report() {
    double err = errorRate();
    return
          "            Classified (rows): " + _rows + "\n"
        + "               Unknown values: " + _unknown + "\n"
        + "        Estimate of err. rate: " + Utils.p2d(err * 100) + "%  (" + Utils.p5d(err) + ")\n"
        + "             Confusion matrix:\n"
        + confusionMatrix();
  }

  public JsonObject toJson() {
    JsonObject res = new JsonObject();
    res.addProperty(JSON_ROWS, _rows);
    res.addProperty(JSON_ERRORS, _errors);
    res.addProperty(JSON_UNKNOWN, _unknown);
    res.addProperty(JSON_ERROR_RATE, errorRate());
    JsonObject cm = new JsonObject();
    JsonArray header = new JsonArray();
    for( String c : _classes ) header.add(new JsonPrimitive(c));
    cm.add(JSON_CM_HEADER, header);
    JsonArray matrix = new JsonArray();
    for( long[] r : _matrix ) {
      JsonArray row = new JsonArray();
      for( long v : r ) row.add(new JsonPrimitive(v));
      matrix.add(row);
    }
    cm.add(JSON_CM_MATRIX, matrix);
    res.add(JSON_CM, cm);
    return res;
  }

  public String toString() { return toJson().toString(); }
}
